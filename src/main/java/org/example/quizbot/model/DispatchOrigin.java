package org.example.quizbot.model;

public enum DispatchOrigin {
    SCHEDULED,
    MANUAL
}

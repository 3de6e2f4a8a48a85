package org.example.quizbot.model;

public enum BatchSource {
    PROVIDER,
    FALLBACK,
    NONE
}

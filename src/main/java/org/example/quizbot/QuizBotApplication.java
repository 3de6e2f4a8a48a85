package org.example.quizbot;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class QuizBotApplication {

    public static void main(String[] args) {
        SpringApplication.run(QuizBotApplication.class, args);
    }
}

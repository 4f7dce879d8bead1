package ru.marthastudios.nudgebot;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class NudgeBotApplication {

    public static void main(String[] args) {
        SpringApplication.run(NudgeBotApplication.class, args);
    }
}

package com.programmersdiary.chatscheduler;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@EnableScheduling
@SpringBootApplication
public class ChatSchedulerApplication {

    public static void main(String[] args) {
        SpringApplication.run(ChatSchedulerApplication.class, args);
    }
}

package com.programmersdiary.taskdaemon;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TaskDaemonApplication {

    public static void main(String[] args) {
        SpringApplication.run(TaskDaemonApplication.class, args);
    }
}

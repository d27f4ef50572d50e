package com.actionplan.taskimport;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TaskImportApplication {

    public static void main(String[] args) {
        SpringApplication.run(TaskImportApplication.class, args);
    }
}

package com.teachertraining.api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

// MongoClient and MongoTemplate come from MongoConfig; Boot's Mongo auto-configuration backs off for them
@SpringBootApplication
public class SpringBootApiApplication {
    public static void main(String[] args) {
        SpringApplication.run(SpringBootApiApplication.class, args);
    }
}

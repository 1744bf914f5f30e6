package com.example.CourseRag;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class CourseRagApplication {

    public static void main(String[] args) {
        SpringApplication.run(CourseRagApplication.class, args);
    }
}

package com.toeic.recommender;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class ToeicRecommenderApplication {
    public static void main(String[] args) {
        SpringApplication.run(ToeicRecommenderApplication.class, args);
    }
}

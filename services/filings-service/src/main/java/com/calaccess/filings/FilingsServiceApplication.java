package com.calaccess.filings;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@ConfigurationPropertiesScan
@EnableScheduling
public class FilingsServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(FilingsServiceApplication.class, args);
    }
}

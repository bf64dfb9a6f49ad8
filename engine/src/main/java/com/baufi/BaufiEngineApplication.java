package com.baufi;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class BaufiEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(BaufiEngineApplication.class, args);
    }
}

package com.synclab.uaengine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class UaEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(UaEngineApplication.class, args);
    }
}

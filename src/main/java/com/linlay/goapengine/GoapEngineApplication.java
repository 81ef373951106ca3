package com.linlay.goapengine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class GoapEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(GoapEngineApplication.class, args);
    }
}

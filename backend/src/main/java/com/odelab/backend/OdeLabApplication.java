package com.odelab.backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class OdeLabApplication {
    public static void main(String[] args) {
        SpringApplication.run(OdeLabApplication.class, args);
    }
}

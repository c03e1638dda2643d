package com.agrisense;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class AgriSenseApplication {

    public static void main(String[] args) {
        SpringApplication.run(AgriSenseApplication.class, args);
    }
}

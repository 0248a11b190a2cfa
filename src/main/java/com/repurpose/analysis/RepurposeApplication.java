package com.repurpose.analysis;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class RepurposeApplication {
    public static void main(String[] args) {
        SpringApplication.run(RepurposeApplication.class, args);
    }
}

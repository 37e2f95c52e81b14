package com.mailflow.mailflow_backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan("com.mailflow.mailflow_backend.config")
public class MailflowBackendApplication {

    public static void main(String[] args) {
        SpringApplication.run(MailflowBackendApplication.class, args);
    }
}

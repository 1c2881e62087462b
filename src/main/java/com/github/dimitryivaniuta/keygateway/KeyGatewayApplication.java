package com.github.dimitryivaniuta.keygateway;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class KeyGatewayApplication {

    public static void main(String[] args) {
        SpringApplication.run(KeyGatewayApplication.class, args);
    }
}

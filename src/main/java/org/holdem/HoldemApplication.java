package org.holdem;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan  // HoldemProperties
public class HoldemApplication {
    public static void main(String[] args) {
        SpringApplication.run(HoldemApplication.class, args);
    }
}

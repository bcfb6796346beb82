package com.williamcallahan.ratchet;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class RatchetApplication {
    public static void main(String[] args) {
        SpringApplication.run(RatchetApplication.class, args);
    }
}

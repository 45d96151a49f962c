package com.emtech.scan;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class EmTechScanApplication {

    public static void main(String[] args) {
        SpringApplication.run(EmTechScanApplication.class, args);
    }
}

package com.demo.degree;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class DegreeAttestationApplication {

    public static void main(String[] args) {
        SpringApplication.run(DegreeAttestationApplication.class, args);
    }

}

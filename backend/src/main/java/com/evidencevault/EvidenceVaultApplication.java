package com.evidencevault;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class EvidenceVaultApplication {

    public static void main(String[] args) {
        SpringApplication.run(EvidenceVaultApplication.class, args);
    }
}

package com.companyintel;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class CompanyResearchApplication {

    public static void main(String[] args) {
        SpringApplication.run(CompanyResearchApplication.class, args);
    }
}

package com.propertyintel.housekeeping;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties
public class HousekeepingReportApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(HousekeepingReportApplication.class, args)));
    }
}

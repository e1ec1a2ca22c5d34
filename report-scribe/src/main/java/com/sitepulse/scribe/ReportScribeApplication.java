package com.sitepulse.scribe;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties
public class ReportScribeApplication {

    public static void main(String[] args) {
        SpringApplication.run(ReportScribeApplication.class, args);
    }
}

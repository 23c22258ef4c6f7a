package com.abandonflow.analyzer;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class AbandonAnalyzerApplication {

    public static void main(String[] args) {
        SpringApplication.run(AbandonAnalyzerApplication.class, args);
    }
}

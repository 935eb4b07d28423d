package com.coursepath.prereq;

import com.coursepath.prereq.config.PrereqProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(PrereqProperties.class)
public class PrereqEngineApplication {
    public static void main(String[] args) {
        SpringApplication.run(PrereqEngineApplication.class, args);
    }
}

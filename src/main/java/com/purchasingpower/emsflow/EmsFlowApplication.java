package com.purchasingpower.emsflow;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class EmsFlowApplication {

    public static void main(String[] args) {
        SpringApplication.run(EmsFlowApplication.class, args);
    }
}

package com.quickdeploy.back;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class QuickDeployApplication {

    public static void main(String[] args) {
        SpringApplication.run(QuickDeployApplication.class, args);
    }
}

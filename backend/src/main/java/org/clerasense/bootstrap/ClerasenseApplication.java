package org.clerasense.bootstrap;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication(scanBasePackages = "org.clerasense")
public class ClerasenseApplication {
    public static void main(String[] args) {
        SpringApplication.run(ClerasenseApplication.class, args);
    }
}

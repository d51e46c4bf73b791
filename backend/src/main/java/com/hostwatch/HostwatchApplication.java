package com.hostwatch;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class HostwatchApplication {

    public static void main(String[] args) {
        SpringApplication.run(HostwatchApplication.class, args);
    }
}

package com.axcockpit.backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class AxCockpitApplication {
    public static void main(String[] args) {
        SpringApplication.run(AxCockpitApplication.class, args);
    }
}

package com.ids.authgate.security.test.servlet;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ServletTestApplication {

    public static void main(String[] args) {
        SpringApplication.run(ServletTestApplication.class, args);
    }
}

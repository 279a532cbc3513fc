package com.chathub.app;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.ComponentScan;

/**
 * chathub application entry point.
 */
@SpringBootApplication
@ComponentScan(basePackages = "com.chathub")
public class ChatHubApplication {

    public static void main(String[] args) {
        SpringApplication.run(ChatHubApplication.class, args);
    }
}

package com.example.console_relay;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ConsoleRelayApplication {

    public static void main(String[] args) {
        SpringApplication.run(ConsoleRelayApplication.class, args);
    }
}

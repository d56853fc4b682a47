package com.botical.app;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.ComponentScan;

/**
 * Botical realtime gateway entry point.
 */
@SpringBootApplication
@ComponentScan(basePackages = "com.botical")
public class BoticalApplication {

    public static void main(String[] args) {
        SpringApplication.run(BoticalApplication.class, args);
    }
}

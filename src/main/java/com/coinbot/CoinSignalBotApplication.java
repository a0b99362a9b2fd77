package com.coinbot;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class CoinSignalBotApplication {

    public static void main(String[] args) {
        SpringApplication.run(CoinSignalBotApplication.class, args);
    }
}

package com.fxtrader;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class FxTraderApplication {

    public static void main(String[] args) {
        SpringApplication.run(FxTraderApplication.class, args);
    }
}

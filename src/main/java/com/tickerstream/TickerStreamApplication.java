package com.tickerstream;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TickerStreamApplication {

    public static void main(String[] args) {
        SpringApplication.run(TickerStreamApplication.class, args);
    }
}

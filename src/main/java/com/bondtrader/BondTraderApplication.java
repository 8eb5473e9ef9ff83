package com.bondtrader;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class BondTraderApplication {

    public static void main(String[] args) {
        SpringApplication.run(BondTraderApplication.class, args);
    }
}

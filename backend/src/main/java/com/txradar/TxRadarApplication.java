package com.txradar;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TxRadarApplication {

    public static void main(String[] args) {
        SpringApplication.run(TxRadarApplication.class, args);
    }
}

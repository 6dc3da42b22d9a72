package com.runeledger;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class RuneLedgerApplication {

    public static void main(String[] args) {
        SpringApplication.run(RuneLedgerApplication.class, args);
    }
}

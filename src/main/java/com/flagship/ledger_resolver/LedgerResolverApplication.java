package com.flagship.ledger_resolver;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class LedgerResolverApplication {

    public static void main(String[] args) {
        SpringApplication.run(LedgerResolverApplication.class, args);
    }
}

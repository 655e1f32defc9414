package com.flagship.crypto_ledger;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CryptoLedgerApplication {

    public static void main(String[] args) {
        SpringApplication.run(CryptoLedgerApplication.class, args);
    }
}

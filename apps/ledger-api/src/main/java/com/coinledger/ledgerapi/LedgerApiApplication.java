package com.coinledger.ledgerapi;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class LedgerApiApplication {
  public static void main(String[] args) {
    SpringApplication.run(LedgerApiApplication.class, args);
  }
}

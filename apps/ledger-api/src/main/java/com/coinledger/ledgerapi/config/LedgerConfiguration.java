package com.coinledger.ledgerapi.config;

import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class LedgerConfiguration {
  @Bean
  public Clock ledgerClock() {
    return Clock.systemUTC();
  }
}

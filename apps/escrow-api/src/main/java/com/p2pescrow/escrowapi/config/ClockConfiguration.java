package com.p2pescrow.escrowapi.config;

import java.time.Clock;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ClockConfiguration {

  @Bean
  @ConditionalOnMissingBean
  public Clock escrowClock() {
    return Clock.systemUTC();
  }
}

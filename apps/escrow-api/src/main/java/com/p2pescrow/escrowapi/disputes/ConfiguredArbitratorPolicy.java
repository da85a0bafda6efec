package com.p2pescrow.escrowapi.disputes;

import com.p2pescrow.escrowapi.config.ArbitrationProperties;
import org.springframework.stereotype.Component;

/** Single arbitrator fixed at startup from {@code escrow.arbitration.arbitrator}. */
@Component
public class ConfiguredArbitratorPolicy implements ArbitratorPolicy {
  private final String arbitrator;

  public ConfiguredArbitratorPolicy(ArbitrationProperties properties) {
    String configured = properties.getArbitrator();
    if (configured == null || configured.isBlank()) {
      throw new IllegalStateException("escrow.arbitration.arbitrator must be configured");
    }
    this.arbitrator = configured.trim();
  }

  @Override
  public boolean isArbitrator(String principal) {
    return arbitrator.equals(principal);
  }
}

package com.p2pescrow.escrowapi.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "escrow.arbitration")
public class ArbitrationProperties {
  private String arbitrator;

  public String getArbitrator() {
    return arbitrator;
  }

  public void setArbitrator(String arbitrator) {
    this.arbitrator = arbitrator;
  }
}

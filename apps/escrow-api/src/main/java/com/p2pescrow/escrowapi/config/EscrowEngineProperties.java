package com.p2pescrow.escrowapi.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "escrow.engine")
public class EscrowEngineProperties {
  private Duration paymentTimeout = Duration.ofHours(48);
  private int maxOpenEscrowsPerOffer = 100;

  public Duration getPaymentTimeout() {
    return paymentTimeout;
  }

  public void setPaymentTimeout(Duration paymentTimeout) {
    this.paymentTimeout = paymentTimeout;
  }

  public int getMaxOpenEscrowsPerOffer() {
    return maxOpenEscrowsPerOffer;
  }

  public void setMaxOpenEscrowsPerOffer(int maxOpenEscrowsPerOffer) {
    this.maxOpenEscrowsPerOffer = maxOpenEscrowsPerOffer;
  }
}

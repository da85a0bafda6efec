package com.p2pescrow.escrowapi.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "escrow.ledger")
public class LedgerProperties {
  private String custodyPrincipal = "escrow-custody";

  public String getCustodyPrincipal() {
    return custodyPrincipal;
  }

  public void setCustodyPrincipal(String custodyPrincipal) {
    this.custodyPrincipal = custodyPrincipal;
  }
}

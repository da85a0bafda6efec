package com.p2pescrow.escrowapi;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class EscrowApiApplication {
  public static void main(String[] args) {
    SpringApplication.run(EscrowApiApplication.class, args);
  }
}

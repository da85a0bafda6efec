package com.p2pescrow.escrowapi.ledger;

import com.p2pescrow.escrowapi.config.LedgerProperties;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.sql.Timestamp;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

/**
 * Settlement ledger kept in {@code ledger_accounts}. The custody principal's row holds the value
 * under escrow control; every movement is journaled in {@code ledger_transfers}.
 */
@Repository
public class JdbcSettlementLedger implements SettlementLedger {
  private static final Logger log = LoggerFactory.getLogger(JdbcSettlementLedger.class);

  private final JdbcTemplate jdbcTemplate;
  private final String custodyPrincipal;
  private final Clock clock;

  public JdbcSettlementLedger(
      JdbcTemplate jdbcTemplate, LedgerProperties ledgerProperties, Clock clock) {
    this.jdbcTemplate = jdbcTemplate;
    this.custodyPrincipal = ledgerProperties.getCustodyPrincipal();
    this.clock = clock;
  }

  @Override
  @Transactional
  public void transferIn(String from, BigInteger amount) {
    Map<String, BigInteger> balances = lockAccounts(from, custodyPrincipal);
    BigInteger fromBalance = balances.get(from);
    if (fromBalance.compareTo(amount) < 0) {
      log.warn(
          "Ledger transfer rejected direction=in principal={} amount={} balance={}",
          from,
          amount,
          fromBalance);
      throw new LedgerTransferException(LedgerFailureReason.INSUFFICIENT_FUNDS, from, amount);
    }
    writeBalance(from, fromBalance.subtract(amount));
    writeBalance(custodyPrincipal, balances.get(custodyPrincipal).add(amount));
    journal("TRANSFER_IN", from, custodyPrincipal, amount);
  }

  @Override
  @Transactional
  public void transferOut(String to, BigInteger amount) {
    Map<String, BigInteger> balances = lockAccounts(to, custodyPrincipal);
    BigInteger custodyBalance = balances.get(custodyPrincipal);
    if (custodyBalance.compareTo(amount) < 0) {
      log.warn(
          "Ledger transfer rejected direction=out principal={} amount={} custodyBalance={}",
          to,
          amount,
          custodyBalance);
      throw new LedgerTransferException(LedgerFailureReason.RESERVE_INSUFFICIENT, to, amount);
    }
    writeBalance(custodyPrincipal, custodyBalance.subtract(amount));
    writeBalance(to, balances.get(to).add(amount));
    journal("TRANSFER_OUT", custodyPrincipal, to, amount);
  }

  @Override
  @Transactional(readOnly = true)
  public BigInteger balanceOf(String principal) {
    List<BigDecimal> rows =
        jdbcTemplate.queryForList(
            "SELECT balance FROM ledger_accounts WHERE principal = ?", BigDecimal.class, principal);
    return rows.isEmpty() ? BigInteger.ZERO : rows.get(0).toBigIntegerExact();
  }

  /** Credits an external account from outside the ledger, e.g. an operator top-up. */
  @Transactional
  public BigInteger credit(String principal, BigInteger amount) {
    BigInteger balance = lockAccount(principal);
    BigInteger next = balance.add(amount);
    writeBalance(principal, next);
    journal("ADMIN_CREDIT", null, principal, amount);
    return next;
  }

  /** Locks both rows in principal order, whichever direction the value moves. */
  private Map<String, BigInteger> lockAccounts(String principal, String counterparty) {
    Map<String, BigInteger> balances = new TreeMap<>();
    for (String account : new TreeSet<>(List.of(principal, counterparty))) {
      balances.put(account, lockAccount(account));
    }
    return balances;
  }

  private BigInteger lockAccount(String principal) {
    jdbcTemplate.update(
        """
        INSERT INTO ledger_accounts (principal, balance, updated_at)
        VALUES (?, 0, ?)
        ON CONFLICT (principal) DO NOTHING
        """,
        principal,
        Timestamp.from(clock.instant()));
    BigDecimal balance =
        jdbcTemplate.queryForObject(
            "SELECT balance FROM ledger_accounts WHERE principal = ? FOR UPDATE",
            BigDecimal.class,
            principal);
    return balance == null ? BigInteger.ZERO : balance.toBigIntegerExact();
  }

  private void writeBalance(String principal, BigInteger balance) {
    jdbcTemplate.update(
        "UPDATE ledger_accounts SET balance = ?, updated_at = ? WHERE principal = ?",
        new BigDecimal(balance),
        Timestamp.from(clock.instant()),
        principal);
  }

  private void journal(String type, String from, String to, BigInteger amount) {
    jdbcTemplate.update(
        """
        INSERT INTO ledger_transfers (
            id, transfer_type, from_principal, to_principal, amount, created_at
        ) VALUES (?, ?, ?, ?, ?, ?)
        """,
        UUID.randomUUID(),
        type,
        from,
        to,
        new BigDecimal(amount),
        Timestamp.from(clock.instant()));
  }
}

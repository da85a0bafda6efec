package com.p2pescrow.escrowapi.balances;

import com.p2pescrow.domain.balance.SellerBalance;
import java.util.Optional;

public interface BalanceRepository {
  Optional<SellerBalance> findByPrincipal(String principal);

  Optional<SellerBalance> findByPrincipalForUpdate(String principal);

  /** Locks the principal's row, creating an empty one first when none exists. */
  SellerBalance lockOrCreate(String principal);

  void update(SellerBalance balance);
}

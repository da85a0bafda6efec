package com.p2pescrow.escrowapi.escrows;

import java.util.List;

public interface EscrowEventRepository {
  void append(EscrowEventAppend event);

  List<EscrowEvent> findByEscrowId(long escrowId);
}

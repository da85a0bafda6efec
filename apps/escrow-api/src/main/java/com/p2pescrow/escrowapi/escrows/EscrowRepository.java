package com.p2pescrow.escrowapi.escrows;

import com.p2pescrow.domain.escrow.Escrow;
import java.util.List;
import java.util.Optional;

public interface EscrowRepository {
  long nextId();

  void insert(Escrow escrow);

  Optional<Escrow> findById(long escrowId);

  Optional<Escrow> findByIdForUpdate(long escrowId);

  void update(Escrow escrow);

  /** Escrows in which {@code principal} is buyer or seller, oldest first. */
  List<Escrow> findByParticipant(String principal);
}

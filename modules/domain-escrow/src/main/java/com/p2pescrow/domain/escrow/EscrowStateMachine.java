package com.p2pescrow.domain.escrow;

import java.util.EnumSet;
import java.util.Map;

public final class EscrowStateMachine {
  private static final Map<EscrowStatus, EnumSet<EscrowStatus>> ALLOWED_TRANSITIONS =
      Map.of(
          EscrowStatus.PENDING,
              EnumSet.of(EscrowStatus.COMPLETED, EscrowStatus.CANCELLED, EscrowStatus.DISPUTED),
          EscrowStatus.DISPUTED, EnumSet.of(EscrowStatus.COMPLETED),
          EscrowStatus.COMPLETED, EnumSet.noneOf(EscrowStatus.class),
          EscrowStatus.CANCELLED, EnumSet.noneOf(EscrowStatus.class));

  private EscrowStateMachine() {}

  public static boolean canTransition(EscrowStatus from, EscrowStatus to) {
    if (from == null || to == null) {
      return false;
    }
    EnumSet<EscrowStatus> allowed = ALLOWED_TRANSITIONS.get(from);
    return allowed != null && allowed.contains(to);
  }

  public static void validateTransition(EscrowStatus from, EscrowStatus to) {
    if (!canTransition(from, to)) {
      throw new EscrowDomainException(
          EscrowErrorCode.INVALID_STATE,
          "Invalid escrow status transition from " + from + " to " + to);
    }
  }
}

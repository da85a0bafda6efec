package com.p2pescrow.escrowapi.api;

import jakarta.validation.constraints.NotNull;

public record ResolveDisputeRequest(@NotNull Boolean favorBuyer) {}

package com.p2pescrow.escrowapi.api;

import jakarta.validation.constraints.NotNull;

public record CreateProfileRequest(
    @NotNull String displayName,
    @NotNull String primaryContact,
    @NotNull String secondaryContact) {}

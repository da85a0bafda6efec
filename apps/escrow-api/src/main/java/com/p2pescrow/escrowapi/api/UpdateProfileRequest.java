package com.p2pescrow.escrowapi.api;

import jakarta.validation.constraints.NotNull;

public record UpdateProfileRequest(
    @NotNull String primaryContact, @NotNull String secondaryContact) {}

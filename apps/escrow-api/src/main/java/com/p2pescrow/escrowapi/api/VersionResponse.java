package com.p2pescrow.escrowapi.api;

import java.time.Instant;

public record VersionResponse(String application, String version, Instant buildTime) {}

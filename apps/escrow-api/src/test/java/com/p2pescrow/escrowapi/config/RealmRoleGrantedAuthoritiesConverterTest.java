package com.p2pescrow.escrowapi.config;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.oauth2.jwt.Jwt;

class RealmRoleGrantedAuthoritiesConverterTest {
  private final RealmRoleGrantedAuthoritiesConverter converter =
      new RealmRoleGrantedAuthoritiesConverter();

  @Test
  void shouldUppercaseRealmRoles() {
    Jwt jwt = token(Map.of("realm_access", Map.of("roles", List.of("admin", "Trader"))));

    assertEquals(Set.of("ROLE_ADMIN", "ROLE_TRADER"), authorityNames(jwt));
  }

  @Test
  void shouldReadClientRolesOfEscrowApiOnly() {
    Jwt jwt =
        token(
            Map.of(
                "resource_access",
                Map.of(
                    "escrow-api", Map.of("roles", List.of("admin")),
                    "other-client", Map.of("roles", List.of("auditor")))));

    assertEquals(Set.of("ROLE_ADMIN"), authorityNames(jwt));
  }

  @Test
  void shouldCombineScopesWithRealmAndClientRoles() {
    Jwt jwt =
        token(
            Map.of(
                "scope", "escrow:read",
                "realm_access", Map.of("roles", List.of("ADMIN")),
                "resource_access",
                    Map.of("escrow-api", Map.of("roles", List.of("admin", "arbitrator")))));

    assertEquals(
        Set.of("SCOPE_escrow:read", "ROLE_ADMIN", "ROLE_ARBITRATOR"), authorityNames(jwt));
  }

  @Test
  void shouldSkipBlankAndNonStringRoles() {
    Jwt jwt = token(Map.of("realm_access", Map.of("roles", List.of(" ", 42, "admin"))));

    assertEquals(Set.of("ROLE_ADMIN"), authorityNames(jwt));
  }

  @Test
  void shouldIgnoreMalformedAccessClaims() {
    Jwt jwt =
        token(
            Map.of(
                "realm_access", "ADMIN",
                "resource_access", Map.of("escrow-api", List.of("admin"))));

    assertEquals(Set.of(), authorityNames(jwt));
  }

  private static Jwt token(Map<String, Object> claims) {
    return Jwt.withTokenValue("token")
        .header("alg", "none")
        .subject("joe")
        .claims(existing -> existing.putAll(claims))
        .build();
  }

  private Set<String> authorityNames(Jwt jwt) {
    return converter.convert(jwt).stream()
        .map(GrantedAuthority::getAuthority)
        .collect(Collectors.toSet());
  }
}

package com.p2pescrow.escrowapi.config;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.springframework.core.convert.converter.Converter;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.server.resource.authentication.JwtGrantedAuthoritiesConverter;

/**
 * Maps Keycloak realm roles and {@code escrow-api} client roles to {@code ROLE_*} authorities,
 * keeping the standard {@code SCOPE_*} authorities alongside them.
 */
public class RealmRoleGrantedAuthoritiesConverter
    implements Converter<Jwt, Collection<GrantedAuthority>> {
  static final String API_CLIENT_ID = "escrow-api";

  private final JwtGrantedAuthoritiesConverter scopeConverter =
      new JwtGrantedAuthoritiesConverter();

  @Override
  public Collection<GrantedAuthority> convert(Jwt jwt) {
    Set<GrantedAuthority> authorities = new LinkedHashSet<>();
    Collection<GrantedAuthority> scopeAuthorities = scopeConverter.convert(jwt);
    if (scopeAuthorities != null) {
      authorities.addAll(scopeAuthorities);
    }

    Object resourceAccess = jwt.getClaims().get("resource_access");
    Object clientAccess =
        resourceAccess instanceof Map<?, ?> clients ? clients.get(API_CLIENT_ID) : null;

    for (String role : roles(jwt.getClaims().get("realm_access"))) {
      authorities.add(toAuthority(role));
    }
    for (String role : roles(clientAccess)) {
      authorities.add(toAuthority(role));
    }
    return authorities;
  }

  private static List<String> roles(Object access) {
    if (!(access instanceof Map<?, ?> accessMap)
        || !(accessMap.get("roles") instanceof Collection<?> roleValues)) {
      return List.of();
    }
    return roleValues.stream()
        .filter(String.class::isInstance)
        .map(String.class::cast)
        .filter(role -> !role.isBlank())
        .toList();
  }

  private static GrantedAuthority toAuthority(String role) {
    return new SimpleGrantedAuthority("ROLE_" + role.toUpperCase());
  }
}

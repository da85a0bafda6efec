package com.p2pescrow.escrowapi.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.convert.converter.Converter;
import org.springframework.http.HttpMethod;
import org.springframework.security.authentication.AbstractAuthenticationToken;
import org.springframework.security.config.annotation.method.configuration.EnableMethodSecurity;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configurers.AbstractHttpConfigurer;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.jwt.JwtDecoder;
import org.springframework.security.oauth2.jwt.NimbusJwtDecoder;
import org.springframework.security.oauth2.server.resource.authentication.JwtAuthenticationConverter;
import org.springframework.security.web.SecurityFilterChain;

/**
 * Stateless JWT resource server. The token subject is the trading principal; ledger top-ups
 * under {@code /v1/admin} additionally need the ADMIN realm role.
 */
@Configuration
@EnableMethodSecurity
public class SecurityConfig {
  private static final String[] OPS_PATHS = {
    "/actuator/health", "/actuator/health/**", "/v1/version"
  };
  private static final String[] API_DOC_PATHS = {
    "/v3/api-docs/**", "/swagger-ui/**", "/swagger-ui.html"
  };

  @Bean
  public SecurityFilterChain escrowApiSecurity(
      HttpSecurity http,
      Converter<Jwt, ? extends AbstractAuthenticationToken> principalConverter)
      throws Exception {
    return http.csrf(AbstractHttpConfigurer::disable)
        .sessionManagement(
            session -> session.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
        .authorizeHttpRequests(
            auth ->
                auth.requestMatchers(HttpMethod.GET, OPS_PATHS)
                    .permitAll()
                    .requestMatchers(API_DOC_PATHS)
                    .permitAll()
                    .requestMatchers("/v1/admin/**")
                    .hasRole("ADMIN")
                    .anyRequest()
                    .authenticated())
        .oauth2ResourceServer(
            oauth2 -> oauth2.jwt(jwt -> jwt.jwtAuthenticationConverter(principalConverter)))
        .build();
  }

  @Bean
  public Converter<Jwt, ? extends AbstractAuthenticationToken> principalConverter() {
    JwtAuthenticationConverter converter = new JwtAuthenticationConverter();
    converter.setJwtGrantedAuthoritiesConverter(new RealmRoleGrantedAuthoritiesConverter());
    return converter;
  }

  @Bean
  public JwtDecoder jwtDecoder(
      @Value(
              "${escrow.security.jwk-set-uri:"
                  + "http://localhost:8080/realms/escrow/protocol/openid-connect/certs}")
          String jwkSetUri) {
    return NimbusJwtDecoder.withJwkSetUri(jwkSetUri).build();
  }
}

package com.p2pescrow.escrowapi.config;

import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.security.SecurityRequirement;
import io.swagger.v3.oas.models.security.SecurityScheme;
import org.springdoc.core.models.GroupedOpenApi;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.info.BuildProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * API documentation. Trading endpoints and the admin ledger are published as separate groups;
 * every operation except the ops group expects a bearer JWT whose subject is the caller.
 */
@Configuration
public class OpenApiConfig {
  private static final String BEARER_SCHEME = "bearer-jwt";

  @Bean
  public OpenAPI escrowApiOpenApi(
      ObjectProvider<BuildProperties> buildPropertiesProvider,
      @Value("${spring.application.name:escrow-api}") String applicationName) {
    String version =
        buildPropertiesProvider.stream()
            .map(BuildProperties::getVersion)
            .filter(v -> v != null && !v.isBlank())
            .findFirst()
            .orElse("unknown");
    return new OpenAPI()
        .info(
            new Info()
                .title(applicationName)
                .version(version)
                .description(
                    "Escrow-mediated peer-to-peer trading: profiles, seller balances,"
                        + " offers, escrows and dispute arbitration"))
        .components(
            new Components()
                .addSecuritySchemes(
                    BEARER_SCHEME,
                    new SecurityScheme()
                        .type(SecurityScheme.Type.HTTP)
                        .scheme("bearer")
                        .bearerFormat("JWT")))
        .addSecurityItem(new SecurityRequirement().addList(BEARER_SCHEME));
  }

  @Bean
  public GroupedOpenApi tradingApiGroup() {
    return GroupedOpenApi.builder()
        .group("trading")
        .pathsToMatch("/v1/profiles/**", "/v1/balances/**", "/v1/offers/**", "/v1/escrows/**")
        .build();
  }

  @Bean
  public GroupedOpenApi adminApiGroup() {
    return GroupedOpenApi.builder().group("admin").pathsToMatch("/v1/admin/**").build();
  }

  @Bean
  public GroupedOpenApi opsApiGroup() {
    return GroupedOpenApi.builder()
        .group("ops")
        .pathsToMatch("/v1/version", "/actuator/health", "/actuator/health/**")
        .build();
  }
}

package com.p2pescrow.escrowapi.api;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.info.BuildProperties;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** Build metadata from {@code META-INF/build-info.properties} when the build produced one. */
@RestController
@RequestMapping("/v1")
public class VersionController {
  private static final String UNKNOWN_VERSION = "unknown";

  private final ObjectProvider<BuildProperties> buildPropertiesProvider;
  private final String applicationName;

  public VersionController(
      ObjectProvider<BuildProperties> buildPropertiesProvider,
      @Value("${spring.application.name:escrow-api}") String applicationName) {
    this.buildPropertiesProvider = buildPropertiesProvider;
    this.applicationName = applicationName;
  }

  @GetMapping("/version")
  public VersionResponse version() {
    return buildPropertiesProvider.stream()
        .findFirst()
        .map(
            build ->
                new VersionResponse(
                    applicationName,
                    build.getVersion() == null || build.getVersion().isBlank()
                        ? UNKNOWN_VERSION
                        : build.getVersion(),
                    build.getTime()))
        .orElseGet(() -> new VersionResponse(applicationName, UNKNOWN_VERSION, null));
  }
}

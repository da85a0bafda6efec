package com.p2pescrow.escrowapi.api;

import com.p2pescrow.domain.escrow.Profile;
import com.p2pescrow.escrowapi.profiles.ProfileService;
import jakarta.validation.Valid;
import java.time.Clock;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/profiles")
public class ProfileController {
  private final ProfileService profileService;
  private final Clock clock;

  public ProfileController(ProfileService profileService, Clock clock) {
    this.profileService = profileService;
    this.clock = clock;
  }

  @PostMapping
  public ResponseEntity<ProfileResponse> createProfile(
      @AuthenticationPrincipal Jwt jwt, @Valid @RequestBody CreateProfileRequest request) {
    Profile profile =
        profileService.createProfile(
            jwt.getSubject(),
            request.displayName(),
            request.primaryContact(),
            request.secondaryContact(),
            clock.instant());
    return ResponseEntity.status(HttpStatus.CREATED).body(ProfileResponse.from(profile));
  }

  @PutMapping("/me")
  public ResponseEntity<ProfileResponse> updateProfile(
      @AuthenticationPrincipal Jwt jwt, @Valid @RequestBody UpdateProfileRequest request) {
    Profile profile =
        profileService.updateProfile(
            jwt.getSubject(), request.primaryContact(), request.secondaryContact());
    return ResponseEntity.ok(ProfileResponse.from(profile));
  }

  @GetMapping("/{principal}")
  public ResponseEntity<ProfileResponse> getProfile(@PathVariable("principal") String principal) {
    Profile profile =
        profileService
            .findProfile(principal)
            .orElseThrow(() -> ProfileService.profileRequired(principal));
    return ResponseEntity.ok(ProfileResponse.from(profile));
  }
}

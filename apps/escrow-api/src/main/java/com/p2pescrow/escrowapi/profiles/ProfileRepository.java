package com.p2pescrow.escrowapi.profiles;

import com.p2pescrow.domain.escrow.Profile;
import java.util.Optional;

public interface ProfileRepository {
  boolean exists(String principal);

  Optional<Profile> findByPrincipal(String principal);

  Optional<Profile> findByPrincipalForUpdate(String principal);

  void insert(Profile profile);

  void update(Profile profile);
}

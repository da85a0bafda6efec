package com.p2pescrow.escrowapi.profiles;

import com.p2pescrow.domain.escrow.EscrowDomainException;
import com.p2pescrow.domain.escrow.EscrowErrorCode;
import com.p2pescrow.domain.escrow.Profile;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.function.UnaryOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class ProfileService {
  private static final Logger log = LoggerFactory.getLogger(ProfileService.class);

  private final ProfileRepository profileRepository;

  public ProfileService(ProfileRepository profileRepository) {
    this.profileRepository = profileRepository;
  }

  @Transactional
  public Profile createProfile(
      String principal,
      String displayName,
      String primaryContact,
      String secondaryContact,
      Instant now) {
    Profile profile =
        Profile.createNew(principal, displayName, primaryContact, secondaryContact, now);
    if (profileRepository.exists(principal)) {
      throw alreadyExists(principal);
    }
    try {
      profileRepository.insert(profile);
    } catch (DuplicateKeyException ex) {
      // concurrent create won the primary key
      throw alreadyExists(principal);
    }
    log.info("Profile created principal={}", principal);
    return profile;
  }

  @Transactional
  public Profile updateProfile(String principal, String primaryContact, String secondaryContact) {
    Profile current =
        profileRepository
            .findByPrincipalForUpdate(principal)
            .orElseThrow(() -> profileRequired(principal));
    Profile updated = current.withContacts(primaryContact, secondaryContact);
    profileRepository.update(updated);
    return updated;
  }

  @Transactional(readOnly = true)
  public Optional<Profile> findProfile(String principal) {
    return profileRepository.findByPrincipal(principal);
  }

  /** Rejects callers that have not registered a profile yet. */
  public void requireProfile(String principal) {
    if (principal == null || !profileRepository.exists(principal)) {
      throw profileRequired(principal);
    }
  }

  /**
   * Applies trade-counter updates to several profiles. Rows are locked in principal order so
   * that two escrows touching the same pair of traders cannot deadlock.
   */
  @Transactional
  public void recordTrades(Map<String, UnaryOperator<Profile>> changes) {
    for (Map.Entry<String, UnaryOperator<Profile>> change : new TreeMap<>(changes).entrySet()) {
      Profile current =
          profileRepository
              .findByPrincipalForUpdate(change.getKey())
              .orElseThrow(() -> profileRequired(change.getKey()));
      profileRepository.update(change.getValue().apply(current));
    }
  }

  private static EscrowDomainException alreadyExists(String principal) {
    return new EscrowDomainException(
        EscrowErrorCode.ALREADY_EXISTS, "Profile already exists for " + principal);
  }

  public static EscrowDomainException profileRequired(String principal) {
    return new EscrowDomainException(
        EscrowErrorCode.PROFILE_REQUIRED, "Profile required for " + principal);
  }
}

package com.classengage.backend.modules.user.application;

import java.time.Clock;
import java.time.OffsetDateTime;

import com.classengage.backend.global.common.text.TextNormalizer;
import com.classengage.backend.global.error.ErrorCode;
import com.classengage.backend.global.error.ProblemException;
import com.classengage.backend.modules.user.domain.AppUser;
import com.classengage.backend.modules.user.infrastructure.persistence.AppUserRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Get-or-create for users keyed by trimmed, case-sensitive display name.
 */
@Service
@Transactional
public class UserIdentityService {

    private static final Logger log = LoggerFactory.getLogger(UserIdentityService.class);

    private final AppUserRepository appUserRepository;
    private final Clock clock;

    public UserIdentityService(AppUserRepository appUserRepository, Clock clock) {
        this.appUserRepository = appUserRepository;
        this.clock = clock;
    }

    public AppUser resolveUser(String displayName) {
        String cleanName = normalizeDisplayName(displayName);
        if (cleanName == null) {
            throw new ProblemException(ErrorCode.INVALID_DISPLAY_NAME);
        }
        return resolveNormalized(cleanName);
    }

    /**
     * Strips Unicode whitespace from both ends and returns {@code null} when the rest is empty or too long.
     */
    public static String normalizeDisplayName(String displayName) {
        if (displayName == null) {
            return null;
        }
        String trimmed = TextNormalizer.strip(displayName);
        if (trimmed.isEmpty() || trimmed.length() > AppUser.MAX_DISPLAY_NAME_LENGTH) {
            return null;
        }
        return trimmed;
    }

    private AppUser resolveNormalized(String cleanName) {
        return appUserRepository.findByDisplayName(cleanName)
                .orElseGet(() -> createOrReload(cleanName));
    }

    // A concurrent creator wins the insert; the conflict leaves 0 rows and we read theirs.
    private AppUser createOrReload(String cleanName) {
        int inserted = appUserRepository.insertIfAbsent(cleanName, OffsetDateTime.now(clock));
        if (inserted == 1) {
            log.info("Created user '{}'", cleanName);
        } else {
            log.debug("User '{}' was created concurrently; reloading", cleanName);
        }
        return appUserRepository.findByDisplayName(cleanName)
                .orElseThrow(() -> new IllegalStateException("User row vanished after insert: " + cleanName));
    }
}

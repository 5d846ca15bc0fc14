package com.classengage.backend.modules.session.application;

import java.security.SecureRandom;
import java.util.random.RandomGenerator;

import com.classengage.backend.global.error.ErrorCode;
import com.classengage.backend.global.error.ProblemException;
import com.classengage.backend.modules.session.infrastructure.persistence.LiveSessionRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Draws join codes from {@code A-Z0-9} with a cryptographically strong source and retries on
 * collision a bounded number of times.
 */
@Component
public class JoinCodeGenerator {

    static final String ALPHABET = "ABCDEFGHIJKLMNOPQRSTUVWXYZ0123456789";

    private static final Logger log = LoggerFactory.getLogger(JoinCodeGenerator.class);

    private final LiveSessionRepository liveSessionRepository;
    private final SessionPolicy sessionPolicy;
    private final RandomGenerator random;

    @Autowired
    public JoinCodeGenerator(LiveSessionRepository liveSessionRepository, SessionPolicy sessionPolicy) {
        this(liveSessionRepository, sessionPolicy, new SecureRandom());
    }

    JoinCodeGenerator(LiveSessionRepository liveSessionRepository, SessionPolicy sessionPolicy,
                      RandomGenerator random) {
        this.liveSessionRepository = liveSessionRepository;
        this.sessionPolicy = sessionPolicy;
        this.random = random;
    }

    public String generateUniqueCode() {
        int maxAttempts = sessionPolicy.maxCodeAttempts();
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            String candidate = nextCandidate();
            if (!liveSessionRepository.existsByCode(candidate)) {
                return candidate;
            }
            log.warn("Join code collision on attempt {}/{}", attempt, maxAttempts);
        }
        throw new ProblemException(ErrorCode.CODE_COLLISION_EXHAUSTED,
                "Failed to generate a unique join code after " + maxAttempts + " attempts");
    }

    String nextCandidate() {
        int length = sessionPolicy.codeLength();
        StringBuilder sb = new StringBuilder(length);
        for (int i = 0; i < length; i++) {
            sb.append(ALPHABET.charAt(random.nextInt(ALPHABET.length())));
        }
        return sb.toString();
    }
}

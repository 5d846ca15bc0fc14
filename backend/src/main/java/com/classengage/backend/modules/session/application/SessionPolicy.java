package com.classengage.backend.modules.session.application;

/**
 * Capacity and join-code settings for live sessions.
 *
 * @param hostSessionLimit     non-ended sessions a single host may own
 * @param pendingQuestionLimit pending questions a participant may have in one session
 * @param codeLength           length of generated join codes
 * @param maxCodeAttempts      candidates sampled before code generation gives up
 */
public record SessionPolicy(
        int hostSessionLimit,
        int pendingQuestionLimit,
        int codeLength,
        int maxCodeAttempts
) {

    public static final int DEFAULT_HOST_SESSION_LIMIT = 3;
    public static final int DEFAULT_PENDING_QUESTION_LIMIT = 3;
    public static final int DEFAULT_CODE_LENGTH = 6;
    public static final int DEFAULT_MAX_CODE_ATTEMPTS = 10;

    public SessionPolicy {
        if (hostSessionLimit < 1) {
            throw new IllegalArgumentException("hostSessionLimit must be >= 1");
        }
        if (pendingQuestionLimit < 1) {
            throw new IllegalArgumentException("pendingQuestionLimit must be >= 1");
        }
        if (codeLength < 4 || codeLength > 6) {
            throw new IllegalArgumentException("codeLength must be between 4 and 6");
        }
        if (maxCodeAttempts < 1) {
            throw new IllegalArgumentException("maxCodeAttempts must be >= 1");
        }
    }

    public static SessionPolicy defaults() {
        return new SessionPolicy(
                DEFAULT_HOST_SESSION_LIMIT,
                DEFAULT_PENDING_QUESTION_LIMIT,
                DEFAULT_CODE_LENGTH,
                DEFAULT_MAX_CODE_ATTEMPTS
        );
    }
}

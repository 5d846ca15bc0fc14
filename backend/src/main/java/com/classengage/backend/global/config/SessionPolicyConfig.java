package com.classengage.backend.global.config;

import com.classengage.backend.modules.session.application.SessionPolicy;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class SessionPolicyConfig {

    @Bean
    public SessionPolicy sessionPolicy(
            @Value("${classengage.session.host-session-limit:3}") int hostSessionLimit,
            @Value("${classengage.session.pending-question-limit:3}") int pendingQuestionLimit,
            @Value("${classengage.session.code-length:6}") int codeLength,
            @Value("${classengage.session.max-code-attempts:10}") int maxCodeAttempts
    ) {
        return new SessionPolicy(hostSessionLimit, pendingQuestionLimit, codeLength, maxCodeAttempts);
    }
}

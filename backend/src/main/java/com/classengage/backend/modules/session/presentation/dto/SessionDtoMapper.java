package com.classengage.backend.modules.session.presentation.dto;

import com.classengage.backend.modules.session.domain.LiveSession;
import com.classengage.backend.modules.session.domain.Question;
import com.classengage.backend.modules.session.domain.SessionParticipant;
import com.classengage.backend.modules.user.domain.AppUser;

public final class SessionDtoMapper {

    private SessionDtoMapper() {
    }

    public static UserSummaryResponse toUserSummary(AppUser user) {
        if (user == null) {
            return null;
        }
        return new UserSummaryResponse(user.getId(), user.getDisplayName());
    }

    public static SessionSummaryResponse toSessionSummary(LiveSession session) {
        return toSessionSummary(session, session.getHost());
    }

    public static SessionSummaryResponse toSessionSummary(LiveSession session, AppUser host) {
        return new SessionSummaryResponse(
                session.getId(),
                session.getCode(),
                session.getTitle(),
                session.getStatus().value(),
                toUserSummary(host),
                session.getCreatedAt()
        );
    }

    public static ParticipantSummaryResponse toParticipantSummary(SessionParticipant participant) {
        return new ParticipantSummaryResponse(
                toUserSummary(participant.getUser()),
                participant.getRole().value(),
                participant.getJoinedAt()
        );
    }

    public static QuestionSummaryResponse toQuestionSummary(Question question) {
        return new QuestionSummaryResponse(
                question.getId(),
                question.getSession().getId(),
                question.getBody(),
                question.getStatus().value(),
                question.getLikes(),
                toUserSummary(question.getAuthor()),
                question.getCreatedAt()
        );
    }
}

package com.classengage.backend.modules.session.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import com.classengage.backend.global.error.ErrorCode;
import com.classengage.backend.global.error.ProblemException;
import com.classengage.backend.modules.session.domain.LiveSession;
import com.classengage.backend.modules.session.domain.ParticipantRole;
import com.classengage.backend.modules.session.domain.Question;
import com.classengage.backend.modules.session.domain.QuestionStatus;
import com.classengage.backend.modules.session.domain.SessionParticipant;
import com.classengage.backend.modules.session.domain.SessionStatus;
import com.classengage.backend.modules.session.infrastructure.persistence.LiveSessionRepository;
import com.classengage.backend.modules.session.infrastructure.persistence.QuestionRepository;
import com.classengage.backend.modules.session.infrastructure.persistence.SessionParticipantRepository;
import com.classengage.backend.modules.session.presentation.dto.QuestionSummaryResponse;
import com.classengage.backend.modules.session.presentation.dto.SessionSummaryResponse;
import com.classengage.backend.modules.user.application.UserIdentityService;
import com.classengage.backend.modules.user.domain.AppUser;
import com.classengage.backend.modules.user.infrastructure.persistence.AppUserRepository;
import com.classengage.backend.support.TestEntities;

import org.assertj.core.api.ThrowableAssert.ThrowingCallable;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;

@ExtendWith(MockitoExtension.class)
class SessionLifecycleServiceTest {

    private static final OffsetDateTime NOW = OffsetDateTime.parse("2025-03-01T09:00:00Z");

    @Mock
    private LiveSessionRepository liveSessionRepository;

    @Mock
    private SessionParticipantRepository sessionParticipantRepository;

    @Mock
    private QuestionRepository questionRepository;

    @Mock
    private AppUserRepository appUserRepository;

    @Mock
    private UserIdentityService userIdentityService;

    @Mock
    private JoinCodeGenerator joinCodeGenerator;

    private SessionLifecycleService service;

    private AppUser host;
    private AppUser student;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(NOW.toInstant(), ZoneOffset.UTC);
        service = new SessionLifecycleService(
                liveSessionRepository,
                sessionParticipantRepository,
                questionRepository,
                appUserRepository,
                userIdentityService,
                joinCodeGenerator,
                SessionPolicy.defaults(),
                clock
        );
        host = TestEntities.user(1L, "Alice");
        student = TestEntities.user(2L, "Bob");
    }

    @Test
    @DisplayName("creating a session stores a draft with a fresh code and enrolls the host")
    void createSession_registersHost() {
        when(userIdentityService.resolveUser("Alice")).thenReturn(host);
        when(appUserRepository.findByIdForUpdate(1L)).thenReturn(Optional.of(host));
        when(liveSessionRepository.countByHost_IdAndStatusIn(eq(1L), anyCollection())).thenReturn(2L);
        when(joinCodeGenerator.generateUniqueCode()).thenReturn("ABC123");
        when(liveSessionRepository.saveAndFlush(any(LiveSession.class))).thenAnswer(invocation -> {
            LiveSession session = invocation.getArgument(0);
            TestEntities.assignId(LiveSession.class, session, 10L);
            TestEntities.setCreatedAt(session, NOW);
            return session;
        });

        SessionSummaryResponse summary = service.createSession("  Physics 101 ", "  Alice ");

        assertThat(summary.id()).isEqualTo(10L);
        assertThat(summary.code()).isEqualTo("ABC123");
        assertThat(summary.title()).isEqualTo("Physics 101");
        assertThat(summary.status()).isEqualTo("draft");
        assertThat(summary.host().displayName()).isEqualTo("Alice");
        assertThat(summary.createdAt()).isEqualTo(NOW);
        verify(sessionParticipantRepository).upsert(10L, 1L, ParticipantRole.HOST.name(), NOW);
    }

    @Test
    @DisplayName("a host with three open sessions cannot open a fourth")
    void createSession_rejectsFourthOpenSession() {
        when(userIdentityService.resolveUser("Alice")).thenReturn(host);
        when(appUserRepository.findByIdForUpdate(1L)).thenReturn(Optional.of(host));
        when(liveSessionRepository.countByHost_IdAndStatusIn(eq(1L), anyCollection())).thenReturn(3L);

        assertErrorCode(() -> service.createSession("Physics", "Alice"), ErrorCode.HOST_SESSION_LIMIT_EXCEEDED);

        verifyNoInteractions(joinCodeGenerator, sessionParticipantRepository);
        verify(liveSessionRepository, never()).saveAndFlush(any());
    }

    @Test
    void createSession_rejectsBlankHostAndTitle() {
        assertErrorCode(() -> service.createSession("Physics", "   "), ErrorCode.INVALID_HOST_DISPLAY_NAME);
        assertErrorCode(() -> service.createSession("Physics", null), ErrorCode.INVALID_HOST_DISPLAY_NAME);
        assertErrorCode(() -> service.createSession("Physics", "\u3000\u3000"), ErrorCode.INVALID_HOST_DISPLAY_NAME);
        assertErrorCode(() -> service.createSession("Physics", "\u00A0"), ErrorCode.INVALID_HOST_DISPLAY_NAME);
        assertErrorCode(() -> service.createSession("  ", "Alice"), ErrorCode.INVALID_TITLE);
        assertErrorCode(() -> service.createSession("\u2003\u3000", "Alice"), ErrorCode.INVALID_TITLE);
        assertErrorCode(() -> service.createSession("\u00A0\u00A0", "Alice"), ErrorCode.INVALID_TITLE);
        assertErrorCode(() -> service.createSession("t".repeat(LiveSession.MAX_TITLE_LENGTH + 1), "Alice"),
                ErrorCode.INVALID_TITLE);

        verifyNoInteractions(userIdentityService, liveSessionRepository);
    }

    @Test
    @DisplayName("a code taken between the check and the insert surfaces as a collision")
    void createSession_mapsCodeConstraintViolation() {
        when(userIdentityService.resolveUser("Alice")).thenReturn(host);
        when(appUserRepository.findByIdForUpdate(1L)).thenReturn(Optional.of(host));
        when(liveSessionRepository.countByHost_IdAndStatusIn(eq(1L), anyCollection())).thenReturn(0L);
        when(joinCodeGenerator.generateUniqueCode()).thenReturn("ABC123");
        when(liveSessionRepository.saveAndFlush(any(LiveSession.class))).thenThrow(
                new DataIntegrityViolationException("could not execute statement",
                        new RuntimeException("duplicate key value violates unique constraint \"uq_sessions_code\"")));

        assertErrorCode(() -> service.createSession("Physics", "Alice"), ErrorCode.CODE_COLLISION_EXHAUSTED);
        verifyNoInteractions(sessionParticipantRepository);
    }

    @Test
    void createSession_rethrowsOtherIntegrityViolations() {
        when(userIdentityService.resolveUser("Alice")).thenReturn(host);
        when(appUserRepository.findByIdForUpdate(1L)).thenReturn(Optional.of(host));
        when(liveSessionRepository.countByHost_IdAndStatusIn(eq(1L), anyCollection())).thenReturn(0L);
        when(joinCodeGenerator.generateUniqueCode()).thenReturn("ABC123");
        when(liveSessionRepository.saveAndFlush(any(LiveSession.class))).thenThrow(
                new DataIntegrityViolationException("could not execute statement",
                        new RuntimeException("violates check constraint \"ck_sessions_status\"")));

        assertThatThrownBy(() -> service.createSession("Physics", "Alice"))
                .isInstanceOf(DataIntegrityViolationException.class);
    }

    @Test
    @DisplayName("the host joining their own session keeps the host role")
    void joinSession_hostKeepsHostRole() {
        LiveSession session = TestEntities.session(10L, host, "ABC123", SessionStatus.DRAFT, NOW);
        when(liveSessionRepository.findByCode("ABC123")).thenReturn(Optional.of(session));
        when(userIdentityService.resolveUser("Alice")).thenReturn(host);

        SessionSummaryResponse summary = service.joinSession("ABC123", "\u3000Alice\u2003");

        assertThat(summary.code()).isEqualTo("ABC123");
        verify(sessionParticipantRepository).upsert(10L, 1L, "HOST", NOW);
    }

    @Test
    void joinSession_otherUserJoinsAsParticipant() {
        LiveSession session = TestEntities.session(10L, host, "ABC123", SessionStatus.ACTIVE, NOW);
        when(liveSessionRepository.findByCode("ABC123")).thenReturn(Optional.of(session));
        when(userIdentityService.resolveUser("Bob")).thenReturn(student);

        service.joinSession("ABC123", "Bob");

        verify(sessionParticipantRepository).upsert(10L, 2L, "PARTICIPANT", NOW);
    }

    @Test
    @DisplayName("a rejected join creates neither a user nor a roster entry")
    void joinSession_rejectionsHaveNoSideEffects() {
        assertErrorCode(() -> service.joinSession("ABC123", "  "), ErrorCode.INVALID_DISPLAY_NAME);
        assertErrorCode(() -> service.joinSession("ABC123", "\u3000\u3000"), ErrorCode.INVALID_DISPLAY_NAME);
        assertErrorCode(() -> service.joinSession("ABC123", "\u00A0"), ErrorCode.INVALID_DISPLAY_NAME);
        verifyNoInteractions(liveSessionRepository);

        when(liveSessionRepository.findByCode("NOPE00")).thenReturn(Optional.empty());
        assertErrorCode(() -> service.joinSession("NOPE00", "Bob"), ErrorCode.SESSION_NOT_FOUND);

        LiveSession ended = TestEntities.session(11L, host, "END000", SessionStatus.ENDED, NOW);
        when(liveSessionRepository.findByCode("END000")).thenReturn(Optional.of(ended));
        assertErrorCode(() -> service.joinSession("END000", "Bob"), ErrorCode.SESSION_NOT_JOINABLE);

        verifyNoInteractions(userIdentityService, sessionParticipantRepository);
    }

    @Test
    void submitQuestion_storesPendingQuestion() {
        LiveSession session = TestEntities.session(10L, host, "ABC123", SessionStatus.DRAFT, NOW);
        when(liveSessionRepository.findByCode("ABC123")).thenReturn(Optional.of(session));
        when(sessionParticipantRepository.findBySessionAndUserForUpdate(10L, 2L))
                .thenReturn(Optional.of(new SessionParticipant()));
        when(appUserRepository.findById(2L)).thenReturn(Optional.of(student));
        when(questionRepository.countBySession_IdAndAuthor_IdAndStatus(10L, 2L, QuestionStatus.PENDING))
                .thenReturn(2L);
        when(questionRepository.saveAndFlush(any(Question.class))).thenAnswer(invocation -> {
            Question question = invocation.getArgument(0);
            TestEntities.assignId(question, 100L);
            TestEntities.setCreatedAt(question, NOW);
            return question;
        });

        QuestionSummaryResponse response = service.submitQuestion("ABC123", 2L, "\u3000 What is entropy?\u00A0 ");

        assertThat(response.id()).isEqualTo(100L);
        assertThat(response.sessionId()).isEqualTo(10L);
        assertThat(response.body()).isEqualTo("What is entropy?");
        assertThat(response.status()).isEqualTo("pending");
        assertThat(response.likes()).isZero();
        assertThat(response.author().id()).isEqualTo(2L);
    }

    @Test
    void submitQuestion_acceptsBodyOfExactlyMaxLength() {
        LiveSession session = TestEntities.session(10L, host, "ABC123", SessionStatus.ACTIVE, NOW);
        when(liveSessionRepository.findByCode("ABC123")).thenReturn(Optional.of(session));
        when(sessionParticipantRepository.findBySessionAndUserForUpdate(10L, 2L))
                .thenReturn(Optional.of(new SessionParticipant()));
        when(appUserRepository.findById(2L)).thenReturn(Optional.of(student));
        when(questionRepository.saveAndFlush(any(Question.class))).thenAnswer(invocation -> invocation.getArgument(0));

        String body = "q".repeat(Question.MAX_BODY_LENGTH);
        QuestionSummaryResponse response = service.submitQuestion("ABC123", 2L, " " + body + " ");

        assertThat(response.body()).hasSize(Question.MAX_BODY_LENGTH);
    }

    @Test
    @DisplayName("a fourth pending question from the same user is refused")
    void submitQuestion_rejectsOverPendingLimit() {
        LiveSession session = TestEntities.session(10L, host, "ABC123", SessionStatus.DRAFT, NOW);
        when(liveSessionRepository.findByCode("ABC123")).thenReturn(Optional.of(session));
        when(sessionParticipantRepository.findBySessionAndUserForUpdate(10L, 2L))
                .thenReturn(Optional.of(new SessionParticipant()));
        when(appUserRepository.findById(2L)).thenReturn(Optional.of(student));
        when(questionRepository.countBySession_IdAndAuthor_IdAndStatus(10L, 2L, QuestionStatus.PENDING))
                .thenReturn(3L);

        assertErrorCode(() -> service.submitQuestion("ABC123", 2L, "Another?"), ErrorCode.QUESTION_LIMIT_EXCEEDED);
        verify(questionRepository, never()).saveAndFlush(any());
    }

    @Test
    void submitQuestion_requiresRosterMembership() {
        LiveSession session = TestEntities.session(10L, host, "ABC123", SessionStatus.DRAFT, NOW);
        when(liveSessionRepository.findByCode("ABC123")).thenReturn(Optional.of(session));
        when(sessionParticipantRepository.findBySessionAndUserForUpdate(10L, 99L)).thenReturn(Optional.empty());

        assertErrorCode(() -> service.submitQuestion("ABC123", 99L, "Hello?"), ErrorCode.NOT_PARTICIPANT);
        assertErrorCode(() -> service.submitQuestion("ABC123", null, "Hello?"), ErrorCode.NOT_PARTICIPANT);
        verifyNoInteractions(questionRepository);
    }

    @Test
    void submitQuestion_rejectsInvalidBodyBeforeLookup() {
        assertErrorCode(() -> service.submitQuestion("ABC123", 2L, "   "), ErrorCode.INVALID_QUESTION_BODY);
        assertErrorCode(() -> service.submitQuestion("ABC123", 2L, null), ErrorCode.INVALID_QUESTION_BODY);
        assertErrorCode(() -> service.submitQuestion("ABC123", 2L, "\u3000\u2003"), ErrorCode.INVALID_QUESTION_BODY);
        assertErrorCode(() -> service.submitQuestion("ABC123", 2L, "\u00A0"), ErrorCode.INVALID_QUESTION_BODY);
        assertErrorCode(() -> service.submitQuestion("ABC123", 2L, "q".repeat(Question.MAX_BODY_LENGTH + 1)),
                ErrorCode.INVALID_QUESTION_BODY);

        verifyNoInteractions(liveSessionRepository, sessionParticipantRepository, questionRepository);
    }

    @Test
    void submitQuestion_rejectsEndedSession() {
        LiveSession ended = TestEntities.session(10L, host, "ABC123", SessionStatus.ENDED, NOW);
        when(liveSessionRepository.findByCode("ABC123")).thenReturn(Optional.of(ended));

        assertErrorCode(() -> service.submitQuestion("ABC123", 2L, "Too late?"), ErrorCode.SESSION_NOT_JOINABLE);
        verify(sessionParticipantRepository, never()).findBySessionAndUserForUpdate(anyLong(), anyLong());
    }

    @Test
    void getRecentSessions_appliesLimitAndValidatesIt() {
        LiveSession session = TestEntities.session(10L, host, "ABC123", SessionStatus.DRAFT, NOW);
        when(liveSessionRepository.findByStatusInOrderByCreatedAtDescIdDesc(anyCollection(), any(Pageable.class)))
                .thenReturn(List.of(session));

        List<SessionSummaryResponse> sessions = service.getRecentSessions(5);

        assertThat(sessions).extracting(SessionSummaryResponse::code).containsExactly("ABC123");
        ArgumentCaptor<Pageable> pageable = ArgumentCaptor.forClass(Pageable.class);
        verify(liveSessionRepository).findByStatusInOrderByCreatedAtDescIdDesc(anyCollection(), pageable.capture());
        assertThat(pageable.getValue()).isEqualTo(PageRequest.of(0, 5));

        assertErrorCode(() -> service.getRecentSessions(0), ErrorCode.INVALID_LIMIT);
    }

    @Test
    void getSessionDetails_unknownOrBlankCodeIsNotFound() {
        when(liveSessionRepository.findByCode(anyString())).thenReturn(Optional.empty());

        assertErrorCode(() -> service.getSessionDetails("ZZZZZZ"), ErrorCode.SESSION_NOT_FOUND);
        assertErrorCode(() -> service.getSessionDetails(" "), ErrorCode.SESSION_NOT_FOUND);
    }

    @Test
    void getSessionQuestions_filtersOnlyWhenStatusGiven() {
        LiveSession session = TestEntities.session(10L, host, "ABC123", SessionStatus.DRAFT, NOW);
        when(liveSessionRepository.findByCode("ABC123")).thenReturn(Optional.of(session));
        when(questionRepository.findBySessionAndStatusNewestFirst(10L, QuestionStatus.ANSWERED)).thenReturn(List.of());
        when(questionRepository.findBySessionNewestFirst(10L)).thenReturn(List.of());

        assertThat(service.getSessionQuestions("ABC123", QuestionStatus.ANSWERED)).isEmpty();
        assertThat(service.getSessionQuestions("ABC123", null)).isEmpty();
        verify(questionRepository).findBySessionAndStatusNewestFirst(10L, QuestionStatus.ANSWERED);
        verify(questionRepository).findBySessionNewestFirst(10L);
    }

    private static void assertErrorCode(ThrowingCallable call, ErrorCode expected) {
        assertThatThrownBy(call)
                .isInstanceOf(ProblemException.class)
                .extracting(ex -> ((ProblemException) ex).getErrorCode())
                .isEqualTo(expected);
    }
}

package com.classengage.backend.modules.session.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import com.classengage.backend.global.common.text.TextNormalizer;
import com.classengage.backend.global.error.ErrorCode;
import com.classengage.backend.global.error.ProblemException;
import com.classengage.backend.modules.session.domain.LiveSession;
import com.classengage.backend.modules.session.domain.ParticipantRole;
import com.classengage.backend.modules.session.domain.Question;
import com.classengage.backend.modules.session.domain.QuestionStatus;
import com.classengage.backend.modules.session.domain.SessionStatus;
import com.classengage.backend.modules.session.infrastructure.persistence.LiveSessionRepository;
import com.classengage.backend.modules.session.infrastructure.persistence.QuestionRepository;
import com.classengage.backend.modules.session.infrastructure.persistence.SessionParticipantRepository;
import com.classengage.backend.modules.session.presentation.dto.ParticipantSummaryResponse;
import com.classengage.backend.modules.session.presentation.dto.QuestionSummaryResponse;
import com.classengage.backend.modules.session.presentation.dto.SessionDtoMapper;
import com.classengage.backend.modules.session.presentation.dto.SessionSummaryResponse;
import com.classengage.backend.modules.user.application.UserIdentityService;
import com.classengage.backend.modules.user.domain.AppUser;
import com.classengage.backend.modules.user.infrastructure.persistence.AppUserRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.NestedExceptionUtils;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Creation, admission and question intake for live Q&A sessions. Every public method is one
 * unit of work; a failure rolls back everything it wrote.
 */
@Service
@Transactional
public class SessionLifecycleService {

    public static final int DEFAULT_RECENT_LIMIT = 10;

    private static final Set<SessionStatus> OPEN_STATUSES = EnumSet.of(SessionStatus.DRAFT, SessionStatus.ACTIVE);
    private static final String SESSION_CODE_CONSTRAINT = "uq_sessions_code";

    private static final Logger log = LoggerFactory.getLogger(SessionLifecycleService.class);

    private final LiveSessionRepository liveSessionRepository;
    private final SessionParticipantRepository sessionParticipantRepository;
    private final QuestionRepository questionRepository;
    private final AppUserRepository appUserRepository;
    private final UserIdentityService userIdentityService;
    private final JoinCodeGenerator joinCodeGenerator;
    private final SessionPolicy sessionPolicy;
    private final Clock clock;

    public SessionLifecycleService(
            LiveSessionRepository liveSessionRepository,
            SessionParticipantRepository sessionParticipantRepository,
            QuestionRepository questionRepository,
            AppUserRepository appUserRepository,
            UserIdentityService userIdentityService,
            JoinCodeGenerator joinCodeGenerator,
            SessionPolicy sessionPolicy,
            Clock clock
    ) {
        this.liveSessionRepository = liveSessionRepository;
        this.sessionParticipantRepository = sessionParticipantRepository;
        this.questionRepository = questionRepository;
        this.appUserRepository = appUserRepository;
        this.userIdentityService = userIdentityService;
        this.joinCodeGenerator = joinCodeGenerator;
        this.sessionPolicy = sessionPolicy;
        this.clock = clock;
    }

    public SessionSummaryResponse createSession(String title, String hostDisplayName) {
        String cleanHostName = UserIdentityService.normalizeDisplayName(hostDisplayName);
        if (cleanHostName == null) {
            throw new ProblemException(ErrorCode.INVALID_HOST_DISPLAY_NAME);
        }
        String cleanTitle = normalizeTitle(title);

        AppUser host = userIdentityService.resolveUser(cleanHostName);
        // Row lock on the host serializes concurrent creates, so count-then-insert is exact.
        appUserRepository.findByIdForUpdate(host.getId())
                .orElseThrow(() -> new IllegalStateException("Host vanished while locking: " + host.getId()));

        long openSessions = liveSessionRepository.countByHost_IdAndStatusIn(host.getId(), OPEN_STATUSES);
        if (openSessions >= sessionPolicy.hostSessionLimit()) {
            log.warn("Host {} rejected: {} open sessions (limit {})",
                    host.getId(), openSessions, sessionPolicy.hostSessionLimit());
            throw new ProblemException(ErrorCode.HOST_SESSION_LIMIT_EXCEEDED);
        }

        LiveSession session = new LiveSession();
        session.setHost(host);
        session.setTitle(cleanTitle);
        session.setCode(joinCodeGenerator.generateUniqueCode());
        session.setStatus(SessionStatus.DRAFT);
        LiveSession saved = saveSession(session);

        sessionParticipantRepository.upsert(saved.getId(), host.getId(), ParticipantRole.HOST.name(),
                OffsetDateTime.now(clock));

        log.info("Session {} created with code {} by host {}", saved.getId(), saved.getCode(), host.getId());
        return SessionDtoMapper.toSessionSummary(saved, host);
    }

    @Transactional(readOnly = true)
    public List<SessionSummaryResponse> getRecentSessions() {
        return getRecentSessions(DEFAULT_RECENT_LIMIT);
    }

    @Transactional(readOnly = true)
    public List<SessionSummaryResponse> getRecentSessions(int limit) {
        if (limit < 1) {
            throw new ProblemException(ErrorCode.INVALID_LIMIT);
        }
        return liveSessionRepository
                .findByStatusInOrderByCreatedAtDescIdDesc(OPEN_STATUSES, PageRequest.of(0, limit))
                .stream()
                .filter(session -> session.getHost() != null)
                .map(SessionDtoMapper::toSessionSummary)
                .toList();
    }

    @Transactional(readOnly = true)
    public SessionSummaryResponse getSessionDetails(String code) {
        return SessionDtoMapper.toSessionSummary(loadSession(code));
    }

    @Transactional(readOnly = true)
    public List<ParticipantSummaryResponse> getSessionParticipants(String code) {
        LiveSession session = loadSession(code);
        return sessionParticipantRepository.findRoster(session.getId()).stream()
                .map(SessionDtoMapper::toParticipantSummary)
                .toList();
    }

    /**
     * @param statusFilter restricts the result to one status; {@code null} returns every question
     */
    @Transactional(readOnly = true)
    public List<QuestionSummaryResponse> getSessionQuestions(String code, QuestionStatus statusFilter) {
        LiveSession session = loadSession(code);
        List<Question> questions = statusFilter == null
                ? questionRepository.findBySessionNewestFirst(session.getId())
                : questionRepository.findBySessionAndStatusNewestFirst(session.getId(), statusFilter);
        return questions.stream()
                .map(SessionDtoMapper::toQuestionSummary)
                .toList();
    }

    public SessionSummaryResponse joinSession(String code, String displayName) {
        String cleanName = UserIdentityService.normalizeDisplayName(displayName);
        if (cleanName == null) {
            throw new ProblemException(ErrorCode.INVALID_DISPLAY_NAME);
        }

        LiveSession session = loadSession(code);
        ensureOpen(session, "Session has ended and is no longer joinable");

        AppUser user = userIdentityService.resolveUser(cleanName);
        // Recomputed from host_user_id on every join; a host can never be stored as a participant.
        ParticipantRole role = session.isHostedBy(user) ? ParticipantRole.HOST : ParticipantRole.PARTICIPANT;
        sessionParticipantRepository.upsert(session.getId(), user.getId(), role.name(), OffsetDateTime.now(clock));

        log.info("User {} joined session {} as {}", user.getId(), session.getId(), role.value());
        return SessionDtoMapper.toSessionSummary(session);
    }

    public QuestionSummaryResponse submitQuestion(String code, Long userId, String body) {
        String cleanBody = normalizeBody(body);

        LiveSession session = loadSession(code);
        ensureOpen(session, "Session has ended and is no longer accepting questions");

        if (userId == null) {
            throw new ProblemException(ErrorCode.NOT_PARTICIPANT);
        }
        // Held until commit: concurrent submissions by the same user queue here.
        sessionParticipantRepository.findBySessionAndUserForUpdate(session.getId(), userId)
                .orElseThrow(() -> new ProblemException(ErrorCode.NOT_PARTICIPANT));
        AppUser author = appUserRepository.findById(userId)
                .orElseThrow(() -> new ProblemException(ErrorCode.NOT_PARTICIPANT, "User not found"));

        long pending = questionRepository.countBySession_IdAndAuthor_IdAndStatus(
                session.getId(), userId, QuestionStatus.PENDING);
        if (pending >= sessionPolicy.pendingQuestionLimit()) {
            log.warn("User {} rejected in session {}: {} pending questions (limit {})",
                    userId, session.getId(), pending, sessionPolicy.pendingQuestionLimit());
            throw new ProblemException(ErrorCode.QUESTION_LIMIT_EXCEEDED,
                    "User has reached the maximum of " + sessionPolicy.pendingQuestionLimit()
                            + " pending questions");
        }

        Question question = new Question();
        question.setSession(session);
        question.setAuthor(author);
        question.setBody(cleanBody);
        question.setStatus(QuestionStatus.PENDING);
        question.setLikes(0);
        Question saved = questionRepository.saveAndFlush(question);

        log.info("Question {} submitted to session {} by user {}", saved.getId(), session.getId(), userId);
        return SessionDtoMapper.toQuestionSummary(saved);
    }

    private LiveSession loadSession(String code) {
        if (code == null || code.isBlank()) {
            throw new ProblemException(ErrorCode.SESSION_NOT_FOUND);
        }
        return liveSessionRepository.findByCode(code)
                .orElseThrow(() -> new ProblemException(ErrorCode.SESSION_NOT_FOUND));
    }

    private void ensureOpen(LiveSession session, String detail) {
        if (!session.getStatus().isOpen()) {
            throw new ProblemException(ErrorCode.SESSION_NOT_JOINABLE, detail);
        }
    }

    private LiveSession saveSession(LiveSession session) {
        try {
            return liveSessionRepository.saveAndFlush(session);
        } catch (DataIntegrityViolationException ex) {
            if (isCodeConstraintViolation(ex)) {
                throw new ProblemException(ErrorCode.CODE_COLLISION_EXHAUSTED,
                        "Join code was taken concurrently; retry the request", ex);
            }
            throw ex;
        }
    }

    private boolean isCodeConstraintViolation(DataIntegrityViolationException ex) {
        Throwable root = NestedExceptionUtils.getMostSpecificCause(ex);
        String message = root.getMessage();
        return message != null && message.contains(SESSION_CODE_CONSTRAINT);
    }

    private static String normalizeTitle(String title) {
        if (title == null) {
            throw new ProblemException(ErrorCode.INVALID_TITLE);
        }
        String trimmed = TextNormalizer.strip(title);
        if (trimmed.isEmpty() || trimmed.length() > LiveSession.MAX_TITLE_LENGTH) {
            throw new ProblemException(ErrorCode.INVALID_TITLE);
        }
        return trimmed;
    }

    private static String normalizeBody(String body) {
        String trimmed = body == null ? "" : TextNormalizer.strip(body);
        if (trimmed.isEmpty()) {
            throw new ProblemException(ErrorCode.INVALID_QUESTION_BODY, "Question body cannot be empty");
        }
        if (trimmed.length() > Question.MAX_BODY_LENGTH) {
            throw new ProblemException(ErrorCode.INVALID_QUESTION_BODY,
                    "Question exceeds " + Question.MAX_BODY_LENGTH + " characters");
        }
        return trimmed;
    }
}

package com.classengage.backend.modules.session.presentation;

import java.util.List;

import com.classengage.backend.global.error.ErrorCode;
import com.classengage.backend.global.error.ProblemException;
import com.classengage.backend.modules.session.application.SessionLifecycleService;
import com.classengage.backend.modules.session.domain.QuestionStatus;
import com.classengage.backend.modules.session.presentation.dto.CreateSessionRequest;
import com.classengage.backend.modules.session.presentation.dto.JoinSessionRequest;
import com.classengage.backend.modules.session.presentation.dto.ParticipantSummaryResponse;
import com.classengage.backend.modules.session.presentation.dto.QuestionSummaryResponse;
import com.classengage.backend.modules.session.presentation.dto.SessionSummaryResponse;
import com.classengage.backend.modules.session.presentation.dto.SubmitQuestionRequest;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;

import jakarta.validation.Valid;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@Tag(name = "sessions")
@RestController
@RequestMapping("/sessions")
public class SessionController {

    public static final String USER_ID_HEADER = "X-User-Id";
    static final int MAX_RECENT_LIMIT = 100;

    private final SessionLifecycleService sessionLifecycleService;

    public SessionController(SessionLifecycleService sessionLifecycleService) {
        this.sessionLifecycleService = sessionLifecycleService;
    }

    @Operation(
            summary = "Create a session",
            description = """
                    Creates a draft session, registers the host on its roster and returns the join code. \
                    A host may own at most three sessions that have not ended.
                    """
    )
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Session created"),
            @ApiResponse(responseCode = "400", description = "`INVALID_HOST_DISPLAY_NAME` or `INVALID_TITLE`"),
            @ApiResponse(responseCode = "409", description = "`HOST_SESSION_LIMIT_EXCEEDED`"),
            @ApiResponse(responseCode = "500", description = "`CODE_COLLISION_EXHAUSTED`, safe to retry")
    })
    @PostMapping
    public ResponseEntity<SessionSummaryResponse> createSession(@Valid @RequestBody CreateSessionRequest request) {
        return ResponseEntity.status(201)
                .body(sessionLifecycleService.createSession(request.title(), request.hostDisplayName()));
    }

    @GetMapping
    public ResponseEntity<List<SessionSummaryResponse>> getRecentSessions(
            @RequestParam(name = "limit", required = false) Integer limit
    ) {
        if (limit == null) {
            return ResponseEntity.ok(sessionLifecycleService.getRecentSessions());
        }
        if (limit > MAX_RECENT_LIMIT) {
            throw new ProblemException(ErrorCode.INVALID_LIMIT,
                    "Limit must be between 1 and " + MAX_RECENT_LIMIT);
        }
        return ResponseEntity.ok(sessionLifecycleService.getRecentSessions(limit));
    }

    @GetMapping("/{code}")
    public ResponseEntity<SessionSummaryResponse> getSession(@PathVariable("code") String code) {
        return ResponseEntity.ok(sessionLifecycleService.getSessionDetails(code));
    }

    @GetMapping("/{code}/participants")
    public ResponseEntity<List<ParticipantSummaryResponse>> getParticipants(@PathVariable("code") String code) {
        return ResponseEntity.ok(sessionLifecycleService.getSessionParticipants(code));
    }

    @GetMapping("/{code}/questions")
    public ResponseEntity<List<QuestionSummaryResponse>> getQuestions(
            @PathVariable("code") String code,
            @RequestParam(name = "status", required = false) String status
    ) {
        QuestionStatus statusFilter = null;
        if (status != null) {
            statusFilter = QuestionStatus.fromValue(status)
                    .orElseThrow(() -> new ProblemException(ErrorCode.INVALID_STATUS_FILTER));
        }
        return ResponseEntity.ok(sessionLifecycleService.getSessionQuestions(code, statusFilter));
    }

    @Operation(summary = "Join a session", description = "Idempotent; the session host always keeps the host role.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Joined (or already on the roster)"),
            @ApiResponse(responseCode = "400", description = "`INVALID_DISPLAY_NAME`"),
            @ApiResponse(responseCode = "404", description = "`SESSION_NOT_FOUND`"),
            @ApiResponse(responseCode = "409", description = "`SESSION_NOT_JOINABLE`")
    })
    @PostMapping("/{code}/join")
    public ResponseEntity<SessionSummaryResponse> joinSession(
            @PathVariable("code") String code,
            @Valid @RequestBody JoinSessionRequest request
    ) {
        return ResponseEntity.ok(sessionLifecycleService.joinSession(code, request.displayName()));
    }

    @Operation(summary = "Submit a question", description = "The caller identifies itself with the X-User-Id header.")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Question stored as pending"),
            @ApiResponse(responseCode = "403", description = "`NOT_PARTICIPANT`"),
            @ApiResponse(responseCode = "404", description = "`SESSION_NOT_FOUND`"),
            @ApiResponse(responseCode = "409", description = "`QUESTION_LIMIT_EXCEEDED` or `SESSION_NOT_JOINABLE`"),
            @ApiResponse(responseCode = "422", description = "`INVALID_QUESTION_BODY`")
    })
    @PostMapping("/{code}/questions")
    public ResponseEntity<QuestionSummaryResponse> submitQuestion(
            @PathVariable("code") String code,
            @RequestHeader(USER_ID_HEADER) Long userId,
            @Valid @RequestBody SubmitQuestionRequest request
    ) {
        return ResponseEntity.status(201)
                .body(sessionLifecycleService.submitQuestion(code, userId, request.body()));
    }
}

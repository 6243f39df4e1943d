package me.golemcore.callboard.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import me.golemcore.callboard.adapter.inbound.web.dto.SessionSummaryDto;
import me.golemcore.callboard.adapter.inbound.web.dto.SessionsPageResponse;
import me.golemcore.callboard.domain.model.SessionDescriptor;
import me.golemcore.callboard.domain.model.SessionPage;
import me.golemcore.callboard.domain.service.SessionCatalogService;
import me.golemcore.callboard.domain.service.SessionPreviewService;
import me.golemcore.callboard.infrastructure.config.CallboardProperties;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Instant;

/**
 * Paged session browser across all projects, newest first.
 */
@RestController
@RequestMapping("/api/sessions")
@RequiredArgsConstructor
public class SessionsController {

    private final SessionCatalogService catalogService;
    private final SessionPreviewService previewService;
    private final CallboardProperties properties;

    @GetMapping
    public Mono<ResponseEntity<SessionsPageResponse>> listSessions(
            @RequestParam(required = false) Integer limit,
            @RequestParam(defaultValue = "0") int offset) {
        int pageSize = limit != null ? limit : properties.getLogs().getDefaultPageSize();
        return Mono.fromCallable(() -> toResponse(catalogService.listSessions(pageSize, Math.max(0, offset))))
                .subscribeOn(Schedulers.boundedElastic())
                .map(ResponseEntity::ok);
    }

    private SessionsPageResponse toResponse(SessionPage page) {
        return SessionsPageResponse.builder()
                .sessions(page.sessions().stream().map(this::toSummary).toList())
                .total(page.total())
                .hasMore(page.hasMore())
                .build();
    }

    private SessionSummaryDto toSummary(SessionDescriptor session) {
        return SessionSummaryDto.builder()
                .sessionId(session.getSessionId())
                .directory(session.getDirectory())
                .displayDirectory(session.getDisplayDirectory())
                .createdAt(format(session.getCreatedAt()))
                .updatedAt(format(session.getUpdatedAt()))
                .preview(previewService.getPreview(session.getLogPath()).orElse(null))
                .build();
    }

    private static String format(Instant instant) {
        return instant != null ? instant.toString() : null;
    }
}

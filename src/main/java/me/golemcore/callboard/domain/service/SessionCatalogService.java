package me.golemcore.callboard.domain.service;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.extern.slf4j.Slf4j;
import me.golemcore.callboard.domain.model.LogFileEntry;
import me.golemcore.callboard.domain.model.SessionDescriptor;
import me.golemcore.callboard.domain.model.SessionPage;
import me.golemcore.callboard.infrastructure.config.CallboardProperties;
import me.golemcore.callboard.port.outbound.SessionListingStrategy;
import me.golemcore.callboard.port.outbound.SessionLogPort;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Lists sessions across all projects, newest first, one page at a time.
 *
 * <p>
 * Enumeration goes through a {@link SessionListingStrategy}: the
 * {@code find}-based one when the platform supports it, otherwise a JVM
 * directory walk. A failing or empty fast listing falls back to the walk; when
 * the walk fails as well the page is empty. Only the files of the requested
 * page are stat'ed, so paging through a large store stays cheap.
 */
@Service
@Slf4j
public class SessionCatalogService {

    static final String STRATEGY_AUTO = "auto";
    static final String STRATEGY_FIND = "find";
    static final String STRATEGY_WALK = "walk";

    private final SessionLogPort sessionLogPort;
    private final ProjectDirectoryCodec directoryCodec;
    private final WorktreeResolutionCache worktreeCache;
    private final CallboardProperties properties;
    private final Map<String, SessionListingStrategy> strategies;

    public SessionCatalogService(SessionLogPort sessionLogPort, ProjectDirectoryCodec directoryCodec,
            WorktreeResolutionCache worktreeCache, CallboardProperties properties,
            List<SessionListingStrategy> strategies) {
        this.sessionLogPort = sessionLogPort;
        this.directoryCodec = directoryCodec;
        this.worktreeCache = worktreeCache;
        this.properties = properties;
        this.strategies = strategies.stream()
                .collect(Collectors.toMap(SessionListingStrategy::getName, Function.identity()));
    }

    public SessionPage listSessions(int limit, int offset) {
        int pageSize = clampLimit(limit);
        int start = Math.max(0, offset);

        Path root = sessionLogPort.getProjectsRoot();
        if (root == null || !Files.isDirectory(root)) {
            log.debug("[Sessions] Projects directory {} does not exist", root);
            return SessionPage.empty();
        }

        List<LogFileEntry> entries;
        try {
            entries = listLogFiles(root);
        } catch (IOException | RuntimeException e) {
            log.warn("[Sessions] Failed to list session logs in {}: {}", root, e.getMessage());
            return SessionPage.empty();
        }

        int total = entries.size();
        if (start >= total) {
            return new SessionPage(List.of(), total, false);
        }
        int end = (int) Math.min((long) start + pageSize, total);

        List<SessionDescriptor> sessions = new ArrayList<>(end - start);
        for (LogFileEntry entry : entries.subList(start, end)) {
            sessions.add(describe(entry));
        }
        return new SessionPage(sessions, total, end < total);
    }

    public void clearWorktreeCache() {
        worktreeCache.clear();
    }

    int clampLimit(int limit) {
        int max = Math.max(1, properties.getLogs().getMaxPageSize());
        return Math.max(1, Math.min(limit, max));
    }

    private List<LogFileEntry> listLogFiles(Path root) throws IOException {
        SessionListingStrategy fallback = strategy(STRATEGY_WALK);
        SessionListingStrategy fast = selectFastStrategy();
        if (fast == null) {
            return fallback.listLogFiles(root);
        }

        try {
            List<LogFileEntry> entries = fast.listLogFiles(root);
            if (!entries.isEmpty()) {
                return entries;
            }
            log.debug("[Sessions] {} listing returned nothing, walking {}", fast.getName(), root);
        } catch (IOException | RuntimeException e) {
            log.warn("[Sessions] {} listing failed, walking {} instead: {}", fast.getName(), root,
                    e.getMessage());
        }
        return fallback.listLogFiles(root);
    }

    private SessionListingStrategy selectFastStrategy() {
        String configured = properties.getLogs().getListingStrategy();
        String mode = configured == null ? STRATEGY_AUTO : configured.trim().toLowerCase(Locale.ROOT);
        if (STRATEGY_WALK.equals(mode)) {
            return null;
        }

        SessionListingStrategy fast = strategies.get(STRATEGY_FIND);
        if (fast == null || !fast.isAvailable()) {
            if (STRATEGY_FIND.equals(mode)) {
                log.warn("[Sessions] Listing strategy 'find' is not available on this platform, walking instead");
            }
            return null;
        }
        if (!STRATEGY_FIND.equals(mode) && !STRATEGY_AUTO.equals(mode)) {
            log.warn("[Sessions] Unknown listing strategy '{}', using auto", configured);
        }
        return fast;
    }

    private SessionListingStrategy strategy(String name) {
        SessionListingStrategy strategy = strategies.get(name);
        if (strategy == null) {
            throw new IllegalStateException("No session listing strategy named " + name);
        }
        return strategy;
    }

    private SessionDescriptor describe(LogFileEntry entry) {
        Path logPath = entry.path();
        String fileName = logPath.getFileName().toString();
        String sessionId = fileName.substring(0, fileName.length() - SessionListingStrategy.LOG_EXTENSION.length());
        String directory = directoryCodec.decode(logPath.getParent().getFileName().toString());

        Instant modified = toInstant(entry.modifiedNanos());
        Instant created = modified;
        try {
            BasicFileAttributes attributes = Files.readAttributes(logPath, BasicFileAttributes.class,
                    LinkOption.NOFOLLOW_LINKS);
            created = attributes.creationTime().toInstant();
            modified = attributes.lastModifiedTime().toInstant();
        } catch (IOException e) {
            log.debug("[Sessions] Could not stat {}: {}", logPath, e.getMessage());
        }

        return SessionDescriptor.builder()
                .sessionId(sessionId)
                .directory(directory)
                .displayDirectory(worktreeCache.displayDirectory(directory))
                .logPath(logPath)
                .createdAt(created)
                .updatedAt(modified)
                .build();
    }

    private static Instant toInstant(long epochNanos) {
        return Instant.ofEpochSecond(Math.floorDiv(epochNanos, 1_000_000_000L),
                Math.floorMod(epochNanos, 1_000_000_000L));
    }
}

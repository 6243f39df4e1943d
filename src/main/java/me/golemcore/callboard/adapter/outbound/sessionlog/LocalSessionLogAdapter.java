package me.golemcore.callboard.adapter.outbound.sessionlog;

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

import me.golemcore.callboard.domain.model.SubagentLogFile;
import me.golemcore.callboard.infrastructure.config.CallboardProperties;
import me.golemcore.callboard.port.outbound.SessionListingStrategy;
import me.golemcore.callboard.port.outbound.SessionLogPort;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Local filesystem implementation of SessionLogPort.
 *
 * <p>
 * Layout of the session log store:
 * <ul>
 * <li>{@code <root>/<encoded-dir>/<sessionId>.jsonl} - one log per session
 * <li>{@code <root>/<encoded-dir>/<sessionId>/subagents/agent-<agentId>.jsonl}
 * - logs of subagents spawned from that session
 * </ul>
 *
 * <p>
 * Root configured via {@code callboard.logs.projects-dir}, defaults to
 * {@code ${user.home}/.claude/projects}. The store is never written.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LocalSessionLogAdapter implements SessionLogPort {

    private static final String SUBAGENTS_DIR = "subagents";
    private static final String AGENT_PREFIX = "agent-";
    private static final Pattern SAFE_SESSION_ID = Pattern.compile("[A-Za-z0-9._-]+");

    private final CallboardProperties properties;

    private Path projectsRoot;

    @PostConstruct
    public void init() {
        this.projectsRoot = CallboardProperties.expandPath(properties.getLogs().getProjectsDir());
        log.info("[Sessions] Session log store: {}", projectsRoot);
    }

    @Override
    public Path getProjectsRoot() {
        return projectsRoot;
    }

    @Override
    public Optional<Path> findLogFileForSession(String sessionId) {
        if (!isSafeSessionId(sessionId)) {
            return Optional.empty();
        }
        String fileName = sessionId + SessionListingStrategy.LOG_EXTENSION;
        for (Path projectDir : listProjectDirectories()) {
            Path candidate = projectDir.resolve(fileName);
            if (Files.isRegularFile(candidate, LinkOption.NOFOLLOW_LINKS)) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    @Override
    public List<SubagentLogFile> findSubagentLogFiles(String sessionId) {
        if (!isSafeSessionId(sessionId)) {
            return List.of();
        }
        List<SubagentLogFile> result = new ArrayList<>();
        for (Path projectDir : listProjectDirectories()) {
            Path subagentsDir = projectDir.resolve(sessionId).resolve(SUBAGENTS_DIR);
            if (!Files.isDirectory(subagentsDir, LinkOption.NOFOLLOW_LINKS)) {
                continue;
            }
            try (DirectoryStream<Path> files = Files.newDirectoryStream(subagentsDir,
                    AGENT_PREFIX + "*" + SessionListingStrategy.LOG_EXTENSION)) {
                for (Path file : files) {
                    if (Files.isRegularFile(file, LinkOption.NOFOLLOW_LINKS)) {
                        result.add(new SubagentLogFile(agentIdOf(file), file));
                    }
                }
            } catch (IOException e) {
                log.warn("[Sessions] Failed to list subagent logs in {}: {}", subagentsDir, e.getMessage());
            }
        }
        result.sort(Comparator.comparing(file -> file.path().toString()));
        return result;
    }

    private List<Path> listProjectDirectories() {
        if (projectsRoot == null || !Files.isDirectory(projectsRoot)) {
            return List.of();
        }
        List<Path> directories = new ArrayList<>();
        try (DirectoryStream<Path> entries = Files.newDirectoryStream(projectsRoot)) {
            for (Path entry : entries) {
                if (Files.isDirectory(entry, LinkOption.NOFOLLOW_LINKS)) {
                    directories.add(entry);
                }
            }
        } catch (IOException e) {
            log.warn("[Sessions] Failed to list project directories in {}: {}", projectsRoot, e.getMessage());
        }
        return directories;
    }

    private static String agentIdOf(Path file) {
        String name = file.getFileName().toString();
        return name.substring(AGENT_PREFIX.length(), name.length() - SessionListingStrategy.LOG_EXTENSION.length());
    }

    private static boolean isSafeSessionId(String sessionId) {
        return sessionId != null && SAFE_SESSION_ID.matcher(sessionId).matches() && !sessionId.contains("..");
    }
}

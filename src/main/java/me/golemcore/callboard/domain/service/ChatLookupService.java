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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.callboard.domain.model.ChatRecord;
import me.golemcore.callboard.domain.model.ChatView;
import me.golemcore.callboard.domain.model.NormalizedMessage;
import me.golemcore.callboard.port.outbound.ChatMetadataPort;
import me.golemcore.callboard.port.outbound.SessionLogPort;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Resolves chats to their sessions and builds their message timelines.
 *
 * <p>
 * A chat is looked up in the chat store first. When the store has no record,
 * the id is treated as a bare session id and a view is synthesized from the
 * session log on disk.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ChatLookupService {

    static final String SESSION_IDS_FIELD = "session_ids";

    private final ChatMetadataPort chatMetadataPort;
    private final SessionLogPort sessionLogPort;
    private final ProjectDirectoryCodec directoryCodec;
    private final WorktreeResolutionCache worktreeCache;
    private final DirectoryStatusCache directoryStatusCache;
    private final ConversationTimelineService timelineService;
    private final ObjectMapper objectMapper;

    public Optional<ChatView> findChat(String id) {
        return findChat(id, true);
    }

    public Optional<ChatView> findChat(String id, boolean includeGitInfo) {
        if (id == null || id.isBlank()) {
            return Optional.empty();
        }
        try {
            Optional<ChatRecord> stored = findStoredChat(id);
            if (stored.isPresent()) {
                return Optional.of(fromRecord(stored.get(), includeGitInfo));
            }
            return sessionLogPort.findLogFileForSession(id)
                    .map(logPath -> fromLogFile(id, logPath, includeGitInfo));
        } catch (RuntimeException e) {
            log.warn("[Sessions] Failed to look up chat {}: {}", id, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Timeline of every session the chat spans. An unknown chat id is treated
     * as a single session id.
     */
    public List<NormalizedMessage> getConversationMessages(String chatId) {
        List<String> sessionIds = findChat(chatId, false)
                .map(ChatView::getSessionIds)
                .filter(ids -> !ids.isEmpty())
                .orElse(List.of(chatId));
        return timelineService.getConversationTimeline(sessionIds);
    }

    private Optional<ChatRecord> findStoredChat(String id) {
        try {
            return chatMetadataPort.findById(id);
        } catch (RuntimeException e) {
            log.warn("[Sessions] Chat store lookup failed for {}: {}", id, e.getMessage());
            return Optional.empty();
        }
    }

    private ChatView fromRecord(ChatRecord record, boolean includeGitInfo) {
        List<String> sessionIds = sessionIdsOf(record);
        String primarySession = record.getSessionId() != null || sessionIds.isEmpty()
                ? record.getSessionId()
                : sessionIds.get(0);
        Path logPath = primarySession != null
                ? sessionLogPort.findLogFileForSession(primarySession).orElse(null)
                : null;
        return ChatView.builder()
                .id(record.getId())
                .folder(record.getFolder())
                .displayFolder(worktreeCache.displayDirectory(record.getFolder()))
                .sessionId(primarySession)
                .sessionIds(sessionIds)
                .sessionLogPath(logPath)
                .metadata(record.getMetadata())
                .createdAt(record.getCreatedAt())
                .updatedAt(record.getUpdatedAt())
                .directoryStatus(includeGitInfo ? directoryStatusCache.get(record.getFolder()) : null)
                .fromFilesystem(false)
                .build();
    }

    private ChatView fromLogFile(String sessionId, Path logPath, boolean includeGitInfo) {
        String folder = directoryCodec.decode(logPath.getParent().getFileName().toString());
        String createdAt = null;
        String updatedAt = null;
        try {
            BasicFileAttributes attributes = Files.readAttributes(logPath, BasicFileAttributes.class);
            createdAt = attributes.creationTime().toInstant().toString();
            updatedAt = attributes.lastModifiedTime().toInstant().toString();
        } catch (IOException e) {
            log.debug("[Sessions] Could not stat {}: {}", logPath, e.getMessage());
        }

        return ChatView.builder()
                .id(sessionId)
                .folder(folder)
                .displayFolder(worktreeCache.displayDirectory(folder))
                .sessionId(sessionId)
                .sessionIds(List.of(sessionId))
                .sessionLogPath(logPath)
                .metadata(sessionIdsMetadata(sessionId))
                .createdAt(createdAt)
                .updatedAt(updatedAt)
                .directoryStatus(includeGitInfo ? directoryStatusCache.get(folder) : null)
                .fromFilesystem(true)
                .build();
    }

    /**
     * Session ids from the record's metadata, falling back to its primary
     * session and finally to the chat id itself.
     */
    List<String> sessionIdsOf(ChatRecord record) {
        List<String> ids = new ArrayList<>();
        if (record.getMetadata() != null && !record.getMetadata().isBlank()) {
            try {
                JsonNode listed = objectMapper.readTree(record.getMetadata()).path(SESSION_IDS_FIELD);
                for (JsonNode id : listed) {
                    if (id.isTextual() && !id.asText().isBlank() && !ids.contains(id.asText())) {
                        ids.add(id.asText());
                    }
                }
            } catch (JsonProcessingException e) {
                log.debug("[Sessions] Ignoring malformed metadata of chat {}", record.getId());
            }
        }
        if (ids.isEmpty() && record.getSessionId() != null && !record.getSessionId().isBlank()) {
            ids.add(record.getSessionId());
        }
        if (ids.isEmpty() && record.getId() != null) {
            ids.add(record.getId());
        }
        return ids;
    }

    private String sessionIdsMetadata(String sessionId) {
        ObjectNode metadata = objectMapper.createObjectNode();
        metadata.putArray(SESSION_IDS_FIELD).add(sessionId);
        return metadata.toString();
    }
}

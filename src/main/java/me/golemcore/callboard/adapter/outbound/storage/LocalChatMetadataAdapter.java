package me.golemcore.callboard.adapter.outbound.storage;

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

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.callboard.domain.model.ChatRecord;
import me.golemcore.callboard.infrastructure.config.CallboardProperties;
import me.golemcore.callboard.port.outbound.ChatMetadataPort;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Read-only ChatMetadataPort over the dashboard's chat store.
 *
 * <p>
 * Each chat is a JSON document in {@code <data-dir>/chats/}, named after the
 * chat's primary session id. A lookup matches that file name first, then
 * scans the directory for a document with the requested chat id. Unreadable
 * documents are skipped.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LocalChatMetadataAdapter implements ChatMetadataPort {

    private static final String CHATS_DIR = "chats";
    private static final String JSON_EXTENSION = ".json";
    private static final Pattern SAFE_ID = Pattern.compile("[A-Za-z0-9._-]+");

    private final CallboardProperties properties;
    private final ObjectMapper objectMapper;

    private Path chatsDir;

    @PostConstruct
    public void init() {
        this.chatsDir = CallboardProperties.expandPath(properties.getChats().getDataDir()).resolve(CHATS_DIR);
        log.debug("[Sessions] Chat store: {}", chatsDir);
    }

    @Override
    public Optional<ChatRecord> findById(String id) {
        if (id == null || !SAFE_ID.matcher(id).matches() || id.contains("..") || !Files.isDirectory(chatsDir)) {
            return Optional.empty();
        }

        Optional<ChatRecord> direct = read(chatsDir.resolve(id + JSON_EXTENSION));
        if (direct.isPresent()) {
            return direct;
        }

        try (DirectoryStream<Path> files = Files.newDirectoryStream(chatsDir, "*" + JSON_EXTENSION)) {
            for (Path file : files) {
                Optional<ChatRecord> chat = read(file);
                if (chat.isPresent() && id.equals(chat.get().getId())) {
                    return chat;
                }
            }
        } catch (IOException e) {
            log.warn("[Sessions] Failed to scan chat store {}: {}", chatsDir, e.getMessage());
        }
        return Optional.empty();
    }

    private Optional<ChatRecord> read(Path file) {
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(objectMapper.readValue(file.toFile(), ChatRecord.class));
        } catch (IOException e) {
            log.debug("[Sessions] Skipping unreadable chat file {}: {}", file, e.getMessage());
            return Optional.empty();
        }
    }
}

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

import lombok.RequiredArgsConstructor;
import me.golemcore.callboard.domain.model.ContentBlock;
import me.golemcore.callboard.domain.model.LogRecord;
import me.golemcore.callboard.domain.model.RecordContent;
import me.golemcore.callboard.domain.model.RecordKind;
import me.golemcore.callboard.infrastructure.config.CallboardProperties;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Extracts a one-line preview of a session: the first text the user typed.
 * Only the head of the log is read.
 */
@Service
@RequiredArgsConstructor
public class SessionPreviewService {

    static final String ELLIPSIS = "…";

    private final LogRecordDecoder decoder;
    private final CallboardProperties properties;

    public Optional<String> getPreview(Path logFile) {
        return getPreview(logFile, properties.getLogs().getPreviewMaxChars());
    }

    public Optional<String> getPreview(Path logFile, int maxChars) {
        int limit = maxChars > 0 ? maxChars : properties.getLogs().getPreviewMaxChars();
        return decoder.scan(logFile, this::userText)
                .map(text -> truncate(text, limit));
    }

    private Optional<String> userText(LogRecord record) {
        if (record.getKind() != RecordKind.USER || record.isMeta()) {
            return Optional.empty();
        }
        RecordContent content = record.getContent();
        if (content.isText()) {
            return collapse(content.text());
        }
        if (!content.hasBlocks()) {
            return Optional.empty();
        }
        for (ContentBlock block : content.blocks()) {
            if (block instanceof ContentBlock.Text text) {
                Optional<String> collapsed = collapse(text.text());
                if (collapsed.isPresent()) {
                    return collapsed;
                }
            }
        }
        return Optional.empty();
    }

    private static Optional<String> collapse(String text) {
        if (text == null) {
            return Optional.empty();
        }
        String collapsed = text.replaceAll("\\s+", " ").trim();
        return collapsed.isEmpty() ? Optional.empty() : Optional.of(collapsed);
    }

    private static String truncate(String text, int maxChars) {
        if (text.length() <= maxChars) {
            return text;
        }
        int cut = maxChars;
        if (Character.isHighSurrogate(text.charAt(cut - 1)) && Character.isLowSurrogate(text.charAt(cut))) {
            cut--;
        }
        return text.substring(0, cut).stripTrailing() + ELLIPSIS;
    }
}

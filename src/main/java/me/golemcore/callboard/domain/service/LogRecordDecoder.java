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
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.callboard.domain.model.ContentBlock;
import me.golemcore.callboard.domain.model.LogRecord;
import me.golemcore.callboard.domain.model.RecordContent;
import me.golemcore.callboard.domain.model.RecordKind;
import me.golemcore.callboard.domain.model.TokenUsage;
import org.springframework.stereotype.Service;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Decodes session log lines into {@link LogRecord}s.
 *
 * <p>
 * Decoding never fails: blank lines, lines that are not JSON objects and lines
 * cut off by a concurrent append decode to empty and are skipped, so one bad
 * line never hides the lines after it. Unrecognized record types decode to
 * {@link RecordKind#UNKNOWN}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LogRecordDecoder {

    private static final int LOG_SNIPPET_LENGTH = 100;

    private final ObjectMapper objectMapper;

    public Optional<LogRecord> decode(String line) {
        if (line == null || line.isBlank()) {
            return Optional.empty();
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(line);
        } catch (JsonProcessingException e) {
            log.debug("Skipping malformed log line: {}", snippet(line));
            return Optional.empty();
        }
        if (root == null || !root.isObject()) {
            return Optional.empty();
        }

        JsonNode message = root.path("message");
        String role = message.isObject() ? textOrNull(message, "role") : textOrNull(root, "role");
        RecordKind kind = RecordKind.resolve(textOrNull(root, "type"), role);

        JsonNode contentNode = message.isObject() && message.has("content")
                ? message.get("content")
                : root.get("content");

        JsonNode toolUseResult = root.path("toolUseResult");
        String agentId = toolUseResult.isObject() ? textOrNull(toolUseResult, "agentId") : null;

        return Optional.of(LogRecord.builder()
                .kind(kind)
                .subtype(textOrNull(root, "subtype"))
                .role(role)
                .content(decodeContent(contentNode))
                .timestamp(parseTimestamp(textOrNull(root, "timestamp")))
                .toolUseResultAgentId(agentId)
                .gitBranch(textOrNull(root, "gitBranch"))
                .model(message.isObject() ? textOrNull(message, "model") : null)
                .usage(message.isObject() ? decodeUsage(message.path("usage")) : null)
                .agentName(textOrNull(root, "agentName"))
                .meta(root.path("isMeta").asBoolean(false))
                .build());
    }

    /**
     * Decode every line of a log file in order. A missing or unreadable file
     * yields an empty list.
     */
    public List<LogRecord> decodeAll(Path logFile) {
        List<LogRecord> records = new ArrayList<>();
        scan(logFile, record -> {
            records.add(record);
            return Optional.empty();
        });
        return records;
    }

    /**
     * Decode lines in order until {@code visitor} returns a value. Used for
     * previews that only need the head of a possibly large log.
     */
    public <T> Optional<T> scan(Path logFile, Function<LogRecord, Optional<T>> visitor) {
        if (logFile == null || !Files.isRegularFile(logFile)) {
            return Optional.empty();
        }

        // InputStreamReader replaces invalid UTF-8 instead of failing mid-file
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(Files.newInputStream(logFile), StandardCharsets.UTF_8))) {
            String line = reader.readLine();
            while (line != null) {
                Optional<LogRecord> record = decode(line);
                if (record.isPresent()) {
                    Optional<T> result = visitor.apply(record.get());
                    if (result.isPresent()) {
                        return result;
                    }
                }
                line = reader.readLine();
            }
        } catch (IOException e) {
            log.warn("Failed to read session log {}: {}", logFile, e.getMessage());
        }
        return Optional.empty();
    }

    private RecordContent decodeContent(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return RecordContent.none();
        }
        if (node.isTextual()) {
            return RecordContent.ofText(node.asText());
        }
        if (!node.isArray()) {
            return RecordContent.none();
        }

        List<ContentBlock> blocks = new ArrayList<>();
        for (JsonNode element : node) {
            blocks.add(decodeBlock(element));
        }
        return RecordContent.ofBlocks(blocks);
    }

    private ContentBlock decodeBlock(JsonNode element) {
        if (!element.isObject()) {
            return new ContentBlock.Other(element.getNodeType().name().toLowerCase(java.util.Locale.ROOT));
        }
        String type = textOrNull(element, "type");
        if (type == null) {
            return new ContentBlock.Other("unknown");
        }
        return switch (type) {
        case "text" -> new ContentBlock.Text(element.path("text").asText(""));
        case "thinking" -> new ContentBlock.Reasoning(element.path("thinking").asText(""));
        case "tool_use" -> new ContentBlock.ToolInvocation(
                textOrNull(element, "id"),
                textOrNull(element, "name"),
                element.get("input"));
        case "tool_result" -> new ContentBlock.ToolResult(
                textOrNull(element, "tool_use_id"),
                element.get("content"));
        default -> new ContentBlock.Other(type);
        };
    }

    private TokenUsage decodeUsage(JsonNode usage) {
        if (!usage.isObject()) {
            return null;
        }
        return TokenUsage.builder()
                .inputTokens(usage.path("input_tokens").asLong(0))
                .outputTokens(usage.path("output_tokens").asLong(0))
                .cacheCreationInputTokens(usage.path("cache_creation_input_tokens").asLong(0))
                .cacheReadInputTokens(usage.path("cache_read_input_tokens").asLong(0))
                .serviceTier(textOrNull(usage, "service_tier"))
                .build();
    }

    private Instant parseTimestamp(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            log.debug("Ignoring unparseable timestamp: {}", value);
            return null;
        }
    }

    private static String textOrNull(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || !value.isTextual()) {
            return null;
        }
        return value.asText();
    }

    private static String snippet(String line) {
        return line.length() > LOG_SNIPPET_LENGTH ? line.substring(0, LOG_SNIPPET_LENGTH) + "..." : line;
    }
}

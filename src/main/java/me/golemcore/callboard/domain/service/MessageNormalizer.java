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
import me.golemcore.callboard.domain.model.MessageMetadata;
import me.golemcore.callboard.domain.model.MessageType;
import me.golemcore.callboard.domain.model.NormalizedMessage;
import me.golemcore.callboard.domain.model.RecordContent;
import me.golemcore.callboard.domain.model.RecordKind;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Converts decoded log records into display-ready {@link NormalizedMessage}s.
 *
 * <p>
 * Rules:
 * <ul>
 * <li>summary, queue-operation and unknown records are dropped</li>
 * <li>a {@code compact_boundary} system record becomes one system marker; other
 * system records are dropped</li>
 * <li>string content becomes one text message</li>
 * <li>block content becomes one message per text, thinking, tool_use and
 * tool_result block, in block order; thinking and tool blocks are always
 * attributed to the assistant</li>
 * <li>messages whose content would be empty are not emitted</li>
 * </ul>
 * Record order is preserved; the record's model, branch and token usage are
 * attached to every message it produces.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MessageNormalizer {

    static final String COMPACT_BOUNDARY_SUBTYPE = "compact_boundary";
    static final String COMPACT_BOUNDARY_TEXT = "Conversation compacted";

    private final ObjectMapper objectMapper;

    public List<NormalizedMessage> normalize(List<LogRecord> records) {
        return normalize(records, null);
    }

    /**
     * @param teamName
     *            label stamped on every produced message, {@code null} for the
     *            parent conversation
     */
    public List<NormalizedMessage> normalize(List<LogRecord> records, String teamName) {
        List<NormalizedMessage> result = new ArrayList<>();
        for (LogRecord record : records) {
            appendRecord(result, record, teamName);
        }
        return result;
    }

    private void appendRecord(List<NormalizedMessage> result, LogRecord record, String teamName) {
        RecordKind kind = record.getKind();
        if (kind == RecordKind.SYSTEM) {
            if (COMPACT_BOUNDARY_SUBTYPE.equals(record.getSubtype())) {
                String text = record.getContent().isText() && !record.getContent().text().isBlank()
                        ? record.getContent().text()
                        : COMPACT_BOUNDARY_TEXT;
                result.add(message(record, teamName, NormalizedMessage.ROLE_SYSTEM, MessageType.SYSTEM_MARKER, text)
                        .build());
            }
            return;
        }
        if (kind != RecordKind.USER && kind != RecordKind.ASSISTANT) {
            return;
        }

        RecordContent content = record.getContent();
        if (content.isText()) {
            if (!isEmpty(content.text())) {
                result.add(message(record, teamName, record.effectiveRole(), MessageType.TEXT, content.text())
                        .build());
            }
            return;
        }
        if (!content.hasBlocks()) {
            return;
        }

        for (ContentBlock block : content.blocks()) {
            NormalizedMessage normalized = normalizeBlock(record, block, teamName);
            if (normalized != null) {
                result.add(normalized);
            }
        }
    }

    private NormalizedMessage normalizeBlock(LogRecord record, ContentBlock block, String teamName) {
        if (block instanceof ContentBlock.Text text) {
            if (isEmpty(text.text())) {
                return null;
            }
            return message(record, teamName, record.effectiveRole(), MessageType.TEXT, text.text()).build();
        }
        if (block instanceof ContentBlock.Reasoning reasoning) {
            if (isEmpty(reasoning.thinking())) {
                return null;
            }
            return message(record, teamName, NormalizedMessage.ROLE_ASSISTANT, MessageType.REASONING,
                    reasoning.thinking()).build();
        }
        if (block instanceof ContentBlock.ToolInvocation invocation) {
            return message(record, teamName, NormalizedMessage.ROLE_ASSISTANT, MessageType.TOOL_INVOCATION,
                    serializeInput(invocation.input()))
                    .toolName(invocation.name())
                    .toolId(invocation.id())
                    .build();
        }
        if (block instanceof ContentBlock.ToolResult toolResult) {
            String flattened = flattenToolResult(toolResult.content());
            if (isEmpty(flattened)) {
                return null;
            }
            // the answered invocation id doubles as the display name
            return message(record, teamName, NormalizedMessage.ROLE_ASSISTANT, MessageType.TOOL_RESULT, flattened)
                    .toolName(toolResult.toolUseId())
                    .toolId(toolResult.toolUseId())
                    .build();
        }
        return null;
    }

    /**
     * Flattens a tool result payload to text: strings pass through, lists join
     * each element's text (or its JSON for non-text elements) with newlines.
     */
    String flattenToolResult(JsonNode content) {
        if (content == null || content.isNull() || content.isMissingNode()) {
            return "";
        }
        if (content.isTextual()) {
            return content.asText();
        }
        if (!content.isArray()) {
            return toJson(content);
        }

        List<String> parts = new ArrayList<>();
        for (JsonNode element : content) {
            if (element.isTextual()) {
                parts.add(element.asText());
            } else if (element.isObject() && "text".equals(element.path("type").asText())) {
                parts.add(element.path("text").asText(""));
            } else {
                parts.add(toJson(element));
            }
        }
        return String.join("\n", parts);
    }

    private NormalizedMessage.NormalizedMessageBuilder message(LogRecord record, String teamName, String role,
            MessageType type, String content) {
        return NormalizedMessage.builder()
                .role(role)
                .type(type)
                .content(content)
                .timestamp(record.getTimestamp())
                .teamName(teamName)
                .metadata(metadataOf(record));
    }

    private MessageMetadata metadataOf(LogRecord record) {
        if (!record.hasMetadata()) {
            return null;
        }
        return MessageMetadata.builder()
                .model(record.getModel())
                .gitBranch(record.getGitBranch())
                .usage(record.getUsage())
                .build();
    }

    private String serializeInput(JsonNode input) {
        if (input == null || input.isNull() || input.isMissingNode()) {
            return "{}";
        }
        return toJson(input);
    }

    private String toJson(JsonNode node) {
        try {
            return objectMapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            log.debug("Falling back to toString for unserializable node: {}", e.getMessage());
            return node.toString();
        }
    }

    private static boolean isEmpty(String value) {
        return value == null || value.isEmpty();
    }
}

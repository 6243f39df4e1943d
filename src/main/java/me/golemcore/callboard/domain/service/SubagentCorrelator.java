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

import com.fasterxml.jackson.databind.JsonNode;
import me.golemcore.callboard.domain.model.ContentBlock;
import me.golemcore.callboard.domain.model.LogRecord;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Maps subagent ids to human-readable labels by joining the {@code Task} tool
 * invocation that spawned each subagent (which carries a description) with the
 * tool result that reports the subagent id.
 *
 * <p>
 * Single forward pass over the parent records. A description normally precedes
 * its result; a result seen first is kept pending and resolved if the
 * description shows up later in the same pass.
 */
@Service
public class SubagentCorrelator {

    static final String TASK_TOOL_NAME = "Task";
    private static final String DESCRIPTION_FIELD = "description";

    public static String fallbackLabel(String agentId) {
        return "Agent " + agentId;
    }

    public Map<String, String> correlate(List<LogRecord> records) {
        Map<String, String> descriptionsByToolUseId = new HashMap<>();
        Map<String, String> toolUseIdsByAgentId = new LinkedHashMap<>();

        for (LogRecord record : records) {
            List<ContentBlock> blocks = record.getContent().hasBlocks() ? record.getContent().blocks() : List.of();
            for (ContentBlock block : blocks) {
                if (block instanceof ContentBlock.ToolInvocation invocation) {
                    rememberDescription(descriptionsByToolUseId, invocation);
                }
            }

            String agentId = record.getToolUseResultAgentId();
            if (agentId != null && !agentId.isBlank()) {
                toolUseIdsByAgentId.put(agentId, answeredToolUseId(blocks));
            }
        }

        Map<String, String> labels = new LinkedHashMap<>();
        toolUseIdsByAgentId.forEach((agentId, toolUseId) -> {
            String description = toolUseId != null ? descriptionsByToolUseId.get(toolUseId) : null;
            labels.put(agentId, description != null ? description : fallbackLabel(agentId));
        });
        return labels;
    }

    private void rememberDescription(Map<String, String> descriptions, ContentBlock.ToolInvocation invocation) {
        if (!TASK_TOOL_NAME.equals(invocation.name()) || invocation.id() == null) {
            return;
        }
        JsonNode input = invocation.input();
        if (input == null || !input.path(DESCRIPTION_FIELD).isTextual()) {
            return;
        }
        String description = input.path(DESCRIPTION_FIELD).asText();
        if (!description.isBlank()) {
            descriptions.put(invocation.id(), description);
        }
    }

    private String answeredToolUseId(List<ContentBlock> blocks) {
        for (ContentBlock block : blocks) {
            if (block instanceof ContentBlock.ToolResult result && result.toolUseId() != null) {
                return result.toolUseId();
            }
        }
        return null;
    }
}

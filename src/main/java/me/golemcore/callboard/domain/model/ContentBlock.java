package me.golemcore.callboard.domain.model;

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

/**
 * One block of a multi-part message content list.
 *
 * <p>
 * Variants:
 * <ul>
 * <li>{@link Text} - plain text</li>
 * <li>{@link Reasoning} - model "thinking" output</li>
 * <li>{@link ToolInvocation} - a tool call issued by the assistant</li>
 * <li>{@link ToolResult} - the result answering a tool call</li>
 * <li>{@link Other} - any block type this index does not interpret</li>
 * </ul>
 */
public interface ContentBlock {

    String type();

    record Text(String text) implements ContentBlock {
        @Override
        public String type() {
            return "text";
        }
    }

    record Reasoning(String thinking) implements ContentBlock {
        @Override
        public String type() {
            return "thinking";
        }
    }

    record ToolInvocation(String id, String name, JsonNode input) implements ContentBlock {
        @Override
        public String type() {
            return "tool_use";
        }
    }

    /**
     * Tool result. {@code content} is the raw payload: a string, a list of
     * sub-blocks, or {@code null} when absent.
     */
    record ToolResult(String toolUseId, JsonNode content) implements ContentBlock {
        @Override
        public String type() {
            return "tool_result";
        }
    }

    record Other(String type) implements ContentBlock {
    }
}

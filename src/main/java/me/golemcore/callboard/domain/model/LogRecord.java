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

import lombok.Builder;
import lombok.Data;

import java.time.Instant;

/**
 * One decoded line of a session log. Optional fields are {@code null} when the
 * line does not carry them.
 */
@Data
@Builder
public class LogRecord {

    private RecordKind kind;
    private String subtype; // system records, e.g. compact_boundary
    private String role;
    @Builder.Default
    private RecordContent content = RecordContent.none();
    private Instant timestamp;

    private String toolUseResultAgentId; // set when the line is the result of spawning a subagent
    private String gitBranch;
    private String model;
    private TokenUsage usage;
    private String agentName; // label embedded in subagent logs
    private boolean meta;

    /**
     * Role used for plain content of this record. Falls back to the kind when the
     * line carries no explicit role.
     */
    public String effectiveRole() {
        if (role != null && !role.isBlank()) {
            return role;
        }
        return kind == RecordKind.ASSISTANT ? "assistant" : "user";
    }

    public boolean hasMetadata() {
        return model != null || gitBranch != null || usage != null;
    }
}

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

/**
 * Kind of a single session log line, taken from its {@code type} field.
 */
public enum RecordKind {

    USER("user"),
    ASSISTANT("assistant"),
    SYSTEM("system"),
    SUMMARY("summary"),
    QUEUE_OPERATION("queue-operation"),
    UNKNOWN(null);

    private final String wireType;

    RecordKind(String wireType) {
        this.wireType = wireType;
    }

    public String getWireType() {
        return wireType;
    }

    /**
     * Resolves the kind from the record {@code type}, falling back to the message
     * role for legacy lines that carry no type.
     */
    public static RecordKind resolve(String type, String role) {
        if (type != null) {
            for (RecordKind kind : values()) {
                if (type.equals(kind.wireType)) {
                    return kind;
                }
            }
            return UNKNOWN;
        }
        if ("user".equals(role)) {
            return USER;
        }
        if ("assistant".equals(role)) {
            return ASSISTANT;
        }
        return UNKNOWN;
    }
}

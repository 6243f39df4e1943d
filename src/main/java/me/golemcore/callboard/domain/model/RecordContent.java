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

import java.util.List;

/**
 * Message content of a log record: absent, a plain string, or a list of
 * blocks. At most one of {@code text} and {@code blocks} is set.
 */
public record RecordContent(String text, List<ContentBlock> blocks) {

    private static final RecordContent NONE = new RecordContent(null, null);

    public RecordContent {
        blocks = blocks != null ? List.copyOf(blocks) : null;
    }

    public static RecordContent none() {
        return NONE;
    }

    public static RecordContent ofText(String text) {
        return new RecordContent(text, null);
    }

    public static RecordContent ofBlocks(List<ContentBlock> blocks) {
        return new RecordContent(null, blocks);
    }

    public boolean isText() {
        return text != null;
    }

    public boolean hasBlocks() {
        return blocks != null;
    }
}

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

import java.nio.file.Path;
import java.util.List;

/**
 * A chat resolved for display: the stored record (or one synthesized from a
 * session log when the store has none) plus derived location and repository
 * details.
 */
@Data
@Builder
public class ChatView {

    private String id;
    private String folder; // actual working directory, may be a worktree
    private String displayFolder;
    private String sessionId;
    private List<String> sessionIds;
    private Path sessionLogPath;
    private String metadata;
    private String createdAt;
    private String updatedAt;

    private DirectoryStatus directoryStatus; // null unless requested
    private boolean fromFilesystem;
}

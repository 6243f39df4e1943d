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
import java.time.Instant;

/**
 * Lightweight description of one session log, computed per listing call.
 */
@Data
@Builder
public class SessionDescriptor {

    private String sessionId;
    private String directory; // working directory the session ran in, possibly a worktree
    private String displayDirectory; // main checkout used for grouping
    private Path logPath;
    private Instant createdAt;
    private Instant updatedAt;
}

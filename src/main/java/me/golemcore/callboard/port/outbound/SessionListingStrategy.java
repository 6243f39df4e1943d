package me.golemcore.callboard.port.outbound;

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

import me.golemcore.callboard.domain.model.LogFileEntry;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Enumerates every session log in the store.
 *
 * <p>
 * Contract shared by all implementations:
 * <ul>
 * <li>only regular {@code *.jsonl} files exactly two levels below the root
 * ({@code <root>/<project>/<session>.jsonl}) are returned, so subagent logs
 * nested deeper are excluded</li>
 * <li>entries are ordered by {@link LogFileEntry#NEWEST_FIRST}</li>
 * <li>symbolic links are not followed</li>
 * </ul>
 */
public interface SessionListingStrategy {

    String LOG_EXTENSION = ".jsonl";

    String getName();

    /**
     * Runtime capability probe. Strategies that depend on platform tooling
     * report {@code false} when it is missing.
     */
    boolean isAvailable();

    List<LogFileEntry> listLogFiles(Path root) throws IOException;
}

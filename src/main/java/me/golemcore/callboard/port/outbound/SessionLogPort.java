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

import me.golemcore.callboard.domain.model.SubagentLogFile;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Port for locating session log files written by the external session runner.
 * Implementations never throw for missing files: absence is reported as an
 * empty result.
 */
public interface SessionLogPort {

    /**
     * Root directory holding one folder per working directory.
     */
    Path getProjectsRoot();

    /**
     * Find the log file of a session.
     *
     * @param sessionId
     *            session identifier (the log file name without extension)
     * @return path of the log, or empty when no such session exists
     */
    Optional<Path> findLogFileForSession(String sessionId);

    /**
     * List the logs of subagents spawned from a session.
     */
    List<SubagentLogFile> findSubagentLogFiles(String sessionId);
}

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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.callboard.domain.model.WorkingDirectoryResolution;
import me.golemcore.callboard.port.outbound.GitPort;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Maps raw working directories to the main checkout they belong to, so
 * sessions run inside git worktrees group with their repository.
 *
 * <p>
 * Resolutions never change for a given path during the process lifetime and
 * are cached without expiry. A failed resolution maps the path to itself.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class WorktreeResolutionCache {

    private final GitPort gitPort;
    private final Map<String, WorkingDirectoryResolution> resolutions = new ConcurrentHashMap<>();

    public WorkingDirectoryResolution resolve(String directory) {
        if (directory == null || directory.isBlank()) {
            return WorkingDirectoryResolution.identity(directory);
        }
        return resolutions.computeIfAbsent(directory, this::lookup);
    }

    public String displayDirectory(String directory) {
        return resolve(directory).canonicalPath();
    }

    public void clear() {
        resolutions.clear();
    }

    private WorkingDirectoryResolution lookup(String directory) {
        try {
            WorkingDirectoryResolution resolution = gitPort.resolveWorkingDirectory(directory);
            if (resolution == null || resolution.canonicalPath() == null) {
                return WorkingDirectoryResolution.identity(directory);
            }
            if (resolution.worktree()) {
                log.debug("[Git] Worktree {} belongs to {}", directory, resolution.canonicalPath());
            }
            return resolution;
        } catch (RuntimeException e) {
            log.warn("[Git] Worktree resolution failed for {}: {}", directory, e.getMessage());
            return WorkingDirectoryResolution.identity(directory);
        }
    }
}

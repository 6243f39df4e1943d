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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.callboard.domain.model.DirectoryStatus;
import me.golemcore.callboard.infrastructure.config.CallboardProperties;
import me.golemcore.callboard.port.outbound.GitPort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Time-bounded cache of repository status per directory.
 *
 * <p>
 * An entry is served until it is {@code callboard.git.status-ttl} old, then
 * recomputed on the next request. There is no background refresh. Lookup
 * failures are cached as "not a repository" like any other value.
 */
@Service
@Slf4j
public class DirectoryStatusCache {

    private final GitPort gitPort;
    private final Clock clock;
    private final Duration ttl;
    private final Map<String, CachedStatus> entries = new ConcurrentHashMap<>();

    public DirectoryStatusCache(GitPort gitPort, CallboardProperties properties, Clock clock) {
        this.gitPort = gitPort;
        this.clock = clock;
        this.ttl = properties.getGit().getStatusTtl();
    }

    public DirectoryStatus get(String directory) {
        if (directory == null || directory.isBlank()) {
            return DirectoryStatus.notRepository();
        }
        Instant now = clock.instant();
        CachedStatus cached = entries.get(directory);
        if (cached != null && Duration.between(cached.storedAt(), now).compareTo(ttl) < 0) {
            return cached.status();
        }

        log.debug("[Git] Status cache miss for {}", directory);
        DirectoryStatus status = lookup(directory);
        entries.put(directory, new CachedStatus(status, now));
        return status;
    }

    public void invalidateAll() {
        entries.clear();
    }

    private DirectoryStatus lookup(String directory) {
        try {
            DirectoryStatus status = gitPort.getRepositoryStatus(directory);
            return status != null ? status : DirectoryStatus.notRepository();
        } catch (RuntimeException e) {
            log.warn("[Git] Status lookup failed for {}: {}", directory, e.getMessage());
            return DirectoryStatus.notRepository();
        }
    }

    private record CachedStatus(DirectoryStatus status, Instant storedAt) {
    }
}

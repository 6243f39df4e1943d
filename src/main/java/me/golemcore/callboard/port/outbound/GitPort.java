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

import me.golemcore.callboard.domain.model.DirectoryStatus;
import me.golemcore.callboard.domain.model.WorkingDirectoryResolution;

/**
 * Port for version-control lookups. Calls may be expensive (they typically run
 * an external process), so domain consumers cache the results.
 */
public interface GitPort {

    /**
     * Resolve a working directory to its main checkout.
     *
     * @return the canonical path, flagged as a worktree when it differs from the
     *         input
     */
    WorkingDirectoryResolution resolveWorkingDirectory(String path);

    /**
     * Read the repository status of a directory.
     */
    DirectoryStatus getRepositoryStatus(String path);
}

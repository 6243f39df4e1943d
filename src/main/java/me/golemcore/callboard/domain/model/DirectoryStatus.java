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
 * Version-control status of a working directory. {@code branch} is
 * {@code null} when the directory is not a repository.
 */
public record DirectoryStatus(boolean isRepo, String branch) {

    private static final DirectoryStatus NOT_REPOSITORY = new DirectoryStatus(false, null);

    public static DirectoryStatus notRepository() {
        return NOT_REPOSITORY;
    }

    public static DirectoryStatus repository(String branch) {
        return new DirectoryStatus(true, branch);
    }
}

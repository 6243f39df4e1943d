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
 * One page of sessions ordered newest first, with the total number of sessions
 * in the whole store.
 */
public record SessionPage(List<SessionDescriptor> sessions, int total, boolean hasMore) {

    public SessionPage {
        sessions = List.copyOf(sessions);
    }

    public static SessionPage empty() {
        return new SessionPage(List.of(), 0, false);
    }
}

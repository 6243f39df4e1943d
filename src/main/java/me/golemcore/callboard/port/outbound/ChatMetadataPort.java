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

import me.golemcore.callboard.domain.model.ChatRecord;

import java.util.Optional;

/**
 * Read-only port onto the chat record store. The store is owned by the chat
 * management side of the dashboard; this index only looks records up.
 */
public interface ChatMetadataPort {

    /**
     * Find a chat by its id or by its current session id.
     */
    Optional<ChatRecord> findById(String id);
}

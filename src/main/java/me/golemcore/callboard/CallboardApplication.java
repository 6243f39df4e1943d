package me.golemcore.callboard;

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

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for GolemCore Callboard.
 *
 * <p>
 * Callboard is the read side of an agent dashboard: it indexes the append-only
 * session logs written by an external session runner and serves paginated
 * session listings, conversation timelines and repository status.
 *
 * <h2>Key Features</h2>
 * <ul>
 * <li><b>Session listing</b> - newest-first pagination over the log store
 * without statting files outside the requested page</li>
 * <li><b>Conversation timelines</b> - normalized messages from every session
 * of a resumed chat, merged with the logs of the subagents it spawned</li>
 * <li><b>Repository status</b> - git branch lookups behind a short-TTL
 * cache</li>
 * </ul>
 *
 * <h2>Architecture</h2>
 * <p>
 * Hexagonal architecture (Ports & Adapters):
 *
 * <pre>
 * Input Layer        → ChatsController, SessionsController, DirectoriesController
 * Domain Layer       → decoder, normalizer, correlator, timeline, catalog services
 * Infrastructure     → local session log, git CLI and chat store adapters
 * </pre>
 *
 * <h2>Configuration</h2>
 * <p>
 * All configuration via {@code application.properties} under
 * {@code callboard.*} prefix.
 *
 * @version 1.0
 * @since 1.0
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class CallboardApplication {

    public static void main(String[] args) {
        SpringApplication.run(CallboardApplication.class, args);
    }

}

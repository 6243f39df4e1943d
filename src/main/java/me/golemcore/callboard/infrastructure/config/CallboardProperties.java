package me.golemcore.callboard.infrastructure.config;

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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;

/**
 * Centralized configuration properties for the dashboard, bound from
 * application.properties.
 *
 * <p>
 * All configuration is organized under the {@code callboard.*} prefix:
 * <ul>
 * <li>{@link LogsProperties} - session log store location, listing and
 * paging</li>
 * <li>{@link GitProperties} - repository status cache and git command
 * limits</li>
 * <li>{@link ChatsProperties} - chat record store location</li>
 * </ul>
 *
 * <p>
 * Paths may use the {@code ${user.home}} placeholder, expanded by
 * {@link #expandPath(String)}.
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "callboard")
@Data
public class CallboardProperties {

    private static final String USER_HOME_PLACEHOLDER = "${user.home}";

    private LogsProperties logs = new LogsProperties();
    private GitProperties git = new GitProperties();
    private ChatsProperties chats = new ChatsProperties();

    @Data
    public static class LogsProperties {
        private String projectsDir = "${user.home}/.claude/projects";
        /** One of {@code auto}, {@code find}, {@code walk}. */
        private String listingStrategy = "auto";
        private int defaultPageSize = 20;
        private int maxPageSize = 200;
        private int previewMaxChars = 200;
        private Duration listingTimeout = Duration.ofSeconds(30);
    }

    @Data
    public static class GitProperties {
        private Duration statusTtl = Duration.ofMinutes(5);
        private Duration commandTimeout = Duration.ofSeconds(5);
    }

    @Data
    public static class ChatsProperties {
        private String dataDir = "${user.home}/.callboard";
    }

    /**
     * Expands {@code ${user.home}} and returns the absolute, normalized path.
     */
    public static Path expandPath(String configured) {
        return Paths.get(configured.replace(USER_HOME_PLACEHOLDER, System.getProperty("user.home")))
                .toAbsolutePath()
                .normalize();
    }
}

package me.golemcore.callboard.adapter.outbound.sessionlog;

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
import me.golemcore.callboard.port.outbound.SessionListingStrategy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.FileVisitOption;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Portable listing that walks the store inside the JVM and stats every log.
 * Always available; used when {@code find} is missing or fails.
 */
@Component
@Slf4j
public class DirectoryWalkListingStrategy implements SessionListingStrategy {

    private static final int SESSION_LOG_DEPTH = 2;

    @Override
    public String getName() {
        return "walk";
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    @Override
    public List<LogFileEntry> listLogFiles(Path root) throws IOException {
        List<LogFileEntry> entries = new ArrayList<>();
        Files.walkFileTree(root, EnumSet.noneOf(FileVisitOption.class), SESSION_LOG_DEPTH,
                new SimpleFileVisitor<>() {
                    @Override
                    public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                        if (attrs.isRegularFile()
                                && root.relativize(file).getNameCount() == SESSION_LOG_DEPTH
                                && file.getFileName().toString().endsWith(LOG_EXTENSION)) {
                            entries.add(new LogFileEntry(file, attrs.lastModifiedTime().to(TimeUnit.NANOSECONDS)));
                        }
                        return FileVisitResult.CONTINUE;
                    }

                    @Override
                    public FileVisitResult visitFileFailed(Path file, IOException exc) {
                        if (file.equals(root)) {
                            return FileVisitResult.TERMINATE;
                        }
                        log.debug("[Sessions] Skipping unreadable {}: {}", file, exc.getMessage());
                        return FileVisitResult.CONTINUE;
                    }
                });
        entries.sort(LogFileEntry.NEWEST_FIRST);
        return entries;
    }
}

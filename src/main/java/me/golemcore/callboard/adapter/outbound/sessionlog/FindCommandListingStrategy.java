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
import me.golemcore.callboard.infrastructure.config.CallboardProperties;
import me.golemcore.callboard.infrastructure.process.ProcessResult;
import me.golemcore.callboard.infrastructure.process.ProcessRunner;
import me.golemcore.callboard.port.outbound.SessionListingStrategy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Fast listing backed by a single {@code find -printf} process.
 *
 * <p>
 * {@code find} reports each log's modification time alongside its path, so the
 * whole store is enumerated without a stat call per file in the JVM. Requires
 * a {@code find} that understands {@code -printf} (GNU findutils); the probe
 * result is remembered for the life of the process.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class FindCommandListingStrategy implements SessionListingStrategy {

    private static final char RECORD_SEPARATOR = '\0';
    private static final char FIELD_SEPARATOR = '\t';
    private static final int NANO_DIGITS = 9;

    private final ProcessRunner processRunner;
    private final CallboardProperties properties;

    private volatile Boolean available;

    @Override
    public String getName() {
        return "find";
    }

    @Override
    public boolean isAvailable() {
        Boolean probed = available;
        if (probed == null) {
            probed = probe();
            available = probed;
            log.info("[Sessions] find -printf listing {}", probed ? "available" : "not available, walking instead");
        }
        return probed;
    }

    @Override
    public List<LogFileEntry> listLogFiles(Path root) throws IOException {
        ProcessResult result = processRunner.run(List.of(
                "find", root.toString(),
                "-mindepth", "2", "-maxdepth", "2",
                "-type", "f",
                "-name", "*" + LOG_EXTENSION,
                "-printf", "%T@\t%p\\0"),
                null, properties.getLogs().getListingTimeout());
        if (result.timedOut()) {
            throw new IOException("find timed out listing " + root);
        }
        if (result.exitCode() != 0 && result.stdout().isEmpty()) {
            throw new IOException("find exited with " + result.exitCode() + " listing " + root);
        }

        List<LogFileEntry> entries = parse(result.stdout());
        entries.sort(LogFileEntry.NEWEST_FIRST);
        return entries;
    }

    List<LogFileEntry> parse(String output) {
        List<LogFileEntry> entries = new ArrayList<>();
        int start = 0;
        while (start < output.length()) {
            int end = output.indexOf(RECORD_SEPARATOR, start);
            if (end < 0) {
                end = output.length();
            }
            String record = output.substring(start, end);
            start = end + 1;

            int tab = record.indexOf(FIELD_SEPARATOR);
            if (tab <= 0 || tab == record.length() - 1) {
                continue;
            }
            try {
                long nanos = parseEpochNanos(record.substring(0, tab));
                entries.add(new LogFileEntry(Paths.get(record.substring(tab + 1)), nanos));
            } catch (NumberFormatException e) {
                log.debug("[Sessions] Skipping unparseable find record: {}", record);
            }
        }
        return entries;
    }

    /**
     * Converts find's {@code %T@} ({@code seconds.fraction}) to epoch
     * nanoseconds without going through a double.
     */
    static long parseEpochNanos(String value) {
        int dot = value.indexOf('.');
        String seconds = dot < 0 ? value : value.substring(0, dot);
        String fraction = dot < 0 ? "" : value.substring(dot + 1);
        if (fraction.length() > NANO_DIGITS) {
            fraction = fraction.substring(0, NANO_DIGITS);
        }
        StringBuilder padded = new StringBuilder(fraction);
        while (padded.length() < NANO_DIGITS) {
            padded.append('0');
        }
        return Math.addExact(Math.multiplyExact(Long.parseLong(seconds), 1_000_000_000L),
                Long.parseLong(padded.toString()));
    }

    private boolean probe() {
        String os = System.getProperty("os.name", "").toLowerCase(Locale.ROOT);
        if (os.contains("win")) {
            return false;
        }
        try {
            ProcessResult result = processRunner.run(List.of(
                    "find", System.getProperty("java.io.tmpdir"), "-maxdepth", "0", "-printf", ""),
                    null, properties.getGit().getCommandTimeout());
            return result.isSuccess();
        } catch (IOException e) {
            log.debug("[Sessions] find probe failed: {}", e.getMessage());
            return false;
        }
    }
}

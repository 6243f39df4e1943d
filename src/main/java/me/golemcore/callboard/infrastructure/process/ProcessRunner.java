package me.golemcore.callboard.infrastructure.process;

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

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs external commands ({@code git}, {@code find}) with a hard timeout.
 *
 * <p>
 * Standard output is drained on a separate thread so a chatty process cannot
 * block on a full pipe; standard error is discarded. A process that outlives
 * its timeout is killed and reported as timed out.
 */
@Component
@Slf4j
public class ProcessRunner {

    private static final long OUTPUT_DRAIN_SECONDS = 1;

    private final ExecutorService executor = Executors.newCachedThreadPool();

    @PreDestroy
    public void shutdown() {
        executor.shutdownNow();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("[Process] Executor did not terminate within timeout");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    /**
     * @param workDir
     *            working directory, {@code null} to inherit the JVM's
     * @throws IOException
     *             if the command cannot be started or its output cannot be read
     */
    public ProcessResult run(List<String> command, Path workDir, Duration timeout) throws IOException {
        ProcessBuilder pb = new ProcessBuilder(command);
        if (workDir != null) {
            pb.directory(workDir.toFile());
        }
        pb.redirectError(ProcessBuilder.Redirect.DISCARD);

        Process process = pb.start();
        process.getOutputStream().close();

        Future<String> outputFuture = executor.submit(() -> {
            try (InputStream stdout = process.getInputStream()) {
                return new String(stdout.readAllBytes(), StandardCharsets.UTF_8);
            }
        });

        try {
            boolean completed = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (!completed) {
                process.destroyForcibly();
                outputFuture.cancel(true);
                log.warn("[Process] {} timed out after {}", command.get(0), timeout);
                return new ProcessResult(-1, "", true);
            }
            String output = outputFuture.get(OUTPUT_DRAIN_SECONDS, TimeUnit.SECONDS);
            return new ProcessResult(process.exitValue(), output, false);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            throw new IOException("Interrupted while running " + command.get(0), e);
        } catch (ExecutionException e) {
            throw new IOException("Failed to read output of " + command.get(0), e.getCause());
        } catch (TimeoutException e) {
            process.destroyForcibly();
            throw new IOException("Timed out reading output of " + command.get(0), e);
        }
    }
}

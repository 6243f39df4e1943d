package me.golemcore.callboard.adapter.outbound.git;

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
import me.golemcore.callboard.infrastructure.config.CallboardProperties;
import me.golemcore.callboard.infrastructure.process.ProcessResult;
import me.golemcore.callboard.infrastructure.process.ProcessRunner;
import me.golemcore.callboard.port.outbound.GitPort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * GitPort backed by the {@code git} command line.
 *
 * <p>
 * Every command runs in the inspected directory with the configured timeout
 * ({@code callboard.git.command-timeout}). Errors are reported as "not a
 * repository" or as the identity mapping, never thrown.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class GitCliAdapter implements GitPort {

    static final String DEFAULT_BRANCH = "main";

    private final ProcessRunner processRunner;
    private final CallboardProperties properties;

    @Override
    public WorkingDirectoryResolution resolveWorkingDirectory(String path) {
        Optional<Path> directory = existingDirectory(path);
        if (directory.isEmpty()) {
            return WorkingDirectoryResolution.identity(path);
        }

        Optional<String> output = git(directory.get(), "rev-parse", "--git-dir", "--git-common-dir");
        if (output.isEmpty()) {
            return WorkingDirectoryResolution.identity(path);
        }
        List<String> lines = nonBlankLines(output.get());
        if (lines.size() < 2) {
            return WorkingDirectoryResolution.identity(path);
        }

        Path gitDir = directory.get().resolve(lines.get(0)).normalize();
        Path commonDir = directory.get().resolve(lines.get(1)).normalize();
        if (gitDir.equals(commonDir) || commonDir.getParent() == null) {
            return WorkingDirectoryResolution.identity(path);
        }
        // a linked worktree keeps its git dir under <main>/.git/worktrees/<name>
        return new WorkingDirectoryResolution(commonDir.getParent().toString(), true);
    }

    @Override
    public DirectoryStatus getRepositoryStatus(String path) {
        Optional<Path> directory = existingDirectory(path);
        if (directory.isEmpty()) {
            return DirectoryStatus.notRepository();
        }

        boolean isRepo = Files.exists(directory.get().resolve(".git"))
                || git(directory.get(), "rev-parse", "--git-dir").isPresent();
        if (!isRepo) {
            return DirectoryStatus.notRepository();
        }

        String branch = git(directory.get(), "branch", "--show-current")
                .map(String::trim)
                .filter(name -> !name.isEmpty())
                .orElse(DEFAULT_BRANCH);
        return DirectoryStatus.repository(branch);
    }

    private Optional<String> git(Path directory, String... args) {
        List<String> command = new ArrayList<>();
        command.add("git");
        command.addAll(List.of(args));
        try {
            ProcessResult result = processRunner.run(command, directory, properties.getGit().getCommandTimeout());
            return result.isSuccess() ? Optional.of(result.stdout()) : Optional.empty();
        } catch (IOException e) {
            log.debug("[Git] {} failed in {}: {}", String.join(" ", command), directory, e.getMessage());
            return Optional.empty();
        }
    }

    private static Optional<Path> existingDirectory(String path) {
        if (path == null || path.isBlank()) {
            return Optional.empty();
        }
        try {
            Path directory = Paths.get(path).toAbsolutePath().normalize();
            return Files.isDirectory(directory) ? Optional.of(directory) : Optional.empty();
        } catch (InvalidPathException e) {
            return Optional.empty();
        }
    }

    private static List<String> nonBlankLines(String output) {
        return output.lines().map(String::trim).filter(line -> !line.isEmpty()).toList();
    }
}

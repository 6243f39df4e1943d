package me.golemcore.callboard.adapter.outbound.sessionlog;

import me.golemcore.callboard.domain.model.SubagentLogFile;
import me.golemcore.callboard.infrastructure.config.CallboardProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import static me.golemcore.callboard.testsupport.SessionLogFixtures.writeSession;
import static me.golemcore.callboard.testsupport.SessionLogFixtures.writeSubagent;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LocalSessionLogAdapterTest {

    @TempDir
    Path tempDir;

    private Path root;
    private LocalSessionLogAdapter adapter;

    @BeforeEach
    void setUp() {
        root = tempDir.resolve("projects");
        CallboardProperties properties = new CallboardProperties();
        properties.getLogs().setProjectsDir(root.toString());
        adapter = new LocalSessionLogAdapter(properties);
        adapter.init();
    }

    @Test
    void shouldExposeNormalizedProjectsRoot() {
        assertEquals(root.toAbsolutePath().normalize(), adapter.getProjectsRoot());
    }

    @Test
    void shouldFindSessionLogInAnyProjectDirectory() throws IOException {
        writeSession(root, "-a", "s1", List.of("{}"));
        Path expected = writeSession(root, "-b", "s2", List.of("{}"));

        assertEquals(Optional.of(expected), adapter.findLogFileForSession("s2"));
        assertTrue(adapter.findLogFileForSession("s3").isEmpty());
    }

    @Test
    void shouldRejectIdsThatEscapeTheStore() throws IOException {
        Files.createDirectories(root.resolve("-a"));
        Files.writeString(root.resolve("secret.jsonl"), "{}");

        assertTrue(adapter.findLogFileForSession("../secret").isEmpty());
        assertTrue(adapter.findLogFileForSession("").isEmpty());
        assertTrue(adapter.findLogFileForSession(null).isEmpty());
    }

    @Test
    void shouldListSubagentLogsSortedWithAgentIds() throws IOException {
        writeSession(root, "-a", "s1", List.of("{}"));
        Path second = writeSubagent(root, "-a", "s1", "b2", List.of("{}"));
        Path first = writeSubagent(root, "-a", "s1", "a1", List.of("{}"));
        Files.writeString(first.resolveSibling("notes.txt"), "ignored");

        List<SubagentLogFile> subagents = adapter.findSubagentLogFiles("s1");

        assertEquals(List.of(new SubagentLogFile("a1", first), new SubagentLogFile("b2", second)), subagents);
        assertTrue(adapter.findSubagentLogFiles("other").isEmpty());
    }

    @Test
    void shouldReturnNothingWhenStoreIsMissing() {
        assertTrue(adapter.findLogFileForSession("s1").isEmpty());
        assertTrue(adapter.findSubagentLogFiles("s1").isEmpty());
    }
}

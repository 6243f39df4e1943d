package me.golemcore.callboard.domain.service;

import me.golemcore.callboard.adapter.outbound.sessionlog.DirectoryWalkListingStrategy;
import me.golemcore.callboard.adapter.outbound.sessionlog.FindCommandListingStrategy;
import me.golemcore.callboard.adapter.outbound.sessionlog.LocalSessionLogAdapter;
import me.golemcore.callboard.domain.model.LogFileEntry;
import me.golemcore.callboard.domain.model.SessionDescriptor;
import me.golemcore.callboard.domain.model.SessionPage;
import me.golemcore.callboard.infrastructure.config.CallboardProperties;
import me.golemcore.callboard.infrastructure.process.ProcessRunner;
import me.golemcore.callboard.port.outbound.GitPort;
import me.golemcore.callboard.port.outbound.SessionListingStrategy;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static me.golemcore.callboard.testsupport.SessionLogFixtures.touch;
import static me.golemcore.callboard.testsupport.SessionLogFixtures.userText;
import static me.golemcore.callboard.testsupport.SessionLogFixtures.writeSession;
import static me.golemcore.callboard.testsupport.SessionLogFixtures.writeSubagent;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.junit.jupiter.api.Assumptions.assumeTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class SessionCatalogServiceTest {

    private static final Instant BASE = Instant.parse("2025-01-01T00:00:00Z");

    @TempDir
    Path tempDir;

    private Path root;
    private CallboardProperties properties;
    private LocalSessionLogAdapter sessionLogAdapter;
    private ProcessRunner processRunner;
    private DirectoryWalkListingStrategy walk;
    private FindCommandListingStrategy find;
    private ProjectDirectoryCodec codec;

    @BeforeEach
    void setUp() {
        root = tempDir.resolve("projects");
        properties = new CallboardProperties();
        properties.getLogs().setProjectsDir(root.toString());
        properties.getLogs().setMaxPageSize(3);
        sessionLogAdapter = new LocalSessionLogAdapter(properties);
        sessionLogAdapter.init();
        processRunner = new ProcessRunner();
        walk = new DirectoryWalkListingStrategy();
        find = new FindCommandListingStrategy(processRunner, properties);
        codec = new ProjectDirectoryCodec();
    }

    @AfterEach
    void tearDown() {
        processRunner.shutdown();
    }

    @Test
    void shouldPageNewestFirstWithStableTotal() throws IOException {
        writeCorpus(5);
        SessionCatalogService service = service(List.of(walk));

        SessionPage first = service.listSessions(2, 0);
        SessionPage last = service.listSessions(2, 4);
        SessionPage beyond = service.listSessions(2, 10);

        assertEquals(List.of("s4", "s3"), ids(first));
        assertTrue(first.hasMore());
        assertEquals(List.of("s0"), ids(last));
        assertFalse(last.hasMore());
        assertTrue(beyond.sessions().isEmpty());
        assertEquals(5, first.total());
        assertEquals(5, last.total());
        assertEquals(5, beyond.total());
    }

    @Test
    void shouldClampLimitToConfiguredBounds() throws IOException {
        writeCorpus(5);
        SessionCatalogService service = service(List.of(walk));

        assertEquals(1, service.listSessions(0, 0).sessions().size());
        assertEquals(1, service.listSessions(-5, 0).sessions().size());
        assertEquals(3, service.listSessions(1000, 0).sessions().size());
        assertEquals(List.of("s4", "s3"), ids(service.listSessions(2, -3)));
    }

    @Test
    void shouldExcludeSubagentLogs() throws IOException {
        writeCorpus(2);
        writeSubagent(root, "-home-dev-app", "s1", "a1", List.of(userText("nested", BASE.toString())));

        SessionPage page = service(List.of(walk)).listSessions(3, 0);

        assertEquals(2, page.total());
    }

    @Test
    void shouldDescribeSessionFromItsLogFile() throws IOException {
        Path log = writeSession(root, "-home-dev-app", "abc-123", List.of(userText("hi", BASE.toString())));
        touch(log, BASE);

        SessionCatalogService service = service(List.of(walk));
        SessionDescriptor session = service.listSessions(3, 0).sessions().get(0);
        service.clearWorktreeCache();

        assertEquals("abc-123", session.getSessionId());
        assertEquals(codec.decode("-home-dev-app"), session.getDirectory());
        assertEquals(session.getDirectory(), session.getDisplayDirectory());
        assertEquals(log, session.getLogPath());
        assertEquals(BASE, session.getUpdatedAt());
        assertEquals(session, service.listSessions(3, 0).sessions().get(0));
    }

    @Test
    void shouldFallBackToWalkWhenFastListingFails() throws IOException {
        writeCorpus(3);
        SessionListingStrategy failing = mock(SessionListingStrategy.class);
        when(failing.getName()).thenReturn("find");
        when(failing.isAvailable()).thenReturn(true);
        when(failing.listLogFiles(any())).thenThrow(new IOException("find: not found"));

        SessionPage page = service(List.of(failing, walk)).listSessions(3, 0);

        assertEquals(List.of("s2", "s1", "s0"), ids(page));
    }

    @Test
    void shouldFallBackToWalkWhenFastListingIsEmpty() throws IOException {
        writeCorpus(2);
        SessionListingStrategy empty = mock(SessionListingStrategy.class);
        when(empty.getName()).thenReturn("find");
        when(empty.isAvailable()).thenReturn(true);
        when(empty.listLogFiles(any())).thenReturn(List.of());

        assertEquals(2, service(List.of(empty, walk)).listSessions(3, 0).total());
    }

    @Test
    void shouldNotUseFastListingWhenWalkIsConfigured() throws IOException {
        writeCorpus(1);
        properties.getLogs().setListingStrategy("walk");
        SessionListingStrategy fast = mock(SessionListingStrategy.class);
        when(fast.getName()).thenReturn("find");

        assertEquals(1, service(List.of(fast, walk)).listSessions(3, 0).total());
        verify(fast, never()).isAvailable();
    }

    @Test
    void shouldReturnEmptyPageWhenEveryListingFails() throws IOException {
        writeCorpus(1);
        SessionListingStrategy brokenWalk = mock(SessionListingStrategy.class);
        when(brokenWalk.getName()).thenReturn("walk");
        when(brokenWalk.listLogFiles(any())).thenThrow(new IOException("denied"));

        SessionPage page = service(List.of(brokenWalk)).listSessions(3, 0);

        assertEquals(SessionPage.empty(), page);
    }

    @Test
    void shouldReturnEmptyPageWhenRootIsMissing() {
        assertEquals(SessionPage.empty(), service(List.of(walk)).listSessions(3, 0));
    }

    @Test
    void shouldListSameEntriesWithFindAndWalk() throws IOException {
        assumeTrue(find.isAvailable());
        writeCorpus(4);
        Path tie = writeSession(root, "-other", "tie", List.of(userText("t", BASE.toString())));
        touch(tie, BASE.plusSeconds(2));
        writeSubagent(root, "-home-dev-app", "s1", "a1", List.of(userText("nested", BASE.toString())));

        List<LogFileEntry> fromFind = find.listLogFiles(root);
        List<LogFileEntry> fromWalk = walk.listLogFiles(root);

        assertEquals(fromWalk.stream().map(LogFileEntry::path).toList(),
                fromFind.stream().map(LogFileEntry::path).toList());
        assertEquals(5, fromFind.size());
    }

    private SessionCatalogService service(List<SessionListingStrategy> strategies) {
        GitPort gitPort = mock(GitPort.class);
        return new SessionCatalogService(sessionLogAdapter, codec, new WorktreeResolutionCache(gitPort),
                properties, strategies);
    }

    private void writeCorpus(int count) throws IOException {
        for (int i = 0; i < count; i++) {
            String dir = i % 2 == 0 ? "-home-dev-app" : "-home-dev-other";
            Path log = writeSession(root, dir, "s" + i, List.of(userText("session " + i, BASE.toString())));
            touch(log, BASE.plusSeconds(i));
        }
    }

    private static List<String> ids(SessionPage page) {
        List<String> ids = new ArrayList<>();
        for (SessionDescriptor session : page.sessions()) {
            ids.add(session.getSessionId());
        }
        return ids;
    }
}

package me.golemcore.callboard.domain.service;

import me.golemcore.callboard.domain.model.ChatRecord;
import me.golemcore.callboard.domain.model.ChatView;
import me.golemcore.callboard.domain.model.DirectoryStatus;
import me.golemcore.callboard.domain.model.NormalizedMessage;
import me.golemcore.callboard.infrastructure.config.AutoConfiguration;
import me.golemcore.callboard.port.outbound.ChatMetadataPort;
import me.golemcore.callboard.port.outbound.SessionLogPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import static me.golemcore.callboard.testsupport.SessionLogFixtures.userText;
import static me.golemcore.callboard.testsupport.SessionLogFixtures.writeSession;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ChatLookupServiceTest {

    @TempDir
    Path tempDir;

    private ChatMetadataPort chatMetadataPort;
    private SessionLogPort sessionLogPort;
    private WorktreeResolutionCache worktreeCache;
    private DirectoryStatusCache directoryStatusCache;
    private ConversationTimelineService timelineService;
    private ChatLookupService service;

    @BeforeEach
    void setUp() {
        chatMetadataPort = mock(ChatMetadataPort.class);
        sessionLogPort = mock(SessionLogPort.class);
        worktreeCache = mock(WorktreeResolutionCache.class);
        directoryStatusCache = mock(DirectoryStatusCache.class);
        timelineService = mock(ConversationTimelineService.class);
        service = new ChatLookupService(chatMetadataPort, sessionLogPort, new ProjectDirectoryCodec(),
                worktreeCache, directoryStatusCache, timelineService, AutoConfiguration.objectMapper());

        when(chatMetadataPort.findById(anyString())).thenReturn(Optional.empty());
        when(sessionLogPort.findLogFileForSession(anyString())).thenReturn(Optional.empty());
        when(worktreeCache.displayDirectory(anyString())).thenAnswer(invocation -> invocation.getArgument(0));
    }

    @Test
    void shouldBuildViewFromStoredChat() {
        Path logPath = tempDir.resolve("s2.jsonl");
        when(chatMetadataPort.findById("chat-1")).thenReturn(Optional.of(ChatRecord.builder()
                .id("chat-1")
                .folder("/src/app.feature")
                .sessionId("s2")
                .metadata("{\"session_ids\":[\"s1\",\"s2\"],\"title\":\"x\"}")
                .createdAt("2025-01-01T00:00:00Z")
                .build()));
        when(sessionLogPort.findLogFileForSession("s2")).thenReturn(Optional.of(logPath));
        when(worktreeCache.displayDirectory("/src/app.feature")).thenReturn("/src/app");
        when(directoryStatusCache.get("/src/app.feature")).thenReturn(DirectoryStatus.repository("feature"));

        ChatView chat = service.findChat("chat-1", true).orElseThrow();

        assertEquals("/src/app.feature", chat.getFolder());
        assertEquals("/src/app", chat.getDisplayFolder());
        assertEquals(List.of("s1", "s2"), chat.getSessionIds());
        assertEquals("s2", chat.getSessionId());
        assertEquals(logPath, chat.getSessionLogPath());
        assertEquals("feature", chat.getDirectoryStatus().branch());
        assertFalse(chat.isFromFilesystem());
    }

    @Test
    void shouldSkipGitInfoWhenNotRequested() {
        when(chatMetadataPort.findById("chat-1")).thenReturn(Optional.of(ChatRecord.builder()
                .id("chat-1").folder("/src/app").sessionId("s1").build()));

        ChatView chat = service.findChat("chat-1", false).orElseThrow();

        assertNull(chat.getDirectoryStatus());
        verify(directoryStatusCache, never()).get(anyString());
    }

    @Test
    void shouldSynthesizeViewFromSessionLog() throws IOException {
        Path log = writeSession(tempDir, "-nowhere-app", "s9", List.of(userText("hi", "2025-01-01T00:00:00Z")));
        when(sessionLogPort.findLogFileForSession("s9")).thenReturn(Optional.of(log));
        when(directoryStatusCache.get("/nowhere-app")).thenReturn(DirectoryStatus.notRepository());

        ChatView chat = service.findChat("s9").orElseThrow();

        assertTrue(chat.isFromFilesystem());
        assertEquals("/nowhere-app", chat.getFolder());
        assertEquals(List.of("s9"), chat.getSessionIds());
        assertEquals("{\"session_ids\":[\"s9\"]}", chat.getMetadata());
        assertNotNull(chat.getUpdatedAt());
        assertFalse(chat.getDirectoryStatus().isRepo());
    }

    @Test
    void shouldReturnEmptyWhenChatIsUnknown() {
        assertTrue(service.findChat("nope").isEmpty());
        assertTrue(service.findChat(" ").isEmpty());
    }

    @Test
    void shouldDegradeToEmptyWhenLookupFails() {
        when(sessionLogPort.findLogFileForSession("boom")).thenThrow(new IllegalStateException("disk gone"));
        assertTrue(service.findChat("boom").isEmpty());
    }

    @Test
    void shouldResolveSessionIdsInPriorityOrder() {
        assertEquals(List.of("a", "b"), service.sessionIdsOf(ChatRecord.builder()
                .id("c").sessionId("b").metadata("{\"session_ids\":[\"a\",\"b\",\"a\"]}").build()));
        assertEquals(List.of("b"), service.sessionIdsOf(ChatRecord.builder()
                .id("c").sessionId("b").metadata("not json").build()));
        assertEquals(List.of("c"), service.sessionIdsOf(ChatRecord.builder().id("c").build()));
    }

    @Test
    void shouldBuildTimelineForEverySessionOfChat() {
        when(chatMetadataPort.findById("chat-1")).thenReturn(Optional.of(ChatRecord.builder()
                .id("chat-1").folder("/src/app").sessionId("s2")
                .metadata("{\"session_ids\":[\"s1\",\"s2\"]}").build()));
        List<NormalizedMessage> timeline = List.of(NormalizedMessage.builder().content("x").build());
        when(timelineService.getConversationTimeline(List.of("s1", "s2"))).thenReturn(timeline);

        assertEquals(timeline, service.getConversationMessages("chat-1"));
    }

    @Test
    void shouldTreatUnknownChatIdAsSessionId() {
        when(timelineService.getConversationTimeline(List.of("raw"))).thenReturn(List.of());

        assertTrue(service.getConversationMessages("raw").isEmpty());
        verify(timelineService).getConversationTimeline(List.of("raw"));
    }
}

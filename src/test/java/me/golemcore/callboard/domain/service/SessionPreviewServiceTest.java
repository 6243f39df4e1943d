package me.golemcore.callboard.domain.service;

import me.golemcore.callboard.infrastructure.config.AutoConfiguration;
import me.golemcore.callboard.infrastructure.config.CallboardProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import static me.golemcore.callboard.testsupport.SessionLogFixtures.assistantText;
import static me.golemcore.callboard.testsupport.SessionLogFixtures.userText;
import static me.golemcore.callboard.testsupport.SessionLogFixtures.writeSession;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SessionPreviewServiceTest {

    private static final String T = "2025-01-01T00:00:00Z";

    @TempDir
    Path tempDir;

    private SessionPreviewService previewService;

    @BeforeEach
    void setUp() {
        CallboardProperties properties = new CallboardProperties();
        properties.getLogs().setPreviewMaxChars(20);
        previewService = new SessionPreviewService(new LogRecordDecoder(AutoConfiguration.objectMapper()),
                properties);
    }

    @Test
    void shouldReturnFirstUserTextSkippingMetaRecords() throws IOException {
        Path log = writeSession(tempDir, "-p", "s1", List.of(
                "{\"type\":\"summary\",\"summary\":\"x\"}",
                "{\"type\":\"user\",\"isMeta\":true,\"message\":{\"role\":\"user\",\"content\":\"caveat\"}}",
                assistantText("assistant speaks first", T),
                userText("  Fix\n the   build  ", T),
                userText("second", T)));

        assertEquals(Optional.of("Fix the build"), previewService.getPreview(log, 100));
    }

    @Test
    void shouldUseFirstNonBlankTextBlock() throws IOException {
        Path log = writeSession(tempDir, "-p", "s1", List.of(
                "{\"type\":\"user\",\"message\":{\"role\":\"user\",\"content\":["
                        + "{\"type\":\"tool_result\",\"tool_use_id\":\"t\",\"content\":\"x\"}]}}",
                "{\"type\":\"user\",\"message\":{\"role\":\"user\",\"content\":["
                        + "{\"type\":\"text\",\"text\":\"  \"},{\"type\":\"text\",\"text\":\"block text\"}]}}"));

        assertEquals(Optional.of("block text"), previewService.getPreview(log, 100));
    }

    @Test
    void shouldTruncateWithEllipsis() throws IOException {
        Path log = writeSession(tempDir, "-p", "s1", List.of(userText("abcdefghij klmnop", T)));

        assertEquals(Optional.of("abcdefghij" + SessionPreviewService.ELLIPSIS), previewService.getPreview(log, 11));
        assertEquals(Optional.of("abcdefghij klmnop"), previewService.getPreview(log, 0));
    }

    @Test
    void shouldNotSplitSurrogatePairWhenTruncating() throws IOException {
        String rocket = "\uD83D\uDE80";
        Path log = writeSession(tempDir, "-p", "s1", List.of(userText("abcd" + rocket + "efgh", T)));

        assertEquals(Optional.of("abcd\u2026"), previewService.getPreview(log, 5));
    }

    @Test
    void shouldReturnEmptyForMissingFileOrNoUserText() throws IOException {
        assertTrue(previewService.getPreview(tempDir.resolve("missing.jsonl"), 10).isEmpty());
        Path log = writeSession(tempDir, "-p", "s2", List.of(assistantText("only me", T)));
        assertTrue(previewService.getPreview(log, 10).isEmpty());
    }
}

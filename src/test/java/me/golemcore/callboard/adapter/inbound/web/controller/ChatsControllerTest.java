package me.golemcore.callboard.adapter.inbound.web.controller;

import me.golemcore.callboard.adapter.inbound.web.dto.ChatDto;
import me.golemcore.callboard.domain.model.ChatView;
import me.golemcore.callboard.domain.model.DirectoryStatus;
import me.golemcore.callboard.domain.model.MessageType;
import me.golemcore.callboard.domain.model.NormalizedMessage;
import me.golemcore.callboard.domain.service.ChatLookupService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;
import reactor.test.StepVerifier;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class ChatsControllerTest {

    private ChatLookupService chatLookupService;
    private ChatsController controller;

    @BeforeEach
    void setUp() {
        chatLookupService = mock(ChatLookupService.class);
        controller = new ChatsController(chatLookupService);
    }

    @Test
    void shouldReturnChatWithGitInfo() {
        when(chatLookupService.findChat("c1", true)).thenReturn(Optional.of(ChatView.builder()
                .id("c1")
                .folder("/src/app")
                .displayFolder("/src/app")
                .sessionId("s1")
                .sessionIds(List.of("s1"))
                .sessionLogPath(Path.of("/p/-src-app/s1.jsonl"))
                .directoryStatus(DirectoryStatus.repository("main"))
                .build()));

        StepVerifier.create(controller.getChat("c1", true))
                .assertNext(response -> {
                    ChatDto body = response.getBody();
                    assertEquals(HttpStatus.OK, response.getStatusCode());
                    assertEquals("c1", body.getId());
                    assertEquals("/p/-src-app/s1.jsonl", body.getSessionLogPath());
                    assertEquals(Boolean.TRUE, body.getGitRepo());
                    assertEquals("main", body.getGitBranch());
                })
                .verifyComplete();
    }

    @Test
    void shouldReturnNotFoundForUnknownChat() {
        when(chatLookupService.findChat("nope", true)).thenReturn(Optional.empty());

        StepVerifier.create(controller.getChat("nope", true))
                .expectErrorSatisfies(error -> {
                    assertTrue(error instanceof ResponseStatusException);
                    assertEquals(HttpStatus.NOT_FOUND, ((ResponseStatusException) error).getStatusCode());
                })
                .verify();
    }

    @Test
    void shouldReturnConversationMessages() {
        List<NormalizedMessage> messages = List.of(NormalizedMessage.builder()
                .role("user").type(MessageType.TEXT).content("hi").build());
        when(chatLookupService.getConversationMessages("c1")).thenReturn(messages);

        StepVerifier.create(controller.getMessages("c1"))
                .assertNext(response -> assertEquals(messages, response.getBody()))
                .verifyComplete();
    }
}

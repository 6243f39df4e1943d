package me.golemcore.callboard.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import me.golemcore.callboard.adapter.inbound.web.dto.ChatDto;
import me.golemcore.callboard.domain.model.ChatView;
import me.golemcore.callboard.domain.model.DirectoryStatus;
import me.golemcore.callboard.domain.model.NormalizedMessage;
import me.golemcore.callboard.domain.service.ChatLookupService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;

/**
 * Chat details and message timelines.
 */
@RestController
@RequestMapping("/api/chats")
@RequiredArgsConstructor
public class ChatsController {

    private final ChatLookupService chatLookupService;

    @GetMapping("/{id}")
    public Mono<ResponseEntity<ChatDto>> getChat(
            @PathVariable String id,
            @RequestParam(defaultValue = "true") boolean includeGitInfo) {
        return Mono.fromCallable(() -> chatLookupService.findChat(id, includeGitInfo)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Chat not found")))
                .subscribeOn(Schedulers.boundedElastic())
                .map(chat -> ResponseEntity.ok(toDto(chat)));
    }

    @GetMapping("/{id}/messages")
    public Mono<ResponseEntity<List<NormalizedMessage>>> getMessages(@PathVariable String id) {
        return Mono.fromCallable(() -> chatLookupService.getConversationMessages(id))
                .subscribeOn(Schedulers.boundedElastic())
                .map(ResponseEntity::ok);
    }

    private ChatDto toDto(ChatView chat) {
        DirectoryStatus status = chat.getDirectoryStatus();
        return ChatDto.builder()
                .id(chat.getId())
                .folder(chat.getFolder())
                .displayFolder(chat.getDisplayFolder())
                .sessionId(chat.getSessionId())
                .sessionIds(chat.getSessionIds())
                .sessionLogPath(chat.getSessionLogPath() != null ? chat.getSessionLogPath().toString() : null)
                .metadata(chat.getMetadata())
                .createdAt(chat.getCreatedAt())
                .updatedAt(chat.getUpdatedAt())
                .gitRepo(status != null ? status.isRepo() : null)
                .gitBranch(status != null ? status.branch() : null)
                .fromFilesystem(chat.isFromFilesystem())
                .build();
    }
}

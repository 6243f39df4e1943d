package me.golemcore.callboard.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import me.golemcore.callboard.adapter.inbound.web.dto.DirectoryStatusDto;
import me.golemcore.callboard.domain.model.DirectoryStatus;
import me.golemcore.callboard.domain.service.DirectoryStatusCache;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

@RestController
@RequestMapping("/api/directories")
@RequiredArgsConstructor
public class DirectoriesController {

    private final DirectoryStatusCache directoryStatusCache;

    @GetMapping("/status")
    public Mono<ResponseEntity<DirectoryStatusDto>> getStatus(@RequestParam(required = false) String path) {
        if (path == null || path.isBlank()) {
            throw new IllegalArgumentException("path is required");
        }
        return Mono.fromCallable(() -> directoryStatusCache.get(path))
                .subscribeOn(Schedulers.boundedElastic())
                .map(status -> ResponseEntity.ok(toDto(path, status)));
    }

    private static DirectoryStatusDto toDto(String path, DirectoryStatus status) {
        return DirectoryStatusDto.builder()
                .path(path)
                .gitRepo(status.isRepo())
                .branch(status.branch())
                .build();
    }
}

package me.golemcore.callboard.adapter.inbound.web.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SessionSummaryDto {
    private String sessionId;
    private String directory;
    private String displayDirectory;
    private String createdAt;
    private String updatedAt;
    private String preview;
}

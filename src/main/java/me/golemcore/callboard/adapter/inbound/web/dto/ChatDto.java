package me.golemcore.callboard.adapter.inbound.web.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ChatDto {
    private String id;
    private String folder;
    private String displayFolder;
    private String sessionId;
    private List<String> sessionIds;
    private String sessionLogPath;
    private String metadata;
    private String createdAt;
    private String updatedAt;
    private Boolean gitRepo;
    private String gitBranch;
    private boolean fromFilesystem;
}

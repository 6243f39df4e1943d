package me.golemcore.callboard.adapter.inbound.web.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SessionsPageResponse {
    private List<SessionSummaryDto> sessions;
    private int total;
    private boolean hasMore;
}

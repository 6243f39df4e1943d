package me.golemcore.callboard.domain.model;

import java.nio.file.Path;

/** Log file of one subagent spawned from a parent session. */
public record SubagentLogFile(String agentId, Path path) {
}

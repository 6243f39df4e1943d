package me.golemcore.callboard.domain.service;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.callboard.domain.model.LogRecord;
import me.golemcore.callboard.domain.model.NormalizedMessage;
import me.golemcore.callboard.domain.model.SubagentLogFile;
import me.golemcore.callboard.port.outbound.SessionLogPort;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Builds the full message timeline of a conversation.
 *
 * <p>
 * A conversation may span several sessions (each resume starts a new session
 * log) and may have spawned subagents logging to their own files. The parent
 * sessions are decoded and normalized in the given order; subagent messages are
 * labelled with the description of the task that spawned them and the combined
 * list is sorted by timestamp. When no subagent produced anything the parent
 * order is returned as is.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ConversationTimelineService {

    private final SessionLogPort sessionLogPort;
    private final LogRecordDecoder decoder;
    private final MessageNormalizer normalizer;
    private final SubagentCorrelator correlator;

    public List<NormalizedMessage> getConversationTimeline(List<String> sessionIds) {
        if (sessionIds == null || sessionIds.isEmpty()) {
            return List.of();
        }
        List<String> orderedIds = new ArrayList<>(new LinkedHashSet<>(sessionIds));

        List<LogRecord> parentRecords = new ArrayList<>();
        for (String sessionId : orderedIds) {
            Optional<Path> logFile = sessionLogPort.findLogFileForSession(sessionId);
            if (logFile.isEmpty()) {
                log.debug("[Timeline] No log file for session {}", sessionId);
                continue;
            }
            parentRecords.addAll(decoder.decodeAll(logFile.get()));
        }

        List<NormalizedMessage> parentMessages = normalizer.normalize(parentRecords);
        Map<String, String> labels = correlator.correlate(parentRecords);

        List<List<NormalizedMessage>> subagentTimelines = new ArrayList<>();
        for (String sessionId : orderedIds) {
            for (SubagentLogFile subagent : sessionLogPort.findSubagentLogFiles(sessionId)) {
                List<LogRecord> records = decoder.decodeAll(subagent.path());
                String label = resolveLabel(subagent.agentId(), labels, records);
                List<NormalizedMessage> messages = normalizer.normalize(records, label);
                if (!messages.isEmpty()) {
                    subagentTimelines.add(messages);
                }
            }
        }

        if (subagentTimelines.isEmpty()) {
            return parentMessages;
        }

        log.debug("[Timeline] Merging {} parent messages with {} subagent timelines",
                parentMessages.size(), subagentTimelines.size());
        List<TimedMessage> combined = new ArrayList<>();
        addWithEffectiveTimestamps(combined, parentMessages);
        for (List<NormalizedMessage> timeline : subagentTimelines) {
            addWithEffectiveTimestamps(combined, timeline);
        }
        combined.sort(Comparator.comparing(TimedMessage::effectiveTimestamp));
        return combined.stream().map(TimedMessage::message).toList();
    }

    private String resolveLabel(String agentId, Map<String, String> labels, List<LogRecord> records) {
        String described = labels.get(agentId);
        if (described != null && !described.equals(SubagentCorrelator.fallbackLabel(agentId))) {
            return described;
        }
        for (LogRecord record : records) {
            if (record.getAgentName() != null && !record.getAgentName().isBlank()) {
                return record.getAgentName();
            }
        }
        return SubagentCorrelator.fallbackLabel(agentId);
    }

    /**
     * Messages without a timestamp take the one of their predecessor in the same
     * sequence, or of their successor when they lead it, so the stable sort keeps
     * them next to their neighbours. A sequence without any timestamp takes the
     * effective timestamp of the message appended before it and stays in place.
     */
    private void addWithEffectiveTimestamps(List<TimedMessage> target, List<NormalizedMessage> messages) {
        Instant previous = messages.stream()
                .map(NormalizedMessage::getTimestamp)
                .filter(Objects::nonNull)
                .findFirst()
                .orElseGet(() -> target.isEmpty() ? Instant.MIN : target.get(target.size() - 1).effectiveTimestamp());
        for (NormalizedMessage message : messages) {
            Instant effective = message.getTimestamp() != null ? message.getTimestamp() : previous;
            target.add(new TimedMessage(message, effective));
            previous = effective;
        }
    }

    private record TimedMessage(NormalizedMessage message, Instant effectiveTimestamp) {
    }
}

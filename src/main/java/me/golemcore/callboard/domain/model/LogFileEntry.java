package me.golemcore.callboard.domain.model;

import java.nio.file.Path;
import java.util.Comparator;

/**
 * A session log path with its modification time in nanoseconds since the
 * epoch, as produced by a listing strategy.
 */
public record LogFileEntry(Path path, long modifiedNanos) {

    /** Most recently modified first; ties broken by path for a stable order. */
    public static final Comparator<LogFileEntry> NEWEST_FIRST = Comparator
            .comparingLong(LogFileEntry::modifiedNanos).reversed()
            .thenComparing(entry -> entry.path().toString());
}

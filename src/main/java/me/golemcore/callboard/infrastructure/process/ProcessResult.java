package me.golemcore.callboard.infrastructure.process;

/**
 * Outcome of an external command. {@code stdout} holds whatever was read
 * before the process ended.
 */
public record ProcessResult(int exitCode, String stdout, boolean timedOut) {

    public boolean isSuccess() {
        return !timedOut && exitCode == 0;
    }
}

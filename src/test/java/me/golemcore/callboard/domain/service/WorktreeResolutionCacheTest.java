package me.golemcore.callboard.domain.service;

import me.golemcore.callboard.domain.model.WorkingDirectoryResolution;
import me.golemcore.callboard.port.outbound.GitPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class WorktreeResolutionCacheTest {

    private GitPort gitPort;
    private WorktreeResolutionCache cache;

    @BeforeEach
    void setUp() {
        gitPort = mock(GitPort.class);
        cache = new WorktreeResolutionCache(gitPort);
    }

    @Test
    void shouldResolveWorktreeToMainCheckoutOnce() {
        when(gitPort.resolveWorkingDirectory("/src/app.feature"))
                .thenReturn(new WorkingDirectoryResolution("/src/app", true));

        assertEquals("/src/app", cache.displayDirectory("/src/app.feature"));
        assertTrue(cache.resolve("/src/app.feature").worktree());
        verify(gitPort, times(1)).resolveWorkingDirectory("/src/app.feature");
    }

    @Test
    void shouldFallBackToIdentityOnFailure() {
        when(gitPort.resolveWorkingDirectory("/src/app")).thenThrow(new IllegalStateException("boom"));

        WorkingDirectoryResolution resolution = cache.resolve("/src/app");

        assertEquals("/src/app", resolution.canonicalPath());
        assertFalse(resolution.worktree());
    }

    @Test
    void shouldResolveAgainAfterClear() {
        when(gitPort.resolveWorkingDirectory("/src/app")).thenReturn(WorkingDirectoryResolution.identity("/src/app"));

        cache.resolve("/src/app");
        cache.clear();
        cache.resolve("/src/app");

        verify(gitPort, times(2)).resolveWorkingDirectory("/src/app");
    }
}

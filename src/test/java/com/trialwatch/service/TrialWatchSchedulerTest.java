package com.trialwatch.service;

import com.trialwatch.client.RegistryApiException;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class TrialWatchSchedulerTest {

    private final TrialSyncService syncService = Mockito.mock(TrialSyncService.class);
    private final LiteratureLinkService literatureService = Mockito.mock(LiteratureLinkService.class);
    private final TrialWatchScheduler scheduler = new TrialWatchScheduler(syncService, literatureService);

    @Test
    void runsSyncThenLiterature() {
        when(syncService.sync(null, null)).thenReturn(new TrialSyncService.SyncReport(List.of()));
        when(literatureService.link(null)).thenReturn(new LiteratureLinkService.LinkReport(0, 0, 0));

        scheduler.runCycle();

        verify(syncService).sync(null, null);
        verify(literatureService).link(null);
    }

    @Test
    void skipsWhileSyncIsRunning() {
        when(syncService.isRunning()).thenReturn(true);

        scheduler.runCycle();

        verify(syncService, never()).sync(null, null);
    }

    @Test
    void failedSyncDoesNotEscapeOrLink() {
        when(syncService.sync(null, null)).thenThrow(new RegistryApiException(500, "boom"));

        assertThatCode(scheduler::runCycle).doesNotThrowAnyException();
        verify(literatureService, never()).link(null);
    }
}

package com.trialwatch.service;

import com.trialwatch.config.TrialWatchProperties;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class DigestServiceTest {

    private final TrialStoreService store = Mockito.mock(TrialStoreService.class);
    private final TrialWatchProperties properties = new TrialWatchProperties();
    private final DigestService service = new DigestService(store, properties);

    @Test
    void usesConfiguredWindowsByDefault() {
        properties.getPipeline().setReadoutWindowDays(90);
        properties.getPipeline().setRecentlyCompletedDays(30);
        when(store.actionableTrials(90, 30)).thenReturn(List.of());

        service.actionableTrials(null);

        verify(store).actionableTrials(90, 30);
    }

    @Test
    void overrideReplacesUpcomingWindowOnly() {
        service.actionableTrials(14);

        verify(store).actionableTrials(14, 120);
    }

    @Test
    void negativeWindowIsRejected() {
        assertThatThrownBy(() -> service.actionableTrials(-1)).isInstanceOf(IllegalArgumentException.class);
    }
}

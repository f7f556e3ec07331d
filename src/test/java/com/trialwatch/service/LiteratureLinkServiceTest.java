package com.trialwatch.service;

import com.trialwatch.client.LiteratureApiException;
import com.trialwatch.client.PubMedClient;
import com.trialwatch.config.TrialWatchProperties;
import com.trialwatch.model.Citation;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;
import org.springframework.web.client.ResourceAccessException;

import java.util.List;

import static com.trialwatch.service.TrialFixtures.citation;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class LiteratureLinkServiceTest {

    private PubMedClient pubMedClient;
    private TrialStoreService store;
    private TrialWatchProperties properties;
    private LiteratureLinkService service;

    @BeforeEach
    void setUp() {
        pubMedClient = Mockito.mock(PubMedClient.class);
        store = Mockito.mock(TrialStoreService.class);
        properties = new TrialWatchProperties();
        service = new LiteratureLinkService(pubMedClient, store, properties);
    }

    @Test
    void linksActionableTrials() {
        when(store.actionableIds(180, 120, 200)).thenReturn(List.of("NCT1", "NCT2"));
        List<Citation> found = List.of(citation("1", "a", "2023 Dec"), citation("2", "b", "2024 Jan"),
                citation("3", "c", ""));
        when(pubMedClient.citationsFor("NCT1")).thenReturn(found);
        when(pubMedClient.citationsFor("NCT2")).thenReturn(List.of());

        LiteratureLinkService.LinkReport report = service.link(null);

        verify(store).upsertCitations("NCT1", found);
        verify(store).updateLiteratureSummary("NCT1", 3, "2024 Jan");
        verify(store).updateLiteratureSummary("NCT2", 0, null);
        assertThat(report.checked()).isEqualTo(2);
        assertThat(report.withCitations()).isEqualTo(1);
        assertThat(report.failed()).isZero();
    }

    @Test
    void failedLookupSkipsOnlyThatTrial() {
        when(store.actionableIds(anyInt(), anyInt(), anyInt())).thenReturn(List.of("NCT1", "NCT2", "NCT3"));
        when(pubMedClient.citationsFor("NCT1")).thenThrow(new LiteratureApiException("esearch.fcgi", 429, "slow down"));
        when(pubMedClient.citationsFor("NCT2")).thenThrow(new ResourceAccessException("timeout"));
        when(pubMedClient.citationsFor("NCT3")).thenReturn(List.of(citation("9", "t", "2022")));

        LiteratureLinkService.LinkReport report = service.link(5);

        verify(store).actionableIds(180, 120, 5);
        verify(store, never()).updateLiteratureSummary(Mockito.eq("NCT1"), anyInt(), Mockito.any());
        verify(store).updateLiteratureSummary("NCT3", 1, "2022");
        assertThat(report.failed()).isEqualTo(2);
        assertThat(report.checked()).isEqualTo(1);
    }

    @Test
    void usesTopScoredTrialsWhenNotActionableOnly() {
        properties.getPubmed().setActionableOnly(false);
        properties.getPubmed().setMaxTrialsPerRun(7);
        when(store.topIds(7)).thenReturn(List.of());

        service.link(null);

        verify(store).topIds(7);
        verify(store, never()).actionableIds(anyInt(), anyInt(), anyInt());
    }

    @Test
    void disabledPassDoesNothing() {
        properties.getPubmed().setEnabled(false);

        assertThat(service.link(null).checked()).isZero();
        verifyNoInteractions(store, pubMedClient);
    }

    @Test
    void invalidCapIsRejected() {
        assertThatThrownBy(() -> service.link(0)).isInstanceOf(IllegalArgumentException.class);
        verify(pubMedClient, never()).citationsFor(anyString());
    }

    @Test
    void latestDateIsStringMaximum() {
        assertThat(LiteratureLinkService.latestPublicationDate(List.of(
                citation("1", "a", "2023 Dec 5"), citation("2", "b", "2023 Dec"), citation("3", "c", null))))
                .isEqualTo("2023 Dec 5");
        assertThat(LiteratureLinkService.latestPublicationDate(List.of())).isNull();
    }
}

package com.repotide.service;

import com.repotide.config.RepoTideProperties;
import com.repotide.exception.EventStoreUnavailableException;
import com.repotide.model.GitHubEvent;
import com.repotide.store.EventStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class EventQueryServiceTest {

    @Mock private EventStore eventStore;

    private EventQueryService queryService;

    @BeforeEach
    void setUp() {
        queryService = new EventQueryService(eventStore, new RepoTideProperties());
    }

    @ParameterizedTest(name = "limit=''{0}'' → {1}")
    @CsvSource(value = {
            "NULL, 10",
            "'', 10",
            "abc, 10",
            "0, 10",
            "-5, 10",
            "1, 1",
            "25, 25",
            " 30 , 30",
            "100, 100",
            "500, 100",
            "99999999999, 100",
            "10000000000, 100",
            "-99999999999, 10"
    }, nullValues = "NULL")
    @DisplayName("Limit parsing falls back to the default and caps at 100")
    void resolveLimit(String raw, int expected) {
        assertEquals(expected, queryService.resolveLimit(raw));
    }

    @Test
    @DisplayName("Configured default limit is honoured")
    void customDefault() {
        RepoTideProperties properties = new RepoTideProperties();
        properties.getQuery().setDefaultLimit(20);

        assertEquals(20, new EventQueryService(eventStore, properties).resolveLimit(null));
    }

    @Test
    @DisplayName("recent() passes the resolved limit to the store and returns its order untouched")
    void recent_delegatesToStore() {
        GitHubEvent newer = GitHubEvent.push("b", "u", "main", "29 January 2026 - 04:31 PM UTC");
        GitHubEvent older = GitHubEvent.push("a", "u", "main", "29 January 2026 - 04:30 PM UTC");
        when(eventStore.recent(100)).thenReturn(List.of(newer, older));

        List<GitHubEvent> events = queryService.recent("500");

        assertEquals(List.of(newer, older), events);
        verify(eventStore).recent(100);
    }

    @Test
    @DisplayName("Store failure is surfaced, not turned into an empty list")
    void recent_storeUnavailable() {
        when(eventStore.recent(10)).thenThrow(new EventStoreUnavailableException("down", null));

        assertThrows(EventStoreUnavailableException.class, () -> queryService.recent(null));
    }
}

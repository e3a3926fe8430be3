package org.caureq.nodetelemetry.service;

import org.caureq.nodetelemetry.TestProps;
import org.caureq.nodetelemetry.config.TelemetryProps;
import org.caureq.nodetelemetry.store.TelemetryStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class RetentionServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-10T03:00:00Z");

    private TelemetryStore store;
    private Clock clock;

    @BeforeEach
    void setUp() {
        store = mock(TelemetryStore.class);
        clock = Clock.fixed(NOW, ZoneOffset.UTC);
    }

    private RetentionService service(int rawDays) {
        var props = TestProps.builder().retention(new TelemetryProps.RetentionProps(rawDays, Duration.ofDays(1))).build();
        return new RetentionService(store, props, clock);
    }

    @Test
    void zeroDaysKeepsEverything() {
        var service = service(0);

        assertFalse(service.isEnabled());
        assertEquals(0, service.pruneRawSamples());
        verifyNoInteractions(store);
    }

    @Test
    void deletesSamplesOlderThanWindow() {
        when(store.deleteRawBefore(NOW.minus(Duration.ofDays(90)))).thenReturn(12);

        assertEquals(12, service(90).pruneRawSamples());
    }

    @Test
    void storeFailureIsLoggedNotThrown() {
        when(store.deleteRawBefore(any())).thenThrow(new DataAccessResourceFailureException("locked"));

        assertEquals(0, service(30).pruneRawSamples());
    }
}

package com.jreinhal.hragent.settings;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.github.benmanes.caffeine.cache.Ticker;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class AgentSettingsCacheTest {

    private final AtomicLong nanos = new AtomicLong();
    private final Ticker ticker = nanos::get;
    private AgentSettingsProvider provider;
    private AgentSettingsCache cache;

    @BeforeEach
    void setUp() {
        provider = mock(AgentSettingsProvider.class);
        when(provider.load()).thenReturn(AgentSettingsFixtures.defaults());
        cache = new AgentSettingsCache(provider, new AgentSettingsValidator(), Duration.ofMinutes(5), ticker);
    }

    @Test
    @DisplayName("Snapshot is reused within the TTL")
    void reusedWithinTtl() {
        AgentSettings first = cache.current();
        nanos.addAndGet(Duration.ofMinutes(4).toNanos());

        assertThat(cache.current()).isSameAs(first);
        verify(provider, times(1)).load();
    }

    @Test
    @DisplayName("Snapshot is reloaded after the TTL")
    void reloadedAfterTtl() {
        cache.current();
        nanos.addAndGet(Duration.ofMinutes(6).toNanos());

        cache.current();

        verify(provider, times(2)).load();
    }

    @Test
    @DisplayName("Invalidate forces a reload")
    void invalidate() {
        cache.current();
        cache.invalidate();
        cache.current();

        verify(provider, times(2)).load();
    }

    @Test
    @DisplayName("Invalid snapshot is rejected and not cached")
    void invalidNotCached() {
        when(provider.load())
                .thenReturn(AgentSettingsFixtures.with(p -> p.getThresholds().setLow(-1)))
                .thenReturn(AgentSettingsFixtures.defaults());

        assertThatThrownBy(cache::current).isInstanceOf(InvalidAgentSettingsException.class);
        assertThat(cache.current().thresholds().low()).isEqualTo(0.5);
    }
}

package com.jreinhal.hragent.settings;

import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.jreinhal.hragent.config.HrAgentProperties;
import java.util.function.Consumer;

/**
 * Settings snapshots for unit tests, built from the same defaults as {@code hragent.*}.
 */
public final class AgentSettingsFixtures {

    private AgentSettingsFixtures() {
    }

    public static AgentSettings defaults() {
        return load(new HrAgentProperties());
    }

    public static AgentSettings with(Consumer<HrAgentProperties> customizer) {
        HrAgentProperties properties = new HrAgentProperties();
        customizer.accept(properties);
        return load(properties);
    }

    public static AgentSettings withMethod(String method) {
        return with(p -> p.getConfidence().setMethod(method));
    }

    public static AgentSettings load(HrAgentProperties properties) {
        return new PropertiesAgentSettingsProvider(properties).load();
    }

    public static AgentSettingsCache cacheOf(AgentSettings settings) {
        AgentSettingsCache cache = mock(AgentSettingsCache.class);
        when(cache.current()).thenReturn(settings);
        return cache;
    }
}

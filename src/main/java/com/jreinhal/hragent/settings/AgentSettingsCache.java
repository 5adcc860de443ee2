package com.jreinhal.hragent.settings;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import com.jreinhal.hragent.config.HrAgentProperties;
import jakarta.annotation.PostConstruct;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Process-wide, read-mostly holder of the active {@link AgentSettings}.
 *
 * <p>Snapshots are loaded from the {@link AgentSettingsProvider}, validated, and kept for the
 * configured TTL. {@link #invalidate()} forces the next read to reload. A snapshot that fails
 * validation is never cached.</p>
 */
@Component
public class AgentSettingsCache {

    private static final Logger log = LoggerFactory.getLogger(AgentSettingsCache.class);
    private static final String ACTIVE_KEY = "active";

    private final AgentSettingsProvider provider;
    private final AgentSettingsValidator validator;
    private final Duration ttl;
    private final Cache<String, AgentSettings> cache;

    @Autowired
    public AgentSettingsCache(AgentSettingsProvider provider, AgentSettingsValidator validator,
                              HrAgentProperties properties) {
        this(provider, validator, properties.getCache().getSettingsTtl(), Ticker.systemTicker());
    }

    AgentSettingsCache(AgentSettingsProvider provider, AgentSettingsValidator validator, Duration ttl, Ticker ticker) {
        this.provider = provider;
        this.validator = validator;
        this.ttl = ttl == null || ttl.isNegative() ? Duration.ofMinutes(5) : ttl;
        this.cache = Caffeine.newBuilder()
                .maximumSize(1L)
                .expireAfterWrite(this.ttl)
                .ticker(ticker)
                .build();
    }

    /**
     * Loads and validates the first snapshot so an invalid configuration fails application start.
     */
    @PostConstruct
    public void init() {
        AgentSettings settings = current();
        log.info("Agent settings loaded: method={}, escalationThreshold={}, ttl={}",
                settings.confidence().method(), settings.thresholds().escalation(), this.ttl);
    }

    /**
     * @throws InvalidAgentSettingsException when a reload produced a snapshot that violates the rules
     */
    public AgentSettings current() {
        return this.cache.get(ACTIVE_KEY, key -> loadValidated());
    }

    public void invalidate() {
        this.cache.invalidate(ACTIVE_KEY);
        log.info("Agent settings cache invalidated");
    }

    private AgentSettings loadValidated() {
        AgentSettings settings = this.provider.load();
        try {
            this.validator.validate(settings);
        } catch (InvalidAgentSettingsException e) {
            log.error("Rejected agent settings: {}", e.getViolations());
            throw e;
        }
        return settings;
    }
}

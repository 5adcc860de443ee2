package com.jreinhal.hragent.settings;

/**
 * Source of the active agent configuration.
 *
 * <p>Implementations are asked for a fresh snapshot whenever the settings cache expires or is
 * invalidated, so they may read from a database or a remote service.</p>
 */
public interface AgentSettingsProvider {

    AgentSettings load();
}

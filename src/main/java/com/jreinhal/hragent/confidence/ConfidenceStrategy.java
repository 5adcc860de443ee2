package com.jreinhal.hragent.confidence;

import com.jreinhal.hragent.settings.AgentSettings;

public interface ConfidenceStrategy {

    ConfidenceResult score(ConfidenceInput input, AgentSettings settings);
}

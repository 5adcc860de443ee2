package com.jreinhal.hragent.pipeline;

import com.jreinhal.hragent.model.PipelineState;
import com.jreinhal.hragent.settings.AgentSettingsCache;
import com.jreinhal.hragent.tools.ToolInvocationOutcome;
import com.jreinhal.hragent.tools.ToolInvoker;
import com.jreinhal.hragent.util.LogSanitizer;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class ToolInvocationStage implements PipelineStage {

    private static final Logger log = LoggerFactory.getLogger(ToolInvocationStage.class);

    private final ToolInvoker toolInvoker;
    private final AgentSettingsCache settingsCache;

    public ToolInvocationStage(ToolInvoker toolInvoker, AgentSettingsCache settingsCache) {
        this.toolInvoker = toolInvoker;
        this.settingsCache = settingsCache;
    }

    @Override
    public StateUpdate apply(PipelineState state) {
        try {
            ToolInvocationOutcome outcome = this.toolInvoker.invoke(state.getQuery(), state.getQueryAnalysis(),
                    this.settingsCache.current());
            log.info("Tool invocation finished: {} results{}", outcome.results().size(),
                    outcome.error() == null ? "" : " (error: " + LogSanitizer.sanitize(outcome.error()) + ")");
            return StateUpdate.builder()
                    .toolResults(outcome.results())
                    .toolInvocationError(outcome.error())
                    .tokenUsage(outcome.usage())
                    .build();
        } catch (RuntimeException e) {
            log.error("Tool invocation failed: {}", LogSanitizer.sanitize(e.getMessage()), e);
            return StateUpdate.builder()
                    .toolResults(List.of())
                    .toolInvocationError(String.valueOf(e.getMessage()))
                    .error("Tool invocation error: " + e.getMessage())
                    .build();
        }
    }
}

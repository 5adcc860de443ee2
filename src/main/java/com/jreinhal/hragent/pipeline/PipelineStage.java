package com.jreinhal.hragent.pipeline;

import com.jreinhal.hragent.model.PipelineState;

/**
 * One step of the agent pipeline: reads the state and describes the fields it sets.
 *
 * <p>Stages do not mutate the state themselves; the pipeline applies the returned update.</p>
 */
@FunctionalInterface
public interface PipelineStage {

    StateUpdate apply(PipelineState state);
}

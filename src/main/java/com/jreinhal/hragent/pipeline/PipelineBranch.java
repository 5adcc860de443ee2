package com.jreinhal.hragent.pipeline;

/**
 * Where the pipeline goes after analysis, before generation.
 */
public enum PipelineBranch {
    /** Run tools; their results become the generation context. */
    TOOLS,
    /** Retrieve passages from the knowledge base. */
    RETRIEVAL
}

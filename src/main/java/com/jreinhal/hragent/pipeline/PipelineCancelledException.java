package com.jreinhal.hragent.pipeline;

/**
 * The caller abandoned the request; no outcome is reported for it.
 */
public class PipelineCancelledException extends RuntimeException {

    public PipelineCancelledException(String stage) {
        super("Pipeline cancelled before stage '" + stage + "'");
    }
}

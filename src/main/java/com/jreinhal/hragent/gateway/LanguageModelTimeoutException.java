package com.jreinhal.hragent.gateway;

import java.time.Duration;

public class LanguageModelTimeoutException extends LanguageModelException {

    private final Duration timeout;

    public LanguageModelTimeoutException(Duration timeout) {
        super("Language model call timed out after " + timeout.toMillis() + "ms");
        this.timeout = timeout;
    }

    public Duration getTimeout() {
        return timeout;
    }
}

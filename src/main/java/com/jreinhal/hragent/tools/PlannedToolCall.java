package com.jreinhal.hragent.tools;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record PlannedToolCall(String name, Map<String, Object> arguments) {

    public PlannedToolCall {
        arguments = arguments == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(arguments));
    }
}

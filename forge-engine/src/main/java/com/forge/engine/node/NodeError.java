package com.forge.engine.node;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** Error carried by a failed node result. {@code details} holds {@code exception} and {@code stack}. */
public final class NodeError {

    private final String message;
    private final String code;
    private final Map<String, Object> details;

    public NodeError(String message, String code, Map<String, Object> details) {
        this.message = message;
        this.code = code;
        this.details = details != null ? Collections.unmodifiableMap(new LinkedHashMap<>(details)) : Map.of();
    }

    public String getMessage() {
        return message;
    }

    public String getCode() {
        return code;
    }

    public Map<String, Object> getDetails() {
        return details;
    }

    @Override
    public String toString() {
        return "NodeError{code=" + code + ", message=" + message + "}";
    }
}

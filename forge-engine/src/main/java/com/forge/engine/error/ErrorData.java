package com.forge.engine.error;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.LinkedHashMap;
import java.util.Map;

/** Converts throwables to the persisted {@code {message, stack}} error shape. */
public final class ErrorData {

    private ErrorData() {
    }

    public static Map<String, Object> of(Throwable t) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("message", messageOf(t));
        m.put("stack", stackTrace(t));
        return m;
    }

    /** Message, or the class name when the throwable has none. */
    public static String messageOf(Throwable t) {
        String msg = t.getMessage();
        return msg != null && !msg.isBlank() ? msg : t.getClass().getName();
    }

    public static String stackTrace(Throwable t) {
        StringWriter sw = new StringWriter();
        t.printStackTrace(new PrintWriter(sw));
        return sw.toString();
    }
}

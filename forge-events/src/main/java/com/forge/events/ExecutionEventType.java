package com.forge.events;

/** Lifecycle event kinds; {@link #getName()} is the wire name. */
public enum ExecutionEventType {
    STARTED("workflow:execution:started"),
    COMPLETED("workflow:execution:completed"),
    FAILED("workflow:execution:failed");

    private final String name;

    ExecutionEventType(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }
}

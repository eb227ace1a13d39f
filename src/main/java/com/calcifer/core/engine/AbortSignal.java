package com.calcifer.core.engine;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Cooperative cancellation flag for one run. The first reason recorded wins.
 */
public final class AbortSignal {

    private final AtomicReference<String> reason = new AtomicReference<>();

    /**
     * @return true if this call triggered the signal, false if it was already triggered
     */
    public boolean trigger(String why) {
        return reason.compareAndSet(null, why != null ? why : "aborted");
    }

    public boolean isTriggered() {
        return reason.get() != null;
    }

    /** Reason given by the first trigger, or null. */
    public String reason() {
        return reason.get();
    }
}

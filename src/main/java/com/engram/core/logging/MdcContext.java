package com.engram.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing Engram-specific MDC keys for structured logging.
 */
public final class MdcContext {

    static final String REPOSITORY = "repository";
    static final String PHASE = "phase";

    private MdcContext() {}

    public static void setRepository(String repository) {
        MDC.put(REPOSITORY, repository);
    }

    public static void setPhase(String phase) {
        MDC.put(PHASE, phase);
    }

    public static void clear() {
        MDC.remove(REPOSITORY);
        MDC.remove(PHASE);
    }
}

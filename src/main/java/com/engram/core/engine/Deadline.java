package com.engram.core.engine;

import java.time.Duration;

/**
 * Top-level time budget for one analysis. Shared by the tree walk and every
 * history query so a caller can bound worst-case latency on huge repositories.
 */
public final class Deadline {

    private static final Deadline NONE = new Deadline(Long.MAX_VALUE);

    private final long expiresAtNanos;

    private Deadline(long expiresAtNanos) {
        this.expiresAtNanos = expiresAtNanos;
    }

    public static Deadline none() {
        return NONE;
    }

    /**
     * Creates a deadline that expires {@code budget} from now. A null, zero or negative
     * budget means no deadline.
     */
    public static Deadline after(Duration budget) {
        if (budget == null || budget.isZero() || budget.isNegative()) {
            return NONE;
        }
        return new Deadline(System.nanoTime() + budget.toNanos());
    }

    public boolean isBounded() {
        return this != NONE;
    }

    public boolean isExpired() {
        return isBounded() && System.nanoTime() - expiresAtNanos >= 0;
    }

    public Duration remaining() {
        if (!isBounded()) {
            return Duration.ofNanos(Long.MAX_VALUE);
        }
        long left = expiresAtNanos - System.nanoTime();
        return left > 0 ? Duration.ofNanos(left) : Duration.ZERO;
    }

    /**
     * Returns the smaller of {@code timeout} and the time remaining.
     */
    public Duration clamp(Duration timeout) {
        Duration left = remaining();
        return left.compareTo(timeout) < 0 ? left : timeout;
    }
}

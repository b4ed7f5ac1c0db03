package com.engram.core.engine;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class DeadlineTest {

    @Test
    @DisplayName("zero, negative or missing budgets mean no deadline")
    void unbounded() {
        assertFalse(Deadline.after(null).isBounded());
        assertFalse(Deadline.after(Duration.ZERO).isBounded());
        assertFalse(Deadline.after(Duration.ofSeconds(-1)).isBounded());
        assertFalse(Deadline.none().isExpired());
        assertEquals(Duration.ofSeconds(10), Deadline.none().clamp(Duration.ofSeconds(10)));
    }

    @Test
    @DisplayName("clamp never exceeds the remaining time")
    void clampToRemaining() {
        Deadline deadline = Deadline.after(Duration.ofSeconds(2));
        assertTrue(deadline.isBounded());
        assertFalse(deadline.isExpired());
        assertTrue(deadline.clamp(Duration.ofSeconds(10)).compareTo(Duration.ofSeconds(2)) <= 0);
        assertEquals(Duration.ofMillis(5), deadline.clamp(Duration.ofMillis(5)));
    }

    @Test
    @DisplayName("expires once the budget is spent")
    void expires() throws InterruptedException {
        Deadline deadline = Deadline.after(Duration.ofMillis(1));
        Thread.sleep(10);
        assertTrue(deadline.isExpired());
        assertEquals(Duration.ZERO, deadline.remaining());
    }
}

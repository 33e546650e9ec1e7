package com.dcruver.notededup.domain.pipeline;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;

class DeadlineTest {

    @Test
    void testExpiresOnceBudgetElapsed() {
        AtomicLong clock = new AtomicLong(1_000);
        Deadline deadline = new Deadline(Duration.ofMillis(5), clock::get);

        assertTrue(deadline.isBounded());
        assertFalse(deadline.isExpired());
        assertEquals(Duration.ofMillis(5), deadline.remaining());
        assertDoesNotThrow(() -> deadline.check("clustering"));

        clock.addAndGet(Duration.ofMillis(5).toNanos());

        assertTrue(deadline.isExpired());
        assertEquals(Duration.ZERO, deadline.remaining());
        DeadlineExceededException error = assertThrows(DeadlineExceededException.class,
            () -> deadline.check("clustering"));
        assertEquals("clustering", error.getWhere());
        assertEquals(Duration.ofMillis(5), error.getBudget());
        assertTrue(error.getMessage().contains("clustering"));
    }

    @Test
    void testNonPositiveBudgetMeansNoDeadline() {
        assertSame(Deadline.none(), Deadline.after(Duration.ZERO));
        assertSame(Deadline.none(), Deadline.after(Duration.ofSeconds(-3)));
        assertSame(Deadline.none(), Deadline.after(null));

        assertFalse(Deadline.none().isBounded());
        assertFalse(Deadline.none().isExpired());
        assertDoesNotThrow(() -> Deadline.none().check("anything"));
    }

    @Test
    void testPositiveBudgetIsBounded() {
        Deadline deadline = Deadline.after(Duration.ofMinutes(1));

        assertTrue(deadline.isBounded());
        assertFalse(deadline.isExpired());
        assertTrue(deadline.remaining().compareTo(Duration.ofMinutes(1)) <= 0);
    }

    @Test
    void testOversizedBudgetIsCapped() {
        Deadline deadline = assertDoesNotThrow(() -> Deadline.after(Duration.ofSeconds(Long.MAX_VALUE)));

        assertTrue(deadline.isBounded());
        assertFalse(deadline.isExpired());
        assertDoesNotThrow(() -> deadline.check("clustering"));
        assertTrue(deadline.remaining().compareTo(Deadline.MAX_BUDGET) <= 0);

        AtomicLong clock = new AtomicLong(Long.MAX_VALUE - 10);
        Deadline nearWrap = new Deadline(Duration.ofDays(365L * 1000), clock::get);
        assertFalse(nearWrap.isExpired());
        assertEquals(Deadline.MAX_BUDGET, nearWrap.remaining());
    }
}

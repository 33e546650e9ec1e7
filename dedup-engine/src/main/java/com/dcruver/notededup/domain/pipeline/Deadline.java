package com.dcruver.notededup.domain.pipeline;

import java.time.Duration;
import java.util.function.LongSupplier;

/**
 * Time budget for one pipeline run. Phases call {@link #check(String)} between comparisons.
 */
public final class Deadline {

    private static final Duration UNBOUNDED = Duration.ofSeconds(Long.MAX_VALUE, 999_999_999);
    private static final Deadline NONE = new Deadline(Duration.ZERO, System::nanoTime);

    // Longest budget whose end still fits a nanoTime reading
    static final Duration MAX_BUDGET = Duration.ofNanos(Long.MAX_VALUE / 2);

    private final Duration budget;
    private final LongSupplier nanoClock;
    private final long deadlineNanos;

    Deadline(Duration budget, LongSupplier nanoClock) {
        if (budget.compareTo(MAX_BUDGET) > 0) {
            budget = MAX_BUDGET;
        }
        this.budget = budget;
        this.nanoClock = nanoClock;
        this.deadlineNanos = nanoClock.getAsLong() + budget.toNanos();
    }

    /**
     * No deadline: never expires.
     */
    public static Deadline none() {
        return NONE;
    }

    /**
     * Deadline after the given budget; zero, negative or null means none. Budgets beyond about
     * 146 years are capped.
     */
    public static Deadline after(Duration budget) {
        if (budget == null || budget.isZero() || budget.isNegative()) {
            return NONE;
        }
        return new Deadline(budget, System::nanoTime);
    }

    public boolean isBounded() {
        return !budget.isZero();
    }

    public boolean isExpired() {
        return isBounded() && nanoClock.getAsLong() - deadlineNanos >= 0;
    }

    public Duration remaining() {
        if (!isBounded()) {
            return UNBOUNDED;
        }
        return Duration.ofNanos(Math.max(0, deadlineNanos - nanoClock.getAsLong()));
    }

    /**
     * Throw if the budget is used up.
     *
     * @param where Name of the phase or step checking, for the exception message
     */
    public void check(String where) {
        if (isExpired()) {
            throw new DeadlineExceededException(where, budget);
        }
    }
}

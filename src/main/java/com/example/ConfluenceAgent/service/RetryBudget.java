package com.example.ConfluenceAgent.service;

/**
 * Number of re-authentication + retry cycles an invocation may still perform.
 * Not thread-safe; each invocation owns its own budget.
 */
public final class RetryBudget {

    /** An invocation retries at most once, even if the retried output again needs auth. */
    public static final int MAX_RETRIES = 1;

    private int remaining;

    private RetryBudget(int remaining) {
        this.remaining = remaining;
    }

    public static RetryBudget singleRetry() {
        return new RetryBudget(MAX_RETRIES);
    }

    /**
     * @return true if a retry was available and has now been used
     */
    public boolean tryConsume() {
        if (remaining <= 0) {
            return false;
        }
        remaining--;
        return true;
    }

    public int remaining() {
        return remaining;
    }

    public boolean isExhausted() {
        return remaining <= 0;
    }
}

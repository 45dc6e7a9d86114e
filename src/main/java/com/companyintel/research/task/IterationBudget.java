package com.companyintel.research.task;

/**
 * Hard cap on task unit invocations for one worker. Touched only by the owning worker thread.
 */
public final class IterationBudget {

    private final int limit;
    private int used;

    public IterationBudget(int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("Iteration budget must be positive, got " + limit);
        }
        this.limit = limit;
    }

    boolean tryConsume() {
        if (used >= limit) {
            return false;
        }
        used++;
        return true;
    }

    public boolean exhausted() {
        return used >= limit;
    }

    public int used() {
        return used;
    }

    public int limit() {
        return limit;
    }
}

package io.taskloom.model;

/**
 * Reporting bands over the integer task priority (lower value = more urgent).
 */
public enum Priority {
    HIGH(1, 3),
    NORMAL(4, 6),
    LOW(7, Integer.MAX_VALUE);

    public static final int DEFAULT_VALUE = 5;

    private final int min;
    private final int max;

    Priority(int min, int max) {
        this.min = min;
        this.max = max;
    }

    public int min() {
        return min;
    }

    public int max() {
        return max;
    }

    public static Priority bandOf(int value) {
        if (value <= HIGH.max) {
            return HIGH;
        }
        if (value <= NORMAL.max) {
            return NORMAL;
        }
        return LOW;
    }
}

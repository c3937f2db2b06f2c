package tech.unifiedportal.sdk.enums;

/**
 * Scheduling priority of a call. Lower level means more urgent.
 */
public enum Priority {
    /** Authentication, emergency alerts. */
    CRITICAL(1),
    /** Real-time operations. */
    HIGH(2),
    /** Standard data operations. */
    NORMAL(3),
    /** Background tasks, analytics. */
    LOW(4),
    /** Non-urgent operations. */
    BACKGROUND(5);

    private final int level;

    Priority(int level) {
        this.level = level;
    }

    public int level() {
        return level;
    }

    public static Priority fromLevel(int level) {
        for (Priority priority : values()) {
            if (priority.level == level) {
                return priority;
            }
        }
        throw new IllegalArgumentException("Priority level must be between 1 and 5, got " + level);
    }
}

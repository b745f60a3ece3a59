package czm.dabs_be.activity;

/**
 * Activity urgency, stored by its lower-case value.
 */
public enum ActivityPriority {
    LOW("low"),
    MEDIUM("medium"),
    HIGH("high"),
    CRITICAL("critical");

    private final String value;

    ActivityPriority(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    /**
     * Unknown or blank input becomes MEDIUM.
     */
    public static ActivityPriority coerce(String raw) {
        if (raw == null || raw.isBlank()) {
            return MEDIUM;
        }
        String normalized = raw.trim();
        for (ActivityPriority priority : values()) {
            if (priority.value.equalsIgnoreCase(normalized)) {
                return priority;
            }
        }
        return MEDIUM;
    }
}

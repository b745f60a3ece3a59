package czm.dabs_be.briefing;

public enum BriefingStatus {
    DRAFT("draft"),
    PUBLISHED("published"),
    ARCHIVED("archived");

    private final String value;

    BriefingStatus(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static BriefingStatus fromValue(String raw) {
        for (BriefingStatus status : values()) {
            if (status.value.equalsIgnoreCase(raw)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown briefing status: " + raw);
    }
}

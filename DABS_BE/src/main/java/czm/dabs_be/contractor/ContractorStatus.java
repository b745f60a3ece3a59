package czm.dabs_be.contractor;

import java.util.Locale;

/**
 * Availability of a subcontractor on site.
 */
public enum ContractorStatus {
    ACTIVE("Active"),
    STANDBY("Standby"),
    DELAYED("Delayed"),
    COMPLETE("Complete"),
    OFFSITE("Offsite");

    private final String label;

    ContractorStatus(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /**
     * Maps a user supplied status onto a known one; blank or unknown values become {@link #ACTIVE}.
     */
    public static ContractorStatus coerce(String raw) {
        if (raw == null || raw.isBlank()) {
            return ACTIVE;
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (ContractorStatus status : values()) {
            if (status.label.toLowerCase(Locale.ROOT).equals(normalized)) {
                return status;
            }
        }
        return ACTIVE;
    }
}

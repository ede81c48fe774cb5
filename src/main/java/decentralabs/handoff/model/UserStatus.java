package decentralabs.handoff.model;

import java.util.Locale;

/**
 * Directory status values. Anything not recognised is {@link #OTHER} and is
 * neither granted nor reported as suspended.
 */
public enum UserStatus {
    ACTIVE("active"),
    SUSPENDED("suspended"),
    OTHER("other");

    private final String value;

    UserStatus(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static UserStatus fromValue(String raw) {
        if (raw == null) {
            return OTHER;
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (UserStatus status : values()) {
            if (status != OTHER && status.value.equals(normalized)) {
                return status;
            }
        }
        return OTHER;
    }
}

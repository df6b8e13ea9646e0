package livepolls.websockets.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum ChangeType {
    CREATED("poll_created", false),
    SNAPSHOT("poll_data", true),
    UPDATED("poll_update", true),
    CLOSED("poll_closed", true),
    DELETED("poll_deleted", false);

    private final String value;
    private final boolean pollScoped;

    ChangeType(String value, boolean pollScoped) {
        this.value = value;
        this.pollScoped = pollScoped;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Poll-scoped events only reach connections subscribed to that poll;
     * the others are announced to every connection.
     */
    public boolean isPollScoped() {
        return pollScoped;
    }

    @JsonCreator
    public static ChangeType fromValue(String value) {
        for (ChangeType type : values()) {
            if (type.value.equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Invalid change type: " + value);
    }
}

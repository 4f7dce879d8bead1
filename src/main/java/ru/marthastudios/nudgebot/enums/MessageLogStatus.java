package ru.marthastudios.nudgebot.enums;

public enum MessageLogStatus {
    PENDING,
    SENT,
    SUCCESS,
    FAILED;

    /**
     * Case-insensitive lookup, so dashboard values like "Success" map onto {@link #SUCCESS}.
     */
    public static MessageLogStatus fromValue(String value) {
        for (MessageLogStatus status : values()) {
            if (status.name().equalsIgnoreCase(value)) {
                return status;
            }
        }

        throw new IllegalArgumentException("Unknown message log status: " + value);
    }
}

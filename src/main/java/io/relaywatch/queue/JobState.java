package io.relaywatch.queue;

public enum JobState {
    WAITING,
    ACTIVE,
    COMPLETED,
    FAILED;

    public boolean isOpen() {
        return this == WAITING || this == ACTIVE;
    }

    public static JobState fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("job state must not be blank");
        }
        return JobState.valueOf(raw.trim().toUpperCase());
    }
}

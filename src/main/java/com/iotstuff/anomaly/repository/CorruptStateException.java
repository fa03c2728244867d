package com.iotstuff.anomaly.repository;

/**
 * A state record exists but its bins cannot be decoded. Carries the record generation
 * so the next write can replace the record.
 */
public class CorruptStateException extends RuntimeException {

    private final int generation;

    public CorruptStateException(String deviceId, int generation, Throwable cause) {
        super("Unreadable state record for device " + deviceId, cause);
        this.generation = generation;
    }

    public int getGeneration() {
        return generation;
    }
}

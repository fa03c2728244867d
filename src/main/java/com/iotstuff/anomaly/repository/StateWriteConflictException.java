package com.iotstuff.anomaly.repository;

/**
 * Another writer updated the device's state between our read and our write.
 * Retryable: reload the state and score the reading again.
 */
public class StateWriteConflictException extends RuntimeException {

    private final String deviceId;
    private final int expectedGeneration;

    public StateWriteConflictException(String deviceId, int expectedGeneration, Throwable cause) {
        super("State for device " + deviceId + " changed since generation " + expectedGeneration, cause);
        this.deviceId = deviceId;
        this.expectedGeneration = expectedGeneration;
    }

    public String getDeviceId() {
        return deviceId;
    }

    public int getExpectedGeneration() {
        return expectedGeneration;
    }
}

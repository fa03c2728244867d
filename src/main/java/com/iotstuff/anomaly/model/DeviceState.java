package com.iotstuff.anomaly.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Everything persisted between readings for one device.
 * {@code generation} is the store's record generation at load time; 0 means no record exists yet.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class DeviceState {

    private String deviceId;

    private RollingWindow window;

    @Builder.Default
    private SmoothingState smoothing = SmoothingState.unset();

    private int generation;

    public static DeviceState empty(String deviceId, int windowCapacity) {
        return DeviceState.builder()
                .deviceId(deviceId)
                .window(new RollingWindow(windowCapacity))
                .smoothing(SmoothingState.unset())
                .generation(0)
                .build();
    }

    public boolean isPersisted() {
        return generation > 0;
    }
}

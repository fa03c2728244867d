package com.iotstuff.anomaly.engine;

import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * Everything a detector may look at for the current reading. The window already
 * contains the current reading as its last element.
 */
@Data
@Builder
public class DetectionContext {

    private double value;

    private List<Double> window;

    private double mean;

    // Sample standard deviation of the window
    private double std;

    // |value - ewma| after the EWMA was updated with this reading
    private double ewmaDeviation;

    private double ewmstd;

    // Reading before this one; null for the first reading a device ever sent
    private Double previousValue;

    private int hampelK;
}

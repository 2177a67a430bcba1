package com.adautopilot.common.attribution;

import java.time.LocalDateTime;

/**
 * The slice of a conversion outcome the attribution engine reads and rewrites.
 * Implemented by the persisted outcome entity so weights are updated in place.
 */
public interface AttributedConversion {

    LocalDateTime getEventTimestamp();

    Double getValueUsd();

    Double getAttributionWeight();

    void setAttributionWeight(Double weight);

    void setAttributionModel(String model);
}

package com.umitunal.stepflow.spi;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Outputs computed by the workflow bridge for a step.
 */
public final class BridgeResponse {
    public static final String EXTEND_TO_SCHEDULE = "extendToSchedule";

    private final Map<String, Object> outputs;

    /**
     * @param outputs bridge outputs, may be null and may hold null values
     */
    public BridgeResponse(Map<String, Object> outputs) {
        this.outputs = outputs == null ? Map.of() : Collections.unmodifiableMap(new HashMap<>(outputs));
    }

    public static BridgeResponse extendingToSchedule(boolean extend) {
        return new BridgeResponse(Map.of(EXTEND_TO_SCHEDULE, extend));
    }

    public Map<String, Object> getOutputs() { return outputs; }

    public boolean extendToSchedule() {
        return Boolean.TRUE.equals(outputs.get(EXTEND_TO_SCHEDULE));
    }
}

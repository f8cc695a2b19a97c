package org.dice.logic.circuit;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public final class SimulationResult {

    private final Map<String, Boolean> outputs;
    private final Map<String, Boolean> gateOutputs;

    SimulationResult(Map<String, Boolean> outputs, Map<String, Boolean> gateOutputs) {
        this.outputs = Collections.unmodifiableMap(new LinkedHashMap<String, Boolean>(outputs));
        this.gateOutputs = Collections.unmodifiableMap(new LinkedHashMap<String, Boolean>(gateOutputs));
    }

    /**
     * @return the value of every declared external output, in declaration order
     */
    public Map<String, Boolean> getOutputs() {
        return outputs;
    }

    public boolean getOutput(String name) {
        Boolean value = outputs.get(name);
        if (value == null) {
            throw new UnknownPinException(name, "not an external output");
        }
        return value;
    }

    /**
     * @return every gate's output value, keyed by gate name in evaluation order
     */
    public Map<String, Boolean> getGateOutputs() {
        return gateOutputs;
    }

    public boolean getGateOutput(String gate) {
        Boolean value = gateOutputs.get(gate);
        if (value == null) {
            throw new UnknownPinException(gate, "no such gate");
        }
        return value;
    }

    @Override
    public String toString() {
        return "SimulationResult{outputs=" + outputs + ", gates=" + gateOutputs + "}";
    }
}

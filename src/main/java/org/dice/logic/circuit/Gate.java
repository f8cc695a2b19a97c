package org.dice.logic.circuit;

import java.util.ArrayList;
import java.util.List;

/**
 * A named gate instance with a fixed number of inputs and one output.
 */
public final class Gate {

    private final String name;
    private final GateType type;
    private final int arity;

    Gate(String name, GateType type, int arity) {
        this.name = name;
        this.type = type;
        this.arity = arity;
    }

    public String getName() {
        return name;
    }

    public GateType getType() {
        return type;
    }

    public int getArity() {
        return arity;
    }

    public Pin getInput(int index) {
        if (index < 1 || index > arity) {
            throw new IndexOutOfBoundsException(String.format("Gate %s has inputs 1..%d, not %d", name, arity, index));
        }
        return Pin.gateInput(name, index);
    }

    public List<Pin> getInputs() {
        List<Pin> pins = new ArrayList<Pin>(arity);
        for (int i = 1; i <= arity; i++) {
            pins.add(Pin.gateInput(name, i));
        }
        return pins;
    }

    public Pin getOutput() {
        return Pin.gateOutput(name);
    }

    /**
     * Resolves the part of a pin reference after the dot.
     *
     * @return the pin, or null when this gate has no such pin
     */
    Pin resolve(String pinName) {
        if (Pin.OUTPUT.equals(pinName) || "out".equals(pinName)) {
            return getOutput();
        }
        if (arity == 1 && ("input".equals(pinName) || Pin.INPUT_PREFIX.equals(pinName))) {
            return getInput(1);
        }
        if (pinName.startsWith(Pin.INPUT_PREFIX) && pinName.length() > Pin.INPUT_PREFIX.length()) {
            String digits = pinName.substring(Pin.INPUT_PREFIX.length());
            if (digits.matches("[1-9][0-9]{0,8}")) {
                int index = Integer.parseInt(digits);
                if (index <= arity) {
                    return getInput(index);
                }
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return String.format("%s(%s/%d)", name, type, arity);
    }
}

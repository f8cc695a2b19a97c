package org.dice.logic.circuit;

/**
 * A resolved pin reference. Gate pins are written {@code GATE.inN} and {@code GATE.output};
 * external pins are bare names.
 */
public final class Pin {

    public enum Kind {
        GATE_INPUT,
        GATE_OUTPUT,
        EXTERNAL
    }

    static final String OUTPUT = "output";
    static final String INPUT_PREFIX = "in";

    private final Kind kind;
    private final String name;
    private final int index;

    private Pin(Kind kind, String name, int index) {
        this.kind = kind;
        this.name = name;
        this.index = index;
    }

    static Pin gateInput(String gate, int index) {
        return new Pin(Kind.GATE_INPUT, gate, index);
    }

    static Pin gateOutput(String gate) {
        return new Pin(Kind.GATE_OUTPUT, gate, 0);
    }

    static Pin external(String name) {
        return new Pin(Kind.EXTERNAL, name, 0);
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * @return the gate name for gate pins, the pin name for external pins
     */
    public String getName() {
        return name;
    }

    /**
     * @return the one-based input number of a gate input pin, 0 otherwise
     */
    public int getIndex() {
        return index;
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof Pin)) {
            return false;
        }
        Pin other = (Pin) o;
        return kind == other.kind && index == other.index && name.equals(other.name);
    }

    @Override
    public int hashCode() {
        return (31 * kind.hashCode() + name.hashCode()) * 31 + index;
    }

    @Override
    public String toString() {
        switch (kind) {
            case GATE_INPUT:
                return name + "." + INPUT_PREFIX + index;
            case GATE_OUTPUT:
                return name + "." + OUTPUT;
            default:
                return name;
        }
    }
}

package org.dice.logic.circuit;

/**
 * A wire from a gate output or external input to a gate input or external output.
 */
public final class Connection {

    private final Pin source;
    private final Pin destination;

    Connection(Pin source, Pin destination) {
        this.source = source;
        this.destination = destination;
    }

    public Pin getSource() {
        return source;
    }

    public Pin getDestination() {
        return destination;
    }

    @Override
    public String toString() {
        return source + " -> " + destination;
    }
}

package org.dice.logic.circuit;

import org.dice.logic.util.DefaultHashTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * A combinational network of named gates.
 *
 * Gates and wires refer to each other by name only, so every reference is checked when it is
 * made. Each gate input and each external output has at most one driver: a wire, or for gate
 * inputs a value given with {@link #setInput(String, boolean)}.
 *
 * Not thread safe for mutation. {@link #simulate()} keeps its state on the stack, so concurrent
 * simulations of a circuit that is not being modified are safe.
 */
public class Circuit {

    private static final Logger log = LoggerFactory.getLogger(Circuit.class);

    private static final Pattern NAME = Pattern.compile("[A-Za-z0-9_]+");

    private final Map<String, Gate> gates = new LinkedHashMap<String, Gate>();
    private final Map<String, Boolean> externalInputs = new LinkedHashMap<String, Boolean>();
    private final Set<String> externalOutputs = new LinkedHashSet<String>();
    // destination -> source, one entry per wire
    private final Map<Pin, Pin> drivers = new LinkedHashMap<Pin, Pin>();
    private final Map<Pin, Boolean> presetInputs = new LinkedHashMap<Pin, Boolean>();
    private final List<Connection> connections = new ArrayList<Connection>();

    /**
     * @throws DuplicateGateNameException if a gate of that name exists
     * @throws IllegalArgumentException   on a malformed name or an arity the gate type does not accept
     */
    public Gate addGate(String name, GateType type, int arity) {
        checkName(name);
        if (type == null) {
            throw new IllegalArgumentException("Gate type must not be null");
        }
        if (!type.acceptsArity(arity)) {
            throw new IllegalArgumentException(String.format("%s gate %s cannot have %d inputs", type, name, arity));
        }
        if (gates.containsKey(name)) {
            throw new DuplicateGateNameException(name);
        }
        Gate gate = new Gate(name, type, arity);
        gates.put(name, gate);
        return gate;
    }

    /**
     * Declares an external input without a value.
     */
    public void addInput(String name) {
        checkName(name);
        if (externalInputs.containsKey(name) || externalOutputs.contains(name)) {
            throw new DuplicateGateNameException(name);
        }
        externalInputs.put(name, null);
    }

    public void addOutput(String name) {
        checkName(name);
        if (externalInputs.containsKey(name) || externalOutputs.contains(name)) {
            throw new DuplicateGateNameException(name);
        }
        externalOutputs.add(name);
    }

    /**
     * Wires a gate output or external input to a gate input or external output.
     *
     * @throws UnknownPinException            if either end does not resolve, or points the wrong way
     * @throws InputAlreadyConnectedException if the destination already has a driver
     */
    public Connection connect(String source, String destination) {
        Pin from = resolve(source);
        if (from.getKind() == Pin.Kind.GATE_INPUT) {
            throw new UnknownPinException(source, "a gate input cannot drive a wire");
        }
        if (from.getKind() == Pin.Kind.EXTERNAL && !externalInputs.containsKey(from.getName())) {
            throw new UnknownPinException(source, "not a declared external input");
        }

        Pin to = resolve(destination);
        if (to.getKind() == Pin.Kind.GATE_OUTPUT) {
            throw new UnknownPinException(destination, "a gate output cannot be driven");
        }
        if (to.getKind() == Pin.Kind.EXTERNAL && !externalOutputs.contains(to.getName())) {
            throw new UnknownPinException(destination, "not a declared external output");
        }
        checkUndriven(to);

        Connection connection = new Connection(from, to);
        drivers.put(to, from);
        connections.add(connection);
        return connection;
    }

    /**
     * Gives a value to a gate input, or to an external input, declaring it if needed.
     *
     * @throws UnknownPinException            if the pin is not an input
     * @throws InputAlreadyConnectedException if a gate input is already wired
     */
    public void setInput(String pin, boolean value) {
        Pin target = resolve(pin);
        switch (target.getKind()) {
            case EXTERNAL:
                if (externalOutputs.contains(target.getName())) {
                    throw new UnknownPinException(pin, "an external output cannot be set");
                }
                externalInputs.put(target.getName(), value);
                break;
            case GATE_INPUT:
                Pin wire = drivers.get(target);
                if (wire != null) {
                    throw new InputAlreadyConnectedException(target.toString(), "wire from " + wire);
                }
                presetInputs.put(target, value);
                break;
            default:
                throw new UnknownPinException(pin, "a gate output cannot be set");
        }
    }

    /**
     * Orders the gates so that every gate comes after the gates feeding it. Ties keep the order
     * the gates were added in.
     *
     * @throws CycleDetectedException if the wiring contains a feedback loop
     */
    public List<Gate> topologicalOrder() {
        Map<String, Integer> pending = new LinkedHashMap<String, Integer>();
        DefaultHashTable<String, List<String>> consumers = new DefaultHashTable<String, List<String>>(ArrayList::new);
        for (Gate gate : gates.values()) {
            pending.put(gate.getName(), 0);
        }
        for (Connection connection : connections) {
            if (connection.getSource().getKind() == Pin.Kind.GATE_OUTPUT
                    && connection.getDestination().getKind() == Pin.Kind.GATE_INPUT) {
                String to = connection.getDestination().getName();
                consumers.get(connection.getSource().getName()).add(to);
                pending.put(to, pending.get(to) + 1);
            }
        }

        Deque<String> ready = new ArrayDeque<String>();
        for (Map.Entry<String, Integer> entry : pending.entrySet()) {
            if (entry.getValue() == 0) {
                ready.add(entry.getKey());
            }
        }

        List<Gate> order = new ArrayList<Gate>(gates.size());
        while (!ready.isEmpty()) {
            String name = ready.removeFirst();
            order.add(gates.get(name));
            for (String consumer : consumers.get(name)) {
                int remaining = pending.get(consumer) - 1;
                pending.put(consumer, remaining);
                if (remaining == 0) {
                    ready.addLast(consumer);
                }
            }
        }

        if (order.size() < gates.size()) {
            List<String> stuck = new ArrayList<String>();
            for (Map.Entry<String, Integer> entry : pending.entrySet()) {
                if (entry.getValue() > 0) {
                    stuck.add(entry.getKey());
                }
            }
            throw new CycleDetectedException(stuck);
        }
        return order;
    }

    /**
     * Evaluates every gate once for the current input values.
     *
     * @throws CycleDetectedException   if the wiring contains a feedback loop
     * @throws UnresolvedInputException if a gate input or external output has no value
     */
    public SimulationResult simulate() {
        List<Gate> order = topologicalOrder();
        log.debug("Simulating {} gates in order {}", order.size(), order);

        Map<String, Boolean> gateValues = new LinkedHashMap<String, Boolean>();
        for (Gate gate : order) {
            List<Boolean> inputs = new ArrayList<Boolean>(gate.getArity());
            for (int i = 1; i <= gate.getArity(); i++) {
                inputs.add(valueOf(gate.getInput(i), gateValues));
            }
            gateValues.put(gate.getName(), gate.getType().evaluate(inputs));
        }

        Map<String, Boolean> outputs = new LinkedHashMap<String, Boolean>();
        for (String output : externalOutputs) {
            outputs.put(output, valueOf(Pin.external(output), gateValues));
        }
        log.debug("Simulation outputs {}", outputs);
        return new SimulationResult(outputs, gateValues);
    }

    public Gate getGate(String name) {
        Gate gate = gates.get(name);
        if (gate == null) {
            throw new UnknownPinException(name, "no such gate");
        }
        return gate;
    }

    public List<Gate> getGates() {
        return Collections.unmodifiableList(new ArrayList<Gate>(gates.values()));
    }

    public List<String> getInputs() {
        return Collections.unmodifiableList(new ArrayList<String>(externalInputs.keySet()));
    }

    public List<String> getOutputs() {
        return Collections.unmodifiableList(new ArrayList<String>(externalOutputs));
    }

    public List<Connection> getConnections() {
        return Collections.unmodifiableList(connections);
    }

    public boolean hasInput(String name) {
        return externalInputs.containsKey(name);
    }

    /**
     * Parses a pin reference against the declared gates. External names are returned unchecked.
     */
    public Pin resolve(String reference) {
        if (reference == null || reference.isEmpty()) {
            throw new UnknownPinException(String.valueOf(reference), "empty pin reference");
        }
        int dot = reference.indexOf('.');
        if (dot < 0) {
            if (!NAME.matcher(reference).matches()) {
                throw new UnknownPinException(reference, "malformed pin name");
            }
            return Pin.external(reference);
        }
        Gate gate = gates.get(reference.substring(0, dot));
        if (gate == null) {
            throw new UnknownPinException(reference, "no gate named " + reference.substring(0, dot));
        }
        Pin pin = gate.resolve(reference.substring(dot + 1));
        if (pin == null) {
            throw new UnknownPinException(reference, "gate " + gate + " has no such pin");
        }
        return pin;
    }

    private boolean valueOf(Pin pin, Map<String, Boolean> gateValues) {
        Pin source = drivers.get(pin);
        if (source == null) {
            Boolean preset = presetInputs.get(pin);
            if (preset == null) {
                throw new UnresolvedInputException(pin.toString(), "not connected and not set");
            }
            return preset;
        }
        if (source.getKind() == Pin.Kind.GATE_OUTPUT) {
            return gateValues.get(source.getName());
        }
        Boolean external = externalInputs.get(source.getName());
        if (external == null) {
            throw new UnresolvedInputException(pin.toString(), "external input " + source + " has no value");
        }
        return external;
    }

    private void checkUndriven(Pin pin) {
        Pin wire = drivers.get(pin);
        if (wire != null) {
            throw new InputAlreadyConnectedException(pin.toString(), "wire from " + wire);
        }
        if (presetInputs.containsKey(pin)) {
            throw new InputAlreadyConnectedException(pin.toString(), "a value set with setInput");
        }
    }

    private static void checkName(String name) {
        if (name == null || !NAME.matcher(name).matches()) {
            throw new IllegalArgumentException("Names must be letters, digits or underscores: " + name);
        }
    }
}

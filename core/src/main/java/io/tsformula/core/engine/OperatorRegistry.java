package io.tsformula.core.engine;

import io.tsformula.core.spi.OperatorFunction;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry of formula operators. Manages registration and lookup by operator name. Thread-safe:
 * registration and lookup can happen concurrently.
 *
 * <p>
 * A registry is an explicit value handed to the engine, never a process-wide table. An
 * {@link #overlay()} shadows entries of its parent without modifying it, which is how tests and
 * callers install scoped operator overrides.
 */
public final class OperatorRegistry {

    private final OperatorRegistry parent;
    private final Map<String, OperatorDescriptor> operators = new ConcurrentHashMap<>();

    public OperatorRegistry() {
        this(null);
    }

    private OperatorRegistry(OperatorRegistry parent) {
        this.parent = parent;
    }

    /**
     * Registers an operator. If an operator with the same name is already registered in this
     * registry, it is replaced (last-write-wins semantics).
     *
     * @param descriptor the operator to register
     * @throws NullPointerException if descriptor is null
     */
    public void register(OperatorDescriptor descriptor) {
        if (descriptor == null) {
            throw new NullPointerException("descriptor must not be null");
        }
        operators.put(descriptor.name(), descriptor);
    }

    /**
     * Registers an operator without hooks.
     *
     * @throws IllegalArgumentException if the signature is missing or the name is blank
     */
    public void register(String name, OperatorFunction function, Signature signature, Capability... capabilities) {
        register(OperatorDescriptor.builder(name, function)
                .signature(signature)
                .capabilities(capabilities)
                .build());
    }

    /**
     * Looks up an operator by name, consulting the parent when this overlay has no entry.
     *
     * @param name the operator name (e.g. "series")
     * @return the operator, or empty if not registered
     */
    public Optional<OperatorDescriptor> lookup(String name) {
        OperatorDescriptor own = operators.get(name);
        if (own != null) {
            return Optional.of(own);
        }
        return parent != null ? parent.lookup(name) : Optional.empty();
    }

    /**
     * Looks up an operator by name, throwing if not found.
     *
     * @throws IllegalArgumentException if no operator is registered with the given name
     */
    public OperatorDescriptor require(String name) {
        return lookup(name)
                .orElseThrow(() -> new IllegalArgumentException("No operator registered for name: '" + name + "'"));
    }

    /** Returns {@code true} if an operator with the given name is visible from this registry. */
    public boolean has(String name) {
        return lookup(name).isPresent();
    }

    /** Returns a child registry whose registrations shadow, but never modify, this one. */
    public OperatorRegistry overlay() {
        return new OperatorRegistry(this);
    }

    /** Names of all visible operators, sorted. */
    public Set<String> names() {
        Set<String> names = parent != null ? parent.names() : new TreeSet<>();
        names.addAll(operators.keySet());
        return names;
    }

    /** Returns the number of visible operators. */
    public int size() {
        return names().size();
    }
}

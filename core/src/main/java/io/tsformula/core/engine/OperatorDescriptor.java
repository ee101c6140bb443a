package io.tsformula.core.engine;

import io.tsformula.core.spi.ArgScopeRewriter;
import io.tsformula.core.spi.ContextScope;
import io.tsformula.core.spi.HistoryProvider;
import io.tsformula.core.spi.InsertionDatesProvider;
import io.tsformula.core.spi.MetadataFinder;
import io.tsformula.core.spi.OperatorFunction;
import io.tsformula.core.spi.ReturnTypeNarrower;
import io.tsformula.core.spi.SeriesFinder;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Everything the engine knows about one operator: its executable, signature, capability flags
 * and optional hooks.
 *
 * <p>
 * Immutable and thread-safe. Built with {@link #builder(String, OperatorFunction)}.
 */
public final class OperatorDescriptor {

    private final String name;
    private final OperatorFunction function;
    private final Signature signature;
    private final Set<Capability> capabilities;
    private final SeriesFinder seriesFinder;
    private final MetadataFinder metadataFinder;
    private final HistoryProvider historyProvider;
    private final InsertionDatesProvider insertionDatesProvider;
    private final ArgScopeRewriter argScopeRewriter;
    private final ReturnTypeNarrower returnTypeNarrower;
    private final ContextScope contextScope;

    private OperatorDescriptor(Builder b) {
        this.name = b.name;
        this.function = b.function;
        this.signature = b.signature;
        this.capabilities = Collections.unmodifiableSet(EnumSet.copyOf(b.capabilities));
        this.seriesFinder = b.seriesFinder;
        this.metadataFinder = b.metadataFinder;
        this.historyProvider = b.historyProvider;
        this.insertionDatesProvider = b.insertionDatesProvider;
        this.argScopeRewriter = b.argScopeRewriter;
        this.returnTypeNarrower = b.returnTypeNarrower;
        this.contextScope = b.contextScope;
    }

    public static Builder builder(String name, OperatorFunction function) {
        return new Builder(name, function);
    }

    public String name() {
        return name;
    }

    public OperatorFunction function() {
        return function;
    }

    public Signature signature() {
        return signature;
    }

    public Set<Capability> capabilities() {
        return capabilities;
    }

    public boolean has(Capability capability) {
        return capabilities.contains(capability);
    }

    public Optional<SeriesFinder> seriesFinder() {
        return Optional.ofNullable(seriesFinder);
    }

    public Optional<MetadataFinder> metadataFinder() {
        return Optional.ofNullable(metadataFinder);
    }

    public Optional<HistoryProvider> historyProvider() {
        return Optional.ofNullable(historyProvider);
    }

    public Optional<InsertionDatesProvider> insertionDatesProvider() {
        return Optional.ofNullable(insertionDatesProvider);
    }

    public Optional<ArgScopeRewriter> argScopeRewriter() {
        return Optional.ofNullable(argScopeRewriter);
    }

    public Optional<ReturnTypeNarrower> returnTypeNarrower() {
        return Optional.ofNullable(returnTypeNarrower);
    }

    public Optional<ContextScope> contextScope() {
        return Optional.ofNullable(contextScope);
    }

    @Override
    public String toString() {
        return "OperatorDescriptor[" + name + " " + signature + " " + capabilities + "]";
    }

    /** Fluent builder. */
    public static final class Builder {

        private final String name;
        private final OperatorFunction function;
        private Signature signature;
        private final Set<Capability> capabilities = EnumSet.noneOf(Capability.class);
        private SeriesFinder seriesFinder;
        private MetadataFinder metadataFinder;
        private HistoryProvider historyProvider;
        private InsertionDatesProvider insertionDatesProvider;
        private ArgScopeRewriter argScopeRewriter;
        private ReturnTypeNarrower returnTypeNarrower;
        private ContextScope contextScope;

        Builder(String name, OperatorFunction function) {
            this.name = name;
            this.function = function;
        }

        public Builder signature(Signature signature) {
            this.signature = signature;
            return this;
        }

        public Builder capabilities(Capability... flags) {
            Collections.addAll(capabilities, flags);
            return this;
        }

        public Builder seriesFinder(SeriesFinder finder) {
            this.seriesFinder = finder;
            return this;
        }

        public Builder metadataFinder(MetadataFinder finder) {
            this.metadataFinder = finder;
            return this;
        }

        public Builder historyProvider(HistoryProvider provider) {
            this.historyProvider = provider;
            return this;
        }

        public Builder insertionDatesProvider(InsertionDatesProvider provider) {
            this.insertionDatesProvider = provider;
            return this;
        }

        public Builder argScopeRewriter(ArgScopeRewriter rewriter) {
            this.argScopeRewriter = rewriter;
            return this;
        }

        public Builder returnTypeNarrower(ReturnTypeNarrower narrower) {
            this.returnTypeNarrower = narrower;
            return this;
        }

        public Builder contextScope(ContextScope scope) {
            this.contextScope = scope;
            return this;
        }

        /**
         * @throws NullPointerException     if the function is missing
         * @throws IllegalArgumentException if the name is blank, the signature is missing, or a
         *     context scope names an undeclared body parameter
         */
        public OperatorDescriptor build() {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("operator name must not be null or blank");
            }
            Objects.requireNonNull(function, "function must not be null");
            if (signature == null) {
                throw new IllegalArgumentException("operator `" + name + "` has no declared signature");
            }
            if (contextScope != null && signature.param(contextScope.bodyParameter()).isEmpty()) {
                throw new IllegalArgumentException("operator `" + name + "` scopes undeclared parameter `"
                        + contextScope.bodyParameter() + "`");
            }
            return new OperatorDescriptor(this);
        }
    }
}

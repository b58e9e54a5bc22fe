package io.github.cyfko.flatdae.core.dae;

import io.github.cyfko.flatdae.core.ast.Expression;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Canonical hybrid DAE produced by flattening one model.
 * <p>
 * The model is immutable once built. Symbols are grouped in the vectors
 * {@code u p cp x m y z x_dot}, each in declaration order. The derivative vector is
 * derived from the states at build time: {@code x_dot[i]} is always
 * {@code der_<x[i]>}, so both vectors have the same length.
 * </p>
 *
 * <h2>Hybrid part</h2>
 * <ul>
 *   <li>{@code fx}: residual equations, the continuous system is {@code fx = 0}</li>
 *   <li>{@code c}: named zero-crossing conditions</li>
 *   <li>{@code fr}: named reset blocks, one per condition of the same name</li>
 *   <li>{@code pre}: symbols whose pre-event value is read somewhere</li>
 * </ul>
 *
 * <pre>{@code
 * DaeModel model = DaeModel.builder("BouncingBall")
 *     .symbol(new Symbol("h", SymbolRole.STATE, Symbol.REAL, Terminal.integer(1)))
 *     .residual(new Residual(ComponentReference.of("der_h"), ComponentReference.of("v")))
 *     .build();
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class DaeModel {

    /** Prefix of derivative symbol names. */
    public static final String DERIVATIVE_PREFIX = "der_";

    private final String name;
    private final Map<SymbolRole, List<Symbol>> vectors;
    private final Map<String, Symbol> symbolsByName;
    private final List<Residual> fx;
    private final Map<String, Expression> c;
    private final Map<String, ResetBlock> fr;
    private final Set<String> pre;

    private DaeModel(Builder builder) {
        this.name = builder._name;

        List<Symbol> all = new ArrayList<>(builder._symbols.values());
        for (Symbol symbol : builder._symbols.values()) {
            if (symbol.role() == SymbolRole.STATE) {
                all.add(new Symbol(derivativeName(symbol.name()), SymbolRole.STATE_DERIVATIVE,
                        symbol.typeName(), null, null, "", Map.of()));
            }
        }

        Map<SymbolRole, List<Symbol>> grouped = new EnumMap<>(SymbolRole.class);
        Map<String, Symbol> byName = new LinkedHashMap<>();
        for (SymbolRole role : SymbolRole.values()) {
            grouped.put(role, new ArrayList<>());
        }
        for (Symbol symbol : all) {
            grouped.get(symbol.role()).add(symbol);
        }
        for (SymbolRole role : SymbolRole.values()) {
            List<Symbol> vector = grouped.get(role);
            vector.forEach(s -> byName.put(s.name(), s));
            grouped.put(role, List.copyOf(vector));
        }

        this.vectors = Collections.unmodifiableMap(grouped);
        this.symbolsByName = Collections.unmodifiableMap(byName);
        this.fx = List.copyOf(builder._fx);
        this.c = Collections.unmodifiableMap(new LinkedHashMap<>(builder._c));
        this.fr = Collections.unmodifiableMap(new LinkedHashMap<>(builder._fr));
        this.pre = Collections.unmodifiableSet(new LinkedHashSet<>(builder._pre));
    }

    /**
     * @param state state name
     * @return the matching derivative symbol name
     */
    public static String derivativeName(String state) {
        return DERIVATIVE_PREFIX + state;
    }

    public String name() {
        return name;
    }

    public List<Symbol> u() { return vectors.get(SymbolRole.INPUT); }
    public List<Symbol> p() { return vectors.get(SymbolRole.PARAMETER); }
    public List<Symbol> cp() { return vectors.get(SymbolRole.CONSTANT); }
    public List<Symbol> x() { return vectors.get(SymbolRole.STATE); }
    public List<Symbol> m() { return vectors.get(SymbolRole.DISCRETE_MODE); }
    public List<Symbol> y() { return vectors.get(SymbolRole.OUTPUT); }
    public List<Symbol> z() { return vectors.get(SymbolRole.ALGEBRAIC); }
    public List<Symbol> xDot() { return vectors.get(SymbolRole.STATE_DERIVATIVE); }

    /**
     * @param role symbol role
     * @return the vector of that role, declaration order
     */
    public List<Symbol> vector(SymbolRole role) {
        return vectors.get(Objects.requireNonNull(role, "role cannot be null"));
    }

    /** @return every symbol, grouped by role in {@link SymbolRole} order */
    public List<Symbol> symbols() {
        return List.copyOf(symbolsByName.values());
    }

    public Optional<Symbol> symbol(String flatName) {
        return Optional.ofNullable(symbolsByName.get(flatName));
    }

    public List<Residual> fx() {
        return fx;
    }

    public Map<String, Expression> c() {
        return c;
    }

    public Map<String, ResetBlock> fr() {
        return fr;
    }

    /** @return names of symbols whose pre-event value is referenced, first-use order */
    public Set<String> preReferences() {
        return pre;
    }

    /**
     * Start expressions of one vector, keyed by symbol name.
     *
     * @param role symbol role
     * @return name to start expression (type default when undeclared)
     */
    public Map<String, Expression> startValues(SymbolRole role) {
        return vector(role).stream().collect(Collectors.toMap(
                Symbol::name, Symbol::startOrDefault, (a, b) -> a, LinkedHashMap::new));
    }

    @Override
    public String toString() {
        return String.format("DaeModel[%s: u=%d p=%d cp=%d x=%d m=%d y=%d z=%d fx=%d c=%d]",
                name, u().size(), p().size(), cp().size(), x().size(), m().size(),
                y().size(), z().size(), fx.size(), c.size());
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public static class Builder {
        private final String _name;
        private final Map<String, Symbol> _symbols = new LinkedHashMap<>();
        private final List<Residual> _fx = new ArrayList<>();
        private final Map<String, Expression> _c = new LinkedHashMap<>();
        private final Map<String, ResetBlock> _fr = new LinkedHashMap<>();
        private final Set<String> _pre = new LinkedHashSet<>();

        private Builder(String name) {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("Model name cannot be null or blank");
            }
            this._name = name;
        }

        /**
         * @throws IllegalArgumentException on a duplicate name or a derivative symbol
         */
        public Builder symbol(Symbol symbol) {
            Objects.requireNonNull(symbol, "symbol cannot be null");
            if (symbol.role() == SymbolRole.STATE_DERIVATIVE) {
                throw new IllegalArgumentException("Derivative symbols are derived from states: " + symbol.name());
            }
            if (_symbols.putIfAbsent(symbol.name(), symbol) != null) {
                throw new IllegalArgumentException("Duplicate symbol: " + symbol.name());
            }
            return this;
        }

        public Builder residual(Residual residual) { this._fx.add(Objects.requireNonNull(residual)); return this; }
        public Builder pre(String symbolName) { this._pre.add(Objects.requireNonNull(symbolName)); return this; }

        public Builder reset(String resetName, Expression condition, ResetBlock block) {
            Objects.requireNonNull(resetName, "resetName cannot be null");
            Objects.requireNonNull(condition, "condition cannot be null");
            Objects.requireNonNull(block, "block cannot be null");
            if (_c.containsKey(resetName)) {
                throw new IllegalArgumentException("Duplicate reset: " + resetName);
            }
            _c.put(resetName, condition);
            _fr.put(resetName, block);
            return this;
        }

        /**
         * @throws IllegalStateException if a derivative name clashes with a declared symbol,
         *                               a reset targets a non-state or {@code pre} names an unknown symbol
         */
        public DaeModel build() {
            for (Symbol symbol : _symbols.values()) {
                if (symbol.role() == SymbolRole.STATE && _symbols.containsKey(derivativeName(symbol.name()))) {
                    throw new IllegalStateException("Symbol '" + derivativeName(symbol.name())
                            + "' clashes with the derivative of state '" + symbol.name() + "'");
                }
            }
            _fr.forEach((resetName, block) -> block.assignments().forEach(assignment -> {
                Symbol target = _symbols.get(assignment.target());
                if (target == null || target.role() != SymbolRole.STATE) {
                    throw new IllegalStateException("Reset '" + resetName + "' targets '"
                            + assignment.target() + "', which is not a state");
                }
            }));
            for (String name : _pre) {
                if (!_symbols.containsKey(name)) {
                    throw new IllegalStateException("pre() references unknown symbol: " + name);
                }
            }
            return new DaeModel(this);
        }
    }
}

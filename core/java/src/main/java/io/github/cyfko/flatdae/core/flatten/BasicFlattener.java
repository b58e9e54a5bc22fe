package io.github.cyfko.flatdae.core.flatten;

import io.github.cyfko.flatdae.core.api.Flattener;
import io.github.cyfko.flatdae.core.api.ModelParser;
import io.github.cyfko.flatdae.core.ast.*;
import io.github.cyfko.flatdae.core.config.FlattenPolicy;
import io.github.cyfko.flatdae.core.dae.Builtins;
import io.github.cyfko.flatdae.core.dae.DaeModel;
import io.github.cyfko.flatdae.core.dae.ResetAssignment;
import io.github.cyfko.flatdae.core.dae.ResetBlock;
import io.github.cyfko.flatdae.core.dae.Residual;
import io.github.cyfko.flatdae.core.dae.Symbol;
import io.github.cyfko.flatdae.core.dae.SymbolRole;
import io.github.cyfko.flatdae.core.exception.ClassificationException;
import io.github.cyfko.flatdae.core.exception.FlatteningException;
import io.github.cyfko.flatdae.core.exception.LexException;
import io.github.cyfko.flatdae.core.exception.ParseException;
import io.github.cyfko.flatdae.core.exception.ResetWithoutConditionException;
import io.github.cyfko.flatdae.core.exception.UnresolvedReferenceException;
import io.github.cyfko.flatdae.core.parsing.RecursiveDescentParser;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * Default {@link Flattener}: classifies declarations by type prefix, expands class-typed
 * components and rewrites every equation onto flat symbol names.
 *
 * <h2>Classification</h2>
 * <ul>
 *   <li>{@code constant} → {@code cp}, {@code parameter} → {@code p}, {@code input} → {@code u},
 *       {@code output} → {@code y}, no prefix → {@code z}</li>
 *   <li>{@code der(x)} promotes an algebraic or output {@code x} to a state</li>
 *   <li>{@code pre(x)} records {@code x} in the pre set</li>
 *   <li>{@code reinit(x, e)} registers reset {@code __c<i>}; its condition comes from {@link FlattenPolicy}</li>
 * </ul>
 *
 * <h2>Expansion</h2>
 * <p>
 * A component typed by a class of the same unit contributes the members of that class
 * under the names {@code <instance>_<member>}, and its equations with references scoped to
 * the instance. Modifications on the instance ({@code Ball b(e = 0.7)}) override the
 * member start values, outermost modification first.
 * </p>
 *
 * <p>The flattener itself is stateless; every call works on its own {@code Instantiation}.</p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class BasicFlattener implements Flattener {

    private static final Logger log = Logger.getLogger(BasicFlattener.class.getName());

    /** Modifiers accepted on builtin-typed components. */
    public static final Set<String> SUPPORTED_MODIFIERS = Set.of(
            "start", "fixed", "unit", "displayUnit", "quantity", "min", "max", "nominal");

    private static final Set<String> BUILTIN_TYPES = Set.of(Symbol.REAL, Symbol.INTEGER, Symbol.BOOLEAN);

    private final FlattenPolicy policy;
    private final ModelParser conditionParser;

    public BasicFlattener() {
        this(FlattenPolicy.defaults());
    }

    public BasicFlattener(FlattenPolicy policy) {
        this(policy, new RecursiveDescentParser());
    }

    /**
     * @param policy          reset conditions
     * @param conditionParser parser used for the condition texts
     */
    public BasicFlattener(FlattenPolicy policy, ModelParser conditionParser) {
        this.policy = Objects.requireNonNull(policy, "policy cannot be null");
        this.conditionParser = Objects.requireNonNull(conditionParser, "conditionParser cannot be null");
    }

    @Override
    public DaeModel flatten(StoredDefinition unit, String modelName) {
        Objects.requireNonNull(unit, "unit cannot be null");
        if (modelName == null || modelName.isBlank()) {
            throw new IllegalArgumentException("modelName cannot be null or blank");
        }

        List<ClassDefinition> path = locate(unit, modelName);
        path.forEach(BasicFlattener::checkEndName);
        ClassDefinition model = path.get(path.size() - 1);
        if (!model.kind().isSimulatable()) {
            throw new ClassificationException(String.format(
                    "Class '%s' is a %s; only model, block or class definitions can be flattened",
                    modelName, model.kind().getKeyword()));
        }

        Instantiation instantiation = new Instantiation(unit, new Scope("", path));
        instantiation.instantiate(instantiation.root, Map.of());
        DaeModel dae = instantiation.assemble(model.name());

        log.fine(() -> String.format("Flattened '%s': %s", modelName, dae));
        return dae;
    }

    private static List<ClassDefinition> locate(StoredDefinition unit, String modelName) {
        Name name = Name.parse(modelName);
        return descend(unit.classes(), name.parts())
                .orElseThrow(() -> new UnresolvedReferenceException(modelName, "compilation unit"));
    }

    private static Optional<List<ClassDefinition>> descend(List<ClassDefinition> candidates, List<String> parts) {
        List<ClassDefinition> path = new ArrayList<>();
        Optional<ClassDefinition> current = candidates.stream()
                .filter(c -> c.name().equals(parts.get(0)))
                .findFirst();
        if (current.isEmpty()) return Optional.empty();
        path.add(current.get());
        for (String part : parts.subList(1, parts.size())) {
            current = current.get().nestedClass(part);
            if (current.isEmpty()) return Optional.empty();
            path.add(current.get());
        }
        return Optional.of(path);
    }

    private static void checkEndName(ClassDefinition cls) {
        if (!cls.endName().equals(cls.name())) {
            throw new ClassificationException(String.format(
                    "Class '%s' is closed by 'end %s' at %s", cls.name(), cls.endName(), cls.position()));
        }
    }

    private static Set<String> componentNames(ClassDefinition cls) {
        return cls.composition().componentClauses().stream()
                .flatMap(clause -> clause.components().stream())
                .map(ComponentDeclaration::ident)
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    private static SymbolRole roleOf(TypePrefix prefix, String component) {
        if (prefix.connection() != TypePrefix.Connection.NONE) {
            throw new ClassificationException(String.format(
                    "Component '%s' has a %s prefix; connector semantics are not supported",
                    component, prefix.connection().name().toLowerCase()));
        }
        if (prefix.variability() != TypePrefix.Variability.NONE && prefix.causality() != TypePrefix.Causality.NONE) {
            throw new ClassificationException(String.format(
                    "Component '%s' combines '%s' with '%s'", component,
                    prefix.variability().name().toLowerCase(), prefix.causality().name().toLowerCase()));
        }
        return switch (prefix.variability()) {
            case CONSTANT -> SymbolRole.CONSTANT;
            case PARAMETER -> SymbolRole.PARAMETER;
            case DISCRETE -> throw new ClassificationException(
                    "Component '" + component + "' is discrete; discrete variables are not supported");
            case NONE -> switch (prefix.causality()) {
                case INPUT -> SymbolRole.INPUT;
                case OUTPUT -> SymbolRole.OUTPUT;
                case NONE -> SymbolRole.ALGEBRAIC;
            };
        };
    }

    /** Instance being expanded: name prefix plus the lexical path of its class. */
    private record Scope(String prefix, List<ClassDefinition> path) {
        ClassDefinition cls() {
            return path.get(path.size() - 1);
        }
    }

    /** A modification together with the scope its expressions are written in. */
    private record ScopedModification(Modification modification, Scope scope) {}

    private record Pending(Expression expression, Scope scope) {}

    private record ScopedEquation(Equation equation, Scope scope, boolean initial) {}

    private record PendingReset(String name, String target, Expression value, Expression condition) {}

    private enum Usage { BINDING, EQUATION, CONDITION, RESET_VALUE }

    private static final class Draft {
        final String name;
        final String typeName;
        final String description;
        final Map<String, Pending> attributes = new LinkedHashMap<>();
        SymbolRole role;
        Pending start;
        Boolean fixed;
        Expression resolvedStart;

        Draft(String name, SymbolRole role, String typeName, String description) {
            this.name = name;
            this.role = role;
            this.typeName = typeName;
            this.description = description;
        }
    }

    /**
     * Mutable state of one flattening call.
     */
    private final class Instantiation {
        final StoredDefinition unit;
        final Scope root;
        final Map<String, Draft> drafts = new LinkedHashMap<>();
        final List<ScopedEquation> equations = new ArrayList<>();
        final List<ClassDefinition> active = new ArrayList<>();
        final Set<String> preReferences = new LinkedHashSet<>();
        final List<PendingReset> resets = new ArrayList<>();
        final List<Residual> residuals = new ArrayList<>();

        Instantiation(StoredDefinition unit, Scope root) {
            this.unit = unit;
            this.root = root;
        }

        // ------------------------------------------------------------------
        // Pass 1: declarations

        void instantiate(Scope scope, Map<String, List<ScopedModification>> overrides) {
            ClassDefinition cls = scope.cls();
            if (active.contains(cls)) {
                throw new ClassificationException("Recursive instantiation of class '" + cls.name() + "'");
            }
            active.add(cls);

            Set<String> members = componentNames(cls);
            for (String modified : overrides.keySet()) {
                if (!members.contains(modified)) {
                    throw new ClassificationException(String.format(
                            "Modification of unknown member '%s' of class '%s'", modified, cls.name()));
                }
            }

            for (ComponentClause clause : cls.composition().componentClauses()) {
                for (ComponentDeclaration component : clause.components()) {
                    List<ScopedModification> outer = overrides.getOrDefault(component.ident(), List.of());
                    if (isBuiltinType(clause.typeName())) {
                        declare(scope, clause, component, outer);
                    } else {
                        expand(scope, clause, component, outer);
                    }
                }
            }

            for (EquationSection section : cls.composition().equationSections()) {
                for (Equation equation : section.equations()) {
                    equations.add(new ScopedEquation(equation, scope, section.initial()));
                }
            }
            active.remove(active.size() - 1);
        }

        private boolean isBuiltinType(Name typeName) {
            return typeName.isSimple() && BUILTIN_TYPES.contains(typeName.first());
        }

        private void declare(Scope scope, ComponentClause clause, ComponentDeclaration component,
                             List<ScopedModification> outer) {
            String flatName = scope.prefix() + component.ident();
            SymbolRole role = roleOf(clause.typePrefix(), flatName);
            Draft draft = new Draft(flatName, role, clause.typeName().first(), component.description());

            List<ScopedModification> modifications = new ArrayList<>();
            component.declaration().modificationOpt().ifPresent(m -> modifications.add(new ScopedModification(m, scope)));
            modifications.addAll(outer);

            Pending binding = null;
            for (ScopedModification scoped : modifications) {
                for (ElementModification argument : scoped.modification().arguments()) {
                    String attribute = argument.name().toString();
                    if (!argument.name().isSimple() || !SUPPORTED_MODIFIERS.contains(attribute)) {
                        throw new ClassificationException(String.format(
                                "Unsupported modifier '%s' on '%s'", attribute, flatName));
                    }
                    Expression value = argument.value().orElseThrow(() -> new ClassificationException(
                            String.format("Modifier '%s' on '%s' has no value", attribute, flatName)));
                    if (attribute.equals("start")) {
                        draft.start = new Pending(value, scoped.scope());
                    } else if (attribute.equals("fixed")) {
                        draft.fixed = booleanLiteral(value, flatName);
                    } else {
                        draft.attributes.put(attribute, new Pending(value, scoped.scope()));
                    }
                }
                if (scoped.modification().binding() != null) {
                    binding = new Pending(scoped.modification().binding(), scoped.scope());
                }
            }
            if (binding != null) {
                draft.start = binding;
            }

            if (drafts.putIfAbsent(flatName, draft) != null) {
                throw new ClassificationException("Duplicate symbol '" + flatName + "'");
            }
            log.finer(() -> String.format("Declared %s '%s' as %s", draft.typeName, flatName, role));
        }

        private Boolean booleanLiteral(Expression value, String flatName) {
            if (value instanceof Terminal terminal && terminal.type() == TerminalType.BOOLEAN) {
                return Boolean.valueOf(terminal.text());
            }
            throw new ClassificationException("Modifier 'fixed' on '" + flatName + "' must be true or false");
        }

        private void expand(Scope scope, ComponentClause clause, ComponentDeclaration component,
                            List<ScopedModification> outer) {
            String instance = scope.prefix() + component.ident();
            List<ClassDefinition> classPath = resolveClass(clause.typeName(), scope.path())
                    .orElseThrow(() -> new ClassificationException(String.format(
                            "Component '%s' has unsupported type '%s'", instance, clause.typeName())));
            ClassDefinition type = classPath.get(classPath.size() - 1);
            checkEndName(type);

            switch (type.kind()) {
                case MODEL, BLOCK, CLASS, RECORD, CONNECTOR -> { }
                default -> throw new ClassificationException(String.format(
                        "Component '%s' is typed by %s '%s', which cannot be instantiated",
                        instance, type.kind().getKeyword(), type.name()));
            }
            if (!clause.typePrefix().isEmpty()) {
                throw new ClassificationException(String.format(
                        "Prefix '%s' on class-typed component '%s' is not supported", clause.typePrefix(), instance));
            }

            List<ScopedModification> modifications = new ArrayList<>();
            component.declaration().modificationOpt().ifPresent(m -> modifications.add(new ScopedModification(m, scope)));
            modifications.addAll(outer);

            Map<String, List<ScopedModification>> memberOverrides = new LinkedHashMap<>();
            for (ScopedModification scoped : modifications) {
                if (scoped.modification().binding() != null) {
                    throw new ClassificationException("Class-typed component '" + instance + "' cannot have a binding");
                }
                for (ElementModification argument : scoped.modification().arguments()) {
                    if (!argument.name().isSimple()) {
                        throw new ClassificationException(String.format(
                                "Dotted modification '%s' on '%s' is not supported", argument.name(), instance));
                    }
                    if (argument.modification() == null) {
                        throw new ClassificationException(String.format(
                                "Modification '%s' on '%s' has no value", argument.name(), instance));
                    }
                    memberOverrides.computeIfAbsent(argument.name().first(), k -> new ArrayList<>())
                            .add(new ScopedModification(argument.modification(), scoped.scope()));
                }
            }

            log.finer(() -> String.format("Expanding '%s' of class '%s'", instance, type.name()));
            instantiate(new Scope(instance + "_", classPath), memberOverrides);
        }

        private Optional<List<ClassDefinition>> resolveClass(Name typeName, List<ClassDefinition> lexicalPath) {
            if (!typeName.absolute()) {
                for (int i = lexicalPath.size() - 1; i >= 0; i--) {
                    ClassDefinition enclosing = lexicalPath.get(i);
                    if (enclosing.nestedClass(typeName.first()).isPresent()) {
                        List<ClassDefinition> path = new ArrayList<>(lexicalPath.subList(0, i + 1));
                        Optional<List<ClassDefinition>> rest = descend(enclosing.composition().classes(), typeName.parts());
                        if (rest.isEmpty()) return Optional.empty();
                        path.addAll(rest.get());
                        return Optional.of(path);
                    }
                }
            }
            return descend(unit.classes(), typeName.parts());
        }

        // ------------------------------------------------------------------
        // Pass 2: expressions and equations

        DaeModel assemble(String modelName) {
            for (Draft draft : drafts.values()) {
                if (draft.start != null) {
                    draft.resolvedStart = rewrite(draft.start.expression(), draft.start.scope(), Usage.BINDING);
                }
            }

            for (ScopedEquation scoped : equations) {
                if (scoped.initial()) {
                    applyInitialEquation(scoped);
                }
            }
            for (ScopedEquation scoped : equations) {
                if (!scoped.initial()) {
                    addEquation(scoped);
                }
            }

            DaeModel.Builder builder = DaeModel.builder(modelName);
            for (Draft draft : drafts.values()) {
                if (draft.role == SymbolRole.STATE && drafts.containsKey(DaeModel.derivativeName(draft.name))) {
                    throw new ClassificationException(String.format(
                            "Symbol '%s' clashes with the derivative of state '%s'",
                            DaeModel.derivativeName(draft.name), draft.name));
                }
                Map<String, Expression> attributes = new LinkedHashMap<>();
                draft.attributes.forEach((key, pending) ->
                        attributes.put(key, rewrite(pending.expression(), pending.scope(), Usage.BINDING)));
                builder.symbol(new Symbol(draft.name, draft.role, draft.typeName, draft.resolvedStart,
                        draft.fixed, draft.description, attributes));
            }
            residuals.forEach(builder::residual);
            preReferences.forEach(builder::pre);

            for (PendingReset reset : resets) {
                SymbolRole targetRole = drafts.get(reset.target()).role;
                if (targetRole != SymbolRole.STATE) {
                    throw new ClassificationException(String.format(
                            "reinit target '%s' is %s, not a state", reset.target(), targetRole));
                }
                builder.reset(reset.name(), reset.condition(),
                        ResetBlock.of(new ResetAssignment(reset.target(), reset.value())));
            }

            for (String configured : policy.resetConditions().keySet()) {
                if (resets.stream().noneMatch(r -> r.name().equals(configured))) {
                    log.warning(() -> String.format(
                            "Condition '%s' matches no reinit statement of model '%s'", configured, modelName));
                }
            }
            return builder.build();
        }

        private void applyInitialEquation(ScopedEquation scoped) {
            if (scoped.equation() instanceof SimpleEquation simple && simple.lhs() instanceof ComponentReference ref) {
                String target = resolve(ref.name(), scoped.scope());
                Draft draft = drafts.get(target);
                if (draft == null) {
                    throw new ClassificationException("Initial equation assigns builtin '" + target + "'");
                }
                draft.resolvedStart = rewrite(simple.rhs(), scoped.scope(), Usage.BINDING);
                return;
            }
            throw new ClassificationException(
                    "Initial equations must have the form 'variable = expression': " + scoped.equation().description());
        }

        private void addEquation(ScopedEquation scoped) {
            Equation equation = scoped.equation();
            if (equation instanceof SimpleEquation simple) {
                Expression lhs = rewrite(simple.lhs(), scoped.scope(), Usage.EQUATION);
                Expression rhs = rewrite(simple.rhs(), scoped.scope(), Usage.EQUATION);
                residuals.add(new Residual(lhs, rhs, simple.description()));
            } else if (equation instanceof FunctionCallEquation call) {
                String function = call.functionName();
                if (function.equals(Builtins.REINIT)) {
                    addReset(call, scoped.scope());
                } else if (Builtins.isMathFunction(function) || function.equals(Builtins.DER)
                        || function.equals(Builtins.PRE)) {
                    throw new ClassificationException("Call to '" + function + "' cannot stand alone as an equation");
                } else {
                    throw new UnresolvedReferenceException(function, "function-call equation");
                }
            } else {
                throw new ClassificationException("Unsupported equation kind: " + equation.getClass().getSimpleName());
            }
        }

        private void addReset(FunctionCallEquation call, Scope scope) {
            if (call.args().size() != 2 || !(call.args().get(0) instanceof ComponentReference ref)) {
                throw new ClassificationException("reinit expects a variable and an expression");
            }
            String target = resolve(ref.name(), scope);
            if (!drafts.containsKey(target)) {
                throw new ClassificationException("reinit cannot target builtin '" + target + "'");
            }
            Expression value = rewrite(call.args().get(1), scope, Usage.RESET_VALUE);

            String name = FlattenPolicy.resetName(resets.size());
            String text = policy.resetConditions().get(name);
            if (text == null) {
                throw new ResetWithoutConditionException(name, target);
            }
            Expression condition;
            try {
                condition = conditionParser.parseExpression(text);
            } catch (ParseException | LexException e) {
                throw new FlatteningException(String.format("Invalid condition for reset '%s': %s", name, text), e);
            }
            condition = rewrite(condition, root, Usage.CONDITION);
            resets.add(new PendingReset(name, target, value, condition));
            log.fine(() -> String.format("Registered reset '%s': reinit(%s, ...) when %s", name, target, text));
        }

        private Expression rewrite(Expression expression, Scope scope, Usage usage) {
            return expression.accept(new Rewriter(scope, usage));
        }

        private String resolve(Name name, Scope scope) {
            String joined = String.join("_", name.parts());
            if (name.absolute()) {
                if (componentNames(root.cls()).contains(name.first()) && drafts.containsKey(joined)) return joined;
                throw new UnresolvedReferenceException(name.toString(), "class '" + root.cls().name() + "'");
            }
            if (componentNames(scope.cls()).contains(name.first())) {
                String flat = scope.prefix() + joined;
                if (drafts.containsKey(flat)) return flat;
            } else if (name.isSimple() && name.first().equals(Builtins.TIME)) {
                return Builtins.TIME;
            }
            throw new UnresolvedReferenceException(name.toString(), "class '" + scope.cls().name() + "'");
        }

        private void promoteToState(String flatName) {
            Draft draft = drafts.get(flatName);
            if (draft == null) {
                throw new ClassificationException("der() cannot be applied to builtin '" + flatName + "'");
            }
            if (draft.role == SymbolRole.STATE) return;
            if (draft.role != SymbolRole.ALGEBRAIC && draft.role != SymbolRole.OUTPUT) {
                throw new ClassificationException(String.format(
                        "der() applied to %s '%s'; only algebraic or output variables can become states",
                        draft.role.name().toLowerCase(), flatName));
            }
            if (!draft.typeName.equals(Symbol.REAL)) {
                throw new ClassificationException(String.format(
                        "der() applied to %s variable '%s'; states must be Real", draft.typeName, flatName));
            }
            SymbolRole previous = draft.role;
            draft.role = SymbolRole.STATE;
            log.fine(() -> String.format("Reclassified '%s' from %s to STATE", flatName, previous));
        }

        /**
         * Rewrites references to flat names and maps the hybrid operators.
         */
        private final class Rewriter implements ExpressionVisitor<Expression> {
            private final Scope scope;
            private final Usage usage;

            Rewriter(Scope scope, Usage usage) {
                this.scope = scope;
                this.usage = usage;
            }

            @Override
            public Expression visitTerminal(Terminal terminal) {
                return terminal;
            }

            @Override
            public Expression visitComponentReference(ComponentReference reference) {
                return new ComponentReference(Name.of(resolve(reference.name(), scope)));
            }

            @Override
            public Expression visitBinary(Binary binary) {
                return new Binary(binary.op(), binary.lhs().accept(this), binary.rhs().accept(this));
            }

            @Override
            public Expression visitUnary(Unary unary) {
                return new Unary(unary.op(), unary.operand().accept(this));
            }

            @Override
            public Expression visitFunctionCall(FunctionCall call) {
                String function = call.functionName();
                switch (function) {
                    case Builtins.DER -> {
                        if (usage != Usage.EQUATION) {
                            throw new ClassificationException("der() is only allowed in equations");
                        }
                        String state = referenceArgument(call);
                        promoteToState(state);
                        return new ComponentReference(Name.of(DaeModel.derivativeName(state)));
                    }
                    case Builtins.PRE -> {
                        if (usage == Usage.BINDING) {
                            throw new ClassificationException("pre() is not allowed in bindings or modifiers");
                        }
                        String variable = referenceArgument(call);
                        if (!drafts.containsKey(variable)) {
                            throw new ClassificationException("pre() cannot be applied to builtin '" + variable + "'");
                        }
                        preReferences.add(variable);
                        return FunctionCall.of(Builtins.PRE, new ComponentReference(Name.of(variable)));
                    }
                    case Builtins.REINIT -> throw new ClassificationException(
                            "reinit() can only be used as an equation statement");
                    default -> {
                        Integer arity = Builtins.mathArity(function).orElseThrow(() ->
                                new UnresolvedReferenceException(function, "function call"));
                        if (call.args().size() != arity) {
                            throw new ClassificationException(String.format(
                                    "%s() expects %d argument(s), got %d", function, arity, call.args().size()));
                        }
                        List<Expression> args = new ArrayList<>();
                        for (Expression arg : call.args()) {
                            args.add(arg.accept(this));
                        }
                        return new FunctionCall(Name.of(function), args);
                    }
                }
            }

            private String referenceArgument(FunctionCall call) {
                if (call.args().size() != 1 || !(call.args().get(0) instanceof ComponentReference ref)) {
                    throw new ClassificationException(call.functionName() + "() expects a single variable reference");
                }
                return resolve(ref.name(), scope);
            }
        }
    }
}

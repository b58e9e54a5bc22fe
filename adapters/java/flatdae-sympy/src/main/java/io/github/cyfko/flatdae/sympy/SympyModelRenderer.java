package io.github.cyfko.flatdae.sympy;

import io.github.cyfko.flatdae.core.ast.Binary;
import io.github.cyfko.flatdae.core.ast.BinaryOperator;
import io.github.cyfko.flatdae.core.ast.Expression;
import io.github.cyfko.flatdae.core.config.RenderPolicy;
import io.github.cyfko.flatdae.core.dae.DaeModel;
import io.github.cyfko.flatdae.core.dae.ResetAssignment;
import io.github.cyfko.flatdae.core.dae.ResetBlock;
import io.github.cyfko.flatdae.core.dae.Residual;
import io.github.cyfko.flatdae.core.dae.Symbol;
import io.github.cyfko.flatdae.core.dae.SymbolRole;
import io.github.cyfko.flatdae.core.spi.ModelRenderer;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Generates a Python module exposing the model as SymPy matrices plus a SciPy-driven
 * hybrid simulation loop.
 * <p>
 * The module defines one class {@code Model} with:
 * </p>
 * <ul>
 *   <li>{@code u p cp x m y z x_dot}: {@code sympy.Matrix} of symbols, in flat-model order</li>
 *   <li>{@code u0 p0 cp0 x0 m0 y0 z0}: start expressions keyed by symbol name</li>
 *   <li>{@code pre_x}: pre-event symbols of the states</li>
 *   <li>{@code fx}: residuals, the system is {@code fx = 0}</li>
 *   <li>{@code c}: conditions; {@code fr}: reset name to new state vector, written over {@code pre_x}</li>
 *   <li>{@code pre_x_of}, {@code pre_z_of}: pre symbol to current symbol, applied between events</li>
 *   <li>{@code solve()}: explicit ODE for {@code [x_dot; y; z]}; zero crossings and resets are
 *       lambdified over {@code time, x, m, u, p, cp} once {@code y} and {@code z} are eliminated</li>
 *   <li>{@code simulate(t0, tf, dt, f_u=None, max_events=100)}: event-driven integration</li>
 * </ul>
 *
 * <p>
 * Every condition must be an ordering comparison {@code lhs op rhs}; its zero-crossing
 * function is {@code lhs - rhs}, with the crossing direction given by the operator.
 * Other conditions render as a placeholder.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class SympyModelRenderer implements ModelRenderer {

    private static final Logger log = Logger.getLogger(SympyModelRenderer.class.getName());

    public static final String TARGET = "sympy";

    private static final List<SymbolRole> DECLARED_VECTORS = List.of(
            SymbolRole.INPUT, SymbolRole.PARAMETER, SymbolRole.CONSTANT, SymbolRole.STATE,
            SymbolRole.DISCRETE_MODE, SymbolRole.OUTPUT, SymbolRole.ALGEBRAIC);

    private static final String RULE = "# ============================================";

    private final SympyExpressionRenderer expressions;
    private final String indent;

    public SympyModelRenderer() {
        this(RenderPolicy.defaults());
    }

    public SympyModelRenderer(RenderPolicy policy) {
        Objects.requireNonNull(policy, "policy cannot be null");
        this.expressions = new SympyExpressionRenderer(policy);
        this.indent = policy.indent();
    }

    @Override
    public String target() {
        return TARGET;
    }

    @Override
    public String render(DaeModel model) {
        Objects.requireNonNull(model, "model cannot be null");
        Writer out = new Writer();

        out.line(0, "\"\"\"");
        out.line(0, "Automatically generated by flatdae");
        out.line(0, "\"\"\"");
        out.line(0, "import sympy");
        out.line(0, "import numpy as np");
        out.line(0, "import scipy.integrate");
        out.blank();
        out.blank();
        out.line(0, "class Model:");
        out.line(1, "\"\"\"");
        out.line(1, "Flattened model " + model.name());
        out.line(1, "\"\"\"");
        out.blank();
        out.line(1, "def __init__(self):");
        section(out, "Initialize");
        out.line(2, "self.solved = False");

        section(out, "Declare time");
        out.line(2, "self.time = sympy.symbols('time')");
        out.line(2, "time = self.time");

        for (SymbolRole role : DECLARED_VECTORS) {
            declareVector(out, role.getVectorName(), model.vector(role));
        }

        section(out, "Start values");
        for (SymbolRole role : DECLARED_VECTORS) {
            startMap(out, role.getVectorName() + "0", model.vector(role));
        }

        declarePre(out, model);
        declareVector(out, "x_dot", model.xDot());

        section(out, "Define Continuous Update Function: fx");
        List<String> residuals = new ArrayList<>();
        for (Residual residual : model.fx()) {
            residuals.add(expressions.render(residual.expression()));
        }
        matrix(out, "self.fx", residuals);

        section(out, "Define Conditions: c");
        List<String> conditions = new ArrayList<>();
        model.c().forEach((name, condition) -> conditions.add("'" + name + "': " + expressions.render(condition)));
        dict(out, "self.c", conditions);

        section(out, "Define Reset Functions: fr");
        List<String> resets = new ArrayList<>();
        model.fr().forEach((name, block) -> {
            resetFunction(out, model, name, block);
            resets.add("'" + name + "': self.fr_" + name);
        });
        dict(out, "self.fr", resets);

        section(out, "Zero-crossing functions and directions");
        List<String> crossings = new ArrayList<>();
        model.c().forEach((name, condition) -> crossings.add("'" + name + "': " + zeroCrossing(condition)));
        dict(out, "self.zc", crossings);

        out.blank();
        writeSolve(out);
        out.blank();
        out.line(1, "def __repr__(self):");
        out.line(2, "return repr(self.__dict__)");
        out.blank();
        writeHelpers(out);
        out.blank();
        writeSimulate(out);

        log.fine(() -> String.format("Generated SymPy module for '%s': %d residuals, %d conditions",
                model.name(), model.fx().size(), model.c().size()));
        return out.toString();
    }

    private void section(Writer out, String title) {
        out.blank();
        out.line(2, RULE);
        out.line(2, "# " + title);
    }

    private void declareVector(Writer out, String vectorName, List<Symbol> symbols) {
        section(out, "Declare " + vectorName);
        List<String> names = new ArrayList<>();
        for (Symbol symbol : symbols) {
            String python = SympyExpressionRenderer.pythonName(symbol.name());
            out.line(2, python + " = sympy.symbols('" + symbol.name() + "')");
            names.add(python);
        }
        matrix(out, "self." + vectorName, names);
    }

    private void startMap(Writer out, String mapName, List<Symbol> symbols) {
        List<String> entries = new ArrayList<>();
        for (Symbol symbol : symbols) {
            entries.add("'" + symbol.name() + "': " + expressions.render(symbol.startOrDefault()));
        }
        dict(out, "self." + mapName, entries);
    }

    private void declarePre(Writer out, DaeModel model) {
        List<Symbol> preOfStates = new ArrayList<>();
        List<String> stateSources = new ArrayList<>();
        for (Symbol state : model.x()) {
            preOfStates.add(renamed(state, preName(state)));
            stateSources.add(preName(state) + ": " + SympyExpressionRenderer.pythonName(state.name()));
        }
        declareVector(out, "pre_x", preOfStates);
        declareVector(out, "pre_m", List.of());

        Set<String> preReferences = model.preReferences();
        List<Symbol> preOfOthers = new ArrayList<>();
        List<String> otherSources = new ArrayList<>();
        for (String name : preReferences) {
            model.symbol(name)
                    .filter(symbol -> symbol.role() != SymbolRole.STATE)
                    .ifPresent(symbol -> {
                        preOfOthers.add(renamed(symbol, preName(symbol)));
                        otherSources.add(preName(symbol) + ": " + SympyExpressionRenderer.pythonName(symbol.name()));
                    });
        }
        declareVector(out, "pre_z", preOfOthers);

        // between events pre(v) is v itself
        section(out, "Pre symbols to current symbols");
        dict(out, "self.pre_x_of", stateSources);
        dict(out, "self.pre_z_of", otherSources);
    }

    private static String preName(Symbol symbol) {
        return "pre_" + SympyExpressionRenderer.pythonName(symbol.name());
    }

    private static Symbol renamed(Symbol symbol, String name) {
        return new Symbol(name, symbol.role(), symbol.typeName(), null);
    }

    private void resetFunction(Writer out, DaeModel model, String name, ResetBlock block) {
        String function = "_fr_" + name;
        out.line(2, "def " + function + "(pre_x_vec, x_vec):");
        List<Symbol> states = model.x();
        for (int i = 0; i < states.size(); i++) {
            String state = SympyExpressionRenderer.pythonName(states.get(i).name());
            out.line(3, "pre_" + state + " = pre_x_vec[" + i + "]");
            out.line(3, state + " = x_vec[" + i + "]");
        }
        for (ResetAssignment assignment : block.assignments()) {
            out.line(3, SympyExpressionRenderer.pythonName(assignment.target()) + " = "
                    + expressions.render(assignment.value()));
        }
        List<String> result = new ArrayList<>();
        states.forEach(s -> result.add(SympyExpressionRenderer.pythonName(s.name())));
        out.line(3, "return [" + String.join(", ", result) + "]");
        out.line(2, "self.fr_" + name + " = " + function + "(self.pre_x, self.x)");
    }

    private String zeroCrossing(Expression condition) {
        if (condition instanceof Binary binary) {
            int direction = switch (binary.op()) {
                case LT, LE -> -1;
                case GT, GE -> 1;
                default -> 0;
            };
            if (direction != 0) {
                Expression crossing = new Binary(BinaryOperator.SUB, binary.lhs(), binary.rhs());
                return "(" + expressions.render(crossing) + ", " + direction + ")";
            }
        }
        return "(" + expressions.unsupported("zero crossing of " + expressions.render(condition)) + ", 0)";
    }

    private void writeSolve(Writer out) {
        out.line(1, "def solve(self):");
        out.line(2, RULE);
        out.line(2, "# Solve for explicit ODE");
        out.line(2, "pre_of = {**self.pre_x_of, **self.pre_z_of}");
        out.line(2, "v = list(self.x_dot) + list(self.y) + list(self.z)");
        out.line(2, "sol = sympy.solve(list(self.fx.subs(pre_of)), v, dict=True)[0] if v else {}");
        out.line(2, "self.sol_x_dot = self.x_dot.subs(sol)");
        out.line(2, "self.sol_y = self.y.subs(sol)");
        out.line(2, "self.sol_z = self.z.subs(sol)");
        out.line(2, "args = [self.time, self.x, self.m, self.u, self.p, self.cp]");
        out.line(2, "self.f_x_dot = sympy.lambdify(args, list(self.sol_x_dot))");
        out.line(2, "self.f_y = sympy.lambdify(args, list(self.sol_y))");
        out.line(2, "self.f_z = sympy.lambdify(args, list(self.sol_z))");
        out.line(2, "self.f_zc = {}");
        out.line(2, "for name, (expr, direction) in self.zc.items():");
        out.line(3, "self.f_zc[name] = (sympy.lambdify(args, sympy.sympify(expr).subs(pre_of).subs(sol)), direction)");
        out.line(2, "reset_args = [self.time, self.pre_x, self.x, self.m, self.u, self.p, self.cp]");
        out.line(2, "self.f_fr = {}");
        out.line(2, "for name, reset in self.fr.items():");
        out.line(3, "values = [sympy.sympify(e).subs(self.pre_z_of).subs(sol) for e in reset]");
        out.line(3, "self.f_fr[name] = sympy.lambdify(reset_args, values)");
        out.line(2, "self.solved = True");
    }

    private void writeHelpers(Writer out) {
        out.line(1, "@staticmethod");
        out.line(1, "def _evaluate(symbols, starts, subs):");
        out.line(2, "values = []");
        out.line(2, "for symbol in symbols:");
        out.line(3, "value = sympy.sympify(starts[str(symbol)]).subs(subs)");
        out.line(3, "if value in (sympy.true, sympy.false):");
        out.line(4, "value = 1.0 if value == sympy.true else 0.0");
        out.line(3, "subs[symbol] = float(value)");
        out.line(3, "values.append(float(value))");
        out.line(2, "return np.array(values, dtype=float)");
        out.blank();
        out.line(1, "@staticmethod");
        out.line(1, "def _event(zc, m0, f_u, p0, cp0):");
        out.line(2, "f, direction = zc");
        out.blank();
        out.line(2, "def event(t, x):");
        out.line(3, "return f(t, x, m0, f_u(t), p0, cp0)");
        out.line(2, "event.terminal = True");
        out.line(2, "event.direction = direction");
        out.line(2, "return event");
        out.blank();
        out.line(1, "def _record(self, data, t, x, m0, f_u, p0, cp0):");
        out.line(2, "for ti, xi in zip(t, x):");
        out.line(3, "ui = f_u(ti)");
        out.line(3, "data['t'].append(ti)");
        out.line(3, "data['x'].append(list(xi))");
        out.line(3, "data['u'].append(list(ui))");
        out.line(3, "data['y'].append(self.f_y(ti, xi, m0, ui, p0, cp0))");
        out.line(3, "data['z'].append(self.f_z(ti, xi, m0, ui, p0, cp0))");
    }

    private void writeSimulate(Writer out) {
        out.line(1, "def simulate(self, t0, tf, dt, f_u=None, max_events=100):");
        out.line(2, "\"\"\"");
        out.line(2, "Integrate from t0 to tf, sampling every dt.");
        out.blank();
        out.line(2, "Each condition is a terminal event. At an event the matching reset is applied");
        out.line(2, "to the pre-event state and integration restarts from the event time. The event");
        out.line(2, "time is sampled once, with the pre-reset state.");
        out.line(2, "\"\"\"");
        out.line(2, "if not self.solved:");
        out.line(3, "self.solve()");
        section(out, "Declare initial vectors");
        out.line(2, "subs = {}");
        out.line(2, "cp0 = self._evaluate(self.cp, self.cp0, subs)");
        out.line(2, "p0 = self._evaluate(self.p, self.p0, subs)");
        out.line(2, "u0 = self._evaluate(self.u, self.u0, subs)");
        out.line(2, "x0 = self._evaluate(self.x, self.x0, subs)");
        out.line(2, "m0 = self._evaluate(self.m, self.m0, subs)");
        out.blank();
        out.line(2, "if f_u is None:");
        out.line(3, "def f_u(t):");
        out.line(4, "return u0");
        section(out, "Declare Events");
        out.line(2, "names = list(self.f_zc.keys())");
        out.line(2, "events = [self._event(self.f_zc[name], m0, f_u, p0, cp0) for name in names]");
        out.line(2, "resets = [self.f_fr[name] for name in names]");
        section(out, "Solve IVP");
        out.line(2, "data = {'t': [], 'x': [], 'u': [], 'y': [], 'z': []}");
        out.line(2, "event_count = 0");
        out.line(2, "event_limit_reached = False");
        out.line(2, "t_start = t0");
        out.line(2, "first_sample = t0");
        out.line(2, "while t_start < tf:");
        out.line(3, "t_eval = np.arange(first_sample, tf + dt * 1e-9, dt)");
        out.line(3, "t_eval = t_eval[t_eval <= tf]");
        out.line(3, "res = scipy.integrate.solve_ivp(");
        out.line(4, "fun=lambda ti, x: self.f_x_dot(ti, x, m0, f_u(ti), p0, cp0),");
        out.line(4, "t_span=[t_start, tf],");
        out.line(4, "y0=x0,");
        out.line(4, "t_eval=t_eval,");
        out.line(4, "events=events if events else None,");
        out.line(4, "max_step=dt)");
        out.line(3, "t = list(res.t)");
        out.line(3, "x = [list(col) for col in res.y.T]");
        out.line(3, "if res.status != 1:");
        out.line(4, "self._record(data, t, x, m0, f_u, p0, cp0)");
        out.line(4, "break");
        out.blank();
        out.line(3, "fired = [i for i, te in enumerate(res.t_events) if len(te) > 0]");
        out.line(3, "te = res.t_events[fired[0]][0]");
        out.line(3, "xe = np.array(res.y_events[fired[0]][0], dtype=float)");
        out.line(3, "while t and t[-1] >= te:");
        out.line(4, "t.pop()");
        out.line(4, "x.pop()");
        out.line(3, "t.append(te)");
        out.line(3, "x.append(list(xe))");
        out.line(3, "self._record(data, t, x, m0, f_u, p0, cp0)");
        out.line(3, "if event_count >= max_events:");
        out.line(4, "event_limit_reached = True");
        out.line(4, "break");
        out.line(3, "event_count += 1");
        out.blank();
        out.line(3, "x_new = xe");
        out.line(3, "for i in fired:");
        out.line(4, "x_new = np.array(resets[i](te, xe, x_new, m0, f_u(te), p0, cp0), dtype=float).flatten()");
        out.line(3, "t_start = te");
        out.line(3, "first_sample = te + dt");
        out.line(3, "x0 = x_new");
        out.blank();
        out.line(2, "result = {k: np.array(v, dtype=float).T for k, v in data.items()}");
        out.line(2, "result['events'] = event_count");
        out.line(2, "result['event_limit_reached'] = event_limit_reached");
        out.line(2, "return result");
    }

    private void matrix(Writer out, String target, List<String> entries) {
        if (entries.isEmpty()) {
            out.line(2, target + " = sympy.Matrix([])");
            return;
        }
        out.line(2, target + " = sympy.Matrix([");
        for (int i = 0; i < entries.size(); i++) {
            out.line(3, entries.get(i) + (i < entries.size() - 1 ? "," : "])"));
        }
    }

    private void dict(Writer out, String target, List<String> entries) {
        if (entries.isEmpty()) {
            out.line(2, target + " = {}");
            return;
        }
        out.line(2, target + " = {");
        for (int i = 0; i < entries.size(); i++) {
            out.line(3, entries.get(i) + (i < entries.size() - 1 ? "," : "}"));
        }
    }

    /**
     * Line-oriented buffer with policy indentation.
     */
    private final class Writer {
        private final StringBuilder sb = new StringBuilder();

        void line(int level, String text) {
            sb.append(indent.repeat(level)).append(text).append('\n');
        }

        void blank() {
            sb.append('\n');
        }

        @Override
        public String toString() {
            return sb.toString();
        }
    }
}

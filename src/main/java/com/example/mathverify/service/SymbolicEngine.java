package com.example.mathverify.service;

import com.example.mathverify.model.NumericValue;
import com.example.mathverify.model.Outcome;
import org.matheclipse.core.eval.ExprEvaluator;
import org.matheclipse.core.interfaces.IAST;
import org.matheclipse.core.interfaces.IExpr;
import org.matheclipse.core.interfaces.INumber;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Gateway to the Symja computer-algebra engine.
 * <p>
 * Inputs are written in generator notation and rewritten by {@link ExpressionSyntax};
 * intermediate results are composed back into Symja input through their printed form.
 * Every operation returns an {@link Outcome}: engine exceptions and unevaluated
 * results are reported as failures and never escape this class.
 * <p>
 * Symja evaluators are not thread safe, so each thread owns one; {@link #reset()} discards it
 * between verifications.
 */
@Service
public class SymbolicEngine {

    private static final Logger log = LoggerFactory.getLogger(SymbolicEngine.class);

    private static final ThreadLocal<ExprEvaluator> EVALUATOR =
            ThreadLocal.withInitial(() -> new ExprEvaluator(false, (short) 100));

    /**
     * Drops the calling thread's evaluator so the next operation starts from a fresh
     * engine state. Called once per verification.
     */
    public void reset() {
        EVALUATOR.remove();
    }

    // ── Parsing ──────────────────────────────────────────────────────────────

    /**
     * Parses (and evaluates) an expression written in generator notation.
     * Assignments are refused: they would outlive the expression in the evaluator.
     */
    public Outcome<IExpr> parse(String text) {
        if (text == null || text.isBlank()) {
            return Outcome.failure("expression vide");
        }
        if (ExpressionSyntax.hasAssignment(text)) {
            return Outcome.failure("affectation refusée: " + text.strip());
        }
        return eval(ExpressionSyntax.toSymja(text));
    }

    /** Like {@link #parse(String)}, also accepting lower-case {@code i} as the imaginary unit. */
    public Outcome<IExpr> parseComplex(String text) {
        if (text == null || text.isBlank()) {
            return Outcome.failure("expression vide");
        }
        if (ExpressionSyntax.hasAssignment(text)) {
            return Outcome.failure("affectation refusée: " + text.strip());
        }
        return eval(ExpressionSyntax.toSymjaComplex(text));
    }

    /** Residual {@code lhs - rhs} of an equality written in generator notation. */
    public Outcome<IExpr> residual(ExpressionSyntax.Equation equation) {
        return parse(equation.residual());
    }

    // ── Symbolic operations ──────────────────────────────────────────────────

    public Outcome<IExpr> simplify(IExpr expr) {
        return eval("Simplify(" + expr + ")");
    }

    public Outcome<IExpr> subtract(IExpr a, IExpr b) {
        return eval("(" + a + ")-(" + b + ")");
    }

    /**
     * Symbolic zero test. Lists and matrices are zero when every entry is.
     *
     * @return true when the expression simplifies to zero
     */
    public Outcome<Boolean> isZero(IExpr expr) {
        Outcome<IExpr> simplified = simplify(expr);
        if (simplified.isFailure()) {
            return Outcome.failure(simplified.error());
        }
        if (isZeroTensor(simplified.value())) {
            return Outcome.success(true);
        }
        Outcome<IExpr> together = eval("Together(ExpandAll(" + expr + "))");
        if (together.isSuccess() && isZeroTensor(together.value())) {
            return Outcome.success(true);
        }
        if (!simplified.value().isList()) {
            Outcome<IExpr> possibleZero = eval("PossibleZeroQ(" + simplified.value() + ")");
            if (possibleZero.isSuccess() && possibleZero.value().isTrue()) {
                return Outcome.success(true);
            }
        }
        return Outcome.success(false);
    }

    /** Free symbols of an expression, sorted by name. */
    public Outcome<List<String>> freeVariables(IExpr expr) {
        return eval("Variables(" + expr + ")").flatMap(vars -> {
            if (!vars.isList()) {
                return Outcome.failure("Variables() n'a pas renvoyé de liste: " + vars);
            }
            List<String> names = new ArrayList<>();
            IAST list = (IAST) vars;
            for (int i = 1; i < list.size(); i++) {
                names.add(list.get(i).toString());
            }
            names.sort(Comparator.naturalOrder());
            return Outcome.success(names);
        });
    }

    /**
     * Solves {@code residual_i == 0} simultaneously for the given variables.
     *
     * @return one mapping per solution, keyed by variable name
     */
    public Outcome<List<Map<String, IExpr>>> solve(List<IExpr> residuals, List<String> variables) {
        String eqs = residuals.stream().map(r -> "(" + r + ")==0").collect(Collectors.joining(",", "{", "}"));
        String vars = String.join(",", variables);
        return eval("Solve(" + eqs + ",{" + vars + "})").flatMap(this::solutionMappings);
    }

    /** Roots of {@code expr == 0} in one variable. */
    public Outcome<List<IExpr>> roots(IExpr expr, String variable) {
        return eval("Solve((" + expr + ")==0," + variable + ")")
                .flatMap(this::solutionMappings)
                .map(solutions -> solutions.stream()
                        .filter(s -> s.size() == 1)
                        .map(s -> s.values().iterator().next())
                        .toList());
    }

    /** n-th derivative with respect to a variable. */
    public Outcome<IExpr> differentiate(IExpr expr, String variable, int order) {
        return eval("D(" + expr + ",{" + variable + "," + order + "})");
    }

    /** Limit of an expression when the variable tends to the point. */
    public Outcome<IExpr> limit(IExpr expr, String variable, IExpr point) {
        return eval("Limit(" + expr + "," + variable + "->(" + point + "))").flatMap(result -> {
            String printed = result.toString();
            if (printed.startsWith("Limit(") || printed.contains("Indeterminate")) {
                return Outcome.failure("limite non calculable: " + printed);
            }
            return Outcome.success(result);
        });
    }

    /** Replaces variables by values. */
    public Outcome<IExpr> substitute(IExpr expr, Map<String, IExpr> mapping) {
        if (mapping.isEmpty()) {
            return Outcome.success(expr);
        }
        String rules = mapping.entrySet().stream()
                .map(e -> e.getKey() + "->(" + e.getValue() + ")")
                .collect(Collectors.joining(",", "{", "}"));
        return eval("ReplaceAll(" + expr + "," + rules + ")");
    }

    // ── Numeric evaluation ───────────────────────────────────────────────────

    /** Numeric value of a closed expression as a complex number. */
    public Outcome<NumericValue> evaluate(IExpr expr) {
        return eval("N(" + expr + ")").flatMap(this::toNumeric);
    }

    /** Numeric value of an expression at a point given as variable → double. */
    public Outcome<NumericValue> evaluateAt(IExpr expr, Map<String, Double> point) {
        Map<String, String> literals = new LinkedHashMap<>();
        point.forEach((k, v) -> literals.put(k, decimal(v)));
        String rules = literals.entrySet().stream()
                .map(e -> e.getKey() + "->(" + e.getValue() + ")")
                .collect(Collectors.joining(",", "{", "}"));
        return eval("N(ReplaceAll(" + expr + "," + rules + "))").flatMap(this::toNumeric);
    }

    /** Plain decimal literal (no exponent notation) for a double. */
    public static String decimal(double value) {
        return BigDecimal.valueOf(value).toPlainString();
    }

    // ── Internals ────────────────────────────────────────────────────────────

    private Outcome<NumericValue> toNumeric(IExpr value) {
        if (!(value instanceof INumber)) {
            return Outcome.failure("valeur non numérique: " + value);
        }
        INumber number = (INumber) value;
        NumericValue numeric = new NumericValue(number.reDoubleValue(), number.imDoubleValue());
        if (!numeric.isFinite()) {
            return Outcome.failure("valeur non finie: " + value);
        }
        return Outcome.success(numeric);
    }

    private Outcome<List<Map<String, IExpr>>> solutionMappings(IExpr result) {
        if (!result.isList()) {
            return Outcome.failure("Solve() n'a pas abouti: " + result);
        }
        List<Map<String, IExpr>> solutions = new ArrayList<>();
        IAST outer = (IAST) result;
        for (int i = 1; i < outer.size(); i++) {
            IExpr solution = outer.get(i);
            if (!solution.isList()) {
                continue;
            }
            IAST rules = (IAST) solution;
            Map<String, IExpr> mapping = new LinkedHashMap<>();
            for (int j = 1; j < rules.size(); j++) {
                IExpr rule = rules.get(j);
                if (rule.isRuleAST()) {
                    IAST r = (IAST) rule;
                    mapping.put(r.arg1().toString(), r.arg2());
                }
            }
            solutions.add(mapping);
        }
        return Outcome.success(solutions);
    }

    private static boolean isZeroTensor(IExpr expr) {
        if (expr.isList()) {
            IAST list = (IAST) expr;
            for (int i = 1; i < list.size(); i++) {
                if (!isZeroTensor(list.get(i))) {
                    return false;
                }
            }
            return true;
        }
        return expr.isZero();
    }

    private Outcome<IExpr> eval(String input) {
        try {
            IExpr result = EVALUATOR.get().eval(input);
            if (result == null) {
                return Outcome.failure("aucun résultat pour " + input);
            }
            if ("$Aborted".equals(result.toString())) {
                return Outcome.failure("évaluation interrompue: " + input);
            }
            log.debug("Symja: {} -> {}", input, result);
            return Outcome.success(result);
        } catch (RuntimeException e) {
            log.debug("Symja: échec sur '{}': {}", input, e.getMessage());
            return Outcome.failure(e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }
}

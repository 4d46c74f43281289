package com.example.mathverify.verifier;

import com.example.mathverify.model.DirectiveKind;
import com.example.mathverify.model.FinalAnswer;
import com.example.mathverify.model.NumericValue;
import com.example.mathverify.model.Outcome;
import com.example.mathverify.model.ReportKind;
import com.example.mathverify.model.VerificationInput;
import com.example.mathverify.model.VerificationReport;
import com.example.mathverify.model.VerifierKind;
import com.example.mathverify.service.ExpressionSyntax;
import com.example.mathverify.service.FinalAnswerParser;
import com.example.mathverify.service.SampleSource;
import com.example.mathverify.service.SymbolicEngine;
import org.matheclipse.core.interfaces.IExpr;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Constrained and unconstrained optimization.
 * <pre>
 *   OPTIMIZE; var=x; func=-2*x**2+8*x-3; domain=[0,5]; goal=max
 *   OPTIMIZE; var=[x,y]; func=x*y; domain=[x+y&lt;=10, x&gt;=0, y&gt;=0]; goal=max
 * </pre>
 * One variable: the exact candidate set (critical points inside the interval plus
 * its endpoints) gives the true optimum, compared with the declared point and value.
 * Several variables: the declared point is only tested against random feasible
 * neighbours. A passing local check is a witness of local optimality, not a proof.
 */
@Service
public class OptimizationVerifier implements DomainVerifier {

    private static final Logger log = LoggerFactory.getLogger(OptimizationVerifier.class);

    private static final List<String> TOPIC_KEYWORDS = List.of(
            "maximum", "minimum", "optim", "extrem", "variation");

    private static final Pattern INTERVAL = Pattern.compile(
            "^\\[\\s*([-+]?\\d+(\\.\\d+)?)\\s*,\\s*([-+]?\\d+(\\.\\d+)?)\\s*]$");

    private static final double FEASIBILITY_TOLERANCE = 1e-6;
    private static final double VALUE_TOLERANCE = 1e-2;
    private static final double POINT_TOLERANCE = 1e-3;
    private static final double IMPROVEMENT_TOLERANCE = 1e-3;
    private static final double REAL_TOLERANCE = 1e-9;

    private static final String[] VALUE_KEYS = {"f_star", "max", "min", "f_max", "f_min", "value"};

    private final SymbolicEngine engine;
    private final FinalAnswerParser answerParser;
    private final SampleSource sampleSource;

    public OptimizationVerifier(SymbolicEngine engine, FinalAnswerParser answerParser, SampleSource sampleSource) {
        this.engine = engine;
        this.answerParser = answerParser;
        this.sampleSource = sampleSource;
    }

    /** Single-variable candidate: where it comes from and its abscissa. */
    private record Candidate(String label, double x) {
    }

    @Override
    public VerifierKind kind() {
        return VerifierKind.OPTIMIZATION;
    }

    @Override
    public boolean canHandle(VerificationInput input) {
        if (input.hasCheck() && DirectiveKind.OPTIMIZE.leads(input.check())) {
            return true;
        }
        String t = input.topicOrDirective().toLowerCase(Locale.ROOT);
        return TOPIC_KEYWORDS.stream().anyMatch(t::contains);
    }

    @Override
    public VerificationReport verify(VerificationInput input) {
        VerificationReport rep = new VerificationReport(ReportKind.MIXED, "Vérification Optimisation (symbolique + numérique)");

        if (!input.hasCheck()) {
            rep.add("opt.check_present", false, "CHECK manquant (OPTIMIZE; ... requis)");
            return rep;
        }
        if (!DirectiveKind.OPTIMIZE.leads(input.check())) {
            rep.add("opt.check_format", false, "CHECK invalide. Attendu: OPTIMIZE; var=...; func=...; domain=...; goal=max|min");
            return rep;
        }
        DirectiveParameters directive = DirectiveParameters.parse(input.check());
        rep.add("opt.check_format", true, "CHECK OPTIMIZE parsé");

        String funcText = directive.get("func");
        if (funcText == null) {
            rep.add("opt.func_present", false, "func=... manquant dans CHECK");
            return rep;
        }

        List<String> vars = parseVariables(directive.getOrDefault("var", "x"));
        String goal = directive.getOrDefault("goal", "max").toLowerCase(Locale.ROOT);
        boolean minimize = goal.equals("min");

        Outcome<IExpr> f = engine.parse(funcText);
        if (f.isFailure()) {
            rep.add("opt.func_parse", false, "Impossible de parser func: " + f.error());
            return rep;
        }
        rep.add("opt.func_parse", true, "Fonction parsée");
        rep.detail("vars", vars);
        rep.detail("f", f.value().toString());
        rep.detail("goal", goal);

        if (!input.hasFinalAnswer()) {
            rep.add("opt.final_answer_present", false, "FINAL_ANSWER manquant");
            return rep;
        }
        Optional<FinalAnswer> answer = parseMapping(input.finalAnswer());
        if (answer.isEmpty()) {
            rep.add("opt.final_answer_dict", false, "FINAL_ANSWER doit être un dict (ex: {x_star:..., f_star:...})");
            return rep;
        }
        rep.add("opt.final_answer_dict", true, "FINAL_ANSWER dict OK");

        // claimed point keyed by engine symbol name
        Map<String, IExpr> claimed = new LinkedHashMap<>();
        for (String v : vars) {
            answer.get().entry(v + "_star", v, "arg" + v, v + "*")
                    .ifPresent(value -> claimed.put(ExpressionSyntax.symbolName(v), value));
        }
        if (vars.size() == 1 && claimed.isEmpty()) {
            answer.get().entry("x_star", "argmax", "argmin", "x")
                    .ifPresent(value -> claimed.put(ExpressionSyntax.symbolName(vars.get(0)), value));
        }
        Optional<IExpr> fStarClaimed = answer.get().entry(VALUE_KEYS);

        rep.add("opt.keys_point", claimed.size() == vars.size(), "Point détecté: " + claimed);
        rep.add("opt.keys_f_star", fStarClaimed.isPresent(),
                fStarClaimed.isPresent() ? "Clé f_star/max/min détectée" : "Manque f_star");

        // ── Domain ──
        String domainText = directive.get("domain");
        double[] interval = null;
        List<String> constraintTexts = null;
        if (domainText == null) {
            rep.add("opt.domain_parse", true, "Pas de domaine fourni");
        } else {
            interval = vars.size() == 1 ? parseInterval(domainText) : null;
            if (interval != null) {
                rep.add("opt.domain_parse", true, "Domaine intervalle: [%s, %s]".formatted(format(interval[0]), format(interval[1])));
            } else {
                constraintTexts = parseConstraintList(domainText);
                rep.add("opt.domain_parse", constraintTexts != null, constraintTexts != null
                        ? "Domaine contraintes: %d contraintes".formatted(constraintTexts.size())
                        : "Domaine illisible");
            }
        }

        List<IExpr> constraints = new ArrayList<>();
        if (constraintTexts != null) {
            for (String c : constraintTexts) {
                constraintToExpression(c).ifPresent(constraints::add);
            }
        }

        // ── Feasibility ──
        if (constraintTexts != null && !claimed.isEmpty()) {
            List<String> failed = new ArrayList<>();
            for (int i = 0; i < constraints.size(); i++) {
                Outcome<NumericValue> value = engine.substitute(constraints.get(i), claimed).flatMap(engine::evaluate);
                if (value.isFailure() || value.value().re() > FEASIBILITY_TOLERANCE) {
                    failed.add(constraints.get(i) + (value.isSuccess() ? " = " + format(value.value().re()) : " (?)"));
                }
            }
            rep.add("opt.constraints_parsed", !constraints.isEmpty(), "%d contraintes parsées".formatted(constraints.size()));
            rep.add("opt.feasible", failed.isEmpty(), failed.isEmpty()
                    ? "Faisable"
                    : "Non faisable: " + failed.subList(0, Math.min(3, failed.size())));
        } else {
            rep.add("opt.feasible", true, "Pas de contraintes à vérifier (ou point manquant)");
        }

        // ── Objective at the declared point ──
        Double fClaimed = null;
        if (claimed.isEmpty()) {
            rep.add("opt.eval_f_claimed", false, "Point (x*/y*/z*) manquant dans FINAL_ANSWER");
        } else {
            Outcome<NumericValue> value = engine.substitute(f.value(), claimed).flatMap(engine::evaluate);
            if (value.isSuccess()) {
                fClaimed = value.value().re();
                rep.add("opt.eval_f_claimed", true, "f(point)= " + format(fClaimed));
            } else {
                rep.add("opt.eval_f_claimed", false, "Impossible d'évaluer f au point: " + value.error());
            }
        }

        if (fStarClaimed.isPresent() && fClaimed != null) {
            Outcome<NumericValue> fs = engine.evaluate(fStarClaimed.get());
            if (fs.isSuccess()) {
                double declared = fs.value().re();
                rep.add("opt.compare_f_star", Math.abs(fClaimed - declared) < VALUE_TOLERANCE,
                        "f_star: claimed=%s, computed=%s".formatted(format(declared), format(fClaimed)));
            } else {
                rep.add("opt.compare_f_star", false, "Comparaison f_star impossible (non numérique)");
            }
        } else {
            rep.add("opt.compare_f_star", true, "Comparaison f_star ignorée (manquant)");
        }

        if (vars.size() == 1) {
            verifySingleVariable(rep, f.value(), ExpressionSyntax.symbolName(vars.get(0)), interval, minimize, claimed);
        } else if (!claimed.isEmpty() && fClaimed != null) {
            verifyLocalOptimality(rep, f.value(), claimed, constraints, minimize, fClaimed);
        }

        log.debug("OptimizationVerifier: vars={}, goal={}, ok={}", vars, goal, rep.ok());
        return rep;
    }

    // ── One variable: exact candidate set ────────────────────────────────────

    private void verifySingleVariable(VerificationReport rep, IExpr f, String x, double[] interval,
                                      boolean minimize, Map<String, IExpr> claimed) {
        Outcome<List<IExpr>> critical = engine.differentiate(f, x, 1).flatMap(fp -> engine.roots(fp, x));
        List<IExpr> roots = critical.orElse(List.of());
        if (critical.isSuccess()) {
            rep.add("opt.crit_points", true, "Points critiques: " + roots);
        } else {
            log.warn("OptimizationVerifier: critical points of {} failed: {}", f, critical.error());
            rep.add("opt.crit_points", false, "Erreur dérivée/solve: " + critical.error());
        }

        List<Candidate> candidates = new ArrayList<>();
        if (interval != null) {
            candidates.add(new Candidate(format(interval[0]), interval[0]));
            candidates.add(new Candidate(format(interval[1]), interval[1]));
        }
        for (IExpr root : roots) {
            Outcome<NumericValue> value = engine.evaluate(root);
            if (value.isFailure() || !value.value().isReal(REAL_TOLERANCE)) {
                continue;
            }
            double r = value.value().re();
            if (interval != null && (r < interval[0] - REAL_TOLERANCE || r > interval[1] + REAL_TOLERANCE)) {
                continue;
            }
            candidates.add(new Candidate(root.toString(), r));
        }

        Map<Candidate, Double> evaluated = new LinkedHashMap<>();
        Candidate best = null;
        double bestValue = 0.0;
        for (Candidate c : candidates) {
            Outcome<NumericValue> value = engine.evaluateAt(f, Map.of(x, c.x()));
            if (value.isFailure() || !value.value().isReal(REAL_TOLERANCE)) {
                continue;
            }
            double v = value.value().re();
            evaluated.put(c, v);
            if (best == null || (minimize ? v < bestValue : v > bestValue)) {
                best = c;
                bestValue = v;
            }
        }
        if (best == null) {
            rep.add("opt.best_candidate", false, "Impossible d'évaluer les candidats 1D");
            return;
        }
        rep.detail("x_star_true", best.label());
        rep.detail("f_star_true", format(bestValue));
        rep.add("opt.best_candidate", true, "Best candidate: x*=%s, f*=%s".formatted(best.label(), format(bestValue)));

        IExpr declared = claimed.get(x);
        if (declared == null) {
            rep.add("opt.compare_x", true, "Comparaison x* ignorée (non fourni)");
            return;
        }
        Outcome<NumericValue> xc = engine.evaluate(declared);
        if (xc.isFailure()) {
            rep.add("opt.compare_x", false, "Comparaison x* impossible");
            return;
        }
        // ties: any candidate reaching the optimal value is an acceptable x*
        double claimedX = xc.value().re();
        double optimum = bestValue;
        Optional<Candidate> match = evaluated.entrySet().stream()
                .filter(e -> Math.abs(e.getValue() - optimum) < VALUE_TOLERANCE)
                .map(Map.Entry::getKey)
                .filter(c -> Math.abs(claimedX - c.x()) < POINT_TOLERANCE)
                .findFirst();
        rep.add("opt.compare_x", match.isPresent(), "x*: claimed=%s, true=%s".formatted(
                format(claimedX), format(match.map(Candidate::x).orElse(best.x()))));
    }

    // ── Several variables: random local search ───────────────────────────────

    private void verifyLocalOptimality(VerificationReport rep, IExpr f, Map<String, IExpr> claimed,
                                       List<IExpr> constraints, boolean minimize, double fClaimed) {
        Map<String, Double> base = new LinkedHashMap<>();
        for (Map.Entry<String, IExpr> e : claimed.entrySet()) {
            Outcome<NumericValue> value = engine.evaluate(e.getValue());
            if (value.isFailure()) {
                rep.add("opt.local_check", true, "Test local ignoré (point non numérique)");
                return;
            }
            base.put(e.getKey(), value.value().re());
        }

        Random random = sampleSource.newRandom();
        double radius = sampleSource.radius();
        int tested = 0;
        int improved = 0;
        for (int i = 0; i < sampleSource.neighbors(); i++) {
            Map<String, Double> neighbour = new LinkedHashMap<>();
            base.forEach((k, v) -> neighbour.put(k, v + SampleSource.uniform(random, -radius, radius)));
            if (!isFeasible(constraints, neighbour)) {
                continue;
            }
            tested++;
            Outcome<NumericValue> value = engine.evaluateAt(f, neighbour);
            if (value.isFailure()) {
                continue;
            }
            double fv = value.value().re();
            if (minimize ? fv < fClaimed - IMPROVEMENT_TOLERANCE : fv > fClaimed + IMPROVEMENT_TOLERANCE) {
                improved++;
            }
        }
        rep.add("opt.local_check", improved == 0, tested > 0
                ? "Test local: %d voisins testés, améliorations trouvées=%d (0 attendu)".formatted(tested, improved)
                : "Test local ignoré (aucun voisin faisable)");
    }

    private boolean isFeasible(List<IExpr> constraints, Map<String, Double> point) {
        for (IExpr constraint : constraints) {
            Outcome<NumericValue> value = engine.evaluateAt(constraint, point);
            if (value.isFailure() || value.value().re() > FEASIBILITY_TOLERANCE) {
                return false;
            }
        }
        return true;
    }

    // ── Parsing ──────────────────────────────────────────────────────────────

    private Optional<FinalAnswer> parseMapping(String text) {
        Outcome<FinalAnswer> direct = answerParser.parse(text);
        if (direct.isSuccess() && direct.value().isMapping()) {
            return Optional.of(direct.value());
        }
        Outcome<FinalAnswer> embedded = answerParser.parseMappingIn(text);
        return embedded.isSuccess() ? Optional.of(embedded.value()) : Optional.empty();
    }

    /** {@code x} or {@code [x, y, z]}. */
    static List<String> parseVariables(String field) {
        String v = field.strip();
        if (v.startsWith("[") && v.endsWith("]")) {
            List<String> names = ExpressionSyntax.splitTopLevel(v.substring(1, v.length() - 1), ',');
            return names.isEmpty() ? List.of("x") : names;
        }
        return List.of(v);
    }

    /** {@code [a, b]} with numeric bounds, sorted; null otherwise. */
    static double[] parseInterval(String domain) {
        Matcher m = INTERVAL.matcher(domain.strip());
        if (!m.matches()) {
            return null;
        }
        double a = Double.parseDouble(m.group(1));
        double b = Double.parseDouble(m.group(3));
        return new double[]{Math.min(a, b), Math.max(a, b)};
    }

    /** {@code [c1, c2, ...]} as constraint strings; null when not bracketed. */
    static List<String> parseConstraintList(String domain) {
        String s = domain.strip();
        if (!s.startsWith("[") || !s.endsWith("]")) {
            return null;
        }
        return ExpressionSyntax.splitTopLevel(s.substring(1, s.length() - 1), ',');
    }

    /**
     * Expression that must be {@code <= 0}: {@code a <= b} gives {@code a - b},
     * {@code a >= b} gives {@code b - a}, {@code a = b} gives {@code |a - b|}.
     */
    Optional<IExpr> constraintToExpression(String constraint) {
        String c = constraint.replace("≤", "<=").replace("≥", ">=");
        String text;
        int le = c.indexOf("<=");
        int ge = c.indexOf(">=");
        int eq = c.indexOf('=');
        if (le >= 0) {
            text = "(" + c.substring(0, le) + ")-(" + c.substring(le + 2) + ")";
        } else if (ge >= 0) {
            text = "(" + c.substring(ge + 2) + ")-(" + c.substring(0, ge) + ")";
        } else if (eq >= 0) {
            String rhs = c.substring(c.startsWith("==", eq) ? eq + 2 : eq + 1);
            text = "Abs((" + c.substring(0, eq) + ")-(" + rhs + "))";
        } else {
            return Optional.empty();
        }
        Outcome<IExpr> expr = engine.parse(text);
        if (expr.isFailure()) {
            log.debug("OptimizationVerifier: constraint '{}' ignored: {}", constraint, expr.error());
            return Optional.empty();
        }
        return Optional.of(expr.value());
    }

    private static String format(double value) {
        if (value == Math.rint(value) && Math.abs(value) < 1e15) {
            return Long.toString((long) value);
        }
        return String.format(Locale.ROOT, "%.6g", value);
    }
}

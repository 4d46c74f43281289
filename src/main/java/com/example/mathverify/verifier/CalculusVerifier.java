package com.example.mathverify.verifier;

import com.example.mathverify.model.CheckItem;
import com.example.mathverify.model.DirectiveKind;
import com.example.mathverify.model.NumericValue;
import com.example.mathverify.model.Outcome;
import com.example.mathverify.model.ReportKind;
import com.example.mathverify.model.VerificationInput;
import com.example.mathverify.model.VerificationReport;
import com.example.mathverify.model.VerifierKind;
import com.example.mathverify.service.ExpressionSyntax;
import com.example.mathverify.service.SampleSource;
import com.example.mathverify.service.SymbolicEngine;
import org.matheclipse.core.interfaces.IExpr;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.Set;

/**
 * Derivatives, antiderivatives and limits.
 * <p>
 * Directive forms:
 * <pre>
 *   DERIVATIVE; var=x; func=x**3+2*x
 *   INTEGRAL; var=x; integrand=x**2+1
 *   LIMIT; var=x; expr=sin(x)/x; point=0
 * </pre>
 * Without a directive the CHECK holds the function (derivative), the integrand (integral)
 * or a {@code limit(expr, x, point)} call, and the branch is chosen from the topic.
 * Symbolic comparisons are corroborated by sampling the residual numerically.
 */
@Service
public class CalculusVerifier implements DomainVerifier {

    private static final Logger log = LoggerFactory.getLogger(CalculusVerifier.class);

    private static final Set<String> DIRECTIVES = Set.of("DERIVATIVE", "INTEGRAL", "LIMIT");

    private static final List<String> TOPIC_KEYWORDS = List.of(
            "dériv", "derive", "intégr", "integr", "limite", "limit");

    private static final List<String> SECOND_DERIVATIVE_MARKERS = List.of(
            "f''", "f’’", "secondederivee", "secondedérivée", "seconddérivée", "secondderivative");

    /** Offsets around a finite limit point. */
    private static final double[] LIMIT_EPSILONS = {1e-2, 1e-3, 1e-4};

    /** Magnitudes sampled for a limit at infinity. */
    private static final double[] LIMIT_MAGNITUDES = {1e4, 1e5, 1e6};

    private static final double LIMIT_TOLERANCE = 1e-2;

    private final SymbolicEngine engine;
    private final SampleSource sampleSource;

    public CalculusVerifier(SymbolicEngine engine, SampleSource sampleSource) {
        this.engine = engine;
        this.sampleSource = sampleSource;
    }

    @Override
    public VerifierKind kind() {
        return VerifierKind.CALCULUS;
    }

    @Override
    public boolean canHandle(VerificationInput input) {
        if (input.hasCheck() && DIRECTIVES.contains(DirectiveParameters.parse(input.check()).head())) {
            return input.hasFinalAnswer();
        }
        String t = input.topicOrDirective().toLowerCase(Locale.ROOT);
        return TOPIC_KEYWORDS.stream().anyMatch(t::contains) && input.hasFinalAnswer();
    }

    @Override
    public VerificationReport verify(VerificationInput input) {
        VerificationReport rep = new VerificationReport(ReportKind.MIXED, "Vérification Calcul (dérivée/intégrale/limite)");

        rep.add("structure.final_answer_present", input.hasFinalAnswer(),
                input.hasFinalAnswer() ? "FINAL_ANSWER présent" : "FINAL_ANSWER manquant");
        if (!input.hasFinalAnswer()) {
            return rep;
        }

        DirectiveParameters directive = DirectiveParameters.parse(input.check());
        boolean directed = input.hasCheck() && DirectiveKind.classify(input.check()).isPresent();
        if (input.hasCheck()) {
            rep.add("parse.check_directive", !directed || DIRECTIVES.contains(directive.head()),
                    directed ? "Directive CHECK: " + directive.head() : "CHECK non-directive (mode ancien)");
        }

        String var = ExpressionSyntax.symbolName(directive.getOrDefault("var", "x"));
        int order = derivativeOrder(input.statement());

        Outcome<IExpr> answer = engine.parse(input.finalAnswer());
        if (answer.isFailure()) {
            rep.add("parse.final_answer", false, "FINAL_ANSWER non parsable: " + answer.error());
            return rep;
        }
        rep.add("parse.final_answer", true, "FINAL_ANSWER parsé");

        String head = directed ? directive.head() : "";
        // a directive selects exactly one branch; the topic only decides in the old mode
        String topic = directed ? "" : input.topic().toLowerCase(Locale.ROOT);

        if ("DERIVATIVE".equals(head) || topic.contains("dériv") || topic.contains("derive")) {
            verifyDerivative(rep, input.check(), directive, var, order, answer.value());
        }
        if ("INTEGRAL".equals(head) || topic.contains("intégr") || topic.contains("integr")) {
            verifyIntegral(rep, input.check(), directive, var, answer.value());
        }
        if ("LIMIT".equals(head) || topic.contains("limite") || topic.contains("limit")) {
            verifyLimit(rep, input.check(), directive, var, answer.value());
        }
        log.debug("CalculusVerifier: directive={}, order={}, ok={}", head, order, rep.ok());
        return rep;
    }

    static int derivativeOrder(String statement) {
        String en = statement == null ? "" : statement.replace(" ", "").toLowerCase(Locale.ROOT);
        return SECOND_DERIVATIVE_MARKERS.stream().anyMatch(en::contains) ? 2 : 1;
    }

    // ── DERIVATIVE ───────────────────────────────────────────────────────────

    private void verifyDerivative(VerificationReport rep, String check, DirectiveParameters directive,
                                  String var, int order, IExpr answer) {
        String funcText = directive.get("func");
        String mode = "directive";
        if (funcText == null) {
            Optional<String> legacy = legacyExpression(check);
            if (legacy.isEmpty()) {
                rep.add("symbolic.derivative", false, "CHECK doit contenir f(x) ou directive DERIVATIVE; var=..; func=..");
                return;
            }
            funcText = legacy.get();
            mode = "old mode";
        }

        Outcome<IExpr> residual = engine.parse(funcText)
                .flatMap(f -> engine.differentiate(f, var, order))
                .flatMap(target -> engine.subtract(target, answer));
        if (residual.isFailure()) {
            log.warn("CalculusVerifier: derivative of '{}' failed: {}", funcText, residual.error());
            rep.add("symbolic.derivative", false, "Erreur DERIVATIVE: " + residual.error());
            return;
        }
        boolean ok = engine.isZero(residual.value()).orElse(false);
        rep.add("symbolic.derivative", ok, "Symbolique: d^%d/dx^%d(func) == FINAL_ANSWER (%s)".formatted(order, order, mode));
        rep.add(sampleResidual("numeric.derivative", residual.value(), var, funcText));
    }

    // ── INTEGRAL ─────────────────────────────────────────────────────────────

    private void verifyIntegral(VerificationReport rep, String check, DirectiveParameters directive,
                                String var, IExpr answer) {
        String integrandText = directive.get("integrand");
        String mode = "directive";
        if (integrandText == null) {
            Optional<String> legacy = legacyExpression(check);
            if (legacy.isEmpty()) {
                rep.add("symbolic.integral", false, "CHECK doit contenir integrand ou directive INTEGRAL; var=..; integrand=..");
                return;
            }
            integrandText = legacy.get();
            mode = "old mode";
        }

        Outcome<IExpr> integrand = engine.parse(integrandText);
        Outcome<IExpr> residual = integrand
                .flatMap(g -> engine.differentiate(answer, var, 1).flatMap(d -> engine.subtract(d, g)));
        if (residual.isFailure()) {
            log.warn("CalculusVerifier: integral check on '{}' failed: {}", integrandText, residual.error());
            rep.add("symbolic.integral", false, "Erreur INTEGRAL: " + residual.error());
            return;
        }
        boolean ok = engine.isZero(residual.value()).orElse(false);
        rep.add("symbolic.integral", ok, "Symbolique: d/dx(FINAL_ANSWER) == integrand (%s)".formatted(mode));
        rep.add(sampleResidual("numeric.integral", residual.value(), var, integrandText));
    }

    // ── LIMIT ────────────────────────────────────────────────────────────────

    private void verifyLimit(VerificationReport rep, String check, DirectiveParameters directive,
                             String var, IExpr answer) {
        String exprText = directive.get("expr");
        String pointText = directive.get("point");
        if (exprText == null || pointText == null) {
            verifyLegacyLimit(rep, check, answer);
            return;
        }

        Outcome<IExpr> expr = engine.parse(exprText);
        Outcome<IExpr> point = engine.parse(pointText);
        Outcome<IExpr> limit = expr.flatMap(e -> point.flatMap(p -> engine.limit(e, var, p)));
        if (limit.isFailure()) {
            log.warn("CalculusVerifier: limit of '{}' at {} failed: {}", exprText, pointText, limit.error());
            rep.add("symbolic.limit", false, "Erreur LIMIT: " + limit.error());
            return;
        }
        boolean ok = engine.subtract(limit.value(), answer).flatMap(engine::isZero).orElse(false);
        rep.add("symbolic.limit", ok, "Symbolique: limit(expr,%s->%s) == FINAL_ANSWER".formatted(var, pointText));

        Outcome<NumericValue> target = engine.evaluate(answer);
        if (target.isFailure()) {
            rep.add("numeric.limit", false, "Erreur numeric limit: " + target.error());
            return;
        }
        double[] samples = limitSamples(pointText, point.value());
        if (samples.length == 0) {
            rep.add("numeric.limit", false, "Erreur numeric limit: point non numérique " + pointText);
            return;
        }
        boolean converges = true;
        for (double s : samples) {
            Outcome<NumericValue> v = engine.evaluateAt(expr.value(), Map.of(var, s));
            if (v.isFailure()) {
                rep.add("numeric.limit", false, "Erreur numeric limit: " + v.error());
                return;
            }
            converges = converges && v.value().minus(target.value()).magnitude() < LIMIT_TOLERANCE;
        }
        rep.add("numeric.limit", converges, converges
                ? "Numérique: approche ±ε cohérente"
                : "Numérique: l'expression ne s'approche pas de FINAL_ANSWER");
    }

    private void verifyLegacyLimit(VerificationReport rep, String check, IExpr answer) {
        String s = check == null ? "" : check.strip();
        if (DirectiveKind.LIMIT.leads(s)) {
            s = s.split(";", 2)[1].strip();
        }
        if (s.isEmpty()) {
            rep.add("symbolic.limit", false, "CHECK limit(...) ou directive LIMIT manquante");
            return;
        }

        String body = s;
        Optional<List<String>> call = ExpressionSyntax.callArguments(body, "limit")
                .or(() -> ExpressionSyntax.callArguments(body, "Limit"));
        Outcome<IExpr> value;
        if (call.isPresent() && call.get().size() == 3) {
            List<String> args = call.get();
            String v = ExpressionSyntax.symbolName(args.get(1));
            value = engine.parse(args.get(0))
                    .flatMap(e -> engine.parse(args.get(2)).flatMap(p -> engine.limit(e, v, p)));
        } else {
            value = engine.parse(body);
        }
        if (value.isFailure()) {
            rep.add("symbolic.limit", false, "Erreur old limit: " + value.error());
            return;
        }
        boolean ok = engine.subtract(value.value(), answer).flatMap(engine::isZero).orElse(false);
        rep.add("symbolic.limit", ok, "Symbolique: limite == FINAL_ANSWER (old mode)");
    }

    private double[] limitSamples(String pointText, IExpr point) {
        String p = pointText.strip().toLowerCase(Locale.ROOT);
        if (p.equals("oo") || p.equals("+oo") || p.equals("infinity") || p.equals("+infinity")) {
            return LIMIT_MAGNITUDES.clone();
        }
        if (p.equals("-oo") || p.equals("-infinity")) {
            double[] out = new double[LIMIT_MAGNITUDES.length];
            for (int i = 0; i < out.length; i++) {
                out[i] = -LIMIT_MAGNITUDES[i];
            }
            return out;
        }
        Outcome<NumericValue> value = engine.evaluate(point);
        if (value.isFailure()) {
            return new double[0];
        }
        double center = value.value().re();
        double[] out = new double[LIMIT_EPSILONS.length * 2];
        for (int i = 0; i < LIMIT_EPSILONS.length; i++) {
            out[2 * i] = center + LIMIT_EPSILONS[i];
            out[2 * i + 1] = center - LIMIT_EPSILONS[i];
        }
        return out;
    }

    // ── Shared ───────────────────────────────────────────────────────────────

    /** CHECK content usable as a bare expression, i.e. neither a directive nor an equality. */
    private static Optional<String> legacyExpression(String check) {
        if (check == null || check.isBlank()) {
            return Optional.empty();
        }
        String s = check.strip();
        if (s.contains(";") || ExpressionSyntax.splitEquality(s).isPresent()) {
            return Optional.empty();
        }
        return Optional.of(s);
    }

    /**
     * Evaluates the residual at seeded random points. Points outside the expression's
     * domain are skipped; at least one point must evaluate.
     */
    private CheckItem sampleResidual(String name, IExpr residual, String var, String sourceText) {
        String lower = sourceText.toLowerCase(Locale.ROOT);
        boolean positiveOnly = lower.contains("log(") || lower.contains("ln(") || lower.contains("sqrt(");
        Random random = sampleSource.newRandom();

        int evaluated = 0;
        int mismatches = 0;
        String lastError = null;
        for (int i = 0; i < sampleSource.samples(); i++) {
            double x = positiveOnly
                    ? SampleSource.uniform(random, 0.2, 3.0)
                    : SampleSource.uniform(random, -3.0, 3.0);
            Outcome<NumericValue> value = engine.evaluateAt(residual, Map.of(var, x));
            if (value.isFailure()) {
                lastError = value.error();
                continue;
            }
            evaluated++;
            if (value.value().magnitude() >= sampleSource.tolerance()) {
                mismatches++;
            }
        }
        if (evaluated == 0) {
            return new CheckItem(name, false, "Erreur numeric: aucun échantillon évaluable (" + lastError + ")");
        }
        return new CheckItem(name, mismatches == 0,
                "Numérique: diff ~ 0 sur échantillons (%d/%d évalués, %d écarts)"
                        .formatted(evaluated, sampleSource.samples(), mismatches));
    }
}

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
import java.util.TreeSet;

/**
 * Equalities and systems of equalities.
 * <ul>
 *   <li>{@code CHECK: Eq(2*x+1, 5)}: every declared root must cancel the residual</li>
 *   <li>{@code CHECK: SYSTEM; Eq(x+y, 1); Eq(x-y, 3)}: the declared mapping must satisfy every equality</li>
 * </ul>
 */
@Service
public class EquationsSystemVerifier implements DomainVerifier {

    private static final Logger log = LoggerFactory.getLogger(EquationsSystemVerifier.class);

    private static final List<String> TOPIC_KEYWORDS = List.of(
            "équation", "equation", "système", "systeme", "arithmétique", "arithmetique");

    /** Maximum residual magnitude at a declared root. */
    private static final double ROOT_TOLERANCE = 1e-6;

    private static final int SANITY_SAMPLES = 5;

    private final SymbolicEngine engine;
    private final FinalAnswerParser answerParser;
    private final SampleSource sampleSource;

    public EquationsSystemVerifier(SymbolicEngine engine, FinalAnswerParser answerParser, SampleSource sampleSource) {
        this.engine = engine;
        this.answerParser = answerParser;
        this.sampleSource = sampleSource;
    }

    @Override
    public VerifierKind kind() {
        return VerifierKind.EQUATIONS_SYSTEM;
    }

    @Override
    public boolean canHandle(VerificationInput input) {
        if (input.hasCheck()) {
            String check = input.check().strip();
            if (DirectiveKind.SYSTEM.leads(check) || check.startsWith("Eq(") || check.startsWith("Eq ")) {
                return true;
            }
        }
        String t = input.topicOrDirective().toLowerCase(Locale.ROOT);
        return TOPIC_KEYWORDS.stream().anyMatch(t::contains);
    }

    @Override
    public VerificationReport verify(VerificationInput input) {
        VerificationReport rep = new VerificationReport(ReportKind.MIXED, "Vérification Algèbre (Eq / Système)");

        rep.add("structure.final_answer_present", input.hasFinalAnswer(),
                input.hasFinalAnswer() ? "FINAL_ANSWER présent" : "FINAL_ANSWER manquant");
        if (!input.hasCheck()) {
            rep.add("structure.check_present", false, "CHECK manquant (Eq(...) ou SYSTEM; Eq(...); ...)");
            return rep;
        }

        Outcome<FinalAnswer> answer = answerParser.parse(input.finalAnswer());
        rep.add("parse.final_answer", answer.isSuccess(),
                answer.isSuccess() ? "FINAL_ANSWER parsé" : "FINAL_ANSWER non parsable: " + answer.error());

        if (DirectiveKind.SYSTEM.leads(input.check())) {
            verifySystem(rep, input.check(), answer);
        } else {
            verifyEquation(rep, input.check(), answer);
        }
        log.debug("EquationsSystemVerifier: ok={} ({} items)", rep.ok(), rep.items().size());
        return rep;
    }

    // ── SYSTEM; Eq(...); Eq(...) ─────────────────────────────────────────────

    private void verifySystem(VerificationReport rep, String check, Outcome<FinalAnswer> answer) {
        List<String> parts = ExpressionSyntax.splitTopLevel(check.strip(), ';');
        List<String> equations = parts.subList(1, parts.size());
        if (equations.isEmpty()) {
            rep.add("parse.system", false, "Aucune équation trouvée après SYSTEM;");
            return;
        }

        List<IExpr> residuals = new ArrayList<>();
        for (String eq : equations) {
            Optional<ExpressionSyntax.Equation> equation = ExpressionSyntax.splitEquality(eq);
            if (equation.isEmpty()) {
                rep.add("parse.system", false, "Erreur parsing SYSTEM: pas une égalité: " + eq);
                return;
            }
            Outcome<IExpr> residual = engine.residual(equation.get());
            if (residual.isFailure()) {
                rep.add("parse.system", false, "Erreur parsing SYSTEM: " + residual.error());
                return;
            }
            residuals.add(residual.value());
        }
        rep.add("parse.system", true, "%d équations parsées".formatted(residuals.size()));

        TreeSet<String> symbols = new TreeSet<>();
        for (IExpr residual : residuals) {
            Outcome<List<String>> vars = engine.freeVariables(residual);
            if (vars.isSuccess()) {
                symbols.addAll(vars.value());
            }
        }
        List<String> variables = new ArrayList<>(symbols);
        rep.detail("system_symbols", variables);
        if (variables.isEmpty()) {
            rep.add("symbolic.system_symbols", false, "Aucune variable détectée dans le système");
            return;
        }
        rep.add("symbolic.system_symbols", true, "Variables: " + String.join(", ", variables));

        Outcome<List<Map<String, IExpr>>> solutions = engine.solve(residuals, variables);
        if (solutions.isFailure()) {
            log.warn("EquationsSystemVerifier: solve failed: {}", solutions.error());
            rep.add("symbolic.system_solve", false, "Erreur solve(): " + solutions.error());
            return;
        }
        List<String> printed = solutions.value().stream().map(Object::toString).toList();
        rep.detail("system_solutions", printed);
        rep.add("symbolic.system_solve", !printed.isEmpty(),
                printed.isEmpty() ? "Aucune solution trouvée" : "Solutions: " + printed);

        if (answer.isFailure() || !answer.value().isMapping()) {
            rep.add("compare.final_answer_mapping", false,
                    "FINAL_ANSWER attendu comme dict pour un système (ex: {x:2, y:3})");
        } else {
            Map<String, IExpr> mapping = symbolMapping(answer.value());
            boolean allOk = true;
            String error = null;
            for (IExpr residual : residuals) {
                Outcome<Boolean> zero = engine.substitute(residual, mapping).flatMap(engine::isZero);
                if (zero.isFailure()) {
                    error = zero.error();
                    break;
                }
                allOk = allOk && zero.value();
            }
            if (error != null) {
                rep.add("symbolic.system_substitution", false, "Erreur substitution: " + error);
            } else {
                rep.add("symbolic.system_substitution", allOk, allOk
                        ? "Substitution: FINAL_ANSWER satisfait le système"
                        : "Substitution: FINAL_ANSWER ne satisfait pas le système");
            }
        }

        // sanity only: the first residual must be evaluable somewhere
        Map<String, Double> point = new LinkedHashMap<>();
        Random random = sampleSource.newRandom();
        for (String v : variables) {
            point.put(v, SampleSource.uniform(random, -5, 5));
        }
        boolean evaluable = engine.evaluateAt(residuals.get(0), point).isSuccess();
        rep.add("numeric.eval", true,
                evaluable ? "Évaluation numérique OK (sanity)" : "Évaluation numérique ignorée (pas nécessaire)");
    }

    // ── Eq(lhs, rhs) ─────────────────────────────────────────────────────────

    private void verifyEquation(VerificationReport rep, String check, Outcome<FinalAnswer> answer) {
        Optional<ExpressionSyntax.Equation> equation = ExpressionSyntax.splitEquality(check);
        if (equation.isEmpty()) {
            rep.add("parse.check", false, "CHECK n'est pas Eq(...)");
            rep.add("symbolic.substitution", false, "CHECK doit être Eq(...) ou SYSTEM; ...");
            return;
        }
        Outcome<IExpr> residual = engine.residual(equation.get()).flatMap(engine::simplify);
        if (residual.isFailure()) {
            rep.add("parse.check", false, "CHECK non parsable: " + residual.error());
            return;
        }
        rep.add("parse.check", true, "CHECK parsé (Eq)");

        List<String> symbols = engine.freeVariables(residual.value()).orElse(List.of());
        rep.detail("eq_symbols", symbols);

        if (symbols.isEmpty()) {
            boolean holds = engine.isZero(residual.value()).orElse(false);
            rep.add("symbolic.eq_constant", holds, holds ? "Eq constante vraie" : "Eq constante fausse");
            return;
        }

        String x = symbols.get(0);
        rep.add("symbolic.variable_guess", true, "Variable utilisée: " + x);

        List<IExpr> roots = answer.isFailure() ? List.of() : rootsFor(answer.value(), x);
        if (roots.isEmpty()) {
            rep.add("symbolic.substitution", false, "Aucune solution exploitable dans FINAL_ANSWER");
            return;
        }

        boolean allOk = true;
        for (IExpr root : roots) {
            Outcome<NumericValue> value = engine.substitute(residual.value(), Map.of(x, root))
                    .flatMap(engine::evaluate);
            allOk = allOk && value.isSuccess() && value.value().magnitude() < ROOT_TOLERANCE;
        }
        rep.add("symbolic.substitution", allOk, allOk
                ? "Substitution: solutions satisfont Eq(...)"
                : "Substitution: au moins une solution ne satisfait pas Eq(...)");

        Random random = sampleSource.newRandom();
        String lastError = null;
        int evaluated = 0;
        for (int i = 0; i < SANITY_SAMPLES; i++) {
            Map<String, Double> point = new LinkedHashMap<>();
            for (String v : symbols) {
                point.put(v, SampleSource.uniform(random, -5, 5));
            }
            Outcome<NumericValue> value = engine.evaluateAt(residual.value(), point);
            if (value.isSuccess()) {
                evaluated++;
            } else {
                lastError = value.error();
            }
        }
        rep.add("numeric.eval", evaluated > 0, evaluated > 0
                ? "Évaluation numérique OK (%d/%d échantillons)".formatted(evaluated, SANITY_SAMPLES)
                : "Évaluation numérique échouée: " + lastError);
    }

    private static List<IExpr> rootsFor(FinalAnswer answer, String variable) {
        if (answer.isMapping()) {
            return answer.entry(variable).map(List::of).orElse(List.of());
        }
        return answer.candidates();
    }

    private static Map<String, IExpr> symbolMapping(FinalAnswer answer) {
        Map<String, IExpr> mapping = new LinkedHashMap<>();
        answer.entries().forEach((k, v) -> mapping.put(ExpressionSyntax.symbolName(k), v));
        return mapping;
    }
}

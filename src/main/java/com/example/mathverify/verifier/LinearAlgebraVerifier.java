package com.example.mathverify.verifier;

import com.example.mathverify.model.Outcome;
import com.example.mathverify.model.ReportKind;
import com.example.mathverify.model.VerificationInput;
import com.example.mathverify.model.VerificationReport;
import com.example.mathverify.model.VerifierKind;
import com.example.mathverify.service.ExpressionSyntax;
import com.example.mathverify.service.SymbolicEngine;
import org.matheclipse.core.interfaces.IExpr;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Matrix and determinant identities, e.g. {@code Eq(det(Matrix([[1, 2], [3, 4]])), -2)}.
 * A matrix residual is zero when every entry simplifies to zero.
 */
@Service
public class LinearAlgebraVerifier implements DomainVerifier {

    private static final Logger log = LoggerFactory.getLogger(LinearAlgebraVerifier.class);

    private static final List<String> TOPIC_KEYWORDS = List.of(
            "matrice", "matrix", "déterminant", "determinant", "vecteur", "espace");

    private final SymbolicEngine engine;

    public LinearAlgebraVerifier(SymbolicEngine engine) {
        this.engine = engine;
    }

    @Override
    public VerifierKind kind() {
        return VerifierKind.LINEAR_ALGEBRA;
    }

    @Override
    public boolean canHandle(VerificationInput input) {
        String t = input.topicOrDirective().toLowerCase(Locale.ROOT);
        return TOPIC_KEYWORDS.stream().anyMatch(t::contains) && input.hasFinalAnswer();
    }

    @Override
    public VerificationReport verify(VerificationInput input) {
        VerificationReport rep = new VerificationReport(ReportKind.SYMBOLIC, "Vérification Algèbre linéaire");

        Outcome<IExpr> answer = engine.parse(input.finalAnswer());
        if (answer.isFailure()) {
            rep.add("parse.final_answer", false, "FINAL_ANSWER non parsable: " + answer.error());
            return rep;
        }
        rep.add("parse.final_answer", true, "FINAL_ANSWER parsé");

        if (!input.hasCheck()) {
            rep.add("parse.check", true, "CHECK absent (OK)");
            return rep;
        }

        Optional<ExpressionSyntax.Equation> equation = ExpressionSyntax.splitEquality(input.check());
        Outcome<IExpr> check = equation.isPresent()
                ? engine.residual(equation.get())
                : engine.parse(input.check());
        if (check.isFailure()) {
            rep.add("parse.check", false, "CHECK non parsable: " + check.error());
            return rep;
        }
        rep.add("parse.check", true, "CHECK parsé");

        Outcome<Boolean> zero = engine.isZero(check.value());
        boolean ok = zero.orElse(false);
        if (equation.isPresent()) {
            rep.add("symbolic.check_eq", ok, "CHECK Eq vérifiée symboliquement");
        } else {
            rep.add("symbolic.check_expr", ok, "CHECK expression == 0");
        }
        log.debug("LinearAlgebraVerifier: residual={}, ok={}", check.value(), ok);
        return rep;
    }
}

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
 * Identities over the complex numbers. Both {@code I} and {@code i} denote the
 * imaginary unit; {@code ^} and {@code **} both mean power.
 */
@Service
public class ComplexNumbersVerifier implements DomainVerifier {

    private static final Logger log = LoggerFactory.getLogger(ComplexNumbersVerifier.class);

    private static final List<String> TOPIC_KEYWORDS = List.of("complex", "complexe", "affixe", "imaginaire");

    private final SymbolicEngine engine;

    public ComplexNumbersVerifier(SymbolicEngine engine) {
        this.engine = engine;
    }

    @Override
    public VerifierKind kind() {
        return VerifierKind.COMPLEX_NUMBERS;
    }

    @Override
    public boolean canHandle(VerificationInput input) {
        String t = input.topicOrDirective().toLowerCase(Locale.ROOT);
        return TOPIC_KEYWORDS.stream().anyMatch(t::contains) && input.hasFinalAnswer();
    }

    @Override
    public VerificationReport verify(VerificationInput input) {
        VerificationReport rep = new VerificationReport(ReportKind.MIXED, "Vérification Nombres complexes");

        Outcome<IExpr> answer = engine.parseComplex(input.finalAnswer());
        if (answer.isFailure()) {
            rep.add("parse.final_answer", false, "FINAL_ANSWER non parsable: " + answer.error());
            return rep;
        }
        rep.add("parse.final_answer", true, "FINAL_ANSWER parsé");

        if (!input.hasCheck()) {
            rep.add("parse.check", true, "CHECK absent (OK)");
            return rep;
        }

        String check = input.check().strip();
        Optional<ExpressionSyntax.Equation> equation = ExpressionSyntax.splitEquality(check);
        Outcome<IExpr> parsed = equation.isPresent()
                ? engine.parseComplex(equation.get().residual())
                : engine.parseComplex(check);
        if (parsed.isFailure()) {
            rep.add("parse.check", false, "CHECK non parsable: " + parsed.error());
            return rep;
        }
        rep.add("parse.check", true, "CHECK parsé");

        IExpr value = parsed.value();
        if (equation.isPresent()) {
            rep.add("symbolic.check_eq", engine.isZero(value).orElse(false), "CHECK Eq vérifiée");
        } else if (value.isTrue()) {
            rep.add("symbolic.check_bool", true, "CHECK évalué à True");
        } else if (value.isFalse()) {
            rep.add("symbolic.check_bool", false, "CHECK évalué à False");
        } else {
            rep.add("symbolic.check_expr", engine.isZero(value).orElse(false), "CHECK expression == 0");
        }
        log.debug("ComplexNumbersVerifier: check={}, ok={}", value, rep.ok());
        return rep;
    }
}

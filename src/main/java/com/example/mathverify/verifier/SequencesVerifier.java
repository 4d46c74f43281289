package com.example.mathverify.verifier;

import com.example.mathverify.model.FinalAnswer;
import com.example.mathverify.model.Outcome;
import com.example.mathverify.model.ReportKind;
import com.example.mathverify.model.VerificationInput;
import com.example.mathverify.model.VerificationReport;
import com.example.mathverify.model.VerifierKind;
import com.example.mathverify.service.ExpressionSyntax;
import com.example.mathverify.service.FinalAnswerParser;
import com.example.mathverify.service.SymbolicEngine;
import org.matheclipse.core.interfaces.IExpr;
import org.springframework.stereotype.Service;

import java.util.Locale;

/**
 * Sequences: only checks that the declared terms parse. An equality-shaped
 * recurrence in CHECK is recognized but not replayed against the terms.
 */
@Service
public class SequencesVerifier implements DomainVerifier {

    private final SymbolicEngine engine;
    private final FinalAnswerParser answerParser;

    public SequencesVerifier(SymbolicEngine engine, FinalAnswerParser answerParser) {
        this.engine = engine;
        this.answerParser = answerParser;
    }

    @Override
    public VerifierKind kind() {
        return VerifierKind.SEQUENCES;
    }

    @Override
    public boolean canHandle(VerificationInput input) {
        String t = input.topicOrDirective().toLowerCase(Locale.ROOT);
        return (t.contains("suite") || t.contains("sequence")) && input.hasFinalAnswer();
    }

    @Override
    public VerificationReport verify(VerificationInput input) {
        VerificationReport rep = new VerificationReport(ReportKind.MIXED, "Vérification Suites (premiers termes / formule)");

        if (!input.hasFinalAnswer()) {
            rep.add("parse.final_answer", false, "FINAL_ANSWER manquant");
            return rep;
        }
        rep.add("parse.final_answer", true, "FINAL_ANSWER présent");

        boolean recurrence = false;
        if (input.hasCheck()) {
            recurrence = ExpressionSyntax.splitEquality(input.check()).isPresent();
            Outcome<IExpr> check = recurrence
                    ? engine.residual(ExpressionSyntax.splitEquality(input.check()).get())
                    : engine.parse(input.check());
            rep.add("parse.check", check.isSuccess(), check.isSuccess() ? "CHECK parsé" : "CHECK non parsable (optionnel)");
        }

        Outcome<FinalAnswer> answer = answerParser.parse(input.finalAnswer());
        if (answer.isFailure()) {
            rep.add("parse.final_answer_sympy", false, "FINAL_ANSWER non parsable (ex: {u0:1, u1:2})");
            return rep;
        }
        rep.add("parse.final_answer_sympy", true, "FINAL_ANSWER parsé (symbolique)");

        // TODO replay an Eq(u(n+1), ...) recurrence against the first declared terms
        rep.add("symbolic.sequence_recurrence", true, recurrence
                ? "Récurrence détectée (Eq), extension possible"
                : "Pas de CHECK Eq, validation limitée (OK)");
        return rep;
    }
}

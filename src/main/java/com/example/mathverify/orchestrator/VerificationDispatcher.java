package com.example.mathverify.orchestrator;

import com.example.mathverify.model.AutoFix;
import com.example.mathverify.model.CheckItem;
import com.example.mathverify.model.DirectiveKind;
import com.example.mathverify.model.NormalizedSolution;
import com.example.mathverify.model.ReportKind;
import com.example.mathverify.model.VerificationInput;
import com.example.mathverify.model.VerificationReport;
import com.example.mathverify.model.VerifierKind;
import com.example.mathverify.service.BlockParser;
import com.example.mathverify.service.StructuralChecker;
import com.example.mathverify.service.SymbolicEngine;
import com.example.mathverify.verifier.CalculusVerifier;
import com.example.mathverify.verifier.ComplexNumbersVerifier;
import com.example.mathverify.verifier.DomainVerifier;
import com.example.mathverify.verifier.EquationsSystemVerifier;
import com.example.mathverify.verifier.LinearAlgebraVerifier;
import com.example.mathverify.verifier.OptimizationVerifier;
import com.example.mathverify.verifier.SequencesVerifier;
import com.example.mathverify.verifier.StatisticsVerifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Verification pipeline:
 * 1. Extract FINAL_ANSWER and CHECK from the solution text
 * 2. Structural checks (statement length, ellipsis placeholders)
 * 3. Directive classification of CHECK
 * 4. Verifier selection: directive mode runs the first accepting verifier only,
 *    topic mode runs every accepting verifier
 * 5. Aggregation of structural and verifier items into one report
 * <p>
 * The text is verified as given; normalization is a separate, explicit step
 * ({@link #verify(String, NormalizedSolution)}).
 */
@Service
public class VerificationDispatcher {

    private static final Logger log = LoggerFactory.getLogger(VerificationDispatcher.class);

    private final BlockParser blockParser;
    private final StructuralChecker structuralChecker;
    private final SymbolicEngine engine;
    private final EquationsSystemVerifier equationsSystemVerifier;
    private final CalculusVerifier calculusVerifier;
    private final LinearAlgebraVerifier linearAlgebraVerifier;
    private final ComplexNumbersVerifier complexNumbersVerifier;
    private final SequencesVerifier sequencesVerifier;
    private final StatisticsVerifier statisticsVerifier;
    private final OptimizationVerifier optimizationVerifier;

    public VerificationDispatcher(BlockParser blockParser,
                                  StructuralChecker structuralChecker,
                                  SymbolicEngine engine,
                                  EquationsSystemVerifier equationsSystemVerifier,
                                  CalculusVerifier calculusVerifier,
                                  LinearAlgebraVerifier linearAlgebraVerifier,
                                  ComplexNumbersVerifier complexNumbersVerifier,
                                  SequencesVerifier sequencesVerifier,
                                  StatisticsVerifier statisticsVerifier,
                                  OptimizationVerifier optimizationVerifier) {
        this.blockParser = blockParser;
        this.structuralChecker = structuralChecker;
        this.engine = engine;
        this.equationsSystemVerifier = equationsSystemVerifier;
        this.calculusVerifier = calculusVerifier;
        this.linearAlgebraVerifier = linearAlgebraVerifier;
        this.complexNumbersVerifier = complexNumbersVerifier;
        this.sequencesVerifier = sequencesVerifier;
        this.statisticsVerifier = statisticsVerifier;
        this.optimizationVerifier = optimizationVerifier;
    }

    /** Verifier registered for a kind. */
    public DomainVerifier verifierFor(VerifierKind kind) {
        return switch (kind) {
            case EQUATIONS_SYSTEM -> equationsSystemVerifier;
            case CALCULUS -> calculusVerifier;
            case LINEAR_ALGEBRA -> linearAlgebraVerifier;
            case COMPLEX_NUMBERS -> complexNumbersVerifier;
            case SEQUENCES -> sequencesVerifier;
            case STATISTICS -> statisticsVerifier;
            case OPTIMIZATION -> optimizationVerifier;
        };
    }

    /**
     * Verifies a solution exactly as written.
     *
     * @param topic        free-text topic hint, may be null
     * @param statement    exercise statement
     * @param solutionText raw solution text with its headings
     * @return the aggregated report; never null, never throws for well-formed input
     */
    public VerificationReport verify(String topic, String statement, String solutionText) {
        engine.reset();
        String finalAnswer = blockParser.getFinalAnswer(solutionText).orElse(null);
        String check = blockParser.getCheck(solutionText).orElse(null);

        VerificationReport structural = structuralChecker.check(statement, solutionText);
        Optional<DirectiveKind> directive = DirectiveKind.classify(check);

        String topicOrDirective = directive.map(DirectiveKind::name).orElse(topic);
        VerificationInput input = new VerificationInput(topicOrDirective, topic, statement, solutionText, finalAnswer, check);

        List<DomainVerifier> chosen = new ArrayList<>();
        for (VerifierKind kind : VerifierKind.values()) {
            DomainVerifier verifier = verifierFor(kind);
            if (accepts(verifier, input)) {
                chosen.add(verifier);
                if (directive.isPresent()) {
                    break;
                }
            }
        }

        if (chosen.isEmpty()) {
            VerificationReport rep = new VerificationReport(ReportKind.STRUCTURAL,
                    "Aucun plugin applicable, seulement checks structurels");
            rep.addAll(structural.items());
            directive.ifPresent(d -> rep.detail("directive", d.name()));
            log.info("Verification: directive={}, no applicable verifier, ok={}",
                    directive.map(DirectiveKind::name).orElse("none"), rep.ok());
            return rep;
        }

        VerificationReport rep = new VerificationReport(ReportKind.MIXED, "Vérification complète (plugins)");
        rep.addAll(structural.items());
        directive.ifPresent(d -> rep.detail("directive", d.name()));
        rep.detail("verifiers", chosen.stream().map(v -> v.kind().key()).toList());

        for (DomainVerifier verifier : chosen) {
            VerificationReport vrep = runGuarded(verifier, input);
            rep.addAll(vrep.items());
            if (!vrep.details().isEmpty()) {
                rep.detail(verifier.kind().key(), vrep.details());
            }
        }

        log.info("Verification: directive={}, verifiers={}, {} items, ok={}",
                directive.map(DirectiveKind::name).orElse("none"),
                chosen.stream().map(v -> v.kind().key()).toList(), rep.items().size(), rep.ok());
        return rep;
    }

    /**
     * Verifies a normalized solution and records the applied repairs in the report:
     * {@code details.autoFix} lists them and a padded statement adds an
     * {@code autofix.statement_padded} item.
     */
    public VerificationReport verify(String topic, NormalizedSolution normalized) {
        VerificationReport rep = verify(topic, normalized.statement(), normalized.solutionText());
        rep.detail("autoFix", normalized.fixes().stream().map(AutoFix::name).toList());
        if (normalized.statementPadded()) {
            rep.add("autofix.statement_padded", true,
                    "Énoncé complété automatiquement pour atteindre la longueur minimale");
        }
        return rep;
    }

    private boolean accepts(DomainVerifier verifier, VerificationInput input) {
        try {
            return verifier.canHandle(input);
        } catch (RuntimeException e) {
            log.error("Verifier {} failed in canHandle: {}", verifier.kind().key(), e.getMessage(), e);
            return false;
        }
    }

    private VerificationReport runGuarded(DomainVerifier verifier, VerificationInput input) {
        try {
            return verifier.verify(input);
        } catch (RuntimeException e) {
            log.error("Verifier {} crashed: {}", verifier.kind().key(), e.getMessage(), e);
            VerificationReport failed = new VerificationReport(ReportKind.MIXED, "Erreur interne");
            failed.add(new CheckItem(verifier.kind().key() + ".internal", false,
                    "Erreur interne du vérificateur: " + e.getClass().getSimpleName() + ": " + e.getMessage()));
            return failed;
        }
    }

    /** Verifier keys in dispatch order. */
    public Map<String, String> registeredVerifiers() {
        Map<String, String> out = new LinkedHashMap<>();
        for (VerifierKind kind : VerifierKind.values()) {
            out.put(kind.name(), verifierFor(kind).getClass().getSimpleName());
        }
        return out;
    }
}

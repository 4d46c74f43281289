package com.example.mathverify;

import com.example.mathverify.config.VerificationProperties;
import com.example.mathverify.orchestrator.VerificationDispatcher;
import com.example.mathverify.service.BlockParser;
import com.example.mathverify.service.DirectiveNormalizer;
import com.example.mathverify.service.FinalAnswerParser;
import com.example.mathverify.service.SampleSource;
import com.example.mathverify.service.StructuralChecker;
import com.example.mathverify.service.SymbolicEngine;
import com.example.mathverify.verifier.CalculusVerifier;
import com.example.mathverify.verifier.ComplexNumbersVerifier;
import com.example.mathverify.verifier.EquationsSystemVerifier;
import com.example.mathverify.verifier.LinearAlgebraVerifier;
import com.example.mathverify.verifier.OptimizationVerifier;
import com.example.mathverify.verifier.SequencesVerifier;
import com.example.mathverify.verifier.StatisticsVerifier;

/**
 * Hand-wired engine components for tests that run without a Spring context.
 */
public final class Fixtures {

    /** Long enough to pass the structural statement check. */
    public static final String LONG_STATEMENT =
            "Résoudre dans R l'équation suivante et justifier chaque étape du calcul.";

    private static final VerificationProperties PROPERTIES = VerificationProperties.defaults();
    private static final SymbolicEngine ENGINE = new SymbolicEngine();

    private Fixtures() {
    }

    public static VerificationProperties properties() {
        return PROPERTIES;
    }

    public static SymbolicEngine engine() {
        return ENGINE;
    }

    public static FinalAnswerParser answerParser() {
        return new FinalAnswerParser(ENGINE);
    }

    public static SampleSource sampleSource() {
        return new SampleSource(PROPERTIES);
    }

    public static DirectiveNormalizer normalizer() {
        return new DirectiveNormalizer(new BlockParser(), ENGINE, PROPERTIES);
    }

    public static VerificationDispatcher dispatcher() {
        return dispatcher(new OptimizationVerifier(ENGINE, answerParser(), sampleSource()));
    }

    /** Dispatcher with a replaceable optimization verifier. */
    public static VerificationDispatcher dispatcher(OptimizationVerifier optimizationVerifier) {
        FinalAnswerParser answerParser = answerParser();
        SampleSource sampleSource = sampleSource();
        return new VerificationDispatcher(
                new BlockParser(),
                new StructuralChecker(PROPERTIES),
                ENGINE,
                new EquationsSystemVerifier(ENGINE, answerParser, sampleSource),
                new CalculusVerifier(ENGINE, sampleSource),
                new LinearAlgebraVerifier(ENGINE),
                new ComplexNumbersVerifier(ENGINE),
                new SequencesVerifier(ENGINE, answerParser),
                new StatisticsVerifier(),
                optimizationVerifier);
    }

    /** Solution blob with the four headings; blank blocks are left out. */
    public static String solution(String statement, String finalAnswer, String check) {
        StringBuilder sb = new StringBuilder();
        sb.append("EXERCICE:\n").append(statement).append("\n\n");
        sb.append("SOLUTION:\nOn applique la méthode du cours.\n\n");
        if (finalAnswer != null) {
            sb.append("FINAL_ANSWER:\n").append(finalAnswer).append("\n\n");
        }
        if (check != null) {
            sb.append("CHECK:\n").append(check).append('\n');
        }
        return sb.toString();
    }
}

package com.example.mathverify.service;

import com.example.mathverify.config.VerificationProperties;
import com.example.mathverify.model.AutoFix;
import com.example.mathverify.model.Heading;
import com.example.mathverify.model.NormalizedSolution;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class DirectiveNormalizerTest {

    private static final String STATEMENT =
            "Déterminer la dérivée de la fonction f définie sur ]0, +oo[ par f(x) = x^3.";

    private final BlockParser blockParser = new BlockParser();
    private final DirectiveNormalizer normalizer =
            new DirectiveNormalizer(blockParser, new SymbolicEngine(), VerificationProperties.defaults());

    private void assertIdempotent(NormalizedSolution first) {
        NormalizedSolution second = normalizer.normalize(first.statement(), first.solutionText());
        assertEquals(first.statement(), second.statement());
        assertEquals(first.solutionText(), second.solutionText());
    }

    @Test
    void padsShortStatement() {
        NormalizedSolution n = normalizer.normalize("Résoudre 2x+1=5", "SOLUTION:\nx=2\nFINAL_ANSWER:\n2");

        assertEquals("Résoudre 2x+1=5 (Donner la réponse finale et vérifier.)", n.statement());
        assertTrue(n.statementPadded());
        assertIdempotent(n);
    }

    @Test
    void emptyStatementIsPaddedOnce() {
        NormalizedSolution n = normalizer.normalize("", "SOLUTION:\nx=2\nFINAL_ANSWER:\n2");

        assertTrue(n.statement().length() >= 45);
        assertIdempotent(n);
    }

    @Test
    void keepsLongStatement() {
        NormalizedSolution n = normalizer.normalize(STATEMENT, "SOLUTION:\ncalcul\nFINAL_ANSWER:\n3*x**2");

        assertEquals(STATEMENT, n.statement());
        assertFalse(n.statementPadded());
    }

    @Test
    void stripsEllipsis() {
        NormalizedSolution n = normalizer.normalize(STATEMENT + " ...", "SOLUTION:\nOn dérive…\nFINAL_ANSWER:\n3*x**2");

        assertEquals(STATEMENT, n.statement());
        assertFalse(n.solutionText().contains("…"));
        assertTrue(n.fixes().contains(AutoFix.ELLIPSIS_STRIPPED));
        assertIdempotent(n);
    }

    @Test
    void reflowsInlineHeadings() {
        String text = "SOLUTION: on divise par 2\nFINAL_ANSWER: 2\nCHECK: Eq(2*x, 4)";

        NormalizedSolution n = normalizer.normalize(STATEMENT, text);
        Map<Heading, String> blocks = blockParser.extractBlocks(n.solutionText());

        assertTrue(n.fixes().contains(AutoFix.HEADINGS_REFLOWED));
        assertEquals(STATEMENT, blocks.get(Heading.EXERCICE));
        assertEquals("on divise par 2", blocks.get(Heading.SOLUTION));
        assertEquals("2", blocks.get(Heading.FINAL_ANSWER));
        assertEquals("Eq(2*x, 4)", blocks.get(Heading.CHECK));
        assertIdempotent(n);
    }

    @Test
    void synthesizesBlocksForUnstructuredText() {
        NormalizedSolution n = normalizer.normalize(STATEMENT, "La dérivée vaut 3x^2.");
        Map<Heading, String> blocks = blockParser.extractBlocks(n.solutionText());

        assertEquals(List.of(AutoFix.BLOCKS_SYNTHESIZED), n.fixes());
        assertEquals("La dérivée vaut 3x^2.", blocks.get(Heading.SOLUTION));
        assertEquals(STATEMENT, blocks.get(Heading.EXERCICE));
        assertIdempotent(n);
    }

    @Test
    void blankSolutionStaysBlank() {
        NormalizedSolution n = normalizer.normalize(STATEMENT, "  ");

        assertEquals("", n.solutionText());
        assertIdempotent(n);
    }

    @Test
    void movesDerivativeDirectiveIntoCheck() {
        String text = "SOLUTION:\ncalcul\nFINAL_ANSWER:\nDERIVATIVE; var=x; func=x**3";

        NormalizedSolution n = normalizer.normalize(STATEMENT, text);

        assertEquals(List.of(AutoFix.DERIVATIVE_MOVED_TO_CHECK), n.fixes());
        assertTrue(blockParser.getFinalAnswer(n.solutionText()).isEmpty());
        assertEquals(Optional.of("DERIVATIVE; var=x; func=x**3"), blockParser.getCheck(n.solutionText()));
        assertIdempotent(n);
    }

    @Test
    void rewritesDerivativeEquality() {
        String text = "SOLUTION:\ncalcul\nFINAL_ANSWER:\n3*x**2\nCHECK:\nDERIVATIVE; Eq(Derivative(x**3, x), 3*x**2)";

        NormalizedSolution n = normalizer.normalize(STATEMENT, text);

        assertTrue(n.fixes().contains(AutoFix.DERIVATIVE_CHECK_REWRITTEN));
        assertEquals(Optional.of("DERIVATIVE; var=x; func=x**3"), blockParser.getCheck(n.solutionText()));
        assertIdempotent(n);
    }

    @Test
    void derivativeRewriteDefaultsVariable() {
        assertEquals(Optional.of("DERIVATIVE; var=x; func=log(x)"),
                normalizer.rewriteDerivativeEquality("DERIVATIVE; Eq(1/x, diff(log(x)))"));
        assertEquals(Optional.of("DERIVATIVE; var=t; func=t**2"),
                normalizer.rewriteDerivativeEquality("derivative; Eq(D(t**2, t), 2*t)"));
    }

    @Test
    void derivativeRewriteLeavesOtherChecksAlone() {
        assertTrue(normalizer.rewriteDerivativeEquality("DERIVATIVE; var=x; func=x**3").isEmpty());
        assertTrue(normalizer.rewriteDerivativeEquality("Eq(Derivative(x**3, x), 3*x**2)").isEmpty());
        assertTrue(normalizer.rewriteDerivativeEquality("DERIVATIVE; 3*x**2").isEmpty());
        assertTrue(normalizer.rewriteDerivativeEquality("DERIVATIVE; Eq(x, 3)").isEmpty());
    }

    @Test
    void promotesSingleVariableSystemAnswer() {
        assertEquals(Optional.of("{x: 2}"), normalizer.promoteSystemAnswer("2", "SYSTEM; Eq(2*x, 4)"));
        assertEquals(Optional.of("{x: 2}"), normalizer.promoteSystemAnswer("2", "SYSTEM;\nEq(2*x, 4)\nEq(x + 1, 3)"));
    }

    @Test
    void doesNotPromoteWhenAmbiguous() {
        assertTrue(normalizer.promoteSystemAnswer("2", "SYSTEM; Eq(x+y, 1); Eq(x-y, 3)").isEmpty());
        assertTrue(normalizer.promoteSystemAnswer("{x: 2}", "SYSTEM; Eq(2*x, 4)").isEmpty());
        assertTrue(normalizer.promoteSystemAnswer("2", "Eq(2*x, 4)").isEmpty());
        assertTrue(normalizer.promoteSystemAnswer("2", "SYSTEM; x > 1").isEmpty());
    }

    @Test
    void promotionIsRecordedAndStable() {
        String text = "SOLUTION:\n2x = 4\nFINAL_ANSWER:\n2\nCHECK:\nSYSTEM; Eq(2*x, 4)";

        NormalizedSolution n = normalizer.normalize(STATEMENT, text);

        assertEquals(List.of(AutoFix.SYSTEM_ANSWER_PROMOTED), n.fixes());
        assertEquals(Optional.of("{x: 2}"), blockParser.getFinalAnswer(n.solutionText()));
        assertIdempotent(n);
    }

    @Test
    void wellFormedSolutionNeedsNoFix() {
        String text = "EXERCICE:\n" + STATEMENT + "\n\nSOLUTION:\ncalcul\n\nFINAL_ANSWER:\n3*x**2\n\nCHECK:\nDERIVATIVE; var=x; func=x**3";

        NormalizedSolution n = normalizer.normalize(STATEMENT, text);

        assertTrue(n.fixes().isEmpty());
        assertEquals(text, n.solutionText());
    }
}

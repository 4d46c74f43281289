package com.example.mathverify.orchestrator;

import com.example.mathverify.Fixtures;
import com.example.mathverify.model.NormalizedSolution;
import com.example.mathverify.model.ReportKind;
import com.example.mathverify.model.VerificationReport;
import com.example.mathverify.model.VerifierKind;
import com.example.mathverify.verifier.OptimizationVerifier;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class VerificationDispatcherTest {

    private static final String STATEMENT = Fixtures.LONG_STATEMENT;

    private final VerificationDispatcher dispatcher = Fixtures.dispatcher();

    @Test
    void directiveSelectsSingleVerifier() {
        String solution = Fixtures.solution(STATEMENT, "{x: 2, y: -1}", "SYSTEM; Eq(x+y, 1); Eq(x-y, 3)");

        VerificationReport rep = dispatcher.verify("Optimisation d'un maximum", STATEMENT, solution);

        assertTrue(rep.ok(), rep::toString);
        assertEquals(ReportKind.MIXED, rep.kind());
        assertEquals("SYSTEM", rep.details().get("directive"));
        assertEquals(List.of("algebra_equations"), rep.details().get("verifiers"));
        assertTrue(rep.item("structure.enonce").ok());
        assertNull(rep.item("opt.check_format"));
    }

    @Test
    void derivativeDirective() {
        String solution = Fixtures.solution(STATEMENT, "(1 - log(x))/x**2", "DERIVATIVE; var=x; func=log(x)/x");

        VerificationReport rep = dispatcher.verify("Dérivées", STATEMENT, solution);

        assertTrue(rep.ok(), rep::toString);
        assertEquals(List.of("calculus"), rep.details().get("verifiers"));
    }

    @Test
    void limitDirectiveWithOverlappingTopicRunsOnlyLimitChecks() {
        String solution = Fixtures.solution(STATEMENT, "1", "LIMIT; var=x; expr=sin(x)/x; point=0");

        VerificationReport rep = dispatcher.verify("Dérivées et limites", STATEMENT, solution);

        assertTrue(rep.ok(), rep::toString);
        assertEquals(List.of("calculus"), rep.details().get("verifiers"));
        assertTrue(rep.item("numeric.limit").ok());
        assertNull(rep.item("symbolic.derivative"));
    }

    @Test
    void assignmentInAnswerDoesNotLeakIntoLaterVerifications() {
        String poisoned = Fixtures.solution(STATEMENT, "Set(x, 5)", "Eq(2*x+1, 5)");
        String clean = Fixtures.solution(STATEMENT, "2", "Eq(2*x+1, 5)");

        VerificationReport first = dispatcher.verify("Équations", STATEMENT, poisoned);
        VerificationReport second = dispatcher.verify("Équations", STATEMENT, clean);

        assertFalse(first.item("parse.final_answer").ok());
        assertTrue(second.ok(), second::toString);
        Map<?, ?> details = (Map<?, ?>) second.details().get("algebra_equations");
        assertEquals(List.of("x"), details.get("eq_symbols"));
    }

    @Test
    void optimizeDirectiveReportsTrueOptimum() {
        String solution = Fixtures.solution(STATEMENT, "{x_star: 2, f_star: 5}",
                "OPTIMIZE; var=x; func=-2*x**2+8*x-3; domain=[0,5]; goal=max");

        VerificationReport rep = dispatcher.verify("Fonctions", STATEMENT, solution);

        assertTrue(rep.ok(), rep::toString);
        Map<?, ?> details = (Map<?, ?>) rep.details().get("optimization");
        assertEquals("2", details.get("x_star_true"));
    }

    @Test
    void topicModeRunsEveryAcceptingVerifier() {
        String solution = Fixtures.solution(STATEMENT, "-2", "Eq(det(Matrix([[1, 2], [3, 4]])), -2)");

        VerificationReport rep = dispatcher.verify("Nombres complexes et matrices", STATEMENT, solution);

        assertTrue(rep.ok(), rep::toString);
        assertFalse(rep.details().containsKey("directive"));
        assertEquals(List.of("algebra_equations", "linear_algebra", "complex_numbers"), rep.details().get("verifiers"));
    }

    @Test
    void noApplicableVerifierGivesStructuralReport() {
        String solution = Fixtures.solution(STATEMENT, "3", "x > 1");

        VerificationReport rep = dispatcher.verify("Géométrie plane", STATEMENT, solution);

        assertEquals(ReportKind.STRUCTURAL, rep.kind());
        assertEquals("Aucun plugin applicable, seulement checks structurels", rep.summary());
        assertEquals(2, rep.items().size());
        assertTrue(rep.ok());
    }

    @Test
    void shortStatementFailsCorrectAnswer() {
        String statement = "Résoudre le système";
        String solution = Fixtures.solution(statement, "{x: 2, y: -1}", "SYSTEM; Eq(x+y, 1); Eq(x-y, 3)");

        VerificationReport rep = dispatcher.verify("Systèmes", statement, solution);

        assertFalse(rep.ok());
        assertFalse(rep.item("structure.enonce").ok());
        assertTrue(rep.item("symbolic.system_substitution").ok());
    }

    @Test
    void ellipsisFailsStructure() {
        String solution = Fixtures.solution(STATEMENT, "2", "Eq(2*x+1, 5)").replace("méthode du cours.", "méthode ...");

        VerificationReport rep = dispatcher.verify("Équations", STATEMENT, solution);

        assertFalse(rep.ok());
        assertFalse(rep.item("structure.ellipsis").ok());
    }

    @Test
    void normalizedSolutionRecordsRepairs() {
        NormalizedSolution normalized = Fixtures.normalizer().normalize("Résoudre 2x+1=5",
                "SOLUTION: on isole x\nFINAL_ANSWER: 2\nCHECK: Eq(2*x+1, 5)");

        VerificationReport rep = dispatcher.verify("Équations", normalized);

        assertTrue(rep.ok(), rep::toString);
        assertTrue(rep.item("autofix.statement_padded").ok());
        assertEquals(List.of("STATEMENT_PADDED", "HEADINGS_REFLOWED"), rep.details().get("autoFix"));
    }

    @Test
    void crashingVerifierBecomesFailingItem() {
        OptimizationVerifier crashing = mock(OptimizationVerifier.class);
        when(crashing.kind()).thenReturn(VerifierKind.OPTIMIZATION);
        when(crashing.canHandle(any())).thenReturn(true);
        when(crashing.verify(any())).thenThrow(new IllegalStateException("boom"));
        String solution = Fixtures.solution(STATEMENT, "{x_star: 2}", "OPTIMIZE; var=x; func=x; goal=max");

        VerificationReport rep = Fixtures.dispatcher(crashing).verify("", STATEMENT, solution);

        assertFalse(rep.ok());
        assertFalse(rep.item("optimization.internal").ok());
        assertTrue(rep.item("optimization.internal").message().contains("boom"));
    }

    @Test
    void failingCanHandleSkipsVerifier() {
        OptimizationVerifier broken = mock(OptimizationVerifier.class);
        when(broken.kind()).thenReturn(VerifierKind.OPTIMIZATION);
        when(broken.canHandle(any())).thenThrow(new IllegalArgumentException("bad input"));
        String solution = Fixtures.solution(STATEMENT, "{x_star: 2}", "OPTIMIZE; var=x; func=x; goal=max");

        VerificationReport rep = Fixtures.dispatcher(broken).verify("", STATEMENT, solution);

        assertEquals(ReportKind.STRUCTURAL, rep.kind());
        assertEquals("OPTIMIZE", rep.details().get("directive"));
    }

    @Test
    void listsVerifiersInDispatchOrder() {
        Map<String, String> registered = dispatcher.registeredVerifiers();

        assertEquals(List.of("EQUATIONS_SYSTEM", "CALCULUS", "LINEAR_ALGEBRA", "COMPLEX_NUMBERS",
                "SEQUENCES", "STATISTICS", "OPTIMIZATION"), List.copyOf(registered.keySet()));
        assertEquals("CalculusVerifier", registered.get("CALCULUS"));
    }
}

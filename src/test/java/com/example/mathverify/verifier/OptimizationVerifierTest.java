package com.example.mathverify.verifier;

import com.example.mathverify.Fixtures;
import com.example.mathverify.model.VerificationInput;
import com.example.mathverify.model.VerificationReport;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class OptimizationVerifierTest {

    private static final String CONCAVE_1D = "OPTIMIZE; var=x; func=-2*x**2+8*x-3; domain=[0,5]; goal=max";
    private static final String PARABOLOID = "OPTIMIZE; var=[x,y]; func=-(x-1)**2-(y-2)**2; goal=max";
    private static final String BUDGET = "OPTIMIZE; var=[x,y]; func=x*y; domain=[x+y<=10, x>=0, y>=0]; goal=max";

    private final OptimizationVerifier verifier =
            new OptimizationVerifier(Fixtures.engine(), Fixtures.answerParser(), Fixtures.sampleSource());

    private static VerificationInput input(String finalAnswer, String check) {
        return new VerificationInput("OPTIMIZE", "Optimisation", Fixtures.LONG_STATEMENT, "", finalAnswer, check);
    }

    @Test
    void acceptsOptimizeDirectiveOrTopic() {
        assertTrue(verifier.canHandle(input("{x_star: 2}", CONCAVE_1D)));
        assertTrue(verifier.canHandle(new VerificationInput("Recherche d'un maximum", "", "", "", null, null)));
        assertFalse(verifier.canHandle(new VerificationInput("Probabilités", "", "", "", "1", "Eq(x, 1)")));
    }

    @Test
    void intervalMaximumMatchesCandidateSet() {
        VerificationReport rep = verifier.verify(input("{x_star: 2, f_star: 5}", CONCAVE_1D));

        assertTrue(rep.ok(), rep::toString);
        assertEquals("2", rep.details().get("x_star_true"));
        assertEquals("5", rep.details().get("f_star_true"));
        assertTrue(rep.item("opt.compare_x").ok());
        assertTrue(rep.item("opt.compare_f_star").ok());
    }

    @Test
    void wrongOptimalValueFails() {
        VerificationReport rep = verifier.verify(input("{x_star: 2, f_star: 4}", CONCAVE_1D));

        assertFalse(rep.ok());
        assertFalse(rep.item("opt.compare_f_star").ok());
        assertTrue(rep.item("opt.compare_x").ok());
    }

    @Test
    void tiedMaximaAcceptEitherPoint() {
        String check = "OPTIMIZE; var=x; func=x**2; domain=[-1,1]; goal=max";

        assertTrue(verifier.verify(input("{x: 1, f_star: 1}", check)).ok());
        assertTrue(verifier.verify(input("{x: -1, f_star: 1}", check)).ok());
        VerificationReport rep = verifier.verify(input("{x: 0, f_star: 0}", check));
        assertFalse(rep.item("opt.compare_x").ok());
    }

    @Test
    void minimumOnIntervalIsAnEndpoint() {
        String check = CONCAVE_1D.replace("goal=max", "goal=min");

        VerificationReport rep = verifier.verify(input("{x_star: 5, f_star: -13}", check));

        assertTrue(rep.ok(), rep::toString);
        assertEquals("5", rep.details().get("x_star_true"));
    }

    @Test
    void wrongArgmaxFails() {
        VerificationReport rep = verifier.verify(input("{x_star: 0, f_star: -3}", CONCAVE_1D));

        assertTrue(rep.item("opt.compare_f_star").ok());
        assertFalse(rep.item("opt.compare_x").ok());
    }

    @Test
    void mappingMayBeEmbeddedInProse() {
        VerificationReport rep = verifier.verify(input("Le maximum est atteint en {x_star: 2, f_star: 5}", CONCAVE_1D));

        assertTrue(rep.item("opt.final_answer_dict").ok());
        assertTrue(rep.ok(), rep::toString);
    }

    @Test
    void scalarAnswerIsRejected() {
        VerificationReport rep = verifier.verify(input("5", CONCAVE_1D));

        assertFalse(rep.item("opt.final_answer_dict").ok());
    }

    @Test
    void missingFunctionIsReported() {
        VerificationReport rep = verifier.verify(input("{x_star: 2}", "OPTIMIZE; var=x; goal=max"));

        assertFalse(rep.item("opt.func_present").ok());
    }

    @Test
    void nonDirectiveCheckIsRejected() {
        assertFalse(verifier.verify(input("{x_star: 2}", "Eq(x, 2)")).item("opt.check_format").ok());
        assertFalse(verifier.verify(input("{x_star: 2}", null)).item("opt.check_present").ok());
    }

    @Test
    void unconstrainedMaximumSurvivesLocalSearch() {
        VerificationReport rep = verifier.verify(input("{x: 1, y: 2, f_star: 0}", PARABOLOID));

        assertTrue(rep.ok(), rep::toString);
        assertEquals(List.of("x", "y"), rep.details().get("vars"));
        assertTrue(rep.item("opt.local_check").ok());
    }

    @Test
    void localSearchFindsBetterNeighbour() {
        VerificationReport rep = verifier.verify(input("{x: 0, y: 0, f_star: -5}", PARABOLOID));

        assertTrue(rep.item("opt.compare_f_star").ok());
        assertFalse(rep.item("opt.local_check").ok());
    }

    @Test
    void constrainedMaximum() {
        VerificationReport rep = verifier.verify(input("{x_star: 5, y_star: 5, f_star: 25}", BUDGET));

        assertTrue(rep.ok(), rep::toString);
        assertTrue(rep.item("opt.constraints_parsed").ok());
        assertTrue(rep.item("opt.feasible").ok());
    }

    @Test
    void infeasiblePointFails() {
        VerificationReport rep = verifier.verify(input("{x_star: 6, y_star: 6, f_star: 36}", BUDGET));

        assertFalse(rep.item("opt.feasible").ok());
    }

    @Test
    void parsesVariablesAndDomains() {
        assertEquals(List.of("x", "y", "z"), OptimizationVerifier.parseVariables("[x, y, z]"));
        assertEquals(List.of("t"), OptimizationVerifier.parseVariables(" t "));
        assertArrayEquals(new double[]{-1.5, 4.0}, OptimizationVerifier.parseInterval("[4, -1.5]"));
        assertNull(OptimizationVerifier.parseInterval("[x+y<=10, x>=0]"));
        assertEquals(List.of("x+y<=10", "x>=0"), OptimizationVerifier.parseConstraintList("[x+y<=10, x>=0]"));
        assertNull(OptimizationVerifier.parseConstraintList("x>=0"));
    }

    @Test
    void constraintsBecomeNonPositiveExpressions() {
        assertTrue(verifier.constraintToExpression("x <= 3").isPresent());
        assertTrue(verifier.constraintToExpression("x ≥ 0").isPresent());
        assertTrue(verifier.constraintToExpression("x + y = 1").isPresent());
        assertTrue(verifier.constraintToExpression("x > 0").isEmpty());
    }
}

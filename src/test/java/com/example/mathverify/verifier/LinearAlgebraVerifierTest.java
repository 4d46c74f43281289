package com.example.mathverify.verifier;

import com.example.mathverify.Fixtures;
import com.example.mathverify.model.ReportKind;
import com.example.mathverify.model.VerificationInput;
import com.example.mathverify.model.VerificationReport;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class LinearAlgebraVerifierTest {

    private final LinearAlgebraVerifier verifier = new LinearAlgebraVerifier(Fixtures.engine());

    private static VerificationInput input(String finalAnswer, String check) {
        return new VerificationInput("Matrices", "Matrices", Fixtures.LONG_STATEMENT, "", finalAnswer, check);
    }

    @Test
    void requiresTopicAndAnswer() {
        assertTrue(verifier.canHandle(input("-2", null)));
        assertFalse(verifier.canHandle(input(null, null)));
        assertFalse(verifier.canHandle(new VerificationInput("Suites", "Suites", "", "", "-2", null)));
    }

    @Test
    void determinantEquality() {
        VerificationReport rep = verifier.verify(input("-2", "Eq(det(Matrix([[1, 2], [3, 4]])), -2)"));

        assertTrue(rep.ok(), rep::toString);
        assertEquals(ReportKind.SYMBOLIC, rep.kind());
        assertTrue(rep.item("symbolic.check_eq").ok());
    }

    @Test
    void wrongDeterminantFails() {
        assertFalse(verifier.verify(input("2", "Eq(det(Matrix([[1, 2], [3, 4]])), 2)")).ok());
    }

    @Test
    void matrixEqualityComparesEntries() {
        VerificationReport rep = verifier.verify(input("[[2, 0], [0, 2]]",
                "Eq(Matrix([[1, 0], [0, 1]]) + Matrix([[1, 0], [0, 1]]), Matrix([[2, 0], [0, 2]]))"));

        assertTrue(rep.item("symbolic.check_eq").ok());
    }

    @Test
    void bareExpressionMustVanish() {
        VerificationReport rep = verifier.verify(input("0", "det(Matrix([[1, 2], [2, 4]]))"));

        assertTrue(rep.item("symbolic.check_expr").ok());
    }

    @Test
    void checkIsOptional() {
        VerificationReport rep = verifier.verify(input("-2", null));

        assertTrue(rep.ok());
        assertEquals("CHECK absent (OK)", rep.item("parse.check").message());
    }
}

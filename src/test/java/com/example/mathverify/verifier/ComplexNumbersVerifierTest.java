package com.example.mathverify.verifier;

import com.example.mathverify.Fixtures;
import com.example.mathverify.model.VerificationInput;
import com.example.mathverify.model.VerificationReport;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ComplexNumbersVerifierTest {

    private final ComplexNumbersVerifier verifier = new ComplexNumbersVerifier(Fixtures.engine());

    private static VerificationInput input(String finalAnswer, String check) {
        return new VerificationInput("Nombres complexes", "Nombres complexes", Fixtures.LONG_STATEMENT, "",
                finalAnswer, check);
    }

    @Test
    void acceptsComplexTopics() {
        assertTrue(verifier.canHandle(input("1+i", null)));
        assertTrue(verifier.canHandle(new VerificationInput("Affixe d'un point", "", "", "", "2*i", null)));
        assertFalse(verifier.canHandle(new VerificationInput("Dérivées", "", "", "", "2*x", null)));
    }

    @Test
    void squareOfComplexNumber() {
        VerificationReport rep = verifier.verify(input("-3+4*i", "Eq((1+2*i)**2, -3+4*i)"));

        assertTrue(rep.ok(), rep::toString);
        assertTrue(rep.item("symbolic.check_eq").ok());
    }

    @Test
    void wrongSquareFails() {
        assertFalse(verifier.verify(input("-3+4*i", "Eq((1+2*i)**2, 5)")).ok());
    }

    @Test
    void booleanCheck() {
        assertTrue(verifier.verify(input("5", "abs(3+4*i) > 4")).item("symbolic.check_bool").ok());
        assertFalse(verifier.verify(input("5", "abs(3+4*i) < 4")).item("symbolic.check_bool").ok());
    }

    @Test
    void expressionCheckMustVanish() {
        VerificationReport rep = verifier.verify(input("0", "(1+i)*(1-i) - 2"));

        assertTrue(rep.item("symbolic.check_expr").ok());
    }
}

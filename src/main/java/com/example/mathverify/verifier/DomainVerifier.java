package com.example.mathverify.verifier;

import com.example.mathverify.model.VerificationInput;
import com.example.mathverify.model.VerificationReport;
import com.example.mathverify.model.VerifierKind;

/**
 * Contract for domain-specific verifiers.
 *
 * Implementations:
 *   EquationsSystemVerifier : single equalities and SYSTEM directives
 *   CalculusVerifier        : DERIVATIVE / INTEGRAL / LIMIT
 *   LinearAlgebraVerifier   : matrix and determinant identities
 *   ComplexNumbersVerifier  : identities over the complex numbers
 *   SequencesVerifier       : parseability of sequence terms
 *   StatisticsVerifier      : linear regression recomputation
 *   OptimizationVerifier    : OPTIMIZE directives
 *
 * Verifiers are stateless; failures are reported as failing items, never thrown.
 */
public interface DomainVerifier {

    VerifierKind kind();

    /**
     * @param input {@link VerificationInput#topicOrDirective()} holds the directive keyword
     *              in directive mode and the caller's topic otherwise
     * @return true when this verifier has something to check
     */
    boolean canHandle(VerificationInput input);

    /**
     * Run the domain checks.
     *
     * @param input extracted blocks and context
     * @return report whose items are appended to the dispatcher's report
     */
    VerificationReport verify(VerificationInput input);
}

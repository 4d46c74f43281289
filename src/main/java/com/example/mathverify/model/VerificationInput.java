package com.example.mathverify.model;

/**
 * Arguments handed to a domain verifier.
 *
 * @param topicOrDirective directive keyword in directive mode, free-text topic otherwise
 * @param topic            the caller's topic hint (always the free text)
 * @param statement        exercise statement
 * @param solutionText     full solution text
 * @param finalAnswer      FINAL_ANSWER content, null when absent
 * @param check            CHECK content, null when absent
 */
public record VerificationInput(
        String topicOrDirective,
        String topic,
        String statement,
        String solutionText,
        String finalAnswer,
        String check
) {
    public VerificationInput {
        topicOrDirective = topicOrDirective != null ? topicOrDirective : "";
        topic = topic != null ? topic : "";
        statement = statement != null ? statement : "";
        solutionText = solutionText != null ? solutionText : "";
    }

    public boolean hasFinalAnswer() {
        return finalAnswer != null && !finalAnswer.isBlank();
    }

    public boolean hasCheck() {
        return check != null && !check.isBlank();
    }
}

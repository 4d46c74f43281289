package com.example.mathverify.model;

import java.util.List;

/**
 * Output of the auto-fix stage.
 *
 * @param statement    normalized statement
 * @param solutionText normalized solution text, rebuilt from its blocks
 * @param fixes        repairs applied, in application order
 */
public record NormalizedSolution(
        String statement,
        String solutionText,
        List<AutoFix> fixes
) {
    public NormalizedSolution {
        fixes = fixes != null ? List.copyOf(fixes) : List.of();
    }

    public boolean statementPadded() {
        return fixes.contains(AutoFix.STATEMENT_PADDED);
    }
}

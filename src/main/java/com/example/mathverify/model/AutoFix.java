package com.example.mathverify.model;

/**
 * Repairs the normalizer may apply before verification.
 */
public enum AutoFix {
    /** Placeholder ellipses removed from statement or solution. */
    ELLIPSIS_STRIPPED,
    /** Statement shorter than the threshold received a trailing clause. */
    STATEMENT_PADDED,
    /** Inline {@code HEADING: content} moved onto its own line. */
    HEADINGS_REFLOWED,
    /** Unstructured text wrapped into EXERCICE/SOLUTION blocks. */
    BLOCKS_SYNTHESIZED,
    /** DERIVATIVE directive found in FINAL_ANSWER moved to CHECK. */
    DERIVATIVE_MOVED_TO_CHECK,
    /** {@code DERIVATIVE; Eq(Derivative(f, x), ...)} rewritten to {@code DERIVATIVE; var=x; func=f}. */
    DERIVATIVE_CHECK_REWRITTEN,
    /** Scalar answer of a one-variable SYSTEM promoted to {@code {var: value}}. */
    SYSTEM_ANSWER_PROMOTED
}

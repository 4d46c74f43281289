package com.example.mathverify.model;

/**
 * HTTP request body for verification, normalization and block extraction.
 *
 * @param topic     Chapter or theme hint (e.g. "Dérivées", "Systèmes d'équations")
 * @param statement Exercise statement
 * @param solution  Raw solution blob with EXERCICE/SOLUTION/FINAL_ANSWER/CHECK headings
 * @param autoFix   Whether to run the normalizer before verifying
 */
public record VerifyRequest(
        String topic,
        String statement,
        String solution,
        boolean autoFix
) {}

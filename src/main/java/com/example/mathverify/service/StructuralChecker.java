package com.example.mathverify.service;

import com.example.mathverify.config.VerificationProperties;
import com.example.mathverify.model.ReportKind;
import com.example.mathverify.model.VerificationReport;
import org.springframework.stereotype.Service;

/**
 * Verifier-independent sanity checks on the text shape of an exercise.
 */
@Service
public class StructuralChecker {

    private final int minStatementLength;

    public StructuralChecker(VerificationProperties properties) {
        this.minStatementLength = properties.structural().minStatementLength();
    }

    /**
     * @param statement exercise statement
     * @param solution  raw solution text
     * @return structural report with {@code structure.enonce} and {@code structure.ellipsis}
     */
    public VerificationReport check(String statement, String solution) {
        VerificationReport rep = new VerificationReport(ReportKind.STRUCTURAL, "Contrôles structurels");

        if (statement == null || statement.strip().length() < minStatementLength) {
            rep.add("structure.enonce", false,
                    "Énoncé trop court / vide (minimum %d caractères)".formatted(minStatementLength));
        } else {
            rep.add("structure.enonce", true, "Énoncé OK");
        }

        if (hasPlaceholder(statement) || hasPlaceholder(solution)) {
            rep.add("structure.ellipsis", false, "Présence de '...' (énoncé ou solution)");
        } else {
            rep.add("structure.ellipsis", true, "Pas de '...'");
        }
        return rep;
    }

    static boolean hasPlaceholder(String text) {
        return text != null && (text.contains("...") || text.contains("…"));
    }
}

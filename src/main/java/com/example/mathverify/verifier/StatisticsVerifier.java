package com.example.mathverify.verifier;

import com.example.mathverify.model.ReportKind;
import com.example.mathverify.model.VerificationInput;
import com.example.mathverify.model.VerificationReport;
import com.example.mathverify.model.VerifierKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Simple linear regression, recomputed from the statement.
 * <p>
 * The last five numbers of the statement are taken as {@code y} with {@code x = 0..4};
 * slope, intercept and correlation use population formulas. The solution passes when
 * one of its numbers is close to the recomputed correlation or slope. This is a
 * heuristic: the table layout is guessed, not parsed.
 */
@Service
public class StatisticsVerifier implements DomainVerifier {

    private static final Logger log = LoggerFactory.getLogger(StatisticsVerifier.class);

    private static final List<String> TOPIC_KEYWORDS = List.of("stat", "régression", "regression", "corrél", "correl");

    private static final Pattern DECIMAL_COMMA = Pattern.compile("(\\d),(\\d)");
    private static final Pattern STATEMENT_NUMBER = Pattern.compile("\\b\\d+(?:\\.\\d+)?\\b");
    private static final Pattern SOLUTION_NUMBER = Pattern.compile("-?\\d+(?:\\.\\d+)?");

    private static final int MIN_STATEMENT_NUMBERS = 8;
    private static final int SERIES_LENGTH = 5;
    private static final double CORRELATION_TOLERANCE = 0.05;
    private static final double SLOPE_TOLERANCE = 0.2;

    /** Least-squares fit of y against x = 0..n-1. */
    record Regression(double slope, double intercept, double correlation) {

        static Regression fit(List<Double> y) {
            int n = y.size();
            double xMean = (n - 1) / 2.0;
            double yMean = y.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
            double cov = 0.0;
            double varX = 0.0;
            double varY = 0.0;
            for (int i = 0; i < n; i++) {
                double dx = i - xMean;
                double dy = y.get(i) - yMean;
                cov += dx * dy;
                varX += dx * dx;
                varY += dy * dy;
            }
            cov /= n;
            varX /= n;
            varY /= n;
            double slope = varX != 0.0 ? cov / varX : 0.0;
            double intercept = yMean - slope * xMean;
            double correlation = varX != 0.0 && varY != 0.0 ? cov / Math.sqrt(varX * varY) : 0.0;
            return new Regression(slope, intercept, correlation);
        }
    }

    @Override
    public VerifierKind kind() {
        return VerifierKind.STATISTICS;
    }

    @Override
    public boolean canHandle(VerificationInput input) {
        String t = input.topicOrDirective().toLowerCase(Locale.ROOT);
        return TOPIC_KEYWORDS.stream().anyMatch(t::contains);
    }

    @Override
    public VerificationReport verify(VerificationInput input) {
        VerificationReport rep = new VerificationReport(ReportKind.NUMERIC, "Vérification Stats/Régression (numérique)");

        List<Double> numbers = numbers(STATEMENT_NUMBER, input.statement());
        if (numbers.size() < MIN_STATEMENT_NUMBERS) {
            rep.add("extract.table", false, "Impossible d'extraire assez de nombres depuis l'énoncé");
            return rep;
        }

        Regression fit = Regression.fit(numbers.subList(numbers.size() - SERIES_LENGTH, numbers.size()));
        rep.detail("slope", fit.slope());
        rep.detail("intercept", fit.intercept());
        rep.detail("correlation", fit.correlation());

        List<Double> solutionNumbers = numbers(SOLUTION_NUMBER, input.solutionText());
        rep.add("extract.solution_numbers", !solutionNumbers.isEmpty(), solutionNumbers.isEmpty()
                ? "Aucun nombre détecté dans la solution"
                : "Nombres détectés dans la solution");
        if (solutionNumbers.isEmpty()) {
            rep.add("numeric.consistency", false, "Aucun nombre trouvé dans la solution pour comparer");
            return rep;
        }

        boolean ok = solutionNumbers.stream().anyMatch(v -> Math.abs(v - fit.correlation()) < CORRELATION_TOLERANCE)
                || solutionNumbers.stream().anyMatch(v -> Math.abs(v - fit.slope()) < SLOPE_TOLERANCE);
        rep.add("numeric.consistency", ok, String.format(Locale.ROOT,
                "Calcul interne: r≈%.3f, a≈%.3f, b≈%.3f", fit.correlation(), fit.slope(), fit.intercept()));
        log.debug("StatisticsVerifier: {} ({} numbers in solution)", fit, solutionNumbers.size());
        return rep;
    }

    private static List<Double> numbers(Pattern pattern, String text) {
        List<Double> out = new ArrayList<>();
        if (text == null) {
            return out;
        }
        Matcher m = pattern.matcher(DECIMAL_COMMA.matcher(text).replaceAll("$1.$2"));
        while (m.find()) {
            out.add(Double.parseDouble(m.group()));
        }
        return out;
    }
}

package com.example.mathverify.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for the verification engine.
 * Missing sections fall back to the built-in defaults.
 */
@ConfigurationProperties(prefix = "verification")
public record VerificationProperties(
        Structural structural,
        Normalization autoFix,
        Sampling sampling,
        Optimization optimization
) {

    public VerificationProperties {
        structural = structural != null ? structural : new Structural(0);
        autoFix = autoFix != null ? autoFix : new Normalization(0, null);
        sampling = sampling != null ? sampling : new Sampling(null, 0, 0.0);
        optimization = optimization != null ? optimization : new Optimization(0, 0.0);
    }

    /** All defaults, for use outside a Spring context. */
    public static VerificationProperties defaults() {
        return new VerificationProperties(null, null, null, null);
    }

    /**
     * Structural sanity checks.
     *
     * @param minStatementLength minimum trimmed statement length (default 40)
     */
    public record Structural(int minStatementLength) {
        public Structural {
            if (minStatementLength <= 0) minStatementLength = 40;
        }
    }

    /**
     * Normalizer settings.
     *
     * @param minStatementLength statements shorter than this are padded (default 45)
     * @param paddingClause      clause appended to short statements
     */
    public record Normalization(int minStatementLength, String paddingClause) {
        public Normalization {
            if (minStatementLength <= 0) minStatementLength = 45;
            if (paddingClause == null || paddingClause.isBlank()) {
                paddingClause = " (Donner la réponse finale et vérifier.)";
            }
        }
    }

    /**
     * Numeric corroboration of symbolic checks.
     *
     * @param seed      seed of the pseudo-random source, fixed per verification call
     * @param samples   number of sample points per numeric check (default 6)
     * @param tolerance residual magnitude under which a sample counts as zero (default 1e-5)
     */
    public record Sampling(Long seed, int samples, double tolerance) {
        public Sampling {
            if (seed == null) seed = 20240601L;
            if (samples <= 0) samples = 6;
            if (tolerance <= 0.0) tolerance = 1e-5;
        }
    }

    /**
     * Multi-variable local search.
     *
     * @param neighbors random neighbours drawn around the declared optimum (default 40)
     * @param radius    maximum perturbation per coordinate (default 0.5)
     */
    public record Optimization(int neighbors, double radius) {
        public Optimization {
            if (neighbors <= 0) neighbors = 40;
            if (radius <= 0.0) radius = 0.5;
        }
    }
}

package com.example.mathverify.service;

import com.example.mathverify.config.VerificationProperties;
import org.springframework.stereotype.Service;

import java.util.Random;

/**
 * Deterministic pseudo-random source for numeric corroboration.
 * <p>
 * Every call to {@link #newRandom()} returns a generator seeded with the configured
 * seed, so verifying the same input twice draws the same sample points.
 */
@Service
public class SampleSource {

    private final VerificationProperties.Sampling sampling;
    private final VerificationProperties.Optimization optimization;

    public SampleSource(VerificationProperties properties) {
        this.sampling = properties.sampling();
        this.optimization = properties.optimization();
    }

    public Random newRandom() {
        return new Random(sampling.seed());
    }

    public int samples() {
        return sampling.samples();
    }

    public double tolerance() {
        return sampling.tolerance();
    }

    public int neighbors() {
        return optimization.neighbors();
    }

    public double radius() {
        return optimization.radius();
    }

    /** Uniform draw in {@code [low, high)}. */
    public static double uniform(Random random, double low, double high) {
        return low + (high - low) * random.nextDouble();
    }
}

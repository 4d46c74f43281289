package com.example.mathverify.model;

/**
 * Numeric evaluation of an expression as a complex number.
 *
 * @param re real part
 * @param im imaginary part
 */
public record NumericValue(double re, double im) {

    public double magnitude() {
        return Math.hypot(re, im);
    }

    public boolean isReal(double tolerance) {
        return Math.abs(im) <= tolerance;
    }

    public boolean isFinite() {
        return Double.isFinite(re) && Double.isFinite(im);
    }

    public NumericValue minus(NumericValue other) {
        return new NumericValue(re - other.re, im - other.im);
    }
}

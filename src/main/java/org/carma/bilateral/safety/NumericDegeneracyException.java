package org.carma.bilateral.safety;

/**
 * Thrown when a learner's weights have collapsed (sum non-positive or not
 * finite), leaving action sampling undefined.
 */
public class NumericDegeneracyException extends ArithmeticException {

    private final double weightSum;

    public NumericDegeneracyException(String message, double weightSum) {
        super(message + " (weight sum = " + weightSum + ")");
        this.weightSum = weightSum;
    }

    public double getWeightSum() {
        return weightSum;
    }
}

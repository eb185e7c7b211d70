package ch.xavier.signalengine.regime.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * GARCH(1,1) coefficients. Only covariance-stationary sets ({@code alpha + beta < 1}) can be constructed.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class GarchParameters {
    public static final GarchParameters DEFAULT = new GarchParameters(1e-4, 0.10, 0.85);

    private final double omega;
    private final double alpha;
    private final double beta;

    public GarchParameters(double omega, double alpha, double beta) {
        if (omega < 0 || alpha < 0 || beta < 0) {
            throw new IllegalArgumentException("GARCH coefficients must be non-negative: omega=" + omega
                    + ", alpha=" + alpha + ", beta=" + beta);
        }
        if (alpha + beta >= 1) {
            throw new IllegalArgumentException("GARCH requires alpha + beta < 1, was " + (alpha + beta));
        }
        this.omega = omega;
        this.alpha = alpha;
        this.beta = beta;
    }

    public double persistence() {
        return alpha + beta;
    }

    public double longRunVariance() {
        return omega / (1 - persistence());
    }
}

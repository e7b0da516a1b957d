package main.java.wte;

import main.java.input.SParameter;
import main.java.util.Cloger;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.DecompositionSolver;
import org.apache.commons.math3.linear.LUDecomposition;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.linear.SingularMatrixException;

/**
 * Whittaker-Eilers smoothing of a sequence of values.
 * <p>
 * The smoothed sequence x is the solution of (I + lambda * D'D) x = y, where D computes the
 * order-th differences of x, adjusted for the spacing of the samples.
 * Every call works on its own matrices, so calls can run in parallel.
 */
public class WTESmoother {

    /**
     * Smooth equally spaced data.
     * @see #smooth(double[], double, int, double[])
     */
    public static double[] smooth(double[] data, double lambda, int order) {
        return smooth(data, lambda, order, null);
    }

    /**
     * Smooth data.
     * @param data values to smooth, not modified
     * @param lambda smoothing parameter. Higher values give smoother output, 0 returns the data.
     *               Negative values are accepted and may lead to an ill-posed system.
     * @param order order of the differences, at least 1 and at most data.length
     * @param spacing distance of each sample to its neighbour, same length as data. null or empty
     *                means unit spacing. Values must be positive, this is not checked.
     * @return smoothed values, same length as data
     * @throws WTEException if the penalty matrix cannot be built or the system cannot be solved
     */
    public static double[] smooth(double[] data, double lambda, int order, double[] spacing) {
        int n = data.length;

        if (spacing == null || spacing.length == 0) {
            spacing = PenaltyMatrix.unit_spacing(n);
        }

        double[][] D;
        try {
            D = PenaltyMatrix.create(data, spacing, order);
        } catch (WTEException e) {
            throw new WTEException(e.getKind(), "failed to create penalty matrix: " + e.getMessage(), e);
        }

        if (lambda < 0) {
            Cloger.getInstance().logger.warn("Negative lambda: {}", lambda);
        }
        Cloger.getInstance().logger.debug("Smoothing {} data points: order={}, lambda={}", n, order, lambda);

        RealMatrix system = SystemAssembler.assemble(D, n, lambda);

        RealVector x;
        try {
            DecompositionSolver solver = new LUDecomposition(system, SParameter.singularity_threshold).getSolver();
            x = solver.solve(new ArrayRealVector(data, true));
        } catch (SingularMatrixException e) {
            throw new WTEException(WTEException.ErrorKind.SOLVE_FAILURE, "failed to solve the system: " + e.getMessage(), e);
        }

        if (x.isNaN() || x.isInfinite()) {
            throw new WTEException(WTEException.ErrorKind.SOLVE_FAILURE,
                    "failed to solve the system: solution has non-finite values");
        }

        return x.toArray();
    }

    /**
     * Sum of squared order-th differences of the values, on unit spacing.
     * @param x values
     * @param order order of the differences
     * @return the roughness of x, 0 when x has no more than order values
     */
    public static double roughness(double[] x, int order) {
        if (order < 1) {
            throw new WTEException(WTEException.ErrorKind.INVALID_ORDER, "order must be at least 1");
        }
        double[] diff = x.clone();
        for (int k = 0; k < order && diff.length > 0; k++) {
            double[] next = new double[diff.length - 1];
            for (int i = 0; i < next.length; i++) {
                next[i] = diff[i + 1] - diff[i];
            }
            diff = next;
        }
        double sum = 0;
        for (double v : diff) {
            sum += v * v;
        }
        return sum;
    }
}

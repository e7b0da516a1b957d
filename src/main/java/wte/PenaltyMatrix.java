package main.java.wte;

public class PenaltyMatrix {

    /**
     * Build the (n-d) x n difference matrix D used as roughness penalty.
     * Row i holds the d-th order difference starting at column i. The interior
     * coefficients are scaled by spacing[i+j-1]/spacing[i+j] for non-uniform sampling.
     * @param data the sequence to smooth, only its length is used
     * @param spacing per-sample spacing, same length as data
     * @param d order of the differences
     * @return D as a dense array, it has no rows when n == d
     */
    public static double[][] create(double[] data, double[] spacing, int d) {
        if (d < 1) {
            throw new WTEException(WTEException.ErrorKind.INVALID_ORDER, "order must be at least 1");
        }

        int n = data.length;

        if (spacing.length != n) {
            throw new WTEException(WTEException.ErrorKind.SPACING_LENGTH_MISMATCH,
                    "spacing must be the same length as data: " + spacing.length + " != " + n);
        }

        if (n < d) {
            throw new WTEException(WTEException.ErrorKind.INSUFFICIENT_DATA,
                    "data must be at least as long as order: " + n + " < " + d);
        }

        double[] binomial = binomial_row(d);
        double[][] D = new double[n - d][n];
        for (int i = 0; i < n - d; i++) {
            for (int j = 0; j <= d; j++) {
                double penalty = (j % 2 == 0) ? binomial[j] : -binomial[j];
                if (j > 0 && j < d) {
                    penalty *= spacing[i + j - 1] / spacing[i + j];
                }
                D[i][i + j] = penalty;
            }
        }
        return D;
    }

    /**
     * Row d of Pascal's triangle, C(d,0) ... C(d,d).
     * @param d row index, d >= 0
     * @return the d+1 binomial coefficients
     */
    public static double[] binomial_row(int d) {
        double[] row = new double[d + 1];
        row[0] = 1;
        for (int k = 1; k <= d; k++) {
            // update in place from the right so row[j-1] is still the previous row's value
            row[k] = 1;
            for (int j = k - 1; j > 0; j--) {
                row[j] = row[j] + row[j - 1];
            }
        }
        return row;
    }

    /**
     * Unit spacing for a sequence of length n.
     */
    public static double[] unit_spacing(int n) {
        double[] spacing = new double[n];
        for (int i = 0; i < n; i++) {
            spacing[i] = 1.0;
        }
        return spacing;
    }
}

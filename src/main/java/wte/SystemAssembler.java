package main.java.wte;

import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;

public class SystemAssembler {

    /**
     * Build I + lambda * D'D.
     * @param D penalty matrix with n columns, possibly without rows
     * @param n number of data points
     * @param lambda smoothing parameter
     * @return the n x n system matrix
     */
    public static RealMatrix assemble(double[][] D, int n, double lambda) {
        RealMatrix system = gram(D, n).scalarMultiply(lambda);
        return MatrixUtils.createRealIdentityMatrix(n).add(system);
    }

    /**
     * D'D, the Gram matrix of the columns of D.
     */
    public static RealMatrix gram(double[][] D, int n) {
        if (D.length == 0) {
            return MatrixUtils.createRealMatrix(n, n);
        }
        RealMatrix d_rm = MatrixUtils.createRealMatrix(D);
        return d_rm.transpose().multiply(d_rm);
    }
}

package main.java.wte;

import main.java.util.Cloger;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;

import java.util.ArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

public class WTEFilter {

    /**
     * Smooth each row of x independently, e.g. one XIC per row.
     * @param x matrix with at least one row, all rows have the same length
     * @param lambda smoothing parameter
     * @param order order of the differences
     * @param spacing spacing shared by all rows, null for unit spacing
     * @param threads number of threads, rows are smoothed in the calling thread when <= 1
     * @return smoothed matrix with the same shape as x
     * @throws IllegalArgumentException if x has no rows
     */
    public static RealMatrix smooth_rows(double[][] x, double lambda, int order, double[] spacing, int threads) {
        if (x.length == 0) {
            throw new IllegalArgumentException("matrix has no rows");
        }
        RealMatrix y = MatrixUtils.createRealMatrix(x.length, x[0].length);
        if (threads <= 1 || x.length == 1) {
            for (int i = 0; i < x.length; i++) {
                y.setRow(i, WTESmoother.smooth(x[i], lambda, order, spacing));
            }
            return y;
        }

        ExecutorService fixedThreadPool = Executors.newFixedThreadPool(Math.min(threads, x.length));
        Cloger.getInstance().logger.debug("Smoothing {} rows with {} threads", x.length, threads);
        try {
            ArrayList<Future<double[]>> rows = new ArrayList<>(x.length);
            for (double[] row : x) {
                rows.add(fixedThreadPool.submit(() -> WTESmoother.smooth(row, lambda, order, spacing)));
            }
            for (int i = 0; i < rows.size(); i++) {
                y.setRow(i, rows.get(i).get());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while smoothing rows", e);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof WTEException) {
                throw (WTEException) e.getCause();
            }
            throw new IllegalStateException(e.getCause());
        } finally {
            fixedThreadPool.shutdownNow();
        }
        return y;
    }

}

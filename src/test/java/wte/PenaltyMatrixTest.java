package test.java.wte;

import main.java.wte.PenaltyMatrix;
import main.java.wte.WTEException;
import org.junit.Test;

import static org.junit.Assert.*;

public class PenaltyMatrixTest {

    @Test
    public void testBinomialRow() {
        assertArrayEquals(new double[]{1}, PenaltyMatrix.binomial_row(0), 0.0);
        assertArrayEquals(new double[]{1, 1}, PenaltyMatrix.binomial_row(1), 0.0);
        assertArrayEquals(new double[]{1, 3, 3, 1}, PenaltyMatrix.binomial_row(3), 0.0);
        assertArrayEquals(new double[]{1, 6, 15, 20, 15, 6, 1}, PenaltyMatrix.binomial_row(6), 0.0);
    }

    @Test
    public void testFirstOrder() {
        double[][] D = PenaltyMatrix.create(new double[4], PenaltyMatrix.unit_spacing(4), 1);
        assertEquals(3, D.length);
        assertArrayEquals(new double[]{1, -1, 0, 0}, D[0], 0.0);
        assertArrayEquals(new double[]{0, 1, -1, 0}, D[1], 0.0);
        assertArrayEquals(new double[]{0, 0, 1, -1}, D[2], 0.0);
    }

    @Test
    public void testThirdOrder() {
        double[][] D = PenaltyMatrix.create(new double[5], PenaltyMatrix.unit_spacing(5), 3);
        assertEquals(2, D.length);
        assertArrayEquals(new double[]{1, -3, 3, -1, 0}, D[0], 0.0);
        assertArrayEquals(new double[]{0, 1, -3, 3, -1}, D[1], 0.0);
    }

    @Test
    public void testSpacingScalesInteriorTerms() {
        double[] spacing = {1, 2, 4, 1};
        double[][] D = PenaltyMatrix.create(new double[4], spacing, 2);
        // interior term of row i is -2 * spacing[i] / spacing[i+1]
        assertArrayEquals(new double[]{1, -1, 1, 0}, D[0], 0.0);
        assertArrayEquals(new double[]{0, 1, -1, 1}, D[1], 0.0);

        // first order rows have no interior terms
        D = PenaltyMatrix.create(new double[4], spacing, 1);
        assertArrayEquals(new double[]{1, -1, 0, 0}, D[0], 0.0);
    }

    @Test
    public void testNoRowsWhenOrderEqualsLength() {
        double[][] D = PenaltyMatrix.create(new double[3], PenaltyMatrix.unit_spacing(3), 3);
        assertEquals(0, D.length);
    }

    @Test
    public void testValidationOrder() {
        try {
            PenaltyMatrix.create(new double[3], new double[2], 0);
            fail();
        } catch (WTEException e) {
            assertEquals(WTEException.ErrorKind.INVALID_ORDER, e.getKind());
        }
        try {
            PenaltyMatrix.create(new double[3], new double[2], 5);
            fail();
        } catch (WTEException e) {
            assertEquals(WTEException.ErrorKind.SPACING_LENGTH_MISMATCH, e.getKind());
        }
        try {
            PenaltyMatrix.create(new double[3], new double[3], 5);
            fail();
        } catch (WTEException e) {
            assertEquals(WTEException.ErrorKind.INSUFFICIENT_DATA, e.getKind());
        }
    }
}

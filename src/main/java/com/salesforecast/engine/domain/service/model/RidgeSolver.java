package com.salesforecast.engine.domain.service.model;

import com.salesforecast.engine.domain.exception.ModelFitException;
import org.apache.commons.math3.exception.MaxCountExceededException;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.ConjugateGradient;
import org.apache.commons.math3.linear.NonPositiveDefiniteOperatorException;
import org.apache.commons.math3.linear.RealVector;

/**
 * Penalised least squares {@code min |y - Xb|^2 + sum(lambda_j * b_j^2)}.
 *
 * <p>The normal equations are symmetrically rescaled to a unit diagonal (Jacobi scaling)
 * and solved with conjugate gradients under a hard iteration budget. Every penalty must
 * be strictly positive so the system is positive definite.
 */
final class RidgeSolver {

    private final int maxIterations;
    private final double tolerance;

    RidgeSolver(int maxIterations, double tolerance) {
        this.maxIterations = maxIterations;
        this.tolerance = tolerance;
    }

    double[] solve(double[][] x, double[] y, double[] penalties) {
        int n = x.length;
        int p = penalties.length;

        double[][] a = new double[p][p];
        double[] b = new double[p];
        for (int i = 0; i < n; i++) {
            double[] row = x[i];
            for (int j = 0; j < p; j++) {
                double rj = row[j];
                if (rj == 0.0) continue;
                b[j] += rj * y[i];
                for (int k = j; k < p; k++) {
                    a[j][k] += rj * row[k];
                }
            }
        }
        for (int j = 0; j < p; j++) {
            a[j][j] += penalties[j];
            for (int k = j + 1; k < p; k++) {
                a[k][j] = a[j][k];
            }
        }

        double[] scale = new double[p];
        for (int j = 0; j < p; j++) {
            if (!(a[j][j] > 0) || !Double.isFinite(a[j][j])) {
                throw new ModelFitException("Normal equations are singular at column " + j);
            }
            scale[j] = 1.0 / Math.sqrt(a[j][j]);
        }
        for (int j = 0; j < p; j++) {
            b[j] *= scale[j];
            for (int k = 0; k < p; k++) {
                a[j][k] *= scale[j] * scale[k];
            }
        }

        RealVector z;
        try {
            ConjugateGradient cg = new ConjugateGradient(maxIterations, tolerance, true);
            z = cg.solve(new Array2DRowRealMatrix(a, false), new ArrayRealVector(b, false));
        } catch (MaxCountExceededException e) {
            throw new ModelFitException(
                    "Least-squares solve did not converge within " + maxIterations + " iterations", e);
        } catch (NonPositiveDefiniteOperatorException e) {
            throw new ModelFitException("Normal equations are not positive definite", e);
        }

        double[] coefficients = new double[p];
        for (int j = 0; j < p; j++) {
            coefficients[j] = z.getEntry(j) * scale[j];
            if (!Double.isFinite(coefficients[j])) {
                throw new ModelFitException("Non-finite coefficient at column " + j);
            }
        }
        return coefficients;
    }
}

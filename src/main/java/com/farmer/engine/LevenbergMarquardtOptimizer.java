package com.farmer.engine;

import com.farmer.model.BandImage;
import com.farmer.model.SourceModel;
import org.apache.commons.math3.exception.MathIllegalArgumentException;
import org.apache.commons.math3.exception.MathIllegalStateException;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.DecompositionSolver;
import org.apache.commons.math3.linear.LUDecomposition;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.linear.SingularMatrixException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Paso de Gauss-Newton amortiguado (Levenberg-Marquardt) con jacobiano por diferencias finitas.
 * Cada llamada a {@link #step(JointFit)} hace un solo paso y devuelve dlnp = (chi²_antes - chi²_después)/2.
 * La varianza es la diagonal de (JᵀJ)⁻¹ evaluada al inicio del paso.
 */
public class LevenbergMarquardtOptimizer implements Optimizer {
    private static final Logger logger = LoggerFactory.getLogger(LevenbergMarquardtOptimizer.class);

    private static final double FD_STEP = 1e-5;
    private static final double INITIAL_DAMPING = 1e-3;
    private static final int MAX_DAMPING_TRIES = 10;

    @Override
    public OptimizerStep step(JointFit fit) throws OptimizationException {
        int n = fit.numberOfParams();
        if (n == 0) return new OptimizerStep(0, new double[0]);

        List<BandImage> images = fit.getImages();
        List<SourceModel> models = fit.getCatalog();
        double[] p0 = fit.getParams();

        // --- RESIDUOS ---
        List<int[]> pixels = new ArrayList<>();
        for (int b = 0; b < images.size(); b++) {
            BandImage img = images.get(b);
            for (int y = 0; y < img.height(); y++)
                for (int x = 0; x < img.width(); x++)
                    if (img.invvar[y][x] > 0) pixels.add(new int[]{b, y, x});
        }
        if (pixels.isEmpty()) throw new OptimizationException("No unmasked pixels to fit");

        double[][][] modelImages = new double[images.size()][][];
        for (int b = 0; b < images.size(); b++) modelImages[b] = fit.getModelImage(b);
        double[] r = new double[pixels.size()];
        double chi0 = 0;
        for (int i = 0; i < r.length; i++) {
            int[] px = pixels.get(i);
            BandImage img = images.get(px[0]);
            r[i] = (img.data[px[1]][px[2]] - modelImages[px[0]][px[1]][px[2]]) * Math.sqrt(img.invvar[px[1]][px[2]]);
            chi0 += r[i] * r[i];
        }
        if (!Double.isFinite(chi0)) throw new OptimizationException("Non-finite chi-square before step");

        // --- JACOBIANO ---
        double[][] jac = jacobian(images, models, pixels, n);

        double[][] a = new double[n][n];
        double[] g = new double[n];
        for (int j = 0; j < n; j++) {
            for (int k = j; k < n; k++) {
                double s = 0;
                for (int i = 0; i < r.length; i++) s += jac[j][i] * jac[k][i];
                a[j][k] = s;
                a[k][j] = s;
            }
            double s = 0;
            for (int i = 0; i < r.length; i++) s += jac[j][i] * r[i];
            g[j] = s;
        }
        double[] variance = variance(a);

        // --- PASO AMORTIGUADO ---
        double lambda = INITIAL_DAMPING;
        for (int t = 0; t < MAX_DAMPING_TRIES; t++, lambda *= 10) {
            double[] delta = solve(a, g, lambda);
            double[] p1 = new double[n];
            for (int j = 0; j < n; j++) {
                p1[j] = p0[j] + delta[j];
                if (!Double.isFinite(p1[j])) throw new OptimizationException("Non-finite parameter update");
            }
            fit.setParams(p1);
            double chi1 = fit.chiSquared();
            if (!Double.isFinite(chi1)) {
                fit.setParams(p0);
                throw new OptimizationException("Non-finite chi-square after update");
            }
            if (chi1 < chi0) {
                return new OptimizerStep((chi0 - chi1) / 2.0, variance);
            }
        }
        // Ningún paso mejora: se queda donde estaba
        logger.debug("no improving step found after {} damping tries", MAX_DAMPING_TRIES);
        fit.setParams(p0);
        return new OptimizerStep(0, variance);
    }

    private static double[][] jacobian(List<BandImage> images, List<SourceModel> models, List<int[]> pixels, int n) {
        double[][] jac = new double[n][];
        int col = 0;
        for (SourceModel m : models) {
            int np = m.numberOfParams();
            if (np == 0) continue;
            double[][][] base = new double[images.size()][][];
            for (int b = 0; b < images.size(); b++) base[b] = ModelRenderer.renderSource(m, b, images.get(b));
            double[] orig = m.getThawedParams();
            for (int j = 0; j < np; j++) {
                SourceModel shifted = m.copy();
                double h = perturb(shifted, orig, j);
                double[] column = new double[pixels.size()];
                if (h != 0) {
                    double[][][] moved = new double[images.size()][][];
                    for (int b = 0; b < images.size(); b++) moved[b] = ModelRenderer.renderSource(shifted, b, images.get(b));
                    for (int i = 0; i < column.length; i++) {
                        int[] px = pixels.get(i);
                        double w = images.get(px[0]).invvar[px[1]][px[2]];
                        column[i] = (moved[px[0]][px[1]][px[2]] - base[px[0]][px[1]][px[2]]) / h * Math.sqrt(w);
                    }
                }
                jac[col++] = column;
            }
        }
        return jac;
    }

    // Desplaza el parámetro j; si el recorte lo anula, prueba hacia el otro lado. Devuelve el paso efectivo.
    private static double perturb(SourceModel shifted, double[] orig, int j) {
        double h = FD_STEP * Math.max(1.0, Math.abs(orig[j]));
        double[] p = orig.clone();
        p[j] = orig[j] + h;
        shifted.setThawedParams(p, 0);
        double actual = shifted.getThawedParams()[j] - orig[j];
        if (actual != 0) return actual;
        p[j] = orig[j] - h;
        shifted.setThawedParams(p, 0);
        return shifted.getThawedParams()[j] - orig[j];
    }

    private static double[] solve(double[][] a, double[] g, double lambda) throws OptimizationException {
        int n = g.length;
        RealMatrix m = new Array2DRowRealMatrix(a);
        for (int j = 0; j < n; j++) {
            double d = a[j][j];
            // Parámetro sin efecto sobre el modelo: no se mueve
            m.setEntry(j, j, d > 0 ? d * (1.0 + lambda) : 1.0);
        }
        try {
            DecompositionSolver solver = new LUDecomposition(m).getSolver();
            RealVector delta = solver.solve(new ArrayRealVector(g));
            return delta.toArray();
        } catch (SingularMatrixException e) {
            throw new OptimizationException("Singular normal matrix (damping " + lambda + ")", e);
        } catch (MathIllegalArgumentException | MathIllegalStateException e) {
            throw new OptimizationException("Linear solve failed: " + e.getMessage(), e);
        }
    }

    private static double[] variance(double[][] a) {
        int n = a.length;
        double[] var = new double[n];
        RealMatrix m = new Array2DRowRealMatrix(a);
        boolean[] dead = new boolean[n];
        for (int j = 0; j < n; j++) {
            if (!(a[j][j] > 0)) {
                dead[j] = true;
                m.setEntry(j, j, 1.0);
            }
        }
        DecompositionSolver solver = new LUDecomposition(m).getSolver();
        if (solver.isNonSingular()) {
            RealMatrix inv = solver.getInverse();
            for (int j = 0; j < n; j++) var[j] = dead[j] ? Double.POSITIVE_INFINITY : inv.getEntry(j, j);
        } else {
            for (int j = 0; j < n; j++) var[j] = dead[j] ? Double.POSITIVE_INFINITY : 1.0 / a[j][j];
        }
        return var;
    }
}

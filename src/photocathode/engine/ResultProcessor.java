package photocathode.engine;

import org.apache.commons.math3.exception.MathIllegalStateException;
import org.apache.commons.math3.fitting.PolynomialCurveFitter;
import org.apache.commons.math3.fitting.WeightedObservedPoints;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import photocathode.config.PhysicalConstants;
import photocathode.model.Bin;
import photocathode.model.BinResult;

import java.util.ArrayList;
import java.util.List;

/**
 * Обработка гистограммы после раскладки:
 * - пик (бин с максимумом электронов),
 * - sigma_z по всем бинам,
 * - взвешенная линейная подгонка p(x) в окне xPeak +- sqrt(2 sigma) -> gamma_z, eta_z.
 */
public final class ResultProcessor {

    private static final Logger log = LogManager.getLogger(ResultProcessor.class);

    private static final int FIT_MAX_ITERATIONS = 1000;

    private final List<Bin> bins;
    private final double numElectrons;
    private final double binWidth;

    public ResultProcessor(List<Bin> bins, double numElectrons, double binWidth) {
        if (!(numElectrons > 0.0)) {
            throw new IllegalArgumentException("numElectrons must be > 0: " + numElectrons);
        }
        if (!(binWidth > 0.0)) {
            throw new IllegalArgumentException("binWidth must be > 0: " + binWidth);
        }
        this.bins = bins;
        this.numElectrons = numElectrons;
        this.binWidth = binWidth;
    }

    public ResultSummary process(double emissionTimeOffset, double totalAllocated) {

        double avX = 0.0;
        double avX2 = 0.0;

        double maxCount = 0.0;
        double xPeak = 0.0;
        double vPeak = 0.0;

        for (Bin bin : bins) {
            // положение бина - его конец
            double x = bin.getEnd();
            BinResult r = bin.result();
            double n = r.getTotalCount();

            if (n > maxCount) {
                maxCount = n;
                xPeak = x;
                vPeak = r.getAvgMomentum() / PhysicalConstants.ELECTRON_MASS;
            }

            avX += n * x;
            avX2 += n * x * x;
        }

        if (!(maxCount > 0.0)) {
            throw new InsufficientDataException("no electrons were allocated to any bin",
                    Double.NaN, Double.NaN, bins.size());
        }

        double meanX = avX / numElectrons;
        double sigma = avX2 / numElectrons - meanX * meanX;

        MomentumFit fit = fitRoutine(xPeak, sigma, maxCount);

        log.debug("peak x={} v={}, sigma={}, fit bins={}", xPeak, vPeak, sigma, fit.getBinCount());

        return new ResultSummary(
                sigma,
                fit.getSigmaCoeff(),
                fit.getEta(),
                sigma * fit.getSlope(),
                fit.getIntercept(),
                xPeak,
                vPeak,
                maxCount,
                fit.getBinCount(),
                emissionTimeOffset,
                totalAllocated
        );
    }

    /**
     * Подгонка в окне [xPeak - sqrt(2 sigma); xPeak + sqrt(2 sigma)].
     * Погрешность точки берётся (N / Nmax)^(-1/2), т.е. вес квадрата невязки линейный по N, а не 1/N^2.
     *
     * @param xPeak    положение пика
     * @param sigma    дисперсия положения
     * @param maxCount число электронов в пиковом бине
     */
    public MomentumFit fitRoutine(double xPeak, double sigma, double maxCount) {
        if (!(sigma > 0.0) || Double.isInfinite(sigma)) {
            throw new InsufficientDataException("sigma must be positive and finite, got " + sigma,
                    xPeak, xPeak, 0);
        }
        if (!(maxCount > 0.0)) {
            throw new IllegalArgumentException("maxCount must be > 0: " + maxCount);
        }

        double halfWidth = Math.sqrt(2 * sigma);
        double low = xPeak - halfWidth;
        double high = xPeak + halfWidth;

        List<Bin> window = new ArrayList<>();
        for (Bin bin : bins) {
            if (bin.getBegin() >= low && bin.getEnd() <= high) {
                window.add(bin);
            }
        }

        if (window.size() < 2) {
            throw new InsufficientDataException("momentum fit needs at least 2 bins", low, high, window.size());
        }

        double sumN = 0.0;
        double sumNdp2 = 0.0;
        double pScale = 0.0;
        int populated = 0;

        for (Bin bin : window) {
            BinResult r = bin.result();
            double n = r.getTotalCount();
            double dp = r.getMomentumUncertainty();
            sumN += n;
            sumNdp2 += n * dp * dp;
            pScale = Math.max(pScale, Math.abs(r.getAvgMomentum()));
            if (n > 0.0) populated++;
        }

        if (populated < 2) {
            log.warn("fit window [{}; {}] has {} bins but only {} with electrons", low, high, window.size(), populated);
            throw new InsufficientDataException("momentum fit needs at least 2 populated bins", low, high, populated);
        }
        if (pScale == 0.0) {
            pScale = 1.0;
        }

        // x и p приводятся к O(1), иначе Левенберг-Марквардт работает с числами 1e-25
        WeightedObservedPoints points = new WeightedObservedPoints();
        for (Bin bin : window) {
            BinResult r = bin.result();
            double weight = r.getTotalCount() / maxCount;
            points.add(weight, (bin.getEnd() - xPeak) / halfWidth, r.getAvgMomentum() / pScale);
        }

        double[] coeffs;
        try {
            coeffs = PolynomialCurveFitter.create(1)
                    .withStartPoint(new double[]{0.0, 0.0})
                    .withMaxIterations(FIT_MAX_ITERATIONS)
                    .fit(points.toList());
        } catch (MathIllegalStateException e) {
            throw new InsufficientDataException("momentum fit did not converge", low, high, window.size(), e);
        }

        double slope = coeffs[1] * pScale / halfWidth;
        double intercept = pScale * (coeffs[0] - coeffs[1] * xPeak / halfWidth);

        double eta = sumNdp2 / sumN;
        double sigmaCoeff = sumN * binWidth / Math.sqrt(2 * PhysicalConstants.PI * sigma);

        return new MomentumFit(slope, intercept, eta, sigmaCoeff, window.size(), low, high);
    }
}

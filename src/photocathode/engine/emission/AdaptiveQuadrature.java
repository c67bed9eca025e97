package photocathode.engine.emission;

import org.apache.commons.math3.analysis.UnivariateFunction;
import org.apache.commons.math3.analysis.integration.IterativeLegendreGaussIntegrator;
import org.apache.commons.math3.analysis.integration.UnivariateIntegrator;
import org.apache.commons.math3.exception.MathIllegalStateException;
import photocathode.config.PhysicalConstants;

/**
 * Адаптивная квадратура Гаусса-Лежандра (commons-math3) с заданными погрешностями.
 * Интегратор commons-math3 хранит состояние, поэтому на каждый вызов создаётся новый:
 * один экземпляр AdaptiveQuadrature можно использовать из нескольких потоков.
 */
public final class AdaptiveQuadrature {

    private final double epsRel;
    private final double epsAbs;
    private final int maxIterations;
    private final int maxEvaluations;

    public AdaptiveQuadrature(double epsRel, double epsAbs) {
        this(epsRel, epsAbs,
                PhysicalConstants.MAX_INTEGRATION_ITERATIONS,
                PhysicalConstants.MAX_INTEGRAND_EVALUATIONS);
    }

    public AdaptiveQuadrature(double epsRel, double epsAbs, int maxIterations, int maxEvaluations) {
        if (!(epsRel >= 0.0)) throw new IllegalArgumentException("epsRel must be >= 0: " + epsRel);
        if (!(epsAbs >= 0.0)) throw new IllegalArgumentException("epsAbs must be >= 0: " + epsAbs);
        if (maxIterations < 2) throw new IllegalArgumentException("maxIterations must be >= 2: " + maxIterations);
        if (maxEvaluations <= 0) throw new IllegalArgumentException("maxEvaluations must be > 0: " + maxEvaluations);
        this.epsRel = epsRel;
        this.epsAbs = epsAbs;
        this.maxIterations = maxIterations;
        this.maxEvaluations = maxEvaluations;
    }

    public double getEpsRel() {
        return epsRel;
    }

    public double getEpsAbs() {
        return epsAbs;
    }

    /**
     * Интеграл f на [lower; upper]. Пустой интервал даёт 0.
     *
     * @throws IntegrationException если точность не достигнута за отведённые итерации
     */
    public double integrate(UnivariateFunction f, double lower, double upper) {
        if (upper < lower) {
            throw new IllegalArgumentException("integration requires lower <= upper: [" + lower + "; " + upper + "]");
        }
        if (upper == lower) {
            return 0.0;
        }

        UnivariateIntegrator integrator = new IterativeLegendreGaussIntegrator(
                PhysicalConstants.GAUSS_POINTS,
                epsRel,
                epsAbs,
                1,
                maxIterations
        );

        try {
            return integrator.integrate(maxEvaluations, f, lower, upper);
        } catch (MathIllegalStateException e) {
            throw new IntegrationException(epsRel, epsAbs, lower, upper, e);
        }
    }
}

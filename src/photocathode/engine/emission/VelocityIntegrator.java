package photocathode.engine.emission;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import photocathode.config.PhysicalConstants;

import static photocathode.config.PhysicalConstants.ELECTRON_MASS;
import static photocathode.config.PhysicalConstants.HBAR;

/**
 * Распределение эмитированных электронов по скоростям.
 * <p>
 * Для скорости v интегрируется T(m v cos(theta) / hbar) sin(theta) по углу на [0; pi/2],
 * затем результат интегрируется по скорости. Отношение интеграла по окну [v1; v2]
 * к интегралу по [0; vmax] - доля электронов среза со скоростями из окна.
 */
public final class VelocityIntegrator {

    private static final Logger log = LogManager.getLogger(VelocityIntegrator.class);

    private final TransmissionModel transmission;
    private final AdaptiveQuadrature quadrature;
    private final double maxVelocity;

    /** Норма vnorm = V(0, vmax); NaN пока не посчитана. */
    private volatile double vnorm = Double.NaN;

    public VelocityIntegrator(TransmissionModel transmission,
                              AdaptiveQuadrature quadrature,
                              double maxVelocity) {
        if (!(maxVelocity > 0.0)) {
            throw new IllegalArgumentException("maxVelocity must be > 0: " + maxVelocity);
        }
        this.transmission = transmission;
        this.quadrature = quadrature;
        this.maxVelocity = maxVelocity;
    }

    public double getMaxVelocity() {
        return maxVelocity;
    }

    /**
     * Интеграл по углу для фиксированной скорости. Для v = 0 равен 0.
     */
    public double thetaIntegral(double v) {
        if (v == 0.0) {
            return 0.0;
        }
        return quadrature.integrate(
                th -> transmission.transmission(ELECTRON_MASS * v * Math.cos(th) / HBAR) * Math.sin(th),
                0.0,
                PhysicalConstants.PI / 2
        );
    }

    /**
     * Интеграл thetaIntegral по скорости на [vLow; vHigh].
     */
    public double velocityIntegral(double vLow, double vHigh) {
        if (vLow > vHigh) {
            throw new IllegalArgumentException("velocityIntegral requires vLow <= vHigh: vLow=" + vLow + " vHigh=" + vHigh);
        }
        return quadrature.integrate(this::thetaIntegral, vLow, vHigh);
    }

    /**
     * Норма распределения V(0, vmax), считается один раз.
     */
    public double normalization() {
        double v = vnorm;
        if (Double.isNaN(v)) {
            synchronized (this) {
                v = vnorm;
                if (Double.isNaN(v)) {
                    v = velocityIntegral(0.0, maxVelocity);
                    if (!(v > 0.0)) {
                        throw new IllegalStateException("velocity distribution norm must be > 0: " + v);
                    }
                    vnorm = v;
                    log.debug("vnorm = {} (vmax = {})", v, maxVelocity);
                }
            }
        }
        return v;
    }

    /**
     * Доля электронов со скоростями из [vLow; vHigh] (разность "функции распределения").
     */
    public double normalizedFraction(double vLow, double vHigh) {
        return velocityIntegral(vLow, vHigh) / normalization();
    }
}

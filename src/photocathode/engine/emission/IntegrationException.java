package photocathode.engine.emission;

import java.util.Locale;

/**
 * Квадратура не сошлась к заданной точности.
 * Молча продолжать нельзя: ошибка нормировки испортит весь прогон.
 */
public class IntegrationException extends RuntimeException {

    private final double epsRel;
    private final double epsAbs;
    private final double lower;
    private final double upper;

    public IntegrationException(double epsRel,
                                double epsAbs,
                                double lower,
                                double upper,
                                Throwable cause) {
        super(String.format(Locale.ROOT,
                "integration over [%s; %s] did not converge (epsRel=%s, epsAbs=%s): %s",
                lower, upper, epsRel, epsAbs, cause == null ? "" : cause.getMessage()), cause);
        this.epsRel = epsRel;
        this.epsAbs = epsAbs;
        this.lower = lower;
        this.upper = upper;
    }

    public double getEpsRel() {
        return epsRel;
    }

    public double getEpsAbs() {
        return epsAbs;
    }

    public double getLower() {
        return lower;
    }

    public double getUpper() {
        return upper;
    }
}

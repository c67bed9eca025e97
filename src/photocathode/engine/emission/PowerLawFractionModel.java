package photocathode.engine.emission;

import photocathode.config.PhysicalConstants;

/**
 * Упрощённая быстрая модель: (v2/vmax)^5 - (v1/vmax)^5.
 * Нужна для проверки раскладки, с физической моделью совпадает только по порядку величины.
 */
public final class PowerLawFractionModel implements EmissionFractionModel {

    private final double maxVelocity;

    public PowerLawFractionModel(double maxVelocity) {
        if (!(maxVelocity > 0.0)) {
            throw new IllegalArgumentException("maxVelocity must be > 0: " + maxVelocity);
        }
        this.maxVelocity = maxVelocity;
    }

    @Override
    public double fraction(double vLow, double vHigh) {
        double p = PhysicalConstants.SIMPLE_MODEL_EXPONENT;
        return Math.pow(vHigh / maxVelocity, p) - Math.pow(vLow / maxVelocity, p);
    }

    @Override
    public String name() {
        return "simple";
    }
}

package photocathode.engine.emission;

/**
 * Физическая модель: доля по нормированному интегралу с коэффициентом прохождения.
 */
public final class TransmissionFractionModel implements EmissionFractionModel {

    private final VelocityIntegrator integrator;

    public TransmissionFractionModel(VelocityIntegrator integrator) {
        this.integrator = integrator;
    }

    public VelocityIntegrator getIntegrator() {
        return integrator;
    }

    @Override
    public void prepare() {
        integrator.normalization();
    }

    @Override
    public double fraction(double vLow, double vHigh) {
        return integrator.normalizedFraction(vLow, vHigh);
    }

    @Override
    public String name() {
        return "transmission";
    }
}

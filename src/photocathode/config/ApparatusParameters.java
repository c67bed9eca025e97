package photocathode.config;

import static photocathode.config.PhysicalConstants.ELECTRON_CHARGE;
import static photocathode.config.PhysicalConstants.ELECTRON_MASS;
import static photocathode.config.PhysicalConstants.HBAR;

/**
 * Параметры установки: лазер, фотокатод и ускоряющее поле (immutable).
 * Все величины в СИ, кроме энергий, которые задаются в эВ.
 * Производные величины считаются один раз в конструкторе.
 */
public class ApparatusParameters {

    /**
     * Длительность лазерного импульса (HW1/eM), с.
     */
    private final double tau;

    /**
     * Полное число эмитированных электронов.
     */
    private final double numElectrons;

    /**
     * Работа выхода фотокатода, эВ (Ta -> 4.25).
     */
    private final double workFunction;

    /**
     * Энергия фотона лазера, эВ.
     */
    private final double photonEnergy;

    /**
     * Напряжённость ускоряющего поля, В/м.
     */
    private final double dcField;

    // ---------- Производные величины ----------

    /** Энергия электрона с полным избытком photonEnergy - WF, Дж */
    private final double maxEnergy;

    /** Ускорение электрона в поле пушки, м/с^2 */
    private final double acceleration;

    /** Максимальная начальная скорость эмитированного электрона, м/с */
    private final double maxVelocity;

    /** Волновое число барьера kV = sqrt(2 m WF) / hbar (WF численно в эВ) */
    private final double barrierWavenumber;

    public ApparatusParameters(double tau,
                               double numElectrons,
                               double workFunction,
                               double photonEnergy,
                               double dcField) {
        if (!(tau > 0.0)) {
            throw new IllegalArgumentException("tau must be > 0: " + tau);
        }
        if (!(numElectrons > 0.0)) {
            throw new IllegalArgumentException("numElectrons must be > 0: " + numElectrons);
        }
        if (!(workFunction > 0.0)) {
            throw new IllegalArgumentException("workFunction must be > 0: " + workFunction);
        }
        if (!(photonEnergy > workFunction)) {
            throw new IllegalArgumentException(
                    "photonEnergy must exceed workFunction: photonEnergy=" + photonEnergy
                            + " workFunction=" + workFunction);
        }
        if (!(dcField >= 0.0) || Double.isInfinite(dcField)) {
            throw new IllegalArgumentException("dcField must be >= 0: " + dcField);
        }

        this.tau = tau;
        this.numElectrons = numElectrons;
        this.workFunction = workFunction;
        this.photonEnergy = photonEnergy;
        this.dcField = dcField;

        this.maxEnergy = ELECTRON_CHARGE * (photonEnergy - workFunction);
        this.acceleration = ELECTRON_CHARGE * dcField / ELECTRON_MASS;
        this.maxVelocity = Math.sqrt(2 * maxEnergy / ELECTRON_MASS);
        this.barrierWavenumber = Math.sqrt(2 * ELECTRON_MASS * workFunction) / HBAR;
    }

    public double getTau() {
        return tau;
    }

    public double getNumElectrons() {
        return numElectrons;
    }

    public double getWorkFunction() {
        return workFunction;
    }

    public double getPhotonEnergy() {
        return photonEnergy;
    }

    public double getDcField() {
        return dcField;
    }

    public double getMaxEnergy() {
        return maxEnergy;
    }

    public double getAcceleration() {
        return acceleration;
    }

    public double getMaxVelocity() {
        return maxVelocity;
    }

    public double getBarrierWavenumber() {
        return barrierWavenumber;
    }

    @Override
    public String toString() {
        return String.format(java.util.Locale.ROOT,
                "tau=%s; N=%s; WF=%s; photon_energy=%s; DC_field=%s",
                tau, numElectrons, workFunction, photonEnergy, dcField);
    }
}

package photocathode.pulse;

/**
 * Начальные условия электронного импульса для модели распространения в колонне (immutable).
 * Продольные параметры в терминах AG-модели.
 */
public final class Pulse {

    /** Положение центра импульса, м. */
    private final double location;

    /** Скорость центра импульса, м/с. */
    private final double velocity;

    /** Число электронов. */
    private final double number;

    private final double sigmaZ;
    private final double etaZ;
    private final double gammaZ;

    public Pulse(double location,
                 double velocity,
                 double number,
                 double sigmaZ,
                 double etaZ,
                 double gammaZ) {
        if (!(number > 0.0)) {
            throw new IllegalArgumentException("pulse number must be > 0: " + number);
        }
        this.location = location;
        this.velocity = velocity;
        this.number = number;
        this.sigmaZ = sigmaZ;
        this.etaZ = etaZ;
        this.gammaZ = gammaZ;
    }

    public double getLocation() { return location; }
    public double getVelocity() { return velocity; }
    public double getNumber()   { return number; }
    public double getSigmaZ()   { return sigmaZ; }
    public double getEtaZ()     { return etaZ; }
    public double getGammaZ()   { return gammaZ; }

    public Pulse withNumber(double newNumber) {
        return new Pulse(location, velocity, newNumber, sigmaZ, etaZ, gammaZ);
    }

    public Pulse withKinematics(double newLocation, double newVelocity) {
        return new Pulse(newLocation, newVelocity, number, sigmaZ, etaZ, gammaZ);
    }

    public Pulse withLongitudinal(double newSigmaZ, double newEtaZ, double newGammaZ) {
        return new Pulse(location, velocity, number, newSigmaZ, newEtaZ, newGammaZ);
    }

    @Override
    public String toString() {
        return "Pulse{z=" + location + ", v=" + velocity + ", N=" + number
                + ", sigma_z=" + sigmaZ + ", eta_z=" + etaZ + ", gamma_z=" + gammaZ + "}";
    }
}

package photocathode.engine.emission;

/**
 * Коэффициент прохождения электрона над одномерной ступенькой потенциала
 * как функция внешней нормальной компоненты волнового вектора.
 */
public final class TransmissionModel {

    /** Волновое число барьера kV. */
    private final double barrierWavenumber;

    public TransmissionModel(double barrierWavenumber) {
        if (!(barrierWavenumber > 0.0)) {
            throw new IllegalArgumentException("barrierWavenumber must be > 0: " + barrierWavenumber);
        }
        this.barrierWavenumber = barrierWavenumber;
    }

    public double getBarrierWavenumber() {
        return barrierWavenumber;
    }

    /**
     * T(kz) = 4 s kz / (s + kz)^2, s = sqrt(kV^2 + kz^2).
     * Монотонно растёт, 0 при kz -> 0 и 1 при kz -> бесконечности.
     */
    public double transmission(double kz) {
        if (kz < 0.0) {
            throw new IllegalArgumentException("kz must be >= 0: " + kz);
        }
        double s = Math.hypot(barrierWavenumber, kz);
        double sum = s + kz;
        // по отдельности: (s + kz)^2 переполняется раньше, чем kz
        return 4 * (s / sum) * (kz / sum);
    }
}

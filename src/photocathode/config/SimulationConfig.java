package photocathode.config;

/**
 * Конфигурация дискретизации и численных методов одного прогона.
 */
public class SimulationConfig {

    /** Количество пространственных бинов. */
    private final int numSpaceBins;

    /** Количество временных срезов. */
    private final int numTimeSlices;

    /** Длительность моделирования в единицах tau. */
    private final int numTaus;

    /** Упрощённая модель (v/vmax)^5 вместо интеграла прохождения. */
    private final boolean simple;

    /** Относительная погрешность квадратур. */
    private final double epsRel;

    /** Абсолютная погрешность квадратур. */
    private final double epsAbs;

    /** Количество потоков для раскладки срезов по бинам. */
    private final int threads;

    /** Подробный вывод итогов распределения. */
    private final boolean verbose;

    public SimulationConfig(int numSpaceBins,
                            int numTimeSlices,
                            int numTaus,
                            boolean simple,
                            double epsRel,
                            double epsAbs,
                            int threads,
                            boolean verbose) {
        if (numSpaceBins <= 0) throw new IllegalArgumentException("numSpaceBins must be > 0: " + numSpaceBins);
        if (numTimeSlices <= 0) throw new IllegalArgumentException("numTimeSlices must be > 0: " + numTimeSlices);
        if (numTaus <= 0) throw new IllegalArgumentException("numTaus must be > 0: " + numTaus);
        if (!(epsRel >= 0.0)) throw new IllegalArgumentException("epsRel must be >= 0: " + epsRel);
        if (!(epsAbs >= 0.0)) throw new IllegalArgumentException("epsAbs must be >= 0: " + epsAbs);
        if (threads <= 0) throw new IllegalArgumentException("threads must be > 0: " + threads);

        this.numSpaceBins = numSpaceBins;
        this.numTimeSlices = numTimeSlices;
        this.numTaus = numTaus;
        this.simple = simple;
        this.epsRel = epsRel;
        this.epsAbs = epsAbs;
        this.threads = threads;
        this.verbose = verbose;
    }

    public int getNumSpaceBins() {
        return numSpaceBins;
    }

    public int getNumTimeSlices() {
        return numTimeSlices;
    }

    public int getNumTaus() {
        return numTaus;
    }

    public boolean isSimple() {
        return simple;
    }

    public double getEpsRel() {
        return epsRel;
    }

    public double getEpsAbs() {
        return epsAbs;
    }

    public int getThreads() {
        return threads;
    }

    public boolean isVerbose() {
        return verbose;
    }
}

package photocathode.config;

/**
 * Builder для SimulationConfig.
 */
public class SimulationConfigBuilder {

    private int numSpaceBins = PhysicalConstants.DEFAULT_NUM_SPACE_BINS;
    private int numTimeSlices = PhysicalConstants.DEFAULT_NUM_TIME_SLICES;
    private int numTaus = PhysicalConstants.DEFAULT_NUM_TAUS;
    private boolean simple;
    private double epsRel = PhysicalConstants.DEFAULT_EPS_REL;
    private double epsAbs = PhysicalConstants.DEFAULT_EPS_ABS;
    private int threads = 1;
    private boolean verbose;

    public SimulationConfigBuilder() {
    }

    public static SimulationConfigBuilder from(SimulationConfig base) {
        SimulationConfigBuilder b = new SimulationConfigBuilder();
        b.numSpaceBins = base.getNumSpaceBins();
        b.numTimeSlices = base.getNumTimeSlices();
        b.numTaus = base.getNumTaus();
        b.simple = base.isSimple();
        b.epsRel = base.getEpsRel();
        b.epsAbs = base.getEpsAbs();
        b.threads = base.getThreads();
        b.verbose = base.isVerbose();
        return b;
    }

    public SimulationConfig build() {
        return new SimulationConfig(
                numSpaceBins,
                numTimeSlices,
                numTaus,
                simple,
                epsRel,
                epsAbs,
                threads,
                verbose
        );
    }

    public SimulationConfigBuilder setNumSpaceBins(int numSpaceBins) {
        this.numSpaceBins = numSpaceBins;
        return this;
    }

    public SimulationConfigBuilder setNumTimeSlices(int numTimeSlices) {
        this.numTimeSlices = numTimeSlices;
        return this;
    }

    /** Сетка бинов и срезов одним вызовом. */
    public SimulationConfigBuilder setGrid(int bins, int slices) {
        this.numSpaceBins = bins;
        this.numTimeSlices = slices;
        return this;
    }

    public SimulationConfigBuilder setNumTaus(int numTaus) {
        this.numTaus = numTaus;
        return this;
    }

    public SimulationConfigBuilder setSimple(boolean simple) {
        this.simple = simple;
        return this;
    }

    public SimulationConfigBuilder setEpsRel(double epsRel) {
        this.epsRel = epsRel;
        return this;
    }

    public SimulationConfigBuilder setEpsAbs(double epsAbs) {
        this.epsAbs = epsAbs;
        return this;
    }

    public SimulationConfigBuilder setThreads(int threads) {
        this.threads = threads;
        return this;
    }

    public SimulationConfigBuilder setVerbose(boolean verbose) {
        this.verbose = verbose;
        return this;
    }
}

package photocathode.engine;

/**
 * Результат взвешенной линейной подгонки p(x) в окне вокруг пика.
 */
public final class MomentumFit {

    /** Наклон p(x), кг/с. */
    private final double slope;

    /** Свободный член p(0), кг·м/с. */
    private final double intercept;

    /** Средний квадрат неопределённости импульса в окне. */
    private final double eta;

    /** Амплитуда гауссовой плотности. */
    private final double sigmaCoeff;

    private final int binCount;
    private final double windowLow;
    private final double windowHigh;

    public MomentumFit(double slope,
                       double intercept,
                       double eta,
                       double sigmaCoeff,
                       int binCount,
                       double windowLow,
                       double windowHigh) {
        this.slope = slope;
        this.intercept = intercept;
        this.eta = eta;
        this.sigmaCoeff = sigmaCoeff;
        this.binCount = binCount;
        this.windowLow = windowLow;
        this.windowHigh = windowHigh;
    }

    public double getSlope()       { return slope; }
    public double getIntercept()   { return intercept; }
    public double getEta()         { return eta; }
    public double getSigmaCoeff()  { return sigmaCoeff; }
    public int getBinCount()       { return binCount; }
    public double getWindowLow()   { return windowLow; }
    public double getWindowHigh()  { return windowHigh; }
}

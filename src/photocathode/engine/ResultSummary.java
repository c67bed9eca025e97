package photocathode.engine;

/**
 * Параметры AG-модели, извлечённые из гистограммы (immutable).
 * <p>
 * Плотность ~ sigmaCoeff * exp(-(x - xPeak)^2 / (2 sigma)),
 * импульс ~ (gamma / sigma) * x + gammaOffset.
 */
public final class ResultSummary {

    /** sigma_z: дисперсия продольного положения, м^2. */
    private final double sigma;
    private final double sigmaCoeff;

    /** eta_z: средний квадрат неопределённости импульса в окне подгонки. */
    private final double eta;

    /** gamma_z = sigma * наклон p(x). */
    private final double gamma;
    private final double gammaOffset;

    /** Положение пика (конец бина с максимумом электронов), м. */
    private final double xPeak;

    /** Средняя скорость электронов в пиковом бине, м/с. */
    private final double vPeak;

    private final double maxCount;
    private final int fitBinCount;

    /** Время эмиссии numTaus * tau, на которое надо сдвинуть начало отсчёта колонны, с. */
    private final double emissionTimeOffset;

    private final double totalAllocated;

    public ResultSummary(double sigma,
                         double sigmaCoeff,
                         double eta,
                         double gamma,
                         double gammaOffset,
                         double xPeak,
                         double vPeak,
                         double maxCount,
                         int fitBinCount,
                         double emissionTimeOffset,
                         double totalAllocated) {
        this.sigma = sigma;
        this.sigmaCoeff = sigmaCoeff;
        this.eta = eta;
        this.gamma = gamma;
        this.gammaOffset = gammaOffset;
        this.xPeak = xPeak;
        this.vPeak = vPeak;
        this.maxCount = maxCount;
        this.fitBinCount = fitBinCount;
        this.emissionTimeOffset = emissionTimeOffset;
        this.totalAllocated = totalAllocated;
    }

    public double getSigma()              { return sigma; }
    public double getSigmaCoeff()         { return sigmaCoeff; }
    public double getEta()                { return eta; }
    public double getGamma()              { return gamma; }
    public double getGammaOffset()        { return gammaOffset; }
    public double getXPeak()              { return xPeak; }
    public double getVPeak()              { return vPeak; }
    public double getMaxCount()           { return maxCount; }
    public int getFitBinCount()           { return fitBinCount; }
    public double getEmissionTimeOffset() { return emissionTimeOffset; }
    public double getTotalAllocated()     { return totalAllocated; }
}

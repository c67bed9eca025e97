package photocathode.model;

/**
 * Итог по бину: число электронов, средний импульс и неопределённость импульса.
 */
public final class BinResult {

    /** Пустой бин: нули вместо 0/0. */
    public static final BinResult EMPTY = new BinResult(0.0, 0.0, 0.0);

    private final double totalCount;
    private final double avgMomentum;
    private final double momentumUncertainty;

    public BinResult(double totalCount, double avgMomentum, double momentumUncertainty) {
        this.totalCount = totalCount;
        this.avgMomentum = avgMomentum;
        this.momentumUncertainty = momentumUncertainty;
    }

    public double getTotalCount() {
        return totalCount;
    }

    public double getAvgMomentum() {
        return avgMomentum;
    }

    public double getMomentumUncertainty() {
        return momentumUncertainty;
    }

    @Override
    public String toString() {
        return "BinResult{N=" + totalCount + ", p=" + avgMomentum + ", dp=" + momentumUncertainty + "}";
    }
}

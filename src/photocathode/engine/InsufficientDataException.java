package photocathode.engine;

/**
 * Недостаточно данных для подгонки параметров импульса
 * (слишком узкое окно, пустые бины, вырожденная ширина).
 */
public class InsufficientDataException extends RuntimeException {

    private final double windowLow;
    private final double windowHigh;
    private final int binCount;

    public InsufficientDataException(String message, double windowLow, double windowHigh, int binCount) {
        this(message, windowLow, windowHigh, binCount, null);
    }

    public InsufficientDataException(String message,
                                     double windowLow,
                                     double windowHigh,
                                     int binCount,
                                     Throwable cause) {
        super(message + " (window=[" + windowLow + "; " + windowHigh + "], bins=" + binCount + ")", cause);
        this.windowLow = windowLow;
        this.windowHigh = windowHigh;
        this.binCount = binCount;
    }

    public double getWindowLow() {
        return windowLow;
    }

    public double getWindowHigh() {
        return windowHigh;
    }

    public int getBinCount() {
        return binCount;
    }
}

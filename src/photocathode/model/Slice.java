package photocathode.model;

/**
 * Вклад одного временного среза в пространственный бин:
 * число электронов и их средняя скорость на момент окончания моделирования.
 */
public final class Slice {

    private final double count;
    private final double avgVelocity;

    public Slice(double count, double avgVelocity) {
        if (!(count >= 0.0)) {
            throw new IllegalArgumentException("slice count must be >= 0: " + count);
        }
        this.count = count;
        this.avgVelocity = avgVelocity;
    }

    public double getCount() {
        return count;
    }

    public double getAvgVelocity() {
        return avgVelocity;
    }
}

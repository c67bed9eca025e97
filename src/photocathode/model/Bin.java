package photocathode.model;

import photocathode.config.PhysicalConstants;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Пространственный бин [begin; end).
 * <p>
 * На каждом временном срезе сюда добавляется число попавших электронов и их
 * скорость (диапазон скоростей сводится к среднему, поэтому бинов должно быть
 * достаточно много). Итог считается лениво и кэшируется до следующего addSlice.
 * <p>
 * Не потокобезопасен: при параллельной раскладке бин принадлежит ровно одному потоку.
 */
public final class Bin {

    private final double begin;
    private final double end;

    private final List<Slice> slices = new ArrayList<>();

    /** null = кэш невалиден, нужно пересчитать. */
    private BinResult cachedResult;

    public Bin(double begin, double end) {
        if (!(begin < end)) {
            throw new IllegalArgumentException("bin requires begin < end: [" + begin + "; " + end + ")");
        }
        this.begin = begin;
        this.end = end;
    }

    public double getBegin() {
        return begin;
    }

    public double getEnd() {
        return end;
    }

    public double getWidth() {
        return end - begin;
    }

    public List<Slice> getSlices() {
        return Collections.unmodifiableList(slices);
    }

    public int getSliceCount() {
        return slices.size();
    }

    /**
     * Добавить вклад среза. Скорости на краях бина сводятся к среднему.
     *
     * @param count  число электронов среза в этом бине
     * @param vBegin скорость электронов, пришедших в начало бина, м/с
     * @param vEnd   скорость электронов, пришедших в конец бина, м/с
     */
    public void addSlice(double count, double vBegin, double vEnd) {
        slices.add(new Slice(count, (vBegin + vEnd) / 2));
        cachedResult = null;
    }

    /**
     * @return [число электронов, средний импульс, неопределённость импульса];
     * для бина без электронов - {@link BinResult#EMPTY}
     */
    public BinResult result() {
        if (cachedResult == null) {
            cachedResult = computeResult();
        }
        return cachedResult;
    }

    private BinResult computeResult() {
        final double mass = PhysicalConstants.ELECTRON_MASS;

        double totalNum = 0.0;
        double velocitySum = 0.0;
        double velocity2Sum = 0.0;
        for (Slice s : slices) {
            double num = s.getCount();
            double v = s.getAvgVelocity();
            totalNum += num;
            velocitySum += num * v;
            velocity2Sum += num * v * v;
        }

        if (totalNum <= 0.0) {
            return BinResult.EMPTY;
        }

        double avgMomentum = mass * velocitySum / totalNum;
        // DeltaP^2 = eta
        double uncertainty = Math.sqrt(Math.abs(mass * mass * velocity2Sum / totalNum - avgMomentum * avgMomentum));

        return new BinResult(totalNum, avgMomentum, uncertainty);
    }
}

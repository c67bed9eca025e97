package photocathode.engine;

import org.apache.commons.math3.special.Erf;
import photocathode.config.ApparatusParameters;

/**
 * Гауссов профиль лазерного импульса: сколько электронов эмитировано к моменту t.
 * Центр импульса - середина окна моделирования numTaus * tau / 2.
 */
public final class EmissionProfile {

    private final double numElectrons;
    private final double tau;
    private final double center;

    public EmissionProfile(ApparatusParameters apparatus, int numTaus) {
        if (numTaus <= 0) {
            throw new IllegalArgumentException("numTaus must be > 0: " + numTaus);
        }
        this.numElectrons = apparatus.getNumElectrons();
        this.tau = apparatus.getTau();
        this.center = numTaus * tau / 2;
    }

    /**
     * N * (erf((t - center) / tau) + 1) / 2
     */
    public double cumulative(double t) {
        return numElectrons * (Erf.erf((t - center) / tau) + 1) / 2;
    }

    /**
     * Число электронов в каждом срезе j = 0..numSlices-1, срез j начинается в j * sliceDuration.
     * В срез 0 попадает и весь "хвост" до начала окна.
     */
    public double[] sliceCounts(int numSlices, double sliceDuration) {
        double[] counts = new double[numSlices];
        double numBeforeSlice = 0.0;
        for (int j = 0; j < numSlices; j++) {
            double elapsedTime = j * sliceDuration;
            // erf в commons-math3 монотонна лишь с точностью 1e-15, отрицательный срез недопустим
            double numInSlice = Math.max(0.0, cumulative(elapsedTime) - numBeforeSlice);
            counts[j] = numInSlice;
            numBeforeSlice += numInSlice;
        }
        return counts;
    }
}

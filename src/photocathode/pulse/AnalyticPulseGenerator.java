package photocathode.pulse;

/**
 * Импульс без моделирования эмиссии: параметры базового импульса, мгновенная эмиссия.
 */
public final class AnalyticPulseGenerator implements PulseGenerator {

    @Override
    public PulseGeneration generatePulse(Pulse base, double number) {
        return new PulseGeneration(base.withNumber(number), 0.0, null);
    }
}

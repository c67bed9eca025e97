package photocathode.pulse;

/**
 * Источник начального импульса для колонны.
 */
public interface PulseGenerator {

    /**
     * @param base   импульс с положением и параметрами по умолчанию (из фотокатода)
     * @param number число электронов
     */
    PulseGeneration generatePulse(Pulse base, double number) throws InterruptedException;
}

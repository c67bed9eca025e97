package photocathode.pulse;

/**
 * Способ получения начального импульса.
 */
public enum PulseGeneratorType {
    ANALYTIC,
    SIMULATED
}

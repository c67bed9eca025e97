package photocathode.pulse;

import photocathode.engine.ResultSummary;

/**
 * Итог генерации импульса: сам импульс, сдвиг времени эмиссии и (для симуляции) сводка прогона.
 */
public final class PulseGeneration {

    public final Pulse pulse;

    /** Импульс создан на столько секунд позже начала моделирования колонны. */
    public final double emissionTimeOffset;

    /** null для аналитического генератора. */
    public final ResultSummary summary;

    public PulseGeneration(Pulse pulse, double emissionTimeOffset, ResultSummary summary) {
        this.pulse = pulse;
        this.emissionTimeOffset = emissionTimeOffset;
        this.summary = summary;
    }
}

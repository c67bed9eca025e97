package photocathode;

import photocathode.config.ApparatusParameters;
import photocathode.config.ApparatusParametersBuilder;
import photocathode.config.SimulationConfig;
import photocathode.config.SimulationConfigBuilder;
import photocathode.engine.progress.ProgressListener;
import photocathode.pulse.AnalyticPulseGenerator;
import photocathode.pulse.PulseGenerator;
import photocathode.pulse.PulseGeneratorType;
import photocathode.pulse.SimulatedPulseGenerator;

public final class ScenarioFactory {

    private ScenarioFactory() {}

    /** Тантал (WF 4.25 эВ), фотон 4.75 эВ, 10 пс, 1e6 электронов, 1 МВ/м. */
    public static ApparatusParameters defaultApparatus() {
        return new ApparatusParameters(
                10e-12,
                1e6,
                4.25,
                4.75,
                1e6
        );
    }

    /** Контрольный сценарий: короткий импульс 100 фс, остальное как по умолчанию. */
    public static ApparatusParameters goldenApparatus() {
        return ApparatusParametersBuilder.from(defaultApparatus())
                .setTau(100e-15)
                .build();
    }

    public static SimulationConfig defaultConfig(int threads) {
        return new SimulationConfigBuilder()
                .setThreads(threads)
                .build();
    }

    public static SimulationConfig quickConfig(int bins, int slices, boolean simple) {
        return new SimulationConfigBuilder()
                .setGrid(bins, slices)
                .setSimple(simple)
                .build();
    }

    public static PulseGenerator pulseGenerator(PulseGeneratorType type,
                                                ApparatusParameters apparatus,
                                                SimulationConfig config,
                                                ProgressListener progress) {
        switch (type) {
            case ANALYTIC:
                return new AnalyticPulseGenerator();
            case SIMULATED:
                return new SimulatedPulseGenerator(apparatus, config, progress);
            default:
                throw new IllegalArgumentException("Unknown pulse generator type: " + type);
        }
    }
}

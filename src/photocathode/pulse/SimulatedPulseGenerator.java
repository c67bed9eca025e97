package photocathode.pulse;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import photocathode.config.ApparatusParameters;
import photocathode.config.ApparatusParametersBuilder;
import photocathode.config.SimulationConfig;
import photocathode.engine.ResultSummary;
import photocathode.engine.SimulationEngine;
import photocathode.engine.progress.NoProgressListener;
import photocathode.engine.progress.ProgressListener;

/**
 * Импульс по результатам моделирования фотоэмиссии.
 * Параметры лазера и катода берутся из apparatus, число электронов - из запроса,
 * настройки сетки (bins/slices/simple и т.д.) - из config.
 */
public final class SimulatedPulseGenerator implements PulseGenerator {

    private static final Logger log = LogManager.getLogger(SimulatedPulseGenerator.class);

    private final ApparatusParameters apparatus;
    private final SimulationConfig config;
    private final ProgressListener progress;

    public SimulatedPulseGenerator(ApparatusParameters apparatus, SimulationConfig config) {
        this(apparatus, config, new NoProgressListener());
    }

    public SimulatedPulseGenerator(ApparatusParameters apparatus,
                                   SimulationConfig config,
                                   ProgressListener progress) {
        this.apparatus = apparatus;
        this.config = config;
        this.progress = progress;
    }

    public ApparatusParameters getApparatus() {
        return apparatus;
    }

    public SimulationConfig getConfig() {
        return config;
    }

    @Override
    public PulseGeneration generatePulse(Pulse base, double number) throws InterruptedException {
        log.info("Simulating pulse emission process");

        ApparatusParameters params = ApparatusParametersBuilder.from(apparatus)
                .setNumElectrons(number)
                .build();

        SimulationEngine engine = new SimulationEngine(params, config, progress);
        engine.simulate();
        ResultSummary s = engine.process();

        double offset = s.getEmissionTimeOffset();
        log.info("Note that the pulse was created at an effective time {} s beyond the simulation begin time", offset);

        Pulse pulse = base.withNumber(number)
                .withLongitudinal(s.getSigma(), s.getEta(), s.getGamma())
                .withKinematics(base.getLocation() + s.getXPeak(), s.getVPeak());

        return new PulseGeneration(pulse, offset, s);
    }
}

package photocathode;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import photocathode.config.ApparatusParameters;
import photocathode.config.ApparatusParametersBuilder;
import photocathode.config.SimulationConfig;
import photocathode.engine.ResultSummary;
import photocathode.engine.SimulationEngine;
import photocathode.engine.progress.NoProgressListener;
import photocathode.engine.progress.ProgressListener;
import photocathode.io.ReportFormatter;

import java.util.ArrayList;
import java.util.List;

public final class PhotocathodeRunner {

    private static final Logger log = LogManager.getLogger(PhotocathodeRunner.class);

    private PhotocathodeRunner() {}

    public static RunResult run(ApparatusParameters apparatus,
                                SimulationConfig config,
                                ProgressListener progress) throws InterruptedException {
        SimulationEngine engine = new SimulationEngine(apparatus, config, progress);
        engine.simulate();
        ResultSummary summary = engine.process();
        return new RunResult(engine, summary);
    }

    /**
     * Прогон одним вызовом: simulate -> process -> текст отчёта (Conditions + Results).
     */
    public static String runSimulation(ApparatusParameters apparatus,
                                       SimulationConfig config) throws InterruptedException {
        RunResult rr = run(apparatus, config, new NoProgressListener());
        return ReportFormatter.report(apparatus, rr.summary());
    }

    /**
     * Перебор длительности импульса: для каждого tau свой движок, остальные параметры из base.
     */
    public static List<ResultSummary> sweepTau(ApparatusParameters base,
                                               SimulationConfig config,
                                               double[] taus,
                                               ProgressListener progress) throws InterruptedException {
        List<ResultSummary> out = new ArrayList<>(taus.length);
        for (int k = 0; k < taus.length; k++) {
            ApparatusParameters p = ApparatusParametersBuilder.from(base)
                    .setTau(taus[k])
                    .build();
            log.info("Sweep point {}/{}: tau={}", k + 1, taus.length, taus[k]);
            out.add(run(p, config, progress).summary());
        }
        return out;
    }

    public record RunResult(SimulationEngine engine, ResultSummary summary) {}
}

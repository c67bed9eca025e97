package photocathode;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import photocathode.config.ApparatusParameters;
import photocathode.config.SimulationConfig;
import photocathode.engine.ResultSummary;
import photocathode.engine.progress.LoggingProgressListener;
import photocathode.engine.progress.NoProgressListener;
import photocathode.engine.progress.ProgressListener;
import photocathode.io.BinResultsCsvWriter;
import photocathode.io.ConfigLoader;
import photocathode.io.ReportFormatter;
import photocathode.io.ResultsExcelWriter;

import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

public class Main {

    private static final Logger log = LogManager.getLogger(Main.class);

    public enum RunMode {SINGLE, SWEEP}

    public static void main(String[] args) {

        String configPath = args.length > 0 ? args[0] : null;
        String outputPrefix = args.length > 1 ? args[1] : "photoemission";
        RunMode mode = args.length > 2 ? RunMode.valueOf(args[2].toUpperCase(Locale.ROOT)) : RunMode.SINGLE;

        int threads = Runtime.getRuntime().availableProcessors();

        // длительности импульса для SWEEP, с
        double[] taus = new double[]{100e-15, 500e-15, 1e-12, 5e-12, 10e-12};

        try {
            // 1) параметры: по умолчанию, поверх - файл настроек
            ApparatusParameters apparatus = ScenarioFactory.defaultApparatus();
            SimulationConfig cfg = ScenarioFactory.defaultConfig(threads);
            if (configPath != null) {
                ConfigLoader.LoadedConfig lc = new ConfigLoader().load(Path.of(configPath), apparatus, cfg);
                apparatus = lc.apparatus();
                cfg = lc.config();
            }

            ProgressListener progress = cfg.isVerbose()
                    ? new LoggingProgressListener("emission")
                    : new NoProgressListener();

            // 2) прогон
            if (mode == RunMode.SINGLE) {
                PhotocathodeRunner.RunResult rr = PhotocathodeRunner.run(apparatus, cfg, progress);

                String csvPath = outputPrefix + ".csv";
                String xlsxPath = outputPrefix + ".xlsx";
                BinResultsCsvWriter.writeCsv(csvPath, rr.engine().getBins());
                ResultsExcelWriter.writeXlsx(xlsxPath, apparatus, cfg, rr.engine().getBins(), rr.summary());
                log.info("Saved: {}, {}", csvPath, xlsxPath);

                System.out.println(ReportFormatter.report(apparatus, rr.summary()));
            } else {
                List<ResultSummary> summaries = PhotocathodeRunner.sweepTau(apparatus, cfg, taus, progress);

                String xlsxPath = outputPrefix + "_sweep.xlsx";
                ResultsExcelWriter.writeSweepXlsx(xlsxPath, apparatus, cfg, "tau", taus, summaries);
                log.info("Saved: {}", xlsxPath);
                System.out.println("Saved: " + xlsxPath);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.error("Simulation interrupted", e);
            System.err.println("Ошибка: прогон прерван");
        } catch (Exception e) {
            log.error("Run failed", e);
            System.err.println("Ошибка: " + e.getMessage());
        }
    }
}

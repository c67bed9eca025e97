package photocathode.engine;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import photocathode.config.ApparatusParameters;
import photocathode.config.SimulationConfig;
import photocathode.engine.emission.AdaptiveQuadrature;
import photocathode.engine.emission.EmissionFractionModel;
import photocathode.engine.emission.PowerLawFractionModel;
import photocathode.engine.emission.TransmissionFractionModel;
import photocathode.engine.emission.TransmissionModel;
import photocathode.engine.emission.VelocityIntegrator;
import photocathode.engine.progress.NoProgressListener;
import photocathode.engine.progress.ProgressListener;
import photocathode.model.Bin;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Движок раскладки фотоэмиссии по пространственным бинам.
 * <p>
 * Два этапа строго по порядку: {@link #simulate()}, затем {@link #process()}.
 * <ul>
 *     <li>срезы обходятся последовательно (j = 0..N-1);</li>
 *     <li>внутри среза бины независимы: при threads > 1 список бинов режется на
 *     непрерывные куски, каждый кусок целиком обрабатывает одна задача;</li>
 *     <li>сумма распределённых электронов собирается по кускам после завершения задач.</li>
 * </ul>
 */
public class SimulationEngine {

    private static final Logger log = LogManager.getLogger(SimulationEngine.class);

    private final ApparatusParameters apparatus;
    private final SimulationConfig config;
    private final EmissionFractionModel fractionModel;
    private final ProgressListener progress;

    private final double endTime;
    private final double dmax;
    private final double binWidth;
    private final double sliceDuration;

    private final List<Bin> bins;

    private double totalElectronsAllocated;
    /** simulate() запускался (даже если упал): бины могли получить часть срезов. */
    private boolean started;
    private boolean simulated;
    private ResultSummary summary;

    public SimulationEngine(ApparatusParameters apparatus, SimulationConfig config) {
        this(apparatus, config, new NoProgressListener());
    }

    public SimulationEngine(ApparatusParameters apparatus,
                            SimulationConfig config,
                            ProgressListener progress) {
        this(apparatus, config, createFractionModel(apparatus, config), progress);
    }

    public SimulationEngine(ApparatusParameters apparatus,
                            SimulationConfig config,
                            EmissionFractionModel fractionModel,
                            ProgressListener progress) {
        this.apparatus = apparatus;
        this.config = config;
        this.fractionModel = fractionModel;
        this.progress = progress;

        this.endTime = config.getNumTaus() * apparatus.getTau();
        this.dmax = apparatus.getMaxVelocity() * endTime
                + apparatus.getAcceleration() * endTime * endTime / 2;
        this.binWidth = dmax / config.getNumSpaceBins();
        this.sliceDuration = endTime / config.getNumTimeSlices();

        this.bins = createBins(config.getNumSpaceBins(), binWidth);
    }

    public static EmissionFractionModel createFractionModel(ApparatusParameters apparatus, SimulationConfig config) {
        if (config.isSimple()) {
            return new PowerLawFractionModel(apparatus.getMaxVelocity());
        }
        VelocityIntegrator integrator = new VelocityIntegrator(
                new TransmissionModel(apparatus.getBarrierWavenumber()),
                new AdaptiveQuadrature(config.getEpsRel(), config.getEpsAbs()),
                apparatus.getMaxVelocity()
        );
        return new TransmissionFractionModel(integrator);
    }

    private static List<Bin> createBins(int numSpaceBins, double binWidth) {
        List<Bin> list = new ArrayList<>(numSpaceBins);
        for (int i = 0; i < numSpaceBins; i++) {
            list.add(new Bin(binWidth * i, binWidth * (i + 1)));
        }
        return list;
    }

    /**
     * Раскладка всех временных срезов по бинам.
     *
     * Движок одноразовый: после прерывания или ошибки бины содержат часть срезов,
     * повторный запуск запрещён, нужен новый движок.
     *
     * @throws IllegalStateException если simulate() уже вызывался, в том числе неудачно
     * @throws InterruptedException  если поток прерван (проверяется на границе срезов)
     */
    public void simulate() throws InterruptedException {
        if (started) {
            throw new IllegalStateException("simulate() has already been run on this engine");
        }
        started = true;

        final int numSlices = config.getNumTimeSlices();
        final int threads = config.getThreads();

        log.info("Simulating emission: {}; bins={} slices={} model={} threads={}",
                apparatus, config.getNumSpaceBins(), numSlices, fractionModel.name(), threads);

        fractionModel.prepare();

        double[] sliceCounts = new EmissionProfile(apparatus, config.getNumTaus())
                .sliceCounts(numSlices, sliceDuration);

        ExecutorService executor = (threads > 1) ? Executors.newFixedThreadPool(threads) : null;
        double total = 0.0;

        try {
            if (progress.enabled()) {
                progress.started(numSlices);
            }

            for (int j = 0; j < numSlices; j++) {
                if (Thread.interrupted()) {
                    throw new InterruptedException("simulation interrupted before slice " + j);
                }

                double elapsedTime = j * sliceDuration;
                double propagationTime = endTime - elapsedTime;

                total += (executor == null)
                        ? propagateSlice(bins, sliceCounts[j], propagationTime)
                        : propagateSliceParallel(executor, threads, sliceCounts[j], propagationTime);

                if (progress.enabled()) {
                    progress.sliceCompleted(j, numSlices);
                }
            }
        } finally {
            if (executor != null) {
                executor.shutdownNow();
            }
        }

        totalElectronsAllocated = total;
        simulated = true;
        if (progress.enabled()) {
            progress.finished(total, apparatus.getNumElectrons());
        }

        double percent = total / apparatus.getNumElectrons() * 100;
        if (config.isVerbose()) {
            log.info("Allocated a total of {} electrons ({}%)", total, percent);
        } else {
            log.debug("Allocated a total of {} electrons ({}%)", total, percent);
        }
        if (Math.abs(percent - 100.0) > 1.0) {
            log.warn("Allocated {}% of electrons, grid may be too coarse (bins={}, slices={})",
                    percent, config.getNumSpaceBins(), numSlices);
        }
    }

    private double propagateSliceParallel(ExecutorService executor,
                                          int threads,
                                          double numInSlice,
                                          double propagationTime) throws InterruptedException {

        int n = bins.size();
        int chunks = Math.min(n, Math.max(1, threads * 2));
        int chunkSize = (int) Math.ceil(n / (double) chunks);

        List<Future<Double>> futures = new ArrayList<>(chunks);
        for (int c = 0; c < chunks; c++) {
            int from = c * chunkSize;
            int to = Math.min(n, from + chunkSize);
            if (from >= to) break;

            List<Bin> part = bins.subList(from, to);
            futures.add(executor.submit(() -> propagateSlice(part, numInSlice, propagationTime)));
        }

        double sum = 0.0;
        try {
            for (Future<Double> f : futures) {
                sum += f.get();
            }
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) throw (RuntimeException) cause;
            if (cause instanceof Error) throw (Error) cause;
            throw new IllegalStateException("bin worker failed", cause);
        }
        return sum;
    }

    /**
     * Раскладка одного среза по переданным бинам.
     *
     * @return сколько электронов среза распределено по этим бинам
     */
    double propagateSlice(List<Bin> targets, double numInSlice, double propagationTime) {
        final double acc = apparatus.getAcceleration();
        final double shift = acc * propagationTime / 2;

        double allocated = 0.0;
        for (Bin bin : targets) {
            double begin = bin.getBegin();
            double end = bin.getEnd();

            // начальные скорости, с которыми электрон доходит до начала и конца бина
            double viBegin = begin / propagationTime - shift;
            double viEnd = end / propagationTime - shift;

            // и его скорости в этих точках
            double vfBegin = Math.sqrt(viBegin * viBegin + 2 * acc * begin);
            double vfEnd = Math.sqrt(viEnd * viEnd + 2 * acc * end);

            double num = numberByVelocity(viBegin, viEnd) * numInSlice;
            allocated += num;

            bin.addSlice(num, vfBegin, vfEnd);
        }
        return allocated;
    }

    /**
     * Доля электронов среза с начальными скоростями из [v1; v2], окно обрезается до [0; vmax].
     */
    double numberByVelocity(double v1, double v2) {
        double vmax = apparatus.getMaxVelocity();

        double low = Math.max(v1, 0.0);
        double high = Math.min(v2, vmax);

        if (low > vmax || high < 0.0) {
            return 0.0;
        }
        return fractionModel.fraction(low, high);
    }

    /**
     * Сбор итогов: пик, sigma_z, подгонка gamma_z и eta_z. Результат строится один раз.
     *
     * @throws IllegalStateException если simulate() ещё не выполнялся
     */
    public ResultSummary process() {
        if (!simulated) {
            throw new IllegalStateException("process() requires simulate() to be run first");
        }
        if (summary == null) {
            ResultProcessor processor = new ResultProcessor(bins, apparatus.getNumElectrons(), binWidth);
            summary = processor.process(getEmissionTimeOffset(), totalElectronsAllocated);
        }
        return summary;
    }

    public ApparatusParameters getApparatus() {
        return apparatus;
    }

    public SimulationConfig getConfig() {
        return config;
    }

    public EmissionFractionModel getFractionModel() {
        return fractionModel;
    }

    /**
     * Бины гистограммы. Список неизменяем, но сами бины нет: addSlice после process()
     * не пересчитает уже построенный ResultSummary. Снаружи бины только читать.
     */
    public List<Bin> getBins() {
        return Collections.unmodifiableList(bins);
    }

    public double getEndTime() {
        return endTime;
    }

    public double getDmax() {
        return dmax;
    }

    public double getBinWidth() {
        return binWidth;
    }

    public double getSliceDuration() {
        return sliceDuration;
    }

    public double getTotalElectronsAllocated() {
        return totalElectronsAllocated;
    }

    public boolean isSimulated() {
        return simulated;
    }

    /**
     * Время, прошедшее за эмиссию: numTaus * tau. Колонна должна сдвинуть на него начало отсчёта.
     */
    public double getEmissionTimeOffset() {
        return config.getNumTaus() * apparatus.getTau();
    }
}

package photocathode.engine.progress;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Прогресс в лог: не чаще, чем раз в stepPercent процентов срезов.
 */
public final class LoggingProgressListener implements ProgressListener {

    private static final Logger log = LogManager.getLogger(LoggingProgressListener.class);

    private final String name;
    private final int stepPercent;

    private int lastReportedPercent;
    private long startNanos;

    public LoggingProgressListener(String name) {
        this(name, 10);
    }

    public LoggingProgressListener(String name, int stepPercent) {
        if (stepPercent <= 0 || stepPercent > 100) {
            throw new IllegalArgumentException("stepPercent must be in (0; 100]: " + stepPercent);
        }
        this.name = name;
        this.stepPercent = stepPercent;
    }

    @Override
    public boolean enabled() {
        return true;
    }

    @Override
    public void started(int totalSlices) {
        lastReportedPercent = 0;
        startNanos = System.nanoTime();
        log.info("{}: {} time slices", name, totalSlices);
    }

    @Override
    public void sliceCompleted(int sliceIndex, int totalSlices) {
        int percent = (int) ((sliceIndex + 1) * 100L / totalSlices);
        if (percent >= lastReportedPercent + stepPercent || sliceIndex + 1 == totalSlices) {
            lastReportedPercent = percent;
            double elapsedSec = (System.nanoTime() - startNanos) / 1e9;
            log.info("{}: {}% ({}/{}) elapsed {} s", name, percent, sliceIndex + 1, totalSlices,
                    String.format(java.util.Locale.ROOT, "%.1f", elapsedSec));
        }
    }

    @Override
    public void finished(double totalAllocated, double numElectrons) {
        log.debug("{}: finished, allocated {} of {}", name, totalAllocated, numElectrons);
    }

    int getLastReportedPercent() {
        return lastReportedPercent;
    }
}

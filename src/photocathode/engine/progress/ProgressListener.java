package photocathode.engine.progress;

/**
 * Наблюдатель за ходом раскладки срезов.
 * Вызывается из потока, который ведёт цикл по срезам, ровно один раз на срез.
 */
public interface ProgressListener {

    boolean enabled();

    void started(int totalSlices);

    void sliceCompleted(int sliceIndex, int totalSlices);

    void finished(double totalAllocated, double numElectrons);
}

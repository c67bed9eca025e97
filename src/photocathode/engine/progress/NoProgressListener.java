package photocathode.engine.progress;

public final class NoProgressListener implements ProgressListener {

    @Override
    public boolean enabled() {
        return false;
    }

    @Override
    public void started(int totalSlices) {
        // no-op
    }

    @Override
    public void sliceCompleted(int sliceIndex, int totalSlices) {
        // no-op
    }

    @Override
    public void finished(double totalAllocated, double numElectrons) {
        // no-op
    }
}

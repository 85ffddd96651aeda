package fr.lapetina.workerpool.infrastructure.metrics;

/**
 * Incremental arithmetic mean: {@code avg += (x - avg) / n}.
 */
public final class RunningAverage {

    private long count;
    private double average;

    public synchronized void add(double value) {
        count++;
        average += (value - average) / count;
    }

    public synchronized double get() {
        return average;
    }

    public synchronized long count() {
        return count;
    }
}

package mmc;

import java.util.LinkedList;
import java.util.Queue;

/**
 * Occupancy, FIFO wait queue and statistical accumulators of one server over one replication.
 *
 * The queue area is integrated from the time the queue length last changed, and always before the length changes,
 * so it stays exact whichever server's events move the clock in between.
 */
class ServerState {
    private final int _id;

    private boolean _busy = false;
    private double _busySince = 0;

    // Arrival timestamps of waiting customers, oldest first
    //
    private final Queue<Double> _queue = new LinkedList<>();
    private int _queueLength = 0;
    private double _lastQueueChange = 0;

    private double _queueArea = 0;
    private long _completedCount = 0;
    private double _cumulativeWait = 0;
    private double _cumulativeService = 0;
    private double _cumulativeBusyTime = 0;

    ServerState(int anId) {
        _id = anId;
    }

    int getId() {
        return _id;
    }

    boolean isBusy() {
        return _busy;
    }

    double getBusySince() {
        return _busySince;
    }

    int getQueueLength() {
        return _queueLength;
    }

    int queueSize() {
        return _queue.size();
    }

    double getQueueArea() {
        return _queueArea;
    }

    long getCompletedCount() {
        return _completedCount;
    }

    double getCumulativeWait() {
        return _cumulativeWait;
    }

    double getCumulativeService() {
        return _cumulativeService;
    }

    double getCumulativeBusyTime() {
        return _cumulativeBusyTime;
    }

    /**
     * A customer finding this server idle goes straight into service. Counted as completed from this point.
     */
    void startService(double aNow, double aServiceTime) {
        if (_busy)
            throw new IllegalStateException("Server " + _id + " is already busy");

        _busy = true;
        _busySince = aNow;
        ++_completedCount;
        _cumulativeService += aServiceTime;
    }

    void enqueue(double aNow) {
        accumulateArea(aNow);

        _queue.add(aNow);
        ++_queueLength;
    }

    /**
     * Moves the oldest waiting customer into service.
     *
     * @return the arrival time of that customer
     */
    double serveNext(double aNow, double aServiceTime) {
        if (_queue.isEmpty())
            throw new IllegalStateException("Server " + _id + " has no waiting customer at " + aNow);

        _cumulativeService += aServiceTime;
        accumulateArea(aNow);

        double myArrival = _queue.remove();
        --_queueLength;
        _cumulativeWait += aNow - myArrival;
        ++_completedCount;

        return myArrival;
    }

    void becomeIdle(double aNow) {
        _busy = false;
        _cumulativeBusyTime += aNow - _busySince;
    }

    /**
     * Closes the open busy interval and queue area interval at the end of a run. Safe to call more than once.
     */
    void flushTo(double aTime) {
        if (_busy) {
            _cumulativeBusyTime += aTime - _busySince;
            _busySince = aTime;
        }

        accumulateArea(aTime);
    }

    private void accumulateArea(double aNow) {
        _queueArea += _queueLength * (aNow - _lastQueueChange);
        _lastQueueChange = aNow;
    }

    public String toString() {
        return String.format("Server %d: %s queue %d area %.4f completed %d wait %.4f service %.4f busy %.4f", _id,
                _busy ? "busy" : "idle", _queueLength, _queueArea, _completedCount, _cumulativeWait,
                _cumulativeService, _cumulativeBusyTime);
    }
}

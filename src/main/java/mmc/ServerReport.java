package mmc;

/**
 * Per server figures of a run: average wait and average service time in minutes, time averaged queue length and
 * utilization as a percentage.
 */
class ServerReport {
    static final ServerReport ZERO = new ServerReport(0, 0, 0, 0);

    private final double _averageWait;
    private final double _averageQueueLength;
    private final double _utilizationPercent;
    private final double _averageServiceTime;

    ServerReport(double anAverageWait, double anAverageQueueLength, double aUtilizationPercent,
                 double anAverageServiceTime) {
        _averageWait = anAverageWait;
        _averageQueueLength = anAverageQueueLength;
        _utilizationPercent = aUtilizationPercent;
        _averageServiceTime = anAverageServiceTime;
    }

    double getAverageWait() {
        return _averageWait;
    }

    double getAverageQueueLength() {
        return _averageQueueLength;
    }

    double getUtilizationPercent() {
        return _utilizationPercent;
    }

    double getAverageServiceTime() {
        return _averageServiceTime;
    }

    ServerReport plus(ServerReport anOther) {
        return new ServerReport(_averageWait + anOther._averageWait,
                _averageQueueLength + anOther._averageQueueLength,
                _utilizationPercent + anOther._utilizationPercent,
                _averageServiceTime + anOther._averageServiceTime);
    }

    ServerReport scale(double aFactor) {
        return new ServerReport(_averageWait * aFactor, _averageQueueLength * aFactor,
                _utilizationPercent * aFactor, _averageServiceTime * aFactor);
    }

    public String toString() {
        return String.format("wait %.4f min, queue %.4f customers, utilization %.2f%%, service %.4f min",
                _averageWait, _averageQueueLength, _utilizationPercent, _averageServiceTime);
    }
}

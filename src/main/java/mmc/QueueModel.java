package mmc;

/**
 * Parameters of an M/M/c run. Rates are customers per time unit, the horizon is in the same time unit.
 */
class QueueModel {
    private final int _servers;
    private final double _arrivalRate;
    private final double _serviceRate;
    private final int _replications;
    private final double _horizon;

    QueueModel(int aServers, double anArrivalRate, double aServiceRate, int aReplications, double aHorizon) {
        if (aServers < 1)
            throw new IllegalArgumentException("Number of servers must be >= 1");

        if (! (anArrivalRate > 0))
            throw new IllegalArgumentException("Arrival rate must be > 0");

        if (! (aServiceRate > 0))
            throw new IllegalArgumentException("Service rate must be > 0");

        if (aReplications < 1)
            throw new IllegalArgumentException("Number of replications must be >= 1");

        if (! (aHorizon > 0))
            throw new IllegalArgumentException("Stop horizon must be > 0");

        _servers = aServers;
        _arrivalRate = anArrivalRate;
        _serviceRate = aServiceRate;
        _replications = aReplications;
        _horizon = aHorizon;
    }

    int getServers() {
        return _servers;
    }

    double getArrivalRate() {
        return _arrivalRate;
    }

    double getServiceRate() {
        return _serviceRate;
    }

    int getReplications() {
        return _replications;
    }

    double getHorizon() {
        return _horizon;
    }

    double getMeanInterarrival() {
        return 1.0 / _arrivalRate;
    }

    double getMeanService() {
        return 1.0 / _serviceRate;
    }

    public String toString() {
        return "Servers: " + _servers + " arrival rate: " + _arrivalRate + " service rate: " + _serviceRate +
                " replications: " + _replications + " horizon: " + _horizon;
    }
}

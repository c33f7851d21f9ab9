package mmc;

import java.util.Collections;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * A single run of the engine from clock zero to the stop horizon.
 */
class Replication implements Callable<Replication> {
    private final Engine _engine;
    private final double _horizon;

    private List<ServerReport> _reports = Collections.emptyList();
    private double _elapsed = 0;
    private long _eventCount = 0;

    Replication(Engine anEngine, double aHorizon) {
        _engine = anEngine;
        _horizon = aHorizon;
    }

    @Override
    public Replication call() {
        _engine.initialize(Collections.singletonList(_engine.getArrival()));
        _engine.runUntil(_horizon);

        _reports = _engine.report();
        _elapsed = _engine.getClock().getCurrent();
        _eventCount = _engine.getFiredCount();

        return this;
    }

    List<ServerReport> getReports() {
        return _reports;
    }

    double getElapsed() {
        return _elapsed;
    }

    long getEventCount() {
        return _eventCount;
    }
}

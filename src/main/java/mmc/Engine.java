package mmc;

import mmc.sample.Variate;
import org.apache.commons.math3.random.RandomGenerator;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedList;
import java.util.List;

/**
 * Discrete-event engine for one arrival stream feeding a set of servers, each with its own queue and departure
 * stream. Events are registered once, at construction, and reused across replications. Every change to server state
 * happens inside a handler fired by {@link #advanceAndFire()}.
 */
class Engine {
    // Rates are per hour, waits and service times are reported in minutes
    //
    static final double MINUTES_PER_UNIT = 60.0;

    private final int _numServers;
    private final RandomGenerator _rng;
    private final EventRegistry _events;
    private final Clock _clock = new Clock();
    private final boolean _recordTrace;

    private final List<Step> _trace = new LinkedList<>();
    private List<ServerState> _servers = Collections.emptyList();
    private long _firedCount = 0;

    /**
     * @param anRNG drives the choice between idle servers
     * @param aVariate draws interarrival and service times
     */
    Engine(QueueModel aModel, RandomGenerator anRNG, Variate aVariate, boolean shouldRecordTrace) {
        _numServers = aModel.getServers();
        _rng = anRNG;
        _events = new EventRegistry(_numServers, aModel.getMeanInterarrival(), aModel.getMeanService(), aVariate);
        _recordTrace = shouldRecordTrace;
    }

    ArrivalEvent getArrival() {
        return _events.getArrival();
    }

    DepartureEvent getDeparture(int aServerId) {
        return _events.getDeparture(aServerId);
    }

    ServerState getServer(int aServerId) {
        return _servers.get(aServerId);
    }

    int getNumServers() {
        return _numServers;
    }

    Clock getClock() {
        return _clock;
    }

    long getFiredCount() {
        return _firedCount;
    }

    List<Step> getTrace() {
        if (! _recordTrace)
            throw new IllegalStateException(
                    "To recover the event trace, set 'shouldRecordTrace' 'true' at construction");

        return _trace;
    }

    /**
     * Starts a fresh replication. Only the given events are scheduled, anything else stays disabled until a handler
     * schedules it, so a replication seeded without the arrival event never sees a customer.
     */
    void initialize(List<? extends Event> aSeedEvents) {
        List<ServerState> myServers = new ArrayList<>(_numServers);

        for (int i = 0; i < _numServers; i++)
            myServers.add(new ServerState(i));

        _servers = Collections.unmodifiableList(myServers);
        _clock.reset();
        _trace.clear();
        _firedCount = 0;
        _events.resetAll();

        for (Event myEvent : aSeedEvents)
            myEvent.schedule(_clock.getCurrent());
    }

    /**
     * @return the enabled event with the earliest scheduled time, the first registered on a tie
     * @throws SimulationInvariantException if no event is enabled
     */
    Event selectNextEvent() {
        Event myNext = null;

        for (Event myEvent : _events.getEvents()) {
            if (! myEvent.isEnabled())
                continue;

            if ((myNext == null) || (myEvent.getScheduledTime() < myNext.getScheduledTime()))
                myNext = myEvent;
        }

        if (myNext == null)
            throw new SimulationInvariantException("No enabled event at clock " + _clock.getCurrent() +
                    ", was the replication initialized without its arrival event?");

        return myNext;
    }

    void advanceAndFire() {
        Event myNext = selectNextEvent();

        _clock.advanceTo(myNext.getScheduledTime());
        myNext.fire(this);
        ++_firedCount;

        if (_recordTrace)
            _trace.add(new Step(myNext.getName(), _clock.getCurrent(), _servers));
    }

    /**
     * @param aHorizon must be > 0
     */
    void runUntil(double aHorizon) {
        if (! (aHorizon > 0))
            throw new IllegalArgumentException("Horizon must be > 0");

        while (_clock.getCurrent() < aHorizon)
            advanceAndFire();
    }

    /**
     * Idle servers are picked at random so the lowest id isn't always favoured. With every server busy the first
     * server with the shortest queue wins.
     */
    ServerState findFreeServer() {
        List<ServerState> myIdle = new ArrayList<>();
        ServerState myShortest = null;
        int myShortestLength = Integer.MAX_VALUE;

        for (ServerState myServer : _servers) {
            if (! myServer.isBusy())
                myIdle.add(myServer);

            if (myServer.getQueueLength() < myShortestLength) {
                myShortestLength = myServer.getQueueLength();
                myShortest = myServer;
            }
        }

        switch (myIdle.size()) {
            case 0 : return myShortest;
            case 1 : return myIdle.get(0);
            default : return myIdle.get(_rng.nextInt(myIdle.size()));
        }
    }

    void onArrival() {
        double myNow = _clock.getCurrent();
        ServerState myServer = findFreeServer();

        // Keep the stream going whatever happens to this customer
        //
        _events.getArrival().schedule(myNow);

        if (! myServer.isBusy()) {
            double myDeparture = _events.getDeparture(myServer.getId()).schedule(myNow);
            myServer.startService(myNow, myDeparture - myNow);
        } else {
            myServer.enqueue(myNow);
        }
    }

    void onDeparture(int aServerId) {
        double myNow = _clock.getCurrent();
        ServerState myServer = _servers.get(aServerId);
        DepartureEvent myDeparture = _events.getDeparture(aServerId);

        if (myServer.getQueueLength() == 0) {
            myDeparture.disable();
            myServer.becomeIdle(myNow);
        } else {
            double myNextDeparture = myDeparture.schedule(myNow);
            myServer.serveNext(myNow, myNextDeparture - myNow);
        }
    }

    /**
     * Per server figures over the elapsed clock. Closes any open busy interval first, so it is meant to be called
     * once the run is over.
     *
     * @return one report per server, indexed by server id
     */
    List<ServerReport> report() {
        double myElapsed = _clock.getCurrent();
        List<ServerReport> myReports = new ArrayList<>(_numServers);

        for (ServerState myServer : _servers) {
            myServer.flushTo(myElapsed);

            long myCompleted = myServer.getCompletedCount();

            double myWait = (myCompleted != 0) ?
                    (myServer.getCumulativeWait() / myCompleted) * MINUTES_PER_UNIT : 0;
            double myService = (myCompleted != 0) ?
                    (myServer.getCumulativeService() / myCompleted) * MINUTES_PER_UNIT : 0;
            double myQueue = (myElapsed > 0) ? myServer.getQueueArea() / myElapsed : 0;
            double myUtilization = (myElapsed > 0) ? (myServer.getCumulativeBusyTime() / myElapsed) * 100 : 0;

            myReports.add(new ServerReport(myWait, myQueue, myUtilization, myService));
        }

        return myReports;
    }

    /**
     * Snapshot of every server taken straight after an event's handler ran.
     */
    static class Step {
        private final String _eventName;
        private final double _time;
        private final int[] _queueLengths;
        private final boolean[] _busy;

        Step(String anEventName, double aTime, List<ServerState> aServers) {
            _eventName = anEventName;
            _time = aTime;
            _queueLengths = new int[aServers.size()];
            _busy = new boolean[aServers.size()];

            for (int i = 0; i < aServers.size(); i++) {
                _queueLengths[i] = aServers.get(i).getQueueLength();
                _busy[i] = aServers.get(i).isBusy();
            }
        }

        String getEventName() {
            return _eventName;
        }

        double getTime() {
            return _time;
        }

        int getQueueLength(int aServerId) {
            return _queueLengths[aServerId];
        }

        boolean isBusy(int aServerId) {
            return _busy[aServerId];
        }

        public String toString() {
            return String.format("%.6f %s queues %s busy %s", _time, _eventName, Arrays.toString(_queueLengths),
                    Arrays.toString(_busy));
        }
    }
}

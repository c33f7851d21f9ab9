package mmc;

import mmc.sample.Variate;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The arrival stream plus one departure stream per server, indexed by server id. Iteration order is the arrival
 * followed by departures in server order.
 */
class EventRegistry {
    private final ArrivalEvent _arrival;
    private final List<DepartureEvent> _departures;
    private final List<Event> _all;

    EventRegistry(int aNumServers, double aMeanInterarrival, double aMeanService, Variate aVariate) {
        _arrival = new ArrivalEvent(aMeanInterarrival, aVariate);

        List<DepartureEvent> myDepartures = new ArrayList<>();
        
        for (int i = 0; i < aNumServers; i++)
            myDepartures.add(new DepartureEvent(i, aMeanService, aVariate));

        _departures = Collections.unmodifiableList(myDepartures);

        List<Event> myAll = new ArrayList<>();
        myAll.add(_arrival);
        myAll.addAll(_departures);

        _all = Collections.unmodifiableList(myAll);
    }

    ArrivalEvent getArrival() {
        return _arrival;
    }

    DepartureEvent getDeparture(int aServerId) {
        return _departures.get(aServerId);
    }

    List<Event> getEvents() {
        return _all;
    }

    void resetAll() {
        for (Event myEvent : _all)
            myEvent.reset();
    }
}

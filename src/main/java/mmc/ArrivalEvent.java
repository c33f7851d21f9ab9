package mmc;

import mmc.sample.Variate;

class ArrivalEvent extends Event {
    static final String NAME = "arrival";

    ArrivalEvent(double aMeanInterarrival, Variate aVariate) {
        super(NAME, aMeanInterarrival, aVariate);
    }

    @Override
    public void fire(Engine anEngine) {
        anEngine.onArrival();
    }
}

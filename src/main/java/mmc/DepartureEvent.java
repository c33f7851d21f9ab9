package mmc;

import mmc.sample.Variate;

class DepartureEvent extends Event {
    private final int _serverId;

    DepartureEvent(int aServerId, double aMeanService, Variate aVariate) {
        super("departure" + aServerId, aMeanService, aVariate);
        _serverId = aServerId;
    }

    int getServerId() {
        return _serverId;
    }

    @Override
    public void fire(Engine anEngine) {
        anEngine.onDeparture(_serverId);
    }
}

package mmc;

class Clock {
    private double _current = 0;
    private double _previous = 0;

    double getCurrent() {
        return _current;
    }

    double getPrevious() {
        return _previous;
    }

    void advanceTo(double aTime) {
        if (aTime < _current)
            throw new SimulationInvariantException("Clock cannot run backwards from " + _current + " to " + aTime);

        _previous = _current;
        _current = aTime;
    }

    void reset() {
        _current = 0;
        _previous = 0;
    }
}

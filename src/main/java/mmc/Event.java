package mmc;

import mmc.sample.Variate;

/**
 * An occurrence recurring at exponentially distributed intervals. A disabled event is never selected by the engine
 * and its scheduled time carries no meaning until it is scheduled again.
 */
abstract class Event implements Schedulable {
    private final String _name;
    private final double _meanInterval;
    private final Variate _variate;

    private double _scheduledTime = 0;
    private boolean _enabled = false;

    Event(String aName, double aMeanInterval, Variate aVariate) {
        _name = aName;
        _meanInterval = aMeanInterval;
        _variate = aVariate;
    }

    String getName() {
        return _name;
    }

    double getMeanInterval() {
        return _meanInterval;
    }

    double getScheduledTime() {
        return _scheduledTime;
    }

    boolean isEnabled() {
        return _enabled;
    }

    /**
     * Enables the event and places its next occurrence one sampled interval after the given clock.
     *
     * @return the new scheduled time
     */
    double schedule(double aClock) {
        enable();
        _scheduledTime = _variate.sample(_meanInterval) + aClock;

        return _scheduledTime;
    }

    void enable() {
        _enabled = true;
    }

    void disable() {
        _enabled = false;
    }

    void reset() {
        disable();
        _scheduledTime = 0;
    }

    public String toString() {
        return _name + (_enabled ? " @ " + _scheduledTime : " (disabled)");
    }
}

package mmc;

/**
 * Raised when the engine reaches a state the queueing model cannot produce, such as having no enabled event to
 * advance to. Aborts the replication in progress.
 */
public class SimulationInvariantException extends IllegalStateException {
    SimulationInvariantException(String aMessage) {
        super(aMessage);
    }
}

package mmc;

import mmc.sample.ExponentialVariate;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.Well44497b;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Runs the replications of a model one after another and averages each server's figures across them.
 *
 * A master generator, seeded once, hands every replication its own seed so replications are independent draws yet a
 * whole run can be repeated from the master seed.
 */
class Simulator {
    private final QueueModel _model;
    private final long _seed;
    private final boolean _debug;
    private final boolean _trace;

    private final RandomGenerator _seeder;
    private final RandomGenerator _replicationRng = new Well44497b();
    private final Engine _engine;

    private long _eventTotal = 0;

    Simulator(QueueModel aModel, long aSeed, boolean isDebug, boolean shouldTrace) {
        _model = aModel;
        _seed = aSeed;
        _debug = isDebug;
        _trace = shouldTrace;
        _seeder = new Well44497b(aSeed);
        _engine = new Engine(aModel, _replicationRng, new ExponentialVariate(_replicationRng), shouldTrace);
    }

    long getSeed() {
        return _seed;
    }

    long getEventTotal() {
        return _eventTotal;
    }

    /**
     * @return per server averages over all replications, indexed by server id
     */
    List<ServerReport> simulate() {
        List<ServerReport> mySums = new ArrayList<>(Collections.nCopies(_model.getServers(), ServerReport.ZERO));

        for (int i = 0; i < _model.getReplications(); i++) {
            _replicationRng.setSeed(_seeder.nextLong());

            Replication myResult = new Replication(_engine, _model.getHorizon()).call();
            List<ServerReport> myReports = myResult.getReports();

            _eventTotal += myResult.getEventCount();

            for (int j = 0; j < myReports.size(); j++)
                mySums.set(j, mySums.get(j).plus(myReports.get(j)));

            if (_debug) {
                System.out.println("Replication " + i + " complete: " + myResult.getEventCount() +
                        " events to clock " + myResult.getElapsed());

                for (int j = 0; j < myReports.size(); j++)
                    System.out.println("  Server " + j + ": " + myReports.get(j));
            }

            if (_trace) {
                for (Engine.Step myStep : _engine.getTrace())
                    System.out.println("  " + myStep);

                System.out.println();
            }
        }

        List<ServerReport> myAverages = new ArrayList<>(mySums.size());

        for (ServerReport mySum : mySums)
            myAverages.add(mySum.scale(1.0 / _model.getReplications()));

        return myAverages;
    }
}

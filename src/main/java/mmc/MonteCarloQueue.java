package mmc;

import joptsimple.OptionParser;
import joptsimple.OptionSet;
import joptsimple.OptionSpec;

import java.util.List;

public class MonteCarloQueue {
    private final QueueModel MODEL;
    private final long SEED;
    private final Boolean DEBUG_MODE;
    private final Boolean TRACE_MODE;

    static class Configuration {
        private final OptionParser myOp = new OptionParser();

        // Number of servers, each with its own queue
        //
        final OptionSpec<Integer> _serversParam = myOp.accepts("c").withOptionalArg().ofType(Integer.class).defaultsTo(1);

        // Arrivals and services per hour
        //
        final OptionSpec<Integer> _arrivalRateParam = myOp.accepts("a").withOptionalArg().ofType(Integer.class).defaultsTo(12);
        final OptionSpec<Integer> _serviceRateParam = myOp.accepts("s").withOptionalArg().ofType(Integer.class).defaultsTo(20);

        final OptionSpec<Integer> _replicationsParam = myOp.accepts("n").withOptionalArg().ofType(Integer.class).defaultsTo(30);

        // Length of each replication in hours
        //
        final OptionSpec<Double> _horizonParam = myOp.accepts("t").withOptionalArg().ofType(Double.class).defaultsTo(8.0);

        final OptionSpec<Long> _seedParam = myOp.accepts("seed").withRequiredArg().ofType(Long.class);
        final OptionSpec<Boolean> _debugModeParam = myOp.accepts("d").withOptionalArg().ofType(Boolean.class).defaultsTo(false);
        final OptionSpec<Boolean> _traceParam = myOp.accepts("trace").withOptionalArg().ofType(Boolean.class).defaultsTo(false);

        OptionSet produce(String[] anArgs) {
            return myOp.parse(anArgs);
        }

        QueueModel model(OptionSet anOptions) {
            return new QueueModel(_serversParam.value(anOptions), _arrivalRateParam.value(anOptions),
                    _serviceRateParam.value(anOptions), _replicationsParam.value(anOptions),
                    _horizonParam.value(anOptions));
        }

        long seed(OptionSet anOptions) {
            if (anOptions.has(_seedParam))
                return _seedParam.value(anOptions);
            else
                return System.currentTimeMillis() ^ System.nanoTime();
        }
    }

    private MonteCarloQueue(String[] anArgs) {
        Configuration myConfig = new Configuration();
        OptionSet myOptions = myConfig.produce(anArgs);

        MODEL = myConfig.model(myOptions);
        SEED = myConfig.seed(myOptions);
        DEBUG_MODE = myConfig._debugModeParam.value(myOptions);
        TRACE_MODE = myConfig._traceParam.value(myOptions);
    }

    public static void main(String[] anArgs) throws Exception {
        new MonteCarloQueue(anArgs).simulate();
    }

    private void simulate() {
        System.out.println("Using seed " + SEED);
        System.out.println(MODEL);
        System.out.println();

        Simulator mySimulator = new Simulator(MODEL, SEED, DEBUG_MODE, TRACE_MODE);
        List<ServerReport> myResults = mySimulator.simulate();

        System.out.println("Events fired: " + mySimulator.getEventTotal());
        System.out.println();

        for (int i = 0; i < myResults.size(); i++) {
            ServerReport myReport = myResults.get(i);

            System.out.println("Server " + i);
            System.out.format("\tAverage wait: %f min\n", myReport.getAverageWait());
            System.out.format("\tAverage queue length: %f customers\n", myReport.getAverageQueueLength());
            System.out.format("\tUtilization: %f%%\n", myReport.getUtilizationPercent());
            System.out.format("\tAverage service time: %f min\n", myReport.getAverageServiceTime());
        }
    }
}

package mmc;

import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

public class ServerStateTest {
    private ServerState _server;

    @Before
    public void setup() {
        _server = new ServerState(0);
    }

    @Test
    public void testStartService() {
        _server.startService(2.0, 3.0);

        Assert.assertTrue(_server.isBusy());
        Assert.assertEquals(2.0, _server.getBusySince(), 0.0);
        Assert.assertEquals(1, _server.getCompletedCount());
        Assert.assertEquals(3.0, _server.getCumulativeService(), 0.0);
        Assert.assertEquals(0, _server.getQueueLength());
    }

    @Test(expected = IllegalStateException.class)
    public void testStartServiceWhenBusyFails() {
        _server.startService(2.0, 3.0);
        _server.startService(2.5, 3.0);
    }

    @Test
    public void testFifo() {
        _server.startService(0.0, 10.0);

        for (int i = 1; i <= 5; i++) {
            _server.enqueue(i);
            Assert.assertEquals(_server.queueSize(), _server.getQueueLength());
        }

        for (int i = 1; i <= 5; i++) {
            Assert.assertEquals(i, _server.serveNext(10.0 + i, 1.0), 0.0);
            Assert.assertEquals(_server.queueSize(), _server.getQueueLength());
        }

        Assert.assertEquals(0, _server.getQueueLength());
        Assert.assertEquals(6, _server.getCompletedCount());

        // Each waited 10 time units
        //
        Assert.assertEquals(50.0, _server.getCumulativeWait(), 1e-12);
        Assert.assertEquals(15.0, _server.getCumulativeService(), 1e-12);
    }

    @Test
    public void testQueueArea() {
        _server.startService(0.0, 10.0);
        _server.enqueue(1.0);
        _server.enqueue(3.0);
        _server.serveNext(4.0, 1.0);
        _server.flushTo(6.0);

        // 1 waiting over [1,3], 2 over [3,4], 1 over [4,6]
        //
        Assert.assertEquals(2.0 + 2.0 + 2.0, _server.getQueueArea(), 1e-12);
    }

    @Test
    public void testBusyTime() {
        _server.startService(1.0, 2.0);
        _server.becomeIdle(3.0);
        _server.startService(5.0, 2.0);
        _server.flushTo(6.0);

        Assert.assertEquals(3.0, _server.getCumulativeBusyTime(), 1e-12);

        // A second flush must not count the trailing interval again
        //
        _server.flushTo(6.0);

        Assert.assertEquals(3.0, _server.getCumulativeBusyTime(), 1e-12);
    }

    @Test(expected = IllegalStateException.class)
    public void testServeFromEmptyQueueFails() {
        _server.startService(0.0, 1.0);
        _server.serveNext(1.0, 1.0);
    }
}

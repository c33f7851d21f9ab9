package mmc;

import org.junit.Assert;
import org.junit.Test;

public class QueueModelTest {
    @Test
    public void testMeans() {
        QueueModel myModel = new QueueModel(2, 4, 5, 10, 8);

        Assert.assertEquals(2, myModel.getServers());
        Assert.assertEquals(10, myModel.getReplications());
        Assert.assertEquals(8.0, myModel.getHorizon(), 0.0);
        Assert.assertEquals(0.25, myModel.getMeanInterarrival(), 1e-12);
        Assert.assertEquals(0.2, myModel.getMeanService(), 1e-12);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testZeroServersFails() {
        new QueueModel(0, 4, 5, 10, 8);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testZeroArrivalRateFails() {
        new QueueModel(1, 0, 5, 10, 8);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNegServiceRateFails() {
        new QueueModel(1, 4, -5, 10, 8);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testZeroReplicationsFails() {
        new QueueModel(1, 4, 5, 0, 8);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testZeroHorizonFails() {
        new QueueModel(1, 4, 5, 10, 0);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNaNHorizonFails() {
        new QueueModel(1, 4, 5, 10, Double.NaN);
    }
}

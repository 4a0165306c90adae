package cn.gm.light.bloom.core;

import cn.gm.light.bloom.factory.BloomFilters;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

public class StatisticsTest {

    @Test
    public void testFormula() {
        Assertions.assertEquals(0.007905097010013629, Statistics.falsePositiveProbability(1, 0, 64), 1e-12);
        Assertions.assertEquals(2.7880282823782437e-05, Statistics.falsePositiveProbability(3, 10, 1024), 1e-15);
    }

    @Test
    public void testNonDecreasingInN() {
        double previous = Statistics.falsePositiveProbability(7, 0, 9586);
        for (long n = 1; n <= 50_000; n++) {
            double current = Statistics.falsePositiveProbability(7, n, 9586);
            Assertions.assertTrue(current >= previous, "decreased at n=" + n);
            Assertions.assertTrue(current <= 1.0);
            previous = current;
        }
    }

    @Test
    public void testUsesCurrentLoad() {
        ConcurrentBloomFilter filter = BloomFilters.newOptimal(1000, 0.01);
        double empty = filter.falsePositiveProbability();
        for (int i = 0; i < 1000; i++) {
            filter.add(i);
        }
        double full = filter.falsePositiveProbability();
        Assertions.assertTrue(full > empty);
        // 按最优参数填满后接近目标误判率
        Assertions.assertTrue(full < 0.02, "fpp=" + full);
        // 继续添加不会失败，只是误判率上升
        for (int i = 0; i < 100_000; i++) {
            filter.add(i);
        }
        Assertions.assertTrue(filter.falsePositiveProbability() > full);
    }
}

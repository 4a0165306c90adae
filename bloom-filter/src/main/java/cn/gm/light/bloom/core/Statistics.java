package cn.gm.light.bloom.core;

/**
 * 误判率统计。
 */
public final class Statistics {

    private Statistics() {
    }

    /**
     * 误判率上界 (1 - e^(-k(n+0.5)/(m-1)))^k。
     * 只做诊断用，n 相对 m 越大结果越接近 1，不存在"满"的状态。
     */
    public static double falsePositiveProbability(long k, long n, long m) {
        double kd = k;
        double nd = n;
        double md = m;
        return Math.pow(1.0 - Math.exp(-kd * (nd + 0.5) / (md - 1)), kd);
    }
}

package cn.gm.light.bloom.factory;

import cn.gm.light.bloom.config.BloomConfig;
import cn.gm.light.bloom.core.ConcurrentBloomFilter;
import cn.gm.light.bloom.exception.BloomException;
import com.google.common.primitives.Longs;
import lombok.extern.slf4j.Slf4j;

import java.security.SecureRandom;
import java.util.LinkedHashSet;
import java.util.Set;

import static cn.gm.light.bloom.core.ConcurrentBloomFilter.K_MIN;
import static cn.gm.light.bloom.core.ConcurrentBloomFilter.M_MAX;
import static cn.gm.light.bloom.core.ConcurrentBloomFilter.M_MIN;
import static com.google.common.base.Preconditions.checkArgument;

/**
 * @author 明溪
 * @version 1.0
 * @project bloomFilter
 * @description 过滤器工厂：计算最优参数、生成 key、校验参数
 * @date 2025/3/12 17:03:29
 */
@Slf4j
public final class BloomFilters {
    private static final double LN2 = Math.log(2);
    private static final double LN2_SQUARED = LN2 * LN2;
    private static final SecureRandom RANDOM = new SecureRandom();

    private BloomFilters() {
    }

    /**
     * m 位、k 个随机 key 的过滤器。
     */
    public static ConcurrentBloomFilter newFilter(long m, long k) {
        if (m < M_MIN || m > M_MAX) {
            throw BloomException.invalidSize(M_MIN, M_MAX);
        }
        if (k < K_MIN) {
            throw BloomException.invalidKeyCount(K_MIN);
        }
        checkArgument(k <= Integer.MAX_VALUE - 8, "too many keys: %s", k);
        return new ConcurrentBloomFilter(m, randomKeys((int) k));
    }

    public static ConcurrentBloomFilter newWithKeys(long m, long[] keys) {
        return new ConcurrentBloomFilter(m, keys);
    }

    /**
     * 按预期元素数量和目标误判率计算最优的 m 和 k。
     */
    public static ConcurrentBloomFilter newOptimal(long maxN, double p) {
        long m = Math.max(M_MIN, optimalM(maxN, p));
        long k = Math.max(K_MIN, optimalK(m, maxN));
        log.debug("New optimal bloom filter: maxN={}, p={}, m={}, k={}", maxN, p, m, k);
        return newFilter(m, k);
    }

    public static ConcurrentBloomFilter create(BloomConfig config) {
        if (config.getBits() == null) {
            return newOptimal(config.getExpectedElements(), config.getFalsePositiveRate());
        }
        long m = config.getBits();
        long k = config.getKeyCount() != null
                ? config.getKeyCount()
                : Math.max(K_MIN, optimalK(m, config.getExpectedElements()));
        log.debug("New bloom filter from config: m={}, k={}", m, k);
        return newFilter(m, k);
    }

    // 动态计算位数组大小
    public static long optimalM(long maxN, double p) {
        checkArgument(maxN > 0, "maxN must be positive: %s", maxN);
        checkArgument(p > 0 && p < 1, "p must be in (0, 1): %s", p);
        return (long) Math.ceil(-maxN * Math.log(p) / LN2_SQUARED);
    }

    // 动态计算哈希函数数量
    public static long optimalK(long m, long maxN) {
        checkArgument(maxN > 0, "maxN must be positive: %s", maxN);
        return (long) Math.ceil(m * LN2 / maxN);
    }

    // k 个互不相同的随机 key
    public static long[] randomKeys(int k) {
        Set<Long> keys = new LinkedHashSet<>(k * 2);
        while (keys.size() < k) {
            keys.add(RANDOM.nextLong());
        }
        return Longs.toArray(keys);
    }

    public static boolean uniqueKeys(long[] keys) {
        return ConcurrentBloomFilter.uniqueKeys(keys);
    }
}

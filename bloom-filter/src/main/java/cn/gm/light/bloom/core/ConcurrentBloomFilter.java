package cn.gm.light.bloom.core;

import cn.gm.light.bloom.BloomFilter;
import cn.gm.light.bloom.exception.BloomException;
import lombok.extern.slf4j.Slf4j;

import java.util.Arrays;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicLongArray;
import java.util.function.LongBinaryOperator;

/**
 * 线程安全的布隆过滤器。
 * <p>
 * add / addC / contains 走 shared 锁，每个 word 用原子 OR 更新，互相之间可以并发；
 * copy / union / unionInPlace / isCompatible 走 exclusive 锁，看到的是整个位数组的一致视图。
 * <p>
 * n 只统计 add 调用次数：union 不会更新 n，合并后 {@link #n()} 不代表合并集合的大小。
 */
@Slf4j
public class ConcurrentBloomFilter implements BloomFilter {
    public static final long M_MIN = 2;
    public static final long K_MIN = 1;
    // AtomicLongArray 长度上限决定
    public static final long M_MAX = 64L * (Integer.MAX_VALUE - 8);

    private static final LongBinaryOperator BIT_OR = (a, b) -> a | b;

    private final long m;                   // 位数组总长度（单位：bit）
    private final long[] keys;              // 构造后不可变
    private final KeyHasher hasher;
    private final AtomicLongArray bits;     // 每个元素管理64位
    private final AtomicLong n = new AtomicLong(0);
    private final FilterGuard guard = new FilterGuard();

    public ConcurrentBloomFilter(long m, long[] keys) {
        this(m, keys, null, 0L);
    }

    /**
     * 用已有的位数组恢复过滤器。words 为 null 时创建空过滤器。
     *
     * @throws BloomException m、key 数量不合法或 key 重复
     */
    public ConcurrentBloomFilter(long m, long[] keys, long[] words, long n) {
        validate(m, keys);
        this.m = m;
        this.keys = keys.clone();
        this.hasher = new KeyHasher(m, this.keys);
        int wordCount = wordCount(m);
        if (words == null) {
            this.bits = new AtomicLongArray(wordCount);
        } else {
            if (words.length != wordCount) {
                throw new IllegalArgumentException("Expected " + wordCount + " words but got " + words.length);
            }
            this.bits = new AtomicLongArray(words);
        }
        this.n.set(n);
    }

    // newCompatible 专用：参数已经校验过，keys 和 hasher 不可变，直接共享
    private ConcurrentBloomFilter(ConcurrentBloomFilter sibling) {
        this.m = sibling.m;
        this.keys = sibling.keys;
        this.hasher = sibling.hasher;
        this.bits = new AtomicLongArray(sibling.bits.length());
    }

    public static void validate(long m, long[] keys) {
        Objects.requireNonNull(keys, "keys");
        if (m < M_MIN || m > M_MAX) {
            throw BloomException.invalidSize(M_MIN, M_MAX);
        }
        if (keys.length < K_MIN) {
            throw BloomException.invalidKeyCount(K_MIN);
        }
        if (!uniqueKeys(keys)) {
            throw BloomException.duplicateKeys();
        }
    }

    public static boolean uniqueKeys(long[] keys) {
        long[] sorted = keys.clone();
        Arrays.sort(sorted);
        for (int i = 1; i < sorted.length; i++) {
            if (sorted[i] == sorted[i - 1]) {
                return false;
            }
        }
        return true;
    }

    public static int wordCount(long m) {
        return (int) ((m + 63) >>> 6);
    }

    @Override
    public long m() {
        return m;
    }

    @Override
    public long k() {
        return keys.length;
    }

    @Override
    public long n() {
        return n.get();
    }

    public long[] keys() {
        return keys.clone();
    }

    long[] keysRef() {
        return keys;
    }

    @Override
    public void add(long hash) {
        long stamp = guard.lockShared();
        try {
            for (int i = 0; i < keys.length; i++) {
                setBit(hasher.index(hash, i));
            }
            n.incrementAndGet();
        } finally {
            guard.unlockShared(stamp);
        }
    }

    /**
     * 添加元素，同时返回添加前 k 个位是否已经全部置位。
     * <p>
     * 每个位的读+写是原子的，但 k 个位整体不是：两个线程并发 addC 同一个哈希时可能都返回 false。
     * 这是概率结构可以接受的竞争，不是 bug。
     *
     * @return false 一定是新元素；true 可能已存在
     */
    @Override
    public boolean addC(long hash) {
        boolean present = true;
        long stamp = guard.lockShared();
        try {
            for (int i = 0; i < keys.length; i++) {
                // 不能短路，每个位都要置上
                present &= setBit(hasher.index(hash, i));
            }
            n.incrementAndGet();
        } finally {
            guard.unlockShared(stamp);
        }
        return present;
    }

    @Override
    public boolean contains(long hash) {
        long stamp = guard.lockShared();
        try {
            for (int i = 0; i < keys.length; i++) {
                if (!testBit(hasher.index(hash, i))) {
                    return false;
                }
            }
            return true;
        } finally {
            guard.unlockShared(stamp);
        }
    }

    // 返回置位前该位的值
    private boolean setBit(long bitIndex) {
        long mask = 1L << (bitIndex & 63);
        long old = bits.getAndAccumulate((int) (bitIndex >>> 6), mask, BIT_OR);
        return (old & mask) != 0;
    }

    private boolean testBit(long bitIndex) {
        long mask = 1L << (bitIndex & 63);
        return (bits.get((int) (bitIndex >>> 6)) & mask) != 0;
    }

    /**
     * 同样 (m, keys) 的空过滤器，n = 0。
     */
    public ConcurrentBloomFilter newCompatible() {
        return new ConcurrentBloomFilter(this);
    }

    /**
     * 深拷贝：位数组和 n 的快照，之后两者互不影响。
     */
    public ConcurrentBloomFilter copy() {
        ConcurrentBloomFilter out = newCompatible();
        guard.runExclusive(() -> {
            for (int i = 0; i < bits.length(); i++) {
                out.bits.set(i, bits.get(i));
            }
            out.n.set(n.get());
        });
        return out;
    }

    /**
     * 把 other 合并进当前过滤器。不兼容时抛异常且两者都不修改。
     * 不更新 n。
     */
    public void unionInPlace(ConcurrentBloomFilter other) {
        Objects.requireNonNull(other, "other");
        FilterGuard.runExclusive(guard, other.guard, () -> {
            Compatibility.verifyCompatible(this, other);
            for (int i = 0; i < bits.length(); i++) {
                bits.getAndAccumulate(i, other.bits.get(i), BIT_OR);
            }
        });
        log.debug("Union in place: m={}, k={}, n={}", m, keys.length, n.get());
    }

    /**
     * 合并成一个新过滤器，两个操作数都不修改。新过滤器 n = 0。
     */
    public ConcurrentBloomFilter union(ConcurrentBloomFilter other) {
        Objects.requireNonNull(other, "other");
        ConcurrentBloomFilter out = FilterGuard.supplyExclusive(guard, other.guard, () -> {
            Compatibility.verifyCompatible(this, other);
            ConcurrentBloomFilter merged = newCompatible();
            for (int i = 0; i < bits.length(); i++) {
                merged.bits.set(i, bits.get(i) | other.bits.get(i));
            }
            return merged;
        });
        log.debug("Union: m={}, k={}", m, keys.length);
        return out;
    }

    public boolean isCompatible(ConcurrentBloomFilter other) {
        Objects.requireNonNull(other, "other");
        return FilterGuard.supplyExclusive(guard, other.guard, () -> Compatibility.isCompatible(this, other));
    }

    /**
     * @throws cn.gm.light.bloom.exception.IncompatibleFilterException 列出不一致的维度
     */
    public void verifyCompatible(ConcurrentBloomFilter other) {
        Objects.requireNonNull(other, "other");
        FilterGuard.runExclusive(guard, other.guard, () -> Compatibility.verifyCompatible(this, other));
    }

    // 位数组的一致快照
    public long[] toWords() {
        return guard.supplyExclusive(this::snapshotWords);
    }

    public BloomFilterState toState() {
        return guard.supplyExclusive(() -> new BloomFilterState(m, n.get(), keys.clone(), snapshotWords()));
    }

    private long[] snapshotWords() {
        long[] out = new long[bits.length()];
        for (int i = 0; i < out.length; i++) {
            out[i] = bits.get(i);
        }
        return out;
    }

    @Override
    public double falsePositiveProbability() {
        return Statistics.falsePositiveProbability(k(), n(), m());
    }

    @Override
    public String toString() {
        return "ConcurrentBloomFilter{m=" + m + ", k=" + keys.length + ", n=" + n.get() + '}';
    }
}

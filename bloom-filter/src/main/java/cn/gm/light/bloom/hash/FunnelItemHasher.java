package cn.gm.light.bloom.hash;

import com.google.common.hash.Funnel;
import com.google.common.hash.HashFunction;
import com.google.common.hash.Hashing;

/**
 * 基于 Guava Funnel 的哈希，任意类型都可以用。
 */
public class FunnelItemHasher<T> implements ItemHasher<T> {
    private final Funnel<? super T> funnel;
    private final HashFunction hashFunction;

    public FunnelItemHasher(Funnel<? super T> funnel, int seed) {
        this.funnel = funnel;
        this.hashFunction = Hashing.murmur3_128(seed);
    }

    @Override
    public long hash64(T item) {
        return hashFunction.hashObject(item, funnel).asLong();
    }
}

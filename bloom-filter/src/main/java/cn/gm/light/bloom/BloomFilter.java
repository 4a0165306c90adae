package cn.gm.light.bloom;

import cn.gm.light.bloom.hash.ItemHasher;

/**
 * @author 明溪
 * @version 1.0
 * @project bloomFilter
 * @description 布隆过滤器。所有方法接收调用方预先算好的 64 位哈希
 * @date 2025/3/8 20:31:33
 */
public interface BloomFilter {
    // 位数组长度（bit）
    long m();

    // key 数量
    long k();

    // add 调用次数，不等于去重后的元素个数
    long n();

    // 添加单个元素（线程安全）
    void add(long hash);

    // 添加并返回添加前是否可能已存在（线程安全）
    boolean addC(long hash);

    // 检查元素是否存在（线程安全），false 表示一定不存在
    boolean contains(long hash);

    double falsePositiveProbability();

    // 批量添加元素（线程安全）
    default void addAll(long... hashes) {
        for (long hash : hashes) {
            add(hash);
        }
    }

    default <T> void add(T item, ItemHasher<? super T> hasher) {
        add(hasher.hash64(item));
    }

    default <T> boolean addC(T item, ItemHasher<? super T> hasher) {
        return addC(hasher.hash64(item));
    }

    default <T> boolean mightContain(T item, ItemHasher<? super T> hasher) {
        return contains(hasher.hash64(item));
    }
}

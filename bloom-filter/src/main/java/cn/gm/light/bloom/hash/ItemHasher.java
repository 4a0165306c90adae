package cn.gm.light.bloom.hash;

import com.google.common.hash.Funnel;

import java.nio.charset.StandardCharsets;

/**
 * 把元素转换成过滤器使用的 64 位哈希。
 */
@FunctionalInterface
public interface ItemHasher<T> {

    long hash64(T item);

    static ItemHasher<byte[]> bytes() {
        return MurmurItemHasher.DEFAULT;
    }

    static ItemHasher<String> utf8() {
        return item -> MurmurItemHasher.DEFAULT.hash64(item.getBytes(StandardCharsets.UTF_8));
    }

    static <T> ItemHasher<T> funnel(Funnel<? super T> funnel) {
        return new FunnelItemHasher<>(funnel, 0);
    }
}

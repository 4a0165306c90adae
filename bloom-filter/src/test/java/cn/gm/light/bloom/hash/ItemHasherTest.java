package cn.gm.light.bloom.hash;

import cn.gm.light.bloom.core.ConcurrentBloomFilter;
import cn.gm.light.bloom.factory.BloomFilters;
import com.google.common.hash.Funnels;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

public class ItemHasherTest {

    @Test
    public void testMurmurDeterministic() {
        byte[] key = "key1".getBytes(StandardCharsets.UTF_8);
        Assertions.assertEquals(ItemHasher.bytes().hash64(key), ItemHasher.bytes().hash64(key.clone()));
        Assertions.assertNotEquals(ItemHasher.bytes().hash64(key),
                ItemHasher.bytes().hash64("key2".getBytes(StandardCharsets.UTF_8)));
        Assertions.assertNotEquals(new MurmurItemHasher(1).hash64(key), new MurmurItemHasher(2).hash64(key));
    }

    @Test
    public void testMurmurTailBytes() {
        // 长度 1..16，覆盖整块和尾部
        byte[] data = new byte[16];
        long previous = ItemHasher.bytes().hash64(new byte[0]);
        for (int len = 1; len <= 16; len++) {
            data[len - 1] = (byte) len;
            byte[] prefix = new byte[len];
            System.arraycopy(data, 0, prefix, 0, len);
            long current = ItemHasher.bytes().hash64(prefix);
            Assertions.assertNotEquals(previous, current);
            previous = current;
        }
    }

    @Test
    public void testFunnel() {
        ItemHasher<CharSequence> hasher = ItemHasher.funnel(Funnels.stringFunnel(StandardCharsets.UTF_8));
        Assertions.assertEquals(hasher.hash64("apple"), hasher.hash64("apple"));
        Assertions.assertNotEquals(hasher.hash64("apple"), hasher.hash64("banana"));
        Assertions.assertNotEquals(new FunnelItemHasher<>(Funnels.integerFunnel(), 1).hash64(42),
                new FunnelItemHasher<>(Funnels.integerFunnel(), 2).hash64(42));
    }

    @Test
    public void testItemOperations() {
        ConcurrentBloomFilter filter = BloomFilters.newOptimal(1000, 0.001);
        ItemHasher<String> hasher = ItemHasher.utf8();
        for (int i = 0; i < 1000; i++) {
            filter.add("user-" + i, hasher);
        }
        for (int i = 0; i < 1000; i++) {
            Assertions.assertTrue(filter.mightContain("user-" + i, hasher));
        }

        ConcurrentBloomFilter empty = filter.newCompatible();
        Assertions.assertFalse(empty.addC("first", hasher));
        Assertions.assertTrue(empty.addC("first", hasher));
    }
}

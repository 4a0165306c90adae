package cn.gm.light.bloom.codec;

import cn.gm.light.bloom.core.ConcurrentBloomFilter;
import cn.gm.light.bloom.exception.BloomErrorType;
import cn.gm.light.bloom.exception.BloomException;
import cn.gm.light.bloom.factory.BloomFilters;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;

/**
 * @author 明溪
 * @version 1.0
 * @project bloomFilter
 * @description TODO
 * @date 2025/3/14 09:12:40
 */
@Slf4j
public class BloomFilterCodecTest {
    private ConcurrentBloomFilter filter;

    @BeforeEach
    public void setUp() {
        filter = BloomFilters.newOptimal(500, 0.01);
        for (int i = 0; i < 500; i++) {
            filter.add(i * 7919L);
        }
    }

    private void assertSameFilter(ConcurrentBloomFilter expected, ConcurrentBloomFilter actual) {
        Assertions.assertEquals(expected.m(), actual.m());
        Assertions.assertEquals(expected.k(), actual.k());
        Assertions.assertEquals(expected.n(), actual.n());
        Assertions.assertArrayEquals(expected.keys(), actual.keys());
        Assertions.assertArrayEquals(expected.toWords(), actual.toWords());
        Assertions.assertTrue(expected.isCompatible(actual));
    }

    @Test
    public void testBinary() {
        byte[] data = BloomFilterCodec.encode(filter);
        int words = ConcurrentBloomFilter.wordCount(filter.m());
        Assertions.assertEquals(24 + 8 * (filter.k() + words) + 48, data.length);

        ConcurrentBloomFilter restored = BloomFilterCodec.decode(data);
        assertSameFilter(filter, restored);
        for (int i = 0; i < 500; i++) {
            Assertions.assertTrue(restored.contains(i * 7919L));
        }
    }

    @Test
    public void testCorruptedData() {
        byte[] data = BloomFilterCodec.encode(filter);
        byte[] flipped = data.clone();
        flipped[40] ^= 0x01;
        BloomException e = Assertions.assertThrows(BloomException.class, () -> BloomFilterCodec.decode(flipped));
        Assertions.assertEquals(BloomErrorType.HASH_MISMATCH, e.getType());

        byte[] truncated = Arrays.copyOf(data, data.length - 8);
        e = Assertions.assertThrows(BloomException.class, () -> BloomFilterCodec.decode(truncated));
        Assertions.assertEquals(BloomErrorType.HASH_MISMATCH, e.getType());

        e = Assertions.assertThrows(BloomException.class, () -> BloomFilterCodec.decode(new byte[10]));
        Assertions.assertEquals(BloomErrorType.HASH_MISMATCH, e.getType());
    }

    @Test
    public void testJson() {
        String json = BloomFilterCodec.toJson(filter);
        log.info("json length={}", json.length());
        assertSameFilter(filter, BloomFilterCodec.fromJson(json));
    }

    @Test
    public void testJsonWordCountMismatch() {
        BloomException e = Assertions.assertThrows(BloomException.class,
                () -> BloomFilterCodec.fromJson("{\"m\":64,\"n\":0,\"keys\":[1],\"words\":[0,0]}"));
        Assertions.assertEquals(BloomErrorType.HASH_MISMATCH, e.getType());

        e = Assertions.assertThrows(BloomException.class, () -> BloomFilterCodec.fromJson("{}"));
        Assertions.assertEquals(BloomErrorType.HASH_MISMATCH, e.getType());

        // 结构完整但 key 重复，仍然走构造校验
        e = Assertions.assertThrows(BloomException.class,
                () -> BloomFilterCodec.fromJson("{\"m\":64,\"n\":0,\"keys\":[1,1],\"words\":[0]}"));
        Assertions.assertEquals(BloomErrorType.DUPLICATE_KEYS, e.getType());

        ConcurrentBloomFilter restored = BloomFilterCodec.fromJson("{\"m\":64,\"n\":1,\"keys\":[1],\"words\":[16]}");
        Assertions.assertTrue(restored.contains(5));
        Assertions.assertEquals(1, restored.n());
    }

    @Test
    public void testStream() throws Exception {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        BloomFilterCodec.writeTo(filter, out);
        ConcurrentBloomFilter restored = BloomFilterCodec.readFrom(new ByteArrayInputStream(out.toByteArray()));
        assertSameFilter(filter, restored);
    }

    @Test
    public void testFile(@TempDir Path dir) throws Exception {
        Path path = dir.resolve("filter.bf.gz");
        BloomFilterCodec.writeFile(filter, path);
        Assertions.assertTrue(Files.size(path) > 0);
        assertSameFilter(filter, BloomFilterCodec.readFile(path));
    }
}

package cn.gm.light.bloom.codec;

import cn.gm.light.bloom.core.BloomFilterState;
import cn.gm.light.bloom.core.ConcurrentBloomFilter;
import cn.gm.light.bloom.exception.BloomException;
import cn.gm.light.bloom.utils.ChecksumUtil;
import cn.gm.light.bloom.utils.LongToByteArray;
import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONException;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

/**
 * @author 明溪
 * @version 1.0
 * @project bloomFilter
 * @description 过滤器编解码
 * @date 2025/3/13 10:15:48
 *
 * 二进制格式（小端序）：
 * <pre>
 * k | n | m | keys[k] | words[ceil(m/64)] | sha384(前面所有字节)
 * </pre>
 * 恢复时长度不一致、摘要不一致都按 {@link cn.gm.light.bloom.exception.BloomErrorType#HASH_MISMATCH} 处理。
 */
@Slf4j
public final class BloomFilterCodec {
    private static final int HEADER_LENGTH = 3 * Long.BYTES;

    private BloomFilterCodec() {
    }

    public static byte[] encode(ConcurrentBloomFilter filter) {
        BloomFilterState state = filter.toState();
        long[] keys = state.getKeys();
        long[] words = state.getWords();
        int bodyLength = HEADER_LENGTH + (keys.length + words.length) * Long.BYTES;
        byte[] out = new byte[bodyLength + ChecksumUtil.SHA384_LENGTH];

        int offset = 0;
        LongToByteArray.writeLong(out, offset, keys.length);
        LongToByteArray.writeLong(out, offset += Long.BYTES, state.getN());
        LongToByteArray.writeLong(out, offset += Long.BYTES, state.getM());
        offset += Long.BYTES;
        for (long key : keys) {
            LongToByteArray.writeLong(out, offset, key);
            offset += Long.BYTES;
        }
        for (long word : words) {
            LongToByteArray.writeLong(out, offset, word);
            offset += Long.BYTES;
        }
        byte[] digest = ChecksumUtil.sha384(out, 0, bodyLength);
        System.arraycopy(digest, 0, out, bodyLength, digest.length);
        return out;
    }

    public static ConcurrentBloomFilter decode(byte[] data) {
        if (data.length < HEADER_LENGTH + ChecksumUtil.SHA384_LENGTH) {
            log.warn("Bloom filter data too short: {} bytes", data.length);
            throw BloomException.hashMismatch();
        }
        int bodyLength = data.length - ChecksumUtil.SHA384_LENGTH;
        byte[] digest = ChecksumUtil.sha384(data, 0, bodyLength);
        if (!ChecksumUtil.matches(digest, data, bodyLength)) {
            log.warn("Bloom filter digest mismatch, computed={}", ChecksumUtil.toHex(digest));
            throw BloomException.hashMismatch();
        }

        long k = LongToByteArray.readLong(data, 0);
        long n = LongToByteArray.readLong(data, Long.BYTES);
        long m = LongToByteArray.readLong(data, 2 * Long.BYTES);
        long maxLongs = (bodyLength - HEADER_LENGTH) / Long.BYTES;
        if (k < 0 || m < 0 || k > maxLongs || m > ConcurrentBloomFilter.M_MAX
                || k + ConcurrentBloomFilter.wordCount(m) != maxLongs
                || (bodyLength - HEADER_LENGTH) % Long.BYTES != 0) {
            log.warn("Bloom filter header inconsistent with length: k={}, m={}, bytes={}", k, m, data.length);
            throw BloomException.hashMismatch();
        }

        int offset = HEADER_LENGTH;
        long[] keys = new long[(int) k];
        for (int i = 0; i < keys.length; i++, offset += Long.BYTES) {
            keys[i] = LongToByteArray.readLong(data, offset);
        }
        long[] words = new long[ConcurrentBloomFilter.wordCount(m)];
        for (int i = 0; i < words.length; i++, offset += Long.BYTES) {
            words[i] = LongToByteArray.readLong(data, offset);
        }
        return restore(new BloomFilterState(m, n, keys, words));
    }

    public static String toJson(ConcurrentBloomFilter filter) {
        return JSON.toJSONString(filter.toState());
    }

    public static ConcurrentBloomFilter fromJson(String json) {
        BloomFilterState state;
        try {
            state = JSON.parseObject(json, BloomFilterState.class);
        } catch (JSONException e) {
            log.warn("Failed to parse bloom filter json", e);
            throw BloomException.hashMismatch(e);
        }
        if (state == null || state.getKeys() == null || state.getWords() == null) {
            log.warn("Incomplete bloom filter json: {}", json);
            throw BloomException.hashMismatch();
        }
        return restore(state);
    }

    // 不关闭 out
    public static void writeTo(ConcurrentBloomFilter filter, OutputStream out) throws IOException {
        GZIPOutputStream gzip = new GZIPOutputStream(out);
        gzip.write(encode(filter));
        gzip.finish();
    }

    // 不关闭 in
    public static ConcurrentBloomFilter readFrom(InputStream in) throws IOException {
        GZIPInputStream gzip = new GZIPInputStream(in);
        return decode(gzip.readAllBytes());
    }

    public static void writeFile(ConcurrentBloomFilter filter, Path path) throws IOException {
        try (OutputStream out = new GZIPOutputStream(Files.newOutputStream(path))) {
            out.write(encode(filter));
        }
    }

    public static ConcurrentBloomFilter readFile(Path path) throws IOException {
        try (InputStream in = new GZIPInputStream(Files.newInputStream(path))) {
            return decode(in.readAllBytes());
        }
    }

    // m、keys 的合法性交给构造方法校验；位数组长度不对属于数据损坏
    private static ConcurrentBloomFilter restore(BloomFilterState state) {
        long m = state.getM();
        if (m >= ConcurrentBloomFilter.M_MIN && m <= ConcurrentBloomFilter.M_MAX
                && state.getWords().length != ConcurrentBloomFilter.wordCount(m)) {
            log.warn("Bloom filter word count mismatch: m={}, words={}", m, state.getWords().length);
            throw BloomException.hashMismatch();
        }
        return new ConcurrentBloomFilter(m, state.getKeys(), state.getWords(), state.getN());
    }
}

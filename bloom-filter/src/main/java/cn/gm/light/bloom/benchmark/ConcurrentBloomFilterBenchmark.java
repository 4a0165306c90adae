package cn.gm.light.bloom.benchmark;

import cn.gm.light.bloom.core.ConcurrentBloomFilter;
import cn.gm.light.bloom.factory.BloomFilters;
import lombok.extern.slf4j.Slf4j;
import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.infra.Blackhole;

import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;

@BenchmarkMode(Mode.Throughput)          // 测试吞吐量（ops/ms）
@OutputTimeUnit(TimeUnit.MILLISECONDS)   // 输出时间单位
@Warmup(iterations = 3, time = 5)       // 预热3轮，每轮5秒
@Measurement(iterations = 5, time = 10) // 正式测试5轮，每轮10秒
@Threads(16)                            // 16线程并发读写
@Fork(1)                                // 单进程测试
@State(Scope.Benchmark)
@Slf4j
public class ConcurrentBloomFilterBenchmark {

    // 预期元素数量（参数化测试）
    @Param({"100000", "1000000", "10000000"})
    private long expectedElements;

    // 过滤器实例（线程共享）
    private ConcurrentBloomFilter filter;

    // 预生成的哈希
    private long[] hashes;

    @Setup(Level.Trial)
    public void setup() {
        filter = BloomFilters.newOptimal(expectedElements, 0.01);
        int dataSize = 1_000_000;
        hashes = new long[dataSize];
        for (int i = 0; i < dataSize; i++) {
            hashes[i] = ThreadLocalRandom.current().nextLong();
        }
        // 先填一半，让 contains 有命中也有不命中
        for (int i = 0; i < dataSize / 2; i++) {
            filter.add(hashes[i]);
        }
        log.info("Benchmark filter ready: {}, fpp={}", filter, filter.falsePositiveProbability());
    }

    private long randomHash() {
        return hashes[ThreadLocalRandom.current().nextInt(hashes.length)];
    }

    @Benchmark
    public void add() {
        filter.add(randomHash());
    }

    @Benchmark
    public void addC(Blackhole blackhole) {
        blackhole.consume(filter.addC(randomHash()));
    }

    @Benchmark
    public void contains(Blackhole blackhole) {
        blackhole.consume(filter.contains(randomHash()));
    }

    // 独占锁下的整体拷贝
    @Benchmark
    @Threads(1)
    public void copy(Blackhole blackhole) {
        blackhole.consume(filter.copy());
    }
}

package cn.gm.light.bloom.core;

import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.StampedLock;
import java.util.function.Supplier;

/**
 * @author 明溪
 * @version 1.0
 * @project bloomFilter
 * @description 过滤器级别的双模式锁
 * @date 2025/3/12 14:26:50
 *
 * 语义和普通读写锁不同：
 * shared 模式给不需要整体一致视图的操作（包括写位：add/addC/contains），靠单个 word 的原子操作保证安全；
 * exclusive 模式给需要整体一致视图的操作（包括只读：copy/union/isCompatible）。
 * StampedLock 不可重入，同一个线程不要嵌套获取。
 */
public final class FilterGuard {
    private static final AtomicLong GLOBAL_ID = new AtomicLong(0);

    // 全局唯一，用来确定两个过滤器的加锁顺序
    private final long id = GLOBAL_ID.incrementAndGet();
    private final StampedLock lock = new StampedLock();

    public long id() {
        return id;
    }

    public long lockShared() {
        return lock.readLock();
    }

    public void unlockShared(long stamp) {
        lock.unlockRead(stamp);
    }

    public <T> T supplyExclusive(Supplier<T> action) {
        long stamp = lock.writeLock();
        try {
            return action.get();
        } finally {
            lock.unlockWrite(stamp);
        }
    }

    public void runExclusive(Runnable action) {
        supplyExclusive(() -> {
            action.run();
            return null;
        });
    }

    /**
     * 同时独占两个过滤器。始终先锁 id 小的那个，A.union(B) 和 B.union(A) 并发执行也不会死锁。
     * 同一个 guard 只加锁一次。
     */
    public static <T> T supplyExclusive(FilterGuard a, FilterGuard b, Supplier<T> action) {
        if (a == b) {
            return a.supplyExclusive(action);
        }
        FilterGuard first = a.id < b.id ? a : b;
        FilterGuard second = first == a ? b : a;
        long firstStamp = first.lock.writeLock();
        try {
            long secondStamp = second.lock.writeLock();
            try {
                return action.get();
            } finally {
                second.lock.unlockWrite(secondStamp);
            }
        } finally {
            first.lock.unlockWrite(firstStamp);
        }
    }

    public static void runExclusive(FilterGuard a, FilterGuard b, Runnable action) {
        supplyExclusive(a, b, () -> {
            action.run();
            return null;
        });
    }
}

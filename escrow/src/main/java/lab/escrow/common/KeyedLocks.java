package lab.escrow.common;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * One {@link ReentrantLock} per key, created on demand and dropped once no thread holds or waits on it.
 * The holder count is only changed inside {@code compute}, so an entry is never removed while a
 * thread that looked it up is still about to lock it.
 */
public class KeyedLocks<K> {

    private final ConcurrentHashMap<K, Entry> locks = new ConcurrentHashMap<>();

    public <T> T withLock(K key, Supplier<T> action) {
        Entry entry = locks.compute(key, (k, existing) -> {
            Entry e = existing == null ? new Entry() : existing;
            e.users++;
            return e;
        });
        entry.lock.lock();
        try {
            return action.get();
        } finally {
            entry.lock.unlock();
            locks.compute(key, (k, existing) -> --existing.users == 0 ? null : existing);
        }
    }

    public int size() {
        return locks.size();
    }

    private static final class Entry {
        private final ReentrantLock lock = new ReentrantLock();
        private int users; // guarded by the map's per-key compute
    }
}

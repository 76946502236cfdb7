package io.xsdbind.core.schema;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

/**
 * Memo of values derived from an immutable schema. The first computation of a key runs under a
 * lock so it happens once; later reads take no lock.
 */
final class MemoCache<K, V> {

    private final Map<K, V> values = new ConcurrentHashMap<>();
    private final ReentrantLock lock = new ReentrantLock();
    private final Function<K, V> loader;

    MemoCache(Function<K, V> loader) {
        this.loader = loader;
    }

    V get(K key) {
        V value = values.get(key);
        if (value != null) {
            return value;
        }
        lock.lock();
        try {
            value = values.get(key);
            if (value == null) {
                value = loader.apply(key);
                values.put(key, value);
            }
            return value;
        } finally {
            lock.unlock();
        }
    }

    int size() {
        return values.size();
    }
}

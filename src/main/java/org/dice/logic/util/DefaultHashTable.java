package org.dice.logic.util;

import java.util.LinkedHashMap;
import java.util.function.Supplier;

/**
 * A map that creates and stores a value the first time a missing key is read, so grouping code
 * can write {@code groups.get(key).add(item)} without checking for absent buckets. Keys keep
 * their insertion order.
 */
public class DefaultHashTable<K,V> extends LinkedHashMap<K,V> {

    private final Supplier<V> supplier;

    public DefaultHashTable(Supplier<V> supplier)
    {
        if (supplier == null) {
            throw new IllegalArgumentException("supplier must not be null");
        }
        this.supplier = supplier;
    }

    @Override
    public V get(Object key)
    {
        if(!this.containsKey(key))
        {
            super.put((K)key, this.supplier.get());
        }
        return super.get(key);
    }
}

package com.farmerworking.datyl.in.java.api;

// A record is dropped from SortedStream#each when any filter rejects it.
@FunctionalInterface
public interface StreamFilter<K, V> {
    boolean accept(K key, V value);
}

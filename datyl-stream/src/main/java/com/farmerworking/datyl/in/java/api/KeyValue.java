package com.farmerworking.datyl.in.java.api;

import lombok.Data;

@Data
public class KeyValue<K, V> {
    private final K key;
    private final V value;

    public static <K, V> KeyValue<K, V> of(K key, V value) {
        return new KeyValue<>(key, value);
    }
}

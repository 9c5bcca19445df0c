package com.farmerworking.datyl.in.java.api;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Data;

// One step of a pairwise walk over two sorted streams. Presence of each side
// is recorded separately from its value, since a present value may be null.
// An absent side has a null value.
@Data
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class JoinedEntry<K, L, R> {
    private final K key;
    private final L left;
    private final R right;
    private final boolean leftPresent;
    private final boolean rightPresent;

    public static <K, L, R> JoinedEntry<K, L, R> both(K key, L left, R right) {
        return new JoinedEntry<>(key, left, right, true, true);
    }

    public static <K, L, R> JoinedEntry<K, L, R> leftOnly(K key, L left) {
        return new JoinedEntry<>(key, left, null, true, false);
    }

    public static <K, L, R> JoinedEntry<K, L, R> rightOnly(K key, R right) {
        return new JoinedEntry<>(key, null, right, false, true);
    }

    public boolean isLeftOnly() {
        return leftPresent && !rightPresent;
    }

    public boolean isRightOnly() {
        return !leftPresent && rightPresent;
    }

    public boolean isBoth() {
        return leftPresent && rightPresent;
    }
}

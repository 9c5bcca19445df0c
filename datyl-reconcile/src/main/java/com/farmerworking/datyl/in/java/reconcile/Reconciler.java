package com.farmerworking.datyl.in.java.reconcile;

import com.farmerworking.datyl.in.java.api.SortedStream;
import com.farmerworking.datyl.in.java.report.Reporter;
import com.farmerworking.datyl.in.java.stream.ComparisonStream;

import java.util.Objects;

/**
 * Walks two sorted streams in step and reports every key whose value differs
 * or that is present on one side only.
 */
public class Reconciler {
    private final Reporter reporter;

    public Reconciler(Reporter reporter) {
        this.reporter = reporter;
    }

    public <K, V> ReconcileStats reconcile(SortedStream<K, V> left, SortedStream<K, V> right) {
        return reconcile(left.toString(), left, right.toString(), right);
    }

    public <K, V> ReconcileStats reconcile(String leftName, SortedStream<K, V> left,
                                           String rightName, SortedStream<K, V> right) {
        ReconcileStats stats = new ReconcileStats();
        ComparisonStream<K, V, V> comparison = left.diffAgainst(right);

        comparison.each(entry -> {
            if (entry.isBoth()) {
                if (Objects.equals(entry.getLeft(), entry.getRight())) {
                    stats.setMatched(stats.getMatched() + 1);
                } else {
                    stats.setChanged(stats.getChanged() + 1);
                    reporter.warn(String.format("%s changed: %s in %s, %s in %s",
                            entry.getKey(), entry.getLeft(), leftName, entry.getRight(), rightName));
                }
            } else if (entry.isLeftOnly()) {
                stats.setLeftOnly(stats.getLeftOnly() + 1);
                reporter.info(String.format("%s only in %s: %s", entry.getKey(), leftName, entry.getLeft()));
            } else {
                stats.setRightOnly(stats.getRightOnly() + 1);
                reporter.info(String.format("%s only in %s: %s", entry.getKey(), rightName, entry.getRight()));
            }
        });
        return stats;
    }
}

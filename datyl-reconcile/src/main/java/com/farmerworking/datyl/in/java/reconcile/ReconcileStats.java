package com.farmerworking.datyl.in.java.reconcile;

import lombok.Data;

@Data
public class ReconcileStats {
    private long matched;
    private long changed;
    private long leftOnly;
    private long rightOnly;

    public boolean isIdentical() {
        return changed == 0 && leftOnly == 0 && rightOnly == 0;
    }

    public long getDifferences() {
        return changed + leftOnly + rightOnly;
    }
}

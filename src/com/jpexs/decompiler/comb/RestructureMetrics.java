package com.jpexs.decompiler.comb;

import com.google.gson.annotations.SerializedName;

/**
 * Per-function statistics of a restructuring run.
 *
 * @author JPEXS
 */
public class RestructureMetrics {

    @SerializedName("function")
    private final String function;

    @SerializedName("duplications")
    private final int duplications;

    @SerializedName("percentage")
    private final double percentage;        // AST weight divided by input weight

    @SerializedName("tentative_untangle_count")
    private final int tentativeUntangleCount;

    @SerializedName("performed_untangle_count")
    private final int performedUntangleCount;

    @SerializedName("initial_weight")
    private final long initialWeight;

    public RestructureMetrics(String function, int duplications, double percentage,
            int tentativeUntangleCount, int performedUntangleCount, long initialWeight) {
        this.function = function;
        this.duplications = duplications;
        this.percentage = percentage;
        this.tentativeUntangleCount = tentativeUntangleCount;
        this.performedUntangleCount = performedUntangleCount;
        this.initialWeight = initialWeight;
    }

    public String getFunction() {
        return function;
    }

    public int getDuplications() {
        return duplications;
    }

    public double getPercentage() {
        return percentage;
    }

    public int getTentativeUntangleCount() {
        return tentativeUntangleCount;
    }

    public int getPerformedUntangleCount() {
        return performedUntangleCount;
    }

    public long getInitialWeight() {
        return initialWeight;
    }

    @Override
    public String toString() {
        return "RestructureMetrics{" + function + ", duplications=" + duplications
                + ", percentage=" + percentage + ", initialWeight=" + initialWeight + "}";
    }
}

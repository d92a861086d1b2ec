package com.chicu.streamcore.merge;

/**
 * Итог применения delta. Разрыв sequence: не исключение, а STALE.
 */
public record MergeResult(Status status, PriceSnapshot snapshot, String reason) {

    public enum Status {
        APPLIED,
        STALE
    }

    public static MergeResult applied(PriceSnapshot snapshot) {
        return new MergeResult(Status.APPLIED, snapshot, null);
    }

    public static MergeResult stale(String reason) {
        return new MergeResult(Status.STALE, null, reason);
    }

    public boolean isApplied() {
        return status == Status.APPLIED;
    }
}

package com.chicu.streamcore.cache;

public record WarmProgress(int total, int completed, double percentage) {

    public static WarmProgress of(int total, int completed) {
        double pct = total > 0 ? (completed * 100.0) / total : 100.0;
        return new WarmProgress(total, completed, pct);
    }
}

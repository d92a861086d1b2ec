package com.chicu.streamcore.audit;

public enum ExportFormat {
    JSON,
    CSV;

    public static ExportFormat parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return JSON;
        }
        return ExportFormat.valueOf(raw.trim().toUpperCase());
    }
}

package com.chicu.streamcore.core;

import com.chicu.streamcore.resilience.FallbackPoller;
import com.chicu.streamcore.stream.ConnectionState;
import com.chicu.streamcore.stream.StreamStatistics;

/**
 * Статус одного провайдера для API и мониторинга.
 */
public record StreamStatus(
        String provider,
        ConnectionState state,
        boolean fallbackActive,
        int consecutiveFailures,
        int reconnectAttempts,
        boolean permanentFailure,
        String lastError,
        int activeKeys,
        StreamStatistics.Snapshot statistics,
        FallbackPoller.Status fallback
) {}

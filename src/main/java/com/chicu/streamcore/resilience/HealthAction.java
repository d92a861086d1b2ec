package com.chicu.streamcore.resilience;

public enum HealthAction {
    NONE,
    SEND_PING,
    FORCE_RECONNECT
}

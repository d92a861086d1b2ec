package com.chicu.streamcore.core;

import com.chicu.streamcore.stream.ConnectionState;

import java.time.Instant;

public record StatusChange(String provider, ConnectionState from, ConnectionState to, String reason, Instant at) {}

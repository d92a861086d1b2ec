package com.chicu.streamcore.audit;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;

public record StoredSnapshot(String id, String aggregateId, JsonNode state, long sequence, Instant timestamp, boolean automatic) {}

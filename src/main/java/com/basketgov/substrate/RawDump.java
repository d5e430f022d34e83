package com.basketgov.substrate;

import java.time.Instant;
import java.util.Map;

public record RawDump(
    String id,
    String basketId,
    String workspaceId,
    String textDump,
    Map<String, Object> sourceMeta,
    Instant createdAt
) {

    public RawDump {
        sourceMeta = sourceMeta == null ? Map.of() : Map.copyOf(sourceMeta);
    }
}

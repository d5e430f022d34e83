package com.basketgov.substrate;

import java.time.Instant;

public record BlockAttachment(String blockId, String documentId, String basketId, Instant attachedAt) {
}

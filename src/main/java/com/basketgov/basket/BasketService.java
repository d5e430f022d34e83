package com.basketgov.basket;

import com.basketgov.error.InvalidRequestException;
import com.basketgov.error.NotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.UUID;

/**
 * Workspace-scoped basket access. A basket owned by another workspace is
 * reported as not found rather than forbidden.
 */
@Service
public class BasketService {

    private static final Logger log = LoggerFactory.getLogger(BasketService.class);

    private final BasketStore store;
    private final Clock clock;

    public BasketService(BasketStore store, Clock clock) {
        this.store = store;
        this.clock = clock;
    }

    public Basket create(String workspaceId, String name) {
        if (name == null || name.isBlank()) {
            throw new InvalidRequestException("name is required");
        }
        Basket basket = store.save(new Basket(UUID.randomUUID().toString(), workspaceId, name.trim(),
            Instant.now(clock)));
        log.info("Basket created id={} workspace={}", basket.id(), workspaceId);
        return basket;
    }

    public Basket requireInWorkspace(String basketId, String workspaceId) {
        return store.findById(basketId)
            .filter(b -> b.workspaceId().equals(workspaceId))
            .orElseThrow(() -> NotFoundException.basket(basketId));
    }
}

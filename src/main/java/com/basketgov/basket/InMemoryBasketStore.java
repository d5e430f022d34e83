package com.basketgov.basket;

import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

@Component
public class InMemoryBasketStore implements BasketStore {

    private final ConcurrentHashMap<String, Basket> baskets = new ConcurrentHashMap<>();

    @Override
    public Basket save(Basket basket) {
        baskets.put(basket.id(), basket);
        return basket;
    }

    @Override
    public Optional<Basket> findById(String basketId) {
        return Optional.ofNullable(baskets.get(basketId));
    }
}

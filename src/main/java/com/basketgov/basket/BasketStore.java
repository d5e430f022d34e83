package com.basketgov.basket;

import java.util.Optional;

public interface BasketStore {

    Basket save(Basket basket);

    Optional<Basket> findById(String basketId);
}

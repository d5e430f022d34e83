package com.basketgov.api;

import com.basketgov.basket.Basket;
import com.basketgov.basket.BasketService;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequestMapping("/v1/baskets")
public class BasketController {

    private final BasketService basketService;

    public BasketController(BasketService basketService) {
        this.basketService = basketService;
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public Basket create(@RequestAttribute(CallerContext.ATTRIBUTE) CallerContext caller,
                         @RequestBody Map<String, Object> body) {
        return basketService.create(caller.workspaceId(), RequestFields.requireString(body, "name"));
    }

    @GetMapping("/{basketId}")
    public Basket get(@RequestAttribute(CallerContext.ATTRIBUTE) CallerContext caller,
                      @PathVariable String basketId) {
        return basketService.requireInWorkspace(RequestFields.requireUuid(basketId, "basket id"),
            caller.workspaceId());
    }
}

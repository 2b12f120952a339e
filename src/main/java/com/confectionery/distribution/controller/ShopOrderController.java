package com.confectionery.distribution.controller;

import com.confectionery.distribution.dto.ShopOrderRequest;
import com.confectionery.distribution.dto.ShopOrderView;
import com.confectionery.distribution.security.ActorResolver;
import com.confectionery.distribution.service.ShopOrderService;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/shop-orders")
public class ShopOrderController {

    private final ShopOrderService shopOrderService;
    private final ActorResolver actorResolver;

    public ShopOrderController(ShopOrderService shopOrderService, ActorResolver actorResolver) {
        this.shopOrderService = shopOrderService;
        this.actorResolver = actorResolver;
    }

    @PostMapping
    public ResponseEntity<Object> create(@RequestBody ShopOrderRequest request, Authentication authentication) {
        return ResultResponses.created(
                shopOrderService.createShopOrder(actorResolver.resolve(authentication), request));
    }

    @GetMapping
    public List<ShopOrderView> list(@RequestParam(required = false) Long shopId, Authentication authentication) {
        return shopOrderService.listShopOrders(actorResolver.resolve(authentication), shopId);
    }

    @GetMapping("/{id}")
    public ResponseEntity<Object> get(@PathVariable Long id, Authentication authentication) {
        return ResultResponses.ok(shopOrderService.getShopOrder(actorResolver.resolve(authentication), id));
    }
}

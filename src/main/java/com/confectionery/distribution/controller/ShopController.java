package com.confectionery.distribution.controller;

import com.confectionery.distribution.dto.ShopRequest;
import com.confectionery.distribution.dto.ShopView;
import com.confectionery.distribution.security.ActorResolver;
import com.confectionery.distribution.service.ShopService;
import com.confectionery.distribution.service.TransferResult;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/shops")
public class ShopController {

    private final ShopService shopService;
    private final ActorResolver actorResolver;

    public ShopController(ShopService shopService, ActorResolver actorResolver) {
        this.shopService = shopService;
        this.actorResolver = actorResolver;
    }

    @GetMapping
    public ResponseEntity<Object> list(@RequestParam(required = false) Long managerId,
            Authentication authentication) {
        return ResultResponses.ok(shopService.listShops(actorResolver.resolve(authentication), managerId));
    }

    @GetMapping("/me")
    public List<ShopView> listMine(Authentication authentication) {
        return shopService.listMyShops(actorResolver.resolve(authentication));
    }

    @PostMapping
    public ResponseEntity<Object> create(@RequestBody ShopRequest request, Authentication authentication) {
        return ResultResponses.created(shopService.createShop(actorResolver.resolve(authentication), request));
    }

    @PutMapping("/{id}")
    public ResponseEntity<Object> update(@PathVariable Long id, @RequestBody ShopRequest request,
            Authentication authentication) {
        return ResultResponses.ok(shopService.updateShop(actorResolver.resolve(authentication), id, request));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Object> delete(@PathVariable Long id, Authentication authentication) {
        TransferResult<Long> result = shopService.deleteShop(actorResolver.resolve(authentication), id);
        if (result.isSuccess()) {
            return ResponseEntity.noContent().build();
        }
        return ResultResponses.ok(result);
    }
}

package com.confectionery.distribution.controller;

import com.confectionery.distribution.dto.ManagerReturnRequest;
import com.confectionery.distribution.dto.ReturnView;
import com.confectionery.distribution.dto.ShopReturnRequest;
import com.confectionery.distribution.security.ActorResolver;
import com.confectionery.distribution.service.ReturnsService;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/returns")
public class ReturnsController {

    private final ReturnsService returnsService;
    private final ActorResolver actorResolver;

    public ReturnsController(ReturnsService returnsService, ActorResolver actorResolver) {
        this.returnsService = returnsService;
        this.actorResolver = actorResolver;
    }

    @PostMapping("/shop")
    public ResponseEntity<Object> createShopReturn(@RequestBody ShopReturnRequest request,
            Authentication authentication) {
        return ResultResponses.created(
                returnsService.createShopReturn(actorResolver.resolve(authentication), request));
    }

    @GetMapping("/shop")
    public List<ReturnView> listShopReturns(@RequestParam(required = false) Long managerId,
            Authentication authentication) {
        return returnsService.listShopReturns(actorResolver.resolve(authentication), managerId);
    }

    @PostMapping("/manager")
    public ResponseEntity<Object> createManagerReturn(@RequestBody ManagerReturnRequest request,
            Authentication authentication) {
        return ResultResponses.created(
                returnsService.createManagerReturn(actorResolver.resolve(authentication), request));
    }

    @GetMapping("/manager")
    public List<ReturnView> listManagerReturns(@RequestParam(required = false) Long managerId,
            Authentication authentication) {
        return returnsService.listManagerReturns(actorResolver.resolve(authentication), managerId);
    }
}

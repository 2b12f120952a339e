package com.confectionery.distribution.controller;

import com.confectionery.distribution.dto.ProductRequest;
import com.confectionery.distribution.dto.ProductUpdateRequest;
import com.confectionery.distribution.dto.StockView;
import com.confectionery.distribution.security.ActorResolver;
import com.confectionery.distribution.service.ProductService;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/products")
public class ProductController {

    private final ProductService productService;
    private final ActorResolver actorResolver;

    public ProductController(ProductService productService, ActorResolver actorResolver) {
        this.productService = productService;
        this.actorResolver = actorResolver;
    }

    // Warehouse stock for admins, own stock (or return bin) for managers
    @GetMapping
    public List<StockView> list(@RequestParam(defaultValue = "false") boolean returnBin,
            @RequestParam(required = false) String search,
            Authentication authentication) {
        return productService.listStock(actorResolver.resolve(authentication), returnBin, search);
    }

    @PostMapping
    public ResponseEntity<Object> create(@RequestBody ProductRequest request, Authentication authentication) {
        return ResultResponses.created(productService.createProduct(actorResolver.resolve(authentication), request));
    }

    @PutMapping("/{id}")
    public ResponseEntity<Object> update(@PathVariable Long id, @RequestBody ProductUpdateRequest request,
            Authentication authentication) {
        return ResultResponses.ok(productService.updateProduct(actorResolver.resolve(authentication), id, request));
    }
}

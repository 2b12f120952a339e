package com.confectionery.distribution.controller;

import com.confectionery.distribution.dto.IncomingRequest;
import com.confectionery.distribution.security.ActorResolver;
import com.confectionery.distribution.service.IncomingService;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/incoming")
public class IncomingController {

    private final IncomingService incomingService;
    private final ActorResolver actorResolver;

    public IncomingController(IncomingService incomingService, ActorResolver actorResolver) {
        this.incomingService = incomingService;
        this.actorResolver = actorResolver;
    }

    @PostMapping
    public ResponseEntity<Object> create(@RequestBody IncomingRequest request, Authentication authentication) {
        return ResultResponses.created(incomingService.createIncoming(actorResolver.resolve(authentication), request));
    }

    @GetMapping
    public ResponseEntity<Object> list(Authentication authentication) {
        return ResultResponses.ok(incomingService.listIncoming(actorResolver.resolve(authentication)));
    }

    @GetMapping("/{id}")
    public ResponseEntity<Object> get(@PathVariable Long id, Authentication authentication) {
        return ResultResponses.ok(incomingService.getIncoming(actorResolver.resolve(authentication), id));
    }
}

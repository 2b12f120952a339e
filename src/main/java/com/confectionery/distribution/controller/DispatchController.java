package com.confectionery.distribution.controller;

import com.confectionery.distribution.dto.DispatchRequest;
import com.confectionery.distribution.dto.DispatchView;
import com.confectionery.distribution.model.DispatchStatus;
import com.confectionery.distribution.security.ActorResolver;
import com.confectionery.distribution.service.DispatchService;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/dispatches")
public class DispatchController {

    private final DispatchService dispatchService;
    private final ActorResolver actorResolver;

    public DispatchController(DispatchService dispatchService, ActorResolver actorResolver) {
        this.dispatchService = dispatchService;
        this.actorResolver = actorResolver;
    }

    @PostMapping
    public ResponseEntity<Object> create(@RequestBody DispatchRequest request, Authentication authentication) {
        return ResultResponses.created(dispatchService.createDispatch(actorResolver.resolve(authentication), request));
    }

    @PostMapping("/{id}/accept")
    public ResponseEntity<Object> accept(@PathVariable Long id, Authentication authentication) {
        return ResultResponses.ok(dispatchService.acceptDispatch(actorResolver.resolve(authentication), id));
    }

    @GetMapping
    public List<DispatchView> list(@RequestParam(required = false) Long managerId,
            @RequestParam(required = false) DispatchStatus status,
            Authentication authentication) {
        return dispatchService.listDispatches(actorResolver.resolve(authentication), managerId, status);
    }

    @GetMapping("/{id}")
    public ResponseEntity<Object> get(@PathVariable Long id, Authentication authentication) {
        return ResultResponses.ok(dispatchService.getDispatch(actorResolver.resolve(authentication), id));
    }
}

package com.confectionery.distribution.controller;

import com.confectionery.distribution.dto.ManagerRequest;
import com.confectionery.distribution.dto.ManagerUpdateRequest;
import com.confectionery.distribution.security.ActorResolver;
import com.confectionery.distribution.service.ManagerService;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/managers")
public class ManagerController {

    private final ManagerService managerService;
    private final ActorResolver actorResolver;

    public ManagerController(ManagerService managerService, ActorResolver actorResolver) {
        this.managerService = managerService;
        this.actorResolver = actorResolver;
    }

    @GetMapping
    public ResponseEntity<Object> list(Authentication authentication) {
        return ResultResponses.ok(managerService.listManagers(actorResolver.resolve(authentication)));
    }

    @PostMapping
    public ResponseEntity<Object> create(@RequestBody ManagerRequest request, Authentication authentication) {
        return ResultResponses.created(managerService.createManager(actorResolver.resolve(authentication), request));
    }

    @PutMapping("/{id}")
    public ResponseEntity<Object> update(@PathVariable Long id, @RequestBody ManagerUpdateRequest request,
            Authentication authentication) {
        return ResultResponses.ok(managerService.updateManager(actorResolver.resolve(authentication), id, request));
    }
}

package com.confectionery.distribution.service;

import com.confectionery.distribution.dto.ManagerRequest;
import com.confectionery.distribution.dto.ManagerUpdateRequest;
import com.confectionery.distribution.dto.ManagerView;
import com.confectionery.distribution.model.User;
import com.confectionery.distribution.model.UserRole;
import com.confectionery.distribution.repository.UserRepository;
import com.confectionery.distribution.security.Actor;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

@Service
public class ManagerService {

    private final UserRepository userRepository;
    private final PasswordEncoder passwordEncoder;
    private final AuditService auditService;

    public ManagerService(UserRepository userRepository, PasswordEncoder passwordEncoder,
            AuditService auditService) {
        this.userRepository = userRepository;
        this.passwordEncoder = passwordEncoder;
        this.auditService = auditService;
    }

    @Transactional
    public TransferResult<ManagerView> createManager(Actor actor, ManagerRequest request) {
        if (!actor.isAdmin()) {
            return TransferResult.forbidden("Only an admin can create managers");
        }
        if (request == null || request.username() == null || request.username().isBlank()) {
            return TransferResult.validation("Username is required");
        }
        if (request.password() == null || request.password().isBlank()) {
            return TransferResult.validation("Password is required");
        }
        String username = request.username().trim();
        if (userRepository.existsByUsername(username)) {
            return TransferResult.conflict("Username '" + username + "' is already taken");
        }

        User manager = new User();
        manager.setUsername(username);
        manager.setPassword(passwordEncoder.encode(request.password()));
        manager.setRole(UserRole.MANAGER);
        manager.setFullName(request.fullName());
        manager.setActive(request.active() == null || request.active());
        User saved = userRepository.save(manager);

        auditService.log("CREATE_MANAGER", "Manager " + username + " created");
        return TransferResult.ok(ManagerView.from(saved));
    }

    @Transactional
    public TransferResult<ManagerView> updateManager(Actor actor, Long managerId, ManagerUpdateRequest request) {
        if (!actor.isAdmin()) {
            return TransferResult.forbidden("Only an admin can edit managers");
        }
        if (request == null) {
            return TransferResult.validation("Request body is required");
        }
        Optional<User> found = userRepository.findByIdAndRole(managerId, UserRole.MANAGER);
        if (found.isEmpty()) {
            return TransferResult.notFound("Manager " + managerId + " not found");
        }
        if (request.password() != null && request.password().isBlank()) {
            return TransferResult.validation("Password cannot be blank");
        }
        User manager = found.get();

        if (request.fullName() != null) {
            manager.setFullName(request.fullName());
        }
        if (request.password() != null) {
            manager.setPassword(passwordEncoder.encode(request.password()));
        }
        if (request.active() != null) {
            manager.setActive(request.active());
        }
        User saved = userRepository.save(manager);

        auditService.log("UPDATE_MANAGER", "Manager " + manager.getUsername() + " updated");
        return TransferResult.ok(ManagerView.from(saved));
    }

    @Transactional(readOnly = true)
    public TransferResult<List<ManagerView>> listManagers(Actor actor) {
        if (!actor.isAdmin()) {
            return TransferResult.forbidden("Only an admin can list managers");
        }
        return TransferResult.ok(userRepository.findByRoleOrderByUsernameAsc(UserRole.MANAGER).stream()
                .map(ManagerView::from)
                .toList());
    }
}

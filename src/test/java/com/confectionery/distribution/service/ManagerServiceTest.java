package com.confectionery.distribution.service;

import com.confectionery.distribution.dto.ManagerRequest;
import com.confectionery.distribution.dto.ManagerUpdateRequest;
import com.confectionery.distribution.dto.ManagerView;
import com.confectionery.distribution.model.User;
import com.confectionery.distribution.model.UserRole;
import com.confectionery.distribution.repository.UserRepository;
import com.confectionery.distribution.security.Actor;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.security.crypto.password.PasswordEncoder;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ManagerServiceTest {

    @Mock
    private UserRepository userRepository;
    @Mock
    private PasswordEncoder passwordEncoder;
    @Mock
    private AuditService auditService;

    @InjectMocks
    private ManagerService managerService;

    private final Actor admin = new Actor(1L, "admin", UserRole.ADMIN);

    @Test
    void createManager_EncodesPasswordAndAssignsRole() {
        when(userRepository.existsByUsername("anna")).thenReturn(false);
        when(passwordEncoder.encode("s3cret")).thenReturn("encoded");
        when(userRepository.save(any(User.class))).thenAnswer(i -> i.getArgument(0));

        TransferResult<ManagerView> result = managerService.createManager(admin,
                new ManagerRequest("anna", "s3cret", "Anna K", null));

        assertTrue(result.isSuccess());
        ArgumentCaptor<User> saved = ArgumentCaptor.forClass(User.class);
        verify(userRepository).save(saved.capture());
        assertEquals(UserRole.MANAGER, saved.getValue().getRole());
        assertEquals("encoded", saved.getValue().getPassword());
        assertTrue(saved.getValue().isActive());
    }

    @Test
    void createManager_DuplicateUsernameIsConflict() {
        when(userRepository.existsByUsername("anna")).thenReturn(true);

        TransferResult<ManagerView> result = managerService.createManager(admin,
                new ManagerRequest("anna", "s3cret", null, null));

        assertEquals(ErrorKind.CONFLICT, result.getError());
        verify(userRepository, never()).save(any());
    }

    @Test
    void updateManager_CanDeactivate() {
        User anna = new User();
        anna.setId(7L);
        anna.setUsername("anna");
        anna.setRole(UserRole.MANAGER);
        when(userRepository.findByIdAndRole(7L, UserRole.MANAGER)).thenReturn(Optional.of(anna));
        when(userRepository.save(anna)).thenReturn(anna);

        TransferResult<ManagerView> result = managerService.updateManager(admin, 7L,
                new ManagerUpdateRequest(null, null, false));

        assertFalse(result.getValue().active());
        verifyNoInteractions(passwordEncoder);
    }

    @Test
    void listManagers_ManagerIsForbidden() {
        assertEquals(ErrorKind.FORBIDDEN,
                managerService.listManagers(new Actor(7L, "anna", UserRole.MANAGER)).getError());
        verifyNoInteractions(userRepository);
    }
}

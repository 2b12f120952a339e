package com.confectionery.distribution.controller;

import com.confectionery.distribution.dto.DispatchView;
import com.confectionery.distribution.model.DispatchStatus;
import com.confectionery.distribution.model.UserRole;
import com.confectionery.distribution.security.Actor;
import com.confectionery.distribution.security.ActorResolver;
import com.confectionery.distribution.service.AuditService;
import com.confectionery.distribution.service.DispatchService;
import com.confectionery.distribution.service.Shortage;
import com.confectionery.distribution.service.TransferResult;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.security.test.context.support.WithMockUser;
import org.springframework.test.web.servlet.MockMvc;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;

import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@SpringBootTest
@AutoConfigureMockMvc
class DispatchControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private DispatchService dispatchService;
    @MockBean
    private ActorResolver actorResolver;
    @MockBean
    private AuditService auditService;

    private static final String DISPATCH_JSON = "{\"managerId\": 7, \"items\": ["
            + "{\"productId\": 1, \"quantity\": 30, \"price\": 5.00},"
            + "{\"productId\": 1, \"quantity\": 20, \"price\": 5.00}]}";

    private DispatchView sentView() {
        return new DispatchView(5L, 7L, "anna", DispatchStatus.SENT, LocalDateTime.now(), LocalDateTime.now(),
                List.of(new DispatchView.Line(1L, "Chocolate Bar", 30, new BigDecimal("5.00"))));
    }

    @Test
    @WithMockUser(roles = "ADMIN")
    void create_ShortageIsConflictWithEveryShortProduct() throws Exception {
        when(actorResolver.resolve(any())).thenReturn(new Actor(1L, "admin", UserRole.ADMIN));
        when(dispatchService.createDispatch(any(), any())).thenReturn(TransferResult.insufficientStock(List.of(
                new Shortage(1L, "Chocolate Bar", 50, 40),
                new Shortage(2L, "Caramel Wafer", 5, 3))));

        mockMvc.perform(post("/api/dispatches")
                .contentType(MediaType.APPLICATION_JSON)
                .content(DISPATCH_JSON))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("CONFLICT"))
                .andExpect(jsonPath("$.shortages.length()").value(2))
                .andExpect(jsonPath("$.shortages[0].requested").value(50))
                .andExpect(jsonPath("$.shortages[0].available").value(40));
    }

    @Test
    @WithMockUser(roles = "MANAGER")
    void create_ManagerRoleIsRejectedBeforeService() throws Exception {
        mockMvc.perform(post("/api/dispatches")
                .contentType(MediaType.APPLICATION_JSON)
                .content(DISPATCH_JSON))
                .andExpect(status().isForbidden());

        verifyNoInteractions(dispatchService);
    }

    @Test
    @WithMockUser(username = "anna", roles = "MANAGER")
    void accept_ReturnsSentDispatch() throws Exception {
        Actor manager = new Actor(7L, "anna", UserRole.MANAGER);
        when(actorResolver.resolve(any())).thenReturn(manager);
        when(dispatchService.acceptDispatch(manager, 5L)).thenReturn(TransferResult.ok(sentView()));

        mockMvc.perform(post("/api/dispatches/5/accept"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("SENT"))
                .andExpect(jsonPath("$.items[0].quantity").value(30));
    }

    @Test
    @WithMockUser(username = "anna", roles = "MANAGER")
    void accept_NotFoundMapsTo404() throws Exception {
        when(actorResolver.resolve(any())).thenReturn(new Actor(7L, "anna", UserRole.MANAGER));
        when(dispatchService.acceptDispatch(any(), eq(99L)))
                .thenReturn(TransferResult.notFound("Dispatch 99 not found"));

        mockMvc.perform(post("/api/dispatches/99/accept"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("NOT_FOUND"))
                .andExpect(jsonPath("$.message").value("Dispatch 99 not found"));
    }

    @Test
    @WithMockUser(username = "anna", roles = "MANAGER")
    void list_PassesFiltersToService() throws Exception {
        Actor manager = new Actor(7L, "anna", UserRole.MANAGER);
        when(actorResolver.resolve(any())).thenReturn(manager);
        when(dispatchService.listDispatches(manager, null, DispatchStatus.SENT)).thenReturn(List.of(sentView()));

        mockMvc.perform(get("/api/dispatches").param("status", "SENT"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].id").value(5));
    }

    @Test
    void anonymousRequestIsUnauthorized() throws Exception {
        mockMvc.perform(get("/api/dispatches"))
                .andExpect(status().isUnauthorized());
    }
}

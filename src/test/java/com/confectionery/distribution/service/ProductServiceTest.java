package com.confectionery.distribution.service;

import com.confectionery.distribution.dto.ProductRequest;
import com.confectionery.distribution.dto.ProductUpdateRequest;
import com.confectionery.distribution.dto.StockView;
import com.confectionery.distribution.model.Product;
import com.confectionery.distribution.model.StockBalance;
import com.confectionery.distribution.model.UserRole;
import com.confectionery.distribution.repository.ProductRepository;
import com.confectionery.distribution.repository.StockBalanceRepository;
import com.confectionery.distribution.security.Actor;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ProductServiceTest {

    @Mock
    private ProductRepository productRepository;
    @Mock
    private StockBalanceRepository balanceRepository;
    @Mock
    private AuditService auditService;

    @InjectMocks
    private ProductService productService;

    private final Actor admin = new Actor(1L, "admin", UserRole.ADMIN);

    @Test
    void createProduct_OpensPoolBalance() {
        when(productRepository.existsByNameIgnoreCase("Nougat")).thenReturn(false);
        when(productRepository.save(any(Product.class))).thenAnswer(i -> {
            Product p = i.getArgument(0);
            p.setId(4L);
            return p;
        });
        when(balanceRepository.save(any(StockBalance.class))).thenAnswer(i -> i.getArgument(0));

        TransferResult<StockView> result = productService.createProduct(admin,
                new ProductRequest("  Nougat ", new BigDecimal("3.20"), 40));

        assertTrue(result.isSuccess());
        assertEquals(4L, result.getValue().productId());
        assertEquals("Nougat", result.getValue().productName());
        assertEquals(40, result.getValue().quantity());
        assertFalse(result.getValue().returnBin());
    }

    @Test
    void createProduct_DuplicateNameIsConflict() {
        when(productRepository.existsByNameIgnoreCase("Nougat")).thenReturn(true);

        TransferResult<StockView> result = productService.createProduct(admin,
                new ProductRequest("Nougat", BigDecimal.ONE, 0));

        assertEquals(ErrorKind.CONFLICT, result.getError());
        verify(productRepository, never()).save(any());
        verifyNoInteractions(balanceRepository);
    }

    @Test
    void createProduct_RequiresPositivePrice() {
        TransferResult<StockView> result = productService.createProduct(admin,
                new ProductRequest("Nougat", BigDecimal.ZERO, 0));

        assertEquals(ErrorKind.VALIDATION, result.getError());
        verifyNoInteractions(productRepository, balanceRepository);
    }

    @Test
    void updateProduct_NewPriceAlsoRepricesPool() {
        Product product = new Product();
        product.setId(4L);
        product.setName("Nougat");
        product.setPrice(new BigDecimal("3.20"));
        StockBalance pool = new StockBalance();
        pool.setProduct(product);
        pool.setQuantity(40);
        pool.setPrice(new BigDecimal("3.20"));
        when(productRepository.findById(4L)).thenReturn(Optional.of(product));
        when(balanceRepository.findPoolBalanceForUpdate(4L)).thenReturn(Optional.of(pool));

        TransferResult<StockView> result = productService.updateProduct(admin, 4L,
                new ProductUpdateRequest(null, new BigDecimal("3.50"), true));

        assertTrue(result.isSuccess());
        assertEquals(new BigDecimal("3.50"), pool.getPrice());
        assertTrue(product.isArchived());
        assertEquals(40, pool.getQuantity());
    }

    @Test
    void updateProduct_ManagerIsForbidden() {
        TransferResult<StockView> result = productService.updateProduct(new Actor(7L, "anna", UserRole.MANAGER), 4L,
                new ProductUpdateRequest("Other", null, null));

        assertEquals(ErrorKind.FORBIDDEN, result.getError());
        verifyNoInteractions(productRepository);
    }
}

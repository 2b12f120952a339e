package com.confectionery.distribution.repository;

import com.confectionery.distribution.model.*;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.dao.DataIntegrityViolationException;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

@DataJpaTest
class StockBalanceRepositoryTest {

    @Autowired
    private StockBalanceRepository balanceRepository;

    @Autowired
    private ProductRepository productRepository;

    @Autowired
    private UserRepository userRepository;

    private User manager;

    @BeforeEach
    void setUp() {
        manager = new User();
        manager.setUsername("repo-manager");
        manager.setPassword("hash");
        manager.setRole(UserRole.MANAGER);
        userRepository.save(manager);
    }

    private Product product(String name, boolean archived) {
        Product p = new Product();
        p.setName(name);
        p.setPrice(BigDecimal.TEN);
        p.setArchived(archived);
        return productRepository.save(p);
    }

    private StockBalance balance(Product product, User owner, boolean returnBin, int quantity) {
        StockBalance b = new StockBalance();
        b.setProduct(product);
        b.setManager(owner);
        b.setReturnBin(returnBin);
        b.setQuantity(quantity);
        b.setPrice(product.getPrice());
        return balanceRepository.save(b);
    }

    @Test
    void forUpdateLookups_SeparatePoolRegularAndReturnBin() {
        Product p = product("Marzipan", false);
        balance(p, null, false, 100);
        balance(p, manager, false, 30);

        Optional<StockBalance> pool = balanceRepository.findPoolBalanceForUpdate(p.getId());
        Optional<StockBalance> regular = balanceRepository.findManagerBalanceForUpdate(p.getId(), manager.getId(), false);
        Optional<StockBalance> bin = balanceRepository.findManagerBalanceForUpdate(p.getId(), manager.getId(), true);

        assertTrue(pool.isPresent());
        assertEquals(100, pool.get().getQuantity());
        assertNull(pool.get().getManager());
        assertTrue(regular.isPresent());
        assertEquals(30, regular.get().getQuantity());
        assertTrue(bin.isEmpty());
    }

    @Test
    void searchPool_HidesArchivedAndSortsByName() {
        balance(product("Nougat", false), null, false, 1);
        balance(product("Brittle", false), null, false, 1);
        balance(product("Old Fudge", true), null, false, 1);

        List<StockBalance> result = balanceRepository.searchPool("%");

        assertEquals(List.of("Brittle", "Nougat"), result.stream().map(b -> b.getProduct().getName()).toList());
    }

    @Test
    void searchManager_FiltersByNameCaseInsensitively() {
        Product toffee = product("Butter Toffee", false);
        balance(toffee, manager, true, 2);
        balance(product("Mint Drops", false), manager, true, 2);

        List<StockBalance> result = balanceRepository.searchManager(manager.getId(), true, "%toffee%");

        assertEquals(1, result.size());
        assertEquals(toffee.getId(), result.get(0).getProduct().getId());
    }

    @Test
    void duplicateOwnerBalance_ViolatesUniqueConstraint() {
        Product p = product("Lollipop", false);
        balance(p, manager, false, 1);
        balanceRepository.flush();

        StockBalance duplicate = new StockBalance();
        duplicate.setProduct(p);
        duplicate.setManager(manager);
        duplicate.setQuantity(5);
        duplicate.setPrice(BigDecimal.ONE);

        assertThrows(DataIntegrityViolationException.class, () -> balanceRepository.saveAndFlush(duplicate));
    }
}

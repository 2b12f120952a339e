package com.confectionery.distribution.service;

import com.confectionery.distribution.dto.*;
import com.confectionery.distribution.model.StockBalance;
import com.confectionery.distribution.model.User;
import com.confectionery.distribution.model.UserRole;
import com.confectionery.distribution.repository.StockBalanceRepository;
import com.confectionery.distribution.repository.UserRepository;
import com.confectionery.distribution.security.Actor;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.List;

@SpringBootTest
@Transactional
public class TransferIntegrityTest {

    @Autowired
    private ProductService productService;
    @Autowired
    private DispatchService dispatchService;
    @Autowired
    private ShopService shopService;
    @Autowired
    private ShopOrderService shopOrderService;
    @Autowired
    private ReturnsService returnsService;
    @Autowired
    private IncomingService incomingService;

    @Autowired
    private UserRepository userRepository;
    @Autowired
    private StockBalanceRepository balanceRepository;

    @MockBean
    private AuditService auditService; // Mock audit to keep logs clean

    private Actor admin;
    private Actor manager;

    private Actor createUser(String username, UserRole role) {
        User user = new User();
        user.setUsername(username);
        user.setPassword("{noop}secret");
        user.setRole(role);
        return Actor.of(userRepository.save(user));
    }

    @BeforeEach
    public void setUp() {
        admin = createUser("ops-admin", UserRole.ADMIN);
        manager = createUser("field-manager", UserRole.MANAGER);
    }

    private Long createProduct(String name, String price, int quantity) {
        TransferResult<StockView> created = productService.createProduct(admin,
                new ProductRequest(name, new BigDecimal(price), quantity));
        Assertions.assertTrue(created.isSuccess(), created.toString());
        return created.getValue().productId();
    }

    private int pool(Long productId) {
        return balanceRepository.findPoolBalanceForUpdate(productId).map(StockBalance::getQuantity).orElse(-1);
    }

    private int held(Long productId, boolean returnBin) {
        return balanceRepository.findManagerBalanceForUpdate(productId, manager.id(), returnBin)
                .map(StockBalance::getQuantity).orElse(0);
    }

    @Test
    public void testFullDistributionCycleConservesStock() {
        Long productId = createProduct("Integration Truffle", "4.00", 100);

        // Dispatch with two lines of the same product, accepted by the manager
        DispatchView dispatch = dispatchService.createDispatch(admin, new DispatchRequest(manager.id(), List.of(
                new DispatchLine(productId, 20, new BigDecimal("5.00")),
                new DispatchLine(productId, 10, new BigDecimal("5.00"))))).getValue();
        Assertions.assertEquals(100, pool(productId));

        TransferResult<DispatchView> accepted = dispatchService.acceptDispatch(manager, dispatch.id());
        Assertions.assertTrue(accepted.isSuccess(), accepted.toString());
        Assertions.assertEquals(70, pool(productId));
        Assertions.assertEquals(30, held(productId, false));
        Assertions.assertEquals(0, new BigDecimal("5.00").compareTo(
                balanceRepository.findManagerBalanceForUpdate(productId, manager.id(), false).get().getPrice()));

        // Shop order at the manager's live price
        ShopView shop = shopService.createShop(manager, new ShopRequest("Integration Shop", "Main St", null, "F-9"))
                .getValue();
        TransferResult<ShopOrderView> order = shopOrderService.createShopOrder(manager, new ShopOrderRequest(
                shop.id(), List.of(new ShopOrderLine(productId, 10, null, false)), null, new BigDecimal("20")));
        Assertions.assertTrue(order.isSuccess(), order.toString());
        Assertions.assertEquals(0, new BigDecimal("50.00").compareTo(order.getValue().payment().payableAmount()));
        Assertions.assertEquals(0, new BigDecimal("30.00").compareTo(order.getValue().payment().debtAmount()));
        Assertions.assertEquals(20, held(productId, false));

        // Shop return into the return bin, then back to the warehouse
        Assertions.assertTrue(returnsService.createShopReturn(manager,
                new ShopReturnRequest(shop.id(), List.of(new ReturnLine(productId, 4)))).isSuccess());
        Assertions.assertEquals(16, held(productId, false));
        Assertions.assertEquals(4, held(productId, true));

        Assertions.assertTrue(returnsService.createManagerReturn(manager,
                new ManagerReturnRequest(List.of(new ReturnLine(productId, 4)), null)).isSuccess());
        Assertions.assertEquals(74, pool(productId));
        Assertions.assertEquals(0, held(productId, true));

        // 10 units left with the shop
        Assertions.assertEquals(100, pool(productId) + held(productId, false) + held(productId, true) + 10);
        Assertions.assertEquals(0, new BigDecimal("30.00").compareTo(
                shopService.listMyShops(manager).get(0).debt()));
    }

    @Test
    public void testSecondAcceptIsConflictAndMovesNothing() {
        Long productId = createProduct("Integration Wafer", "1.00", 50);
        DispatchView dispatch = dispatchService.createDispatch(admin, new DispatchRequest(manager.id(), List.of(
                new DispatchLine(productId, 10, new BigDecimal("1.50"))))).getValue();

        Assertions.assertTrue(dispatchService.acceptDispatch(manager, dispatch.id()).isSuccess());
        TransferResult<DispatchView> again = dispatchService.acceptDispatch(manager, dispatch.id());

        Assertions.assertEquals(ErrorKind.CONFLICT, again.getError());
        Assertions.assertEquals(40, pool(productId));
        Assertions.assertEquals(10, held(productId, false));
    }

    @Test
    public void testFailedShopOrderLeavesEveryBalanceUntouched() {
        Long first = createProduct("Integration Jelly", "1.00", 10);
        Long second = createProduct("Integration Toffee", "1.00", 10);
        DispatchView dispatch = dispatchService.createDispatch(admin, new DispatchRequest(manager.id(), List.of(
                new DispatchLine(first, 10, new BigDecimal("1.00")),
                new DispatchLine(second, 2, new BigDecimal("1.00"))))).getValue();
        dispatchService.acceptDispatch(manager, dispatch.id());
        ShopView shop = shopService.createShop(manager, new ShopRequest("Kiosk", null, null, "F-2")).getValue();

        TransferResult<ShopOrderView> order = shopOrderService.createShopOrder(manager, new ShopOrderRequest(
                shop.id(),
                List.of(new ShopOrderLine(first, 5, null, false), new ShopOrderLine(second, 3, null, false)),
                null, null));

        Assertions.assertEquals(ErrorKind.CONFLICT, order.getError());
        Assertions.assertEquals(1, order.getShortages().size());
        Assertions.assertEquals(10, held(first, false));
        Assertions.assertEquals(2, held(second, false));
    }

    @Test
    public void testIncomingCreditsPoolAndArchivedProductsAreRejected() {
        Long productId = createProduct("Integration Praline", "2.00", 5);

        TransferResult<IncomingView> incoming = incomingService.createIncoming(admin, new IncomingRequest(List.of(
                new IncomingLine(productId, 15, null))));
        Assertions.assertTrue(incoming.isSuccess(), incoming.toString());
        Assertions.assertEquals(20, pool(productId));
        Assertions.assertEquals(0, new BigDecimal("2.00").compareTo(incoming.getValue().items().get(0).priceAtTime()));

        productService.updateProduct(admin, productId, new ProductUpdateRequest(null, null, true));
        TransferResult<DispatchView> dispatch = dispatchService.createDispatch(admin, new DispatchRequest(
                manager.id(), List.of(new DispatchLine(productId, 1, BigDecimal.ONE))));
        Assertions.assertEquals(ErrorKind.NOT_FOUND, dispatch.getError());
    }

    @Test
    public void testQuantitiesBeyondIntRangeNeverReachBalances() {
        Long productId = createProduct("Integration Nougat", "3.00", 10);

        TransferResult<DispatchView> dispatch = dispatchService.createDispatch(admin, new DispatchRequest(
                manager.id(), List.of(
                        new DispatchLine(productId, Integer.MAX_VALUE, BigDecimal.ONE),
                        new DispatchLine(productId, Integer.MAX_VALUE, BigDecimal.ONE))));
        Assertions.assertEquals(ErrorKind.VALIDATION, dispatch.getError());

        TransferResult<IncomingView> incoming = incomingService.createIncoming(admin, new IncomingRequest(List.of(
                new IncomingLine(productId, Integer.MAX_VALUE, null))));
        Assertions.assertEquals(ErrorKind.CONFLICT, incoming.getError());

        Assertions.assertEquals(10, pool(productId));
        Assertions.assertEquals(0, held(productId, false));
    }
}

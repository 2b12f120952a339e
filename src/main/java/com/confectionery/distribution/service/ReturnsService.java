package com.confectionery.distribution.service;

import com.confectionery.distribution.dto.ManagerReturnRequest;
import com.confectionery.distribution.dto.ReturnView;
import com.confectionery.distribution.dto.ShopReturnRequest;
import com.confectionery.distribution.model.*;
import com.confectionery.distribution.repository.ManagerReturnRepository;
import com.confectionery.distribution.repository.ShopRepository;
import com.confectionery.distribution.repository.ShopReturnRepository;
import com.confectionery.distribution.repository.UserRepository;
import com.confectionery.distribution.security.Actor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Reverse transfers. Shop returns swap regular stock for return-bin stock of the
 * same product; manager returns hand goods back to the pool.
 *
 * <p>
 * Rows are locked pool first, then manager regular stock, then the return bin,
 * the same order dispatch acceptance uses.
 */
@Service
public class ReturnsService {

    private static final Logger log = LoggerFactory.getLogger(ReturnsService.class);

    private final ShopReturnRepository shopReturnRepository;
    private final ManagerReturnRepository managerReturnRepository;
    private final ShopRepository shopRepository;
    private final UserRepository userRepository;
    private final StockLedger ledger;
    private final AuditService auditService;

    public ReturnsService(ShopReturnRepository shopReturnRepository,
            ManagerReturnRepository managerReturnRepository, ShopRepository shopRepository,
            UserRepository userRepository, StockLedger ledger, AuditService auditService) {
        this.shopReturnRepository = shopReturnRepository;
        this.managerReturnRepository = managerReturnRepository;
        this.shopRepository = shopRepository;
        this.userRepository = userRepository;
        this.ledger = ledger;
        this.auditService = auditService;
    }

    @Transactional
    public TransferResult<ReturnView> createShopReturn(Actor actor, ShopReturnRequest request) {
        if (!actor.isManager()) {
            return TransferResult.forbidden("Only managers can register shop returns");
        }
        if (request == null || request.shopId() == null) {
            return TransferResult.validation("Shop is required");
        }
        Optional<String> invalid = ledger.validate(request.items(), false);
        if (invalid.isPresent()) {
            return TransferResult.validation(invalid.get());
        }

        Optional<Shop> foundShop = shopRepository.findById(request.shopId());
        if (foundShop.isEmpty()) {
            return TransferResult.notFound("Shop " + request.shopId() + " not found");
        }
        Shop shop = foundShop.get();
        if (!shop.getManager().getId().equals(actor.id())) {
            return TransferResult.forbidden("Shop " + shop.getId() + " belongs to another manager");
        }

        List<AggregatedLine> lines = ledger.aggregate(request.items());
        Map<Long, StockBalance> source = ledger.lockManager(actor.id(), false, lines);
        List<Long> missing = ledger.missing(lines, source);
        if (!missing.isEmpty()) {
            return TransferResult.notFound("Manager holds no stock of products " + missing);
        }
        List<Shortage> shortages = ledger.findShortages(lines, source);
        if (!shortages.isEmpty()) {
            return TransferResult.insufficientStock(shortages);
        }
        List<Long> overflowing = ledger.overflowing(lines, ledger.lockManager(actor.id(), true, lines));
        if (!overflowing.isEmpty()) {
            return TransferResult.conflict("Return bin would exceed the storable quantity: " + overflowing);
        }

        ShopReturn shopReturn = new ShopReturn();
        shopReturn.setManager(shop.getManager());
        shopReturn.setShop(shop);
        for (AggregatedLine line : lines) {
            StockBalance regular = source.get(line.productId());
            ledger.debit(regular, line.quantity());
            ledger.creditManager(shop.getManager(), regular.getProduct(), true, line.quantity(),
                    regular.getPrice(), false);

            ShopReturnItem item = new ShopReturnItem();
            item.setProduct(regular.getProduct());
            item.setQuantity(line.quantity());
            shopReturn.addItem(item);
        }
        ShopReturn saved = shopReturnRepository.save(shopReturn);

        log.info("Shop return {} from '{}' moved {} products into the return bin of {}", saved.getId(),
                shop.getName(), lines.size(), actor.username());
        auditService.log("CREATE_SHOP_RETURN", "Return " + saved.getId() + " from shop " + shop.getName());
        return TransferResult.ok(ReturnView.from(saved));
    }

    /**
     * Hands goods back to the pool. The pool must already hold a balance for
     * every returned product; otherwise nothing moves.
     */
    @Transactional
    public TransferResult<ReturnView> createManagerReturn(Actor actor, ManagerReturnRequest request) {
        if (!actor.isManager()) {
            return TransferResult.forbidden("Only managers can return goods to the warehouse");
        }
        if (request == null) {
            return TransferResult.validation("Request body is required");
        }
        Optional<String> invalid = ledger.validate(request.items(), false);
        if (invalid.isPresent()) {
            return TransferResult.validation(invalid.get());
        }
        boolean fromReturnBin = request.fromReturnBin() == null || request.fromReturnBin();

        List<AggregatedLine> lines = ledger.aggregate(request.items());
        Map<Long, StockBalance> pool = ledger.lockPool(lines);
        List<Long> notInPool = ledger.missing(lines, pool);
        if (!notInPool.isEmpty()) {
            return TransferResult.notFound("Warehouse has no balance for products " + notInPool);
        }

        Map<Long, StockBalance> source = ledger.lockManager(actor.id(), fromReturnBin, lines);
        List<Long> missing = ledger.missing(lines, source);
        if (!missing.isEmpty()) {
            return TransferResult.notFound((fromReturnBin ? "Return bin" : "Manager stock")
                    + " holds no products " + missing);
        }
        List<Shortage> shortages = ledger.findShortages(lines, source);
        if (!shortages.isEmpty()) {
            return TransferResult.insufficientStock(shortages);
        }
        List<Long> overflowing = ledger.overflowing(lines, pool);
        if (!overflowing.isEmpty()) {
            return TransferResult.conflict("Warehouse balance would exceed the storable quantity: " + overflowing);
        }

        ManagerReturn managerReturn = new ManagerReturn();
        managerReturn.setManager(userRepository.getReferenceById(actor.id()));
        managerReturn.setFromReturnBin(fromReturnBin);
        for (AggregatedLine line : lines) {
            ledger.debit(source.get(line.productId()), line.quantity());
            ledger.credit(pool.get(line.productId()), line.quantity());

            ManagerReturnItem item = new ManagerReturnItem();
            item.setProduct(pool.get(line.productId()).getProduct());
            item.setQuantity(line.quantity());
            managerReturn.addItem(item);
        }
        ManagerReturn saved = managerReturnRepository.save(managerReturn);

        log.info("Manager return {} by {} credited {} products to the warehouse", saved.getId(),
                actor.username(), lines.size());
        auditService.log("CREATE_MANAGER_RETURN", "Return " + saved.getId() + " by " + actor.username()
                + (fromReturnBin ? " from return bin" : " from regular stock"));
        return TransferResult.ok(ReturnView.from(saved));
    }

    @Transactional(readOnly = true)
    public List<ReturnView> listShopReturns(Actor actor, Long managerId) {
        Long owner = actor.isAdmin() ? managerId : actor.id();
        return shopReturnRepository.search(owner).stream()
                .map(ReturnView::from)
                .toList();
    }

    @Transactional(readOnly = true)
    public List<ReturnView> listManagerReturns(Actor actor, Long managerId) {
        Long owner = actor.isAdmin() ? managerId : actor.id();
        return managerReturnRepository.search(owner).stream()
                .map(ReturnView::from)
                .toList();
    }
}

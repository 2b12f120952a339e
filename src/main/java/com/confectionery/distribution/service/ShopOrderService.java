package com.confectionery.distribution.service;

import com.confectionery.distribution.dto.ShopOrderLine;
import com.confectionery.distribution.dto.ShopOrderRequest;
import com.confectionery.distribution.dto.ShopOrderView;
import com.confectionery.distribution.model.*;
import com.confectionery.distribution.repository.ShopOrderRepository;
import com.confectionery.distribution.repository.ShopRepository;
import com.confectionery.distribution.security.Actor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Service
public class ShopOrderService {

    private static final Logger log = LoggerFactory.getLogger(ShopOrderService.class);

    private final ShopOrderRepository orderRepository;
    private final ShopRepository shopRepository;
    private final StockLedger ledger;
    private final AuditService auditService;

    public ShopOrderService(ShopOrderRepository orderRepository, ShopRepository shopRepository,
            StockLedger ledger, AuditService auditService) {
        this.orderRepository = orderRepository;
        this.shopRepository = shopRepository;
        this.ledger = ledger;
        this.auditService = auditService;
    }

    /**
     * Delivers goods from the manager's regular stock to one of their shops and
     * records the payment. Goods and bonus lines of the same product draw on
     * the same balance, so they are checked together.
     */
    @Transactional
    public TransferResult<ShopOrderView> createShopOrder(Actor actor, ShopOrderRequest request) {
        if (!actor.isManager()) {
            return TransferResult.forbidden("Only managers can create shop orders");
        }
        if (request == null || request.shopId() == null) {
            return TransferResult.validation("Shop is required");
        }
        Optional<String> invalid = ledger.validate(request.items(), false);
        if (invalid.isPresent()) {
            return TransferResult.validation(invalid.get());
        }
        if (isNegative(request.returnsAmount()) || isNegative(request.paidAmount())) {
            return TransferResult.validation("Returns and paid amounts cannot be negative");
        }

        Optional<Shop> foundShop = shopRepository.findByIdForUpdate(request.shopId());
        if (foundShop.isEmpty()) {
            return TransferResult.notFound("Shop " + request.shopId() + " not found");
        }
        Shop shop = foundShop.get();
        if (!shop.getManager().getId().equals(actor.id())) {
            return TransferResult.forbidden("Shop " + shop.getId() + " belongs to another manager");
        }

        List<AggregatedLine> required = ledger.aggregate(request.items());
        Map<Long, StockBalance> stock = ledger.lockManager(actor.id(), false, required);
        List<Shortage> shortages = ledger.findShortages(required, stock);
        if (!shortages.isEmpty()) {
            return TransferResult.insufficientStock(shortages);
        }

        ShopOrder order = new ShopOrder();
        order.setManager(shop.getManager());
        order.setShop(shop);
        BigDecimal goodsTotal = BigDecimal.ZERO;
        BigDecimal bonusTotal = BigDecimal.ZERO;
        for (ShopOrderLine line : request.items()) {
            StockBalance balance = stock.get(line.productId());
            BigDecimal price = line.price() != null ? line.price() : balance.getPrice();
            BigDecimal amount = price.multiply(BigDecimal.valueOf(line.quantity()));
            if (line.bonus()) {
                bonusTotal = bonusTotal.add(amount);
            } else {
                goodsTotal = goodsTotal.add(amount);
            }

            ShopOrderItem item = new ShopOrderItem();
            item.setProduct(balance.getProduct());
            item.setQuantity(line.quantity());
            item.setPrice(price);
            item.setBonus(line.bonus());
            order.addItem(item);
        }

        PaymentBreakdown payment = PaymentBreakdown.calculate(goodsTotal, bonusTotal,
                request.returnsAmount(), request.paidAmount());
        // Needs the locked debt and live prices, so it runs after locking but before any write
        BigDecimal currentDebt = shop.getDebt() != null ? shop.getDebt() : BigDecimal.ZERO;
        if (payment.paidAmount().compareTo(payment.payableAmount().add(currentDebt)) > 0) {
            return TransferResult.validation("Paid amount " + payment.paidAmount()
                    + " exceeds payable " + payment.payableAmount() + " plus outstanding debt " + currentDebt);
        }

        for (AggregatedLine line : required) {
            ledger.debit(stock.get(line.productId()), line.quantity());
        }

        ShopOrderPayment record = new ShopOrderPayment();
        record.setGoodsTotal(payment.goodsTotal());
        record.setBonusTotal(payment.bonusTotal());
        record.setReturnsAmount(payment.returnsAmount());
        record.setPayableAmount(payment.payableAmount());
        record.setPaidAmount(payment.paidAmount());
        record.setDebtAmount(payment.debtAmount());
        order.attachPayment(record);
        ShopOrder saved = orderRepository.save(order);

        shop.setDebt(payment.nextShopDebt(currentDebt));
        shopRepository.save(shop);

        log.info("Shop order {} for shop '{}': payable {}, paid {}, shop debt {}", saved.getId(),
                shop.getName(), payment.payableAmount(), payment.paidAmount(), shop.getDebt());
        auditService.log("CREATE_SHOP_ORDER", "Order " + saved.getId() + " for shop " + shop.getName()
                + " payable " + payment.payableAmount());
        return TransferResult.ok(ShopOrderView.from(saved));
    }

    @Transactional(readOnly = true)
    public List<ShopOrderView> listShopOrders(Actor actor, Long shopId) {
        Long owner = actor.isAdmin() ? null : actor.id();
        return orderRepository.search(owner, shopId).stream()
                .map(ShopOrderView::from)
                .toList();
    }

    @Transactional(readOnly = true)
    public TransferResult<ShopOrderView> getShopOrder(Actor actor, Long orderId) {
        Optional<ShopOrder> found = orderRepository.findById(orderId);
        if (found.isEmpty()) {
            return TransferResult.notFound("Shop order " + orderId + " not found");
        }
        if (!actor.isAdmin() && !found.get().getManager().getId().equals(actor.id())) {
            return TransferResult.forbidden("Shop order " + orderId + " belongs to another manager");
        }
        return TransferResult.ok(ShopOrderView.from(found.get()));
    }

    private static boolean isNegative(BigDecimal value) {
        return value != null && value.signum() < 0;
    }
}

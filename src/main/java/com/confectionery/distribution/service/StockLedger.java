package com.confectionery.distribution.service;

import com.confectionery.distribution.model.Product;
import com.confectionery.distribution.model.StockBalance;
import com.confectionery.distribution.model.User;
import com.confectionery.distribution.repository.ProductRepository;
import com.confectionery.distribution.repository.StockBalanceRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Primitives every transfer is built from. Callers run inside one transaction:
 * lock, check every line, and only then debit and credit.
 */
@Service
public class StockLedger {

    private static final Logger log = LoggerFactory.getLogger(StockLedger.class);

    private final StockBalanceRepository balanceRepository;
    private final ProductRepository productRepository;

    public StockLedger(StockBalanceRepository balanceRepository, ProductRepository productRepository) {
        this.balanceRepository = balanceRepository;
        this.productRepository = productRepository;
    }

    /**
     * Rejects malformed lines before anything is locked.
     *
     * @return the first problem found, or empty when every line is usable
     */
    public Optional<String> validate(List<? extends LedgerLine> lines, boolean priceRequired) {
        if (lines == null || lines.isEmpty()) {
            return Optional.of("At least one line item is required");
        }
        Map<Long, Long> totals = new HashMap<>();
        for (LedgerLine line : lines) {
            if (line == null || line.productId() == null) {
                return Optional.of("Every line item must reference a product");
            }
            if (line.quantity() == null || line.quantity() <= 0) {
                return Optional.of("Quantity must be greater than zero (product " + line.productId() + ")");
            }
            if (priceRequired && line.price() == null) {
                return Optional.of("Price is required (product " + line.productId() + ")");
            }
            if (line.price() != null && line.price().signum() < 0) {
                return Optional.of("Price cannot be negative (product " + line.productId() + ")");
            }
            long total = totals.merge(line.productId(), line.quantity().longValue(), Long::sum);
            if (total > Integer.MAX_VALUE) {
                return Optional.of("Total quantity of product " + line.productId() + " exceeds " + Integer.MAX_VALUE);
            }
        }
        return Optional.empty();
    }

    /**
     * Sums lines of the same product into one required quantity. The last
     * non-null price wins; products keep the order they were first seen in,
     * which is also the lock order.
     */
    public List<AggregatedLine> aggregate(List<? extends LedgerLine> lines) {
        Map<Long, AggregatedLine> byProduct = new LinkedHashMap<>();
        for (LedgerLine line : lines) {
            byProduct.merge(line.productId(),
                    new AggregatedLine(line.productId(), line.quantity(), line.price()),
                    (current, next) -> current.merge(next));
        }
        return new ArrayList<>(byProduct.values());
    }

    /**
     * Locks the pool balance of every line. Products without a pool balance are
     * absent from the returned map.
     */
    public Map<Long, StockBalance> lockPool(List<AggregatedLine> lines) {
        Map<Long, StockBalance> locked = new LinkedHashMap<>();
        for (AggregatedLine line : lines) {
            balanceRepository.findPoolBalanceForUpdate(line.productId())
                    .ifPresent(b -> locked.put(line.productId(), b));
        }
        return locked;
    }

    public Map<Long, StockBalance> lockManager(Long managerId, boolean returnBin, List<AggregatedLine> lines) {
        Map<Long, StockBalance> locked = new LinkedHashMap<>();
        for (AggregatedLine line : lines) {
            balanceRepository.findManagerBalanceForUpdate(line.productId(), managerId, returnBin)
                    .ifPresent(b -> locked.put(line.productId(), b));
        }
        return locked;
    }

    /**
     * Products whose locked balance cannot take the line quantity without
     * leaving the storable range.
     */
    public List<Long> overflowing(List<AggregatedLine> lines, Map<Long, StockBalance> locked) {
        return lines.stream()
                .filter(line -> locked.containsKey(line.productId()))
                .filter(line -> (long) locked.get(line.productId()).getQuantity() + line.quantity() > Integer.MAX_VALUE)
                .map(AggregatedLine::productId)
                .toList();
    }

    public List<Long> missing(List<AggregatedLine> lines, Map<Long, StockBalance> locked) {
        return lines.stream()
                .map(AggregatedLine::productId)
                .filter(id -> !locked.containsKey(id))
                .toList();
    }

    /**
     * Compares every line with its locked balance. A line without a balance is
     * short by its whole quantity.
     */
    public List<Shortage> findShortages(List<AggregatedLine> lines, Map<Long, StockBalance> locked) {
        List<Shortage> shortages = new ArrayList<>();
        for (AggregatedLine line : lines) {
            StockBalance balance = locked.get(line.productId());
            int available = balance == null ? 0 : balance.getQuantity();
            if (available < line.quantity()) {
                String name = balance != null ? balance.getProduct().getName() : productName(line.productId());
                shortages.add(new Shortage(line.productId(), name, line.quantity(), available));
            }
        }
        if (!shortages.isEmpty()) {
            log.debug("Sufficiency check failed for {} of {} products", shortages.size(), lines.size());
        }
        return shortages;
    }

    public void debit(StockBalance balance, int quantity) {
        requirePositive(quantity);
        int remaining = balance.getQuantity() - quantity;
        if (remaining < 0) {
            // Unreachable after findShortages on a locked row
            throw new IllegalStateException("Balance " + balance.getId() + " would go negative: "
                    + balance.getQuantity() + " - " + quantity);
        }
        balance.setQuantity(remaining);
        balanceRepository.save(balance);
    }

    public void credit(StockBalance balance, int quantity) {
        requirePositive(quantity);
        balance.setQuantity(Math.addExact(balance.getQuantity(), quantity));
        balanceRepository.save(balance);
    }

    /**
     * Credits a manager balance, opening it when the manager has never held the
     * product in that bin.
     *
     * @param price          price for a newly opened balance, or the new price when
     *                       {@code overwritePrice} is set; falls back to the list price
     * @param overwritePrice replace the live price of an existing balance
     */
    public StockBalance creditManager(User manager, Product product, boolean returnBin, int quantity,
            BigDecimal price, boolean overwritePrice) {
        requirePositive(quantity);
        BigDecimal effectivePrice = price != null ? price : product.getPrice();
        Optional<StockBalance> existing = balanceRepository
                .findManagerBalanceForUpdate(product.getId(), manager.getId(), returnBin);
        if (existing.isPresent()) {
            StockBalance balance = existing.get();
            balance.setQuantity(Math.addExact(balance.getQuantity(), quantity));
            if (overwritePrice) {
                balance.setPrice(effectivePrice);
            }
            balanceRepository.save(balance);
            return balance;
        }

        StockBalance balance = new StockBalance();
        balance.setProduct(product);
        balance.setManager(manager);
        balance.setReturnBin(returnBin);
        balance.setQuantity(quantity);
        balance.setPrice(effectivePrice);
        balanceRepository.save(balance);
        log.debug("Opened {} balance of '{}' for manager {}", returnBin ? "return-bin" : "regular",
                product.getName(), manager.getUsername());
        return balance;
    }

    private static void requirePositive(int quantity) {
        if (quantity <= 0) {
            throw new IllegalArgumentException("Quantity must be greater than zero: " + quantity);
        }
    }

    private String productName(Long productId) {
        return productRepository.findById(productId).map(Product::getName).orElse("#" + productId);
    }
}

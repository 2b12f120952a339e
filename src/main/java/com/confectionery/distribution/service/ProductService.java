package com.confectionery.distribution.service;

import com.confectionery.distribution.dto.ProductRequest;
import com.confectionery.distribution.dto.ProductUpdateRequest;
import com.confectionery.distribution.dto.StockView;
import com.confectionery.distribution.model.Product;
import com.confectionery.distribution.model.StockBalance;
import com.confectionery.distribution.repository.ProductRepository;
import com.confectionery.distribution.repository.StockBalanceRepository;
import com.confectionery.distribution.security.Actor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

@Service
public class ProductService {

    private final ProductRepository productRepository;
    private final StockBalanceRepository balanceRepository;
    private final AuditService auditService;

    public ProductService(ProductRepository productRepository, StockBalanceRepository balanceRepository,
            AuditService auditService) {
        this.productRepository = productRepository;
        this.balanceRepository = balanceRepository;
        this.auditService = auditService;
    }

    /**
     * Adds a catalog product together with its warehouse balance.
     */
    @Transactional
    public TransferResult<StockView> createProduct(Actor actor, ProductRequest request) {
        if (!actor.isAdmin()) {
            return TransferResult.forbidden("Only an admin can create products");
        }
        if (request == null || request.name() == null || request.name().isBlank()) {
            return TransferResult.validation("Product name is required");
        }
        if (request.price() == null || request.price().signum() <= 0) {
            return TransferResult.validation("Price must be greater than zero");
        }
        int quantity = request.quantity() != null ? request.quantity() : 0;
        if (quantity < 0) {
            return TransferResult.validation("Quantity cannot be negative");
        }
        String name = request.name().trim();
        if (productRepository.existsByNameIgnoreCase(name)) {
            return TransferResult.conflict("Product '" + name + "' already exists");
        }

        Product product = new Product();
        product.setName(name);
        product.setPrice(request.price());
        product = productRepository.save(product);

        StockBalance pool = new StockBalance();
        pool.setProduct(product);
        pool.setQuantity(quantity);
        pool.setPrice(request.price());
        pool = balanceRepository.save(pool);

        auditService.log("CREATE_PRODUCT", "Product " + name + " with " + quantity + " units");
        return TransferResult.ok(StockView.from(pool));
    }

    /**
     * Renames, reprices or archives a product. A new price also becomes the
     * warehouse price; manager balances keep the price they were dispatched at.
     */
    @Transactional
    public TransferResult<StockView> updateProduct(Actor actor, Long productId, ProductUpdateRequest request) {
        if (!actor.isAdmin()) {
            return TransferResult.forbidden("Only an admin can edit products");
        }
        if (request == null) {
            return TransferResult.validation("Request body is required");
        }
        Optional<Product> found = productRepository.findById(productId);
        if (found.isEmpty()) {
            return TransferResult.notFound("Product " + productId + " not found");
        }
        Product product = found.get();
        if (request.price() != null && request.price().signum() <= 0) {
            return TransferResult.validation("Price must be greater than zero");
        }
        String name = request.name() != null ? request.name().trim() : null;
        if (name != null && name.isEmpty()) {
            return TransferResult.validation("Product name cannot be blank");
        }
        if (name != null && !name.equalsIgnoreCase(product.getName())
                && productRepository.existsByNameIgnoreCase(name)) {
            return TransferResult.conflict("Product '" + name + "' already exists");
        }

        if (name != null) {
            product.setName(name);
        }
        Optional<StockBalance> pool = balanceRepository.findPoolBalanceForUpdate(productId);
        if (request.price() != null) {
            product.setPrice(request.price());
            pool.ifPresent(b -> b.setPrice(request.price()));
        }
        if (request.archived() != null) {
            product.setArchived(request.archived());
        }
        productRepository.save(product);
        pool.ifPresent(balanceRepository::save);

        auditService.log("UPDATE_PRODUCT", "Product " + productId + " updated");
        return TransferResult.ok(pool.map(StockView::from)
                .orElseGet(() -> new StockView(null, product.getId(), product.getName(), 0, product.getPrice(),
                        false, product.isArchived())));
    }

    /**
     * Stock visible to the caller: the warehouse for an admin, the caller's own
     * balances for a manager. Archived products are hidden.
     */
    @Transactional(readOnly = true)
    public List<StockView> listStock(Actor actor, boolean returnBin, String search) {
        String pattern = "%" + (search == null ? "" : search.trim().toLowerCase(Locale.ROOT)) + "%";
        List<StockBalance> balances = actor.isAdmin()
                ? balanceRepository.searchPool(pattern)
                : balanceRepository.searchManager(actor.id(), returnBin, pattern);
        return balances.stream()
                .map(StockView::from)
                .toList();
    }
}

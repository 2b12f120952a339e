package com.confectionery.distribution.service;

import com.confectionery.distribution.dto.ShopRequest;
import com.confectionery.distribution.dto.ShopView;
import com.confectionery.distribution.model.Shop;
import com.confectionery.distribution.repository.ShopOrderRepository;
import com.confectionery.distribution.repository.ShopRepository;
import com.confectionery.distribution.repository.ShopReturnRepository;
import com.confectionery.distribution.repository.UserRepository;
import com.confectionery.distribution.security.Actor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

@Service
public class ShopService {

    private final ShopRepository shopRepository;
    private final ShopOrderRepository orderRepository;
    private final ShopReturnRepository returnRepository;
    private final UserRepository userRepository;
    private final AuditService auditService;

    public ShopService(ShopRepository shopRepository, ShopOrderRepository orderRepository,
            ShopReturnRepository returnRepository, UserRepository userRepository, AuditService auditService) {
        this.shopRepository = shopRepository;
        this.orderRepository = orderRepository;
        this.returnRepository = returnRepository;
        this.userRepository = userRepository;
        this.auditService = auditService;
    }

    @Transactional
    public TransferResult<ShopView> createShop(Actor actor, ShopRequest request) {
        if (!actor.isManager()) {
            return TransferResult.forbidden("Only managers can register shops");
        }
        Optional<String> invalid = validate(request);
        if (invalid.isPresent()) {
            return TransferResult.validation(invalid.get());
        }

        Shop shop = new Shop();
        shop.setManager(userRepository.getReferenceById(actor.id()));
        apply(shop, request);
        Shop saved = shopRepository.save(shop);

        auditService.log("CREATE_SHOP", "Shop " + saved.getName() + " by " + actor.username());
        return TransferResult.ok(ShopView.from(saved));
    }

    @Transactional
    public TransferResult<ShopView> updateShop(Actor actor, Long shopId, ShopRequest request) {
        Optional<Shop> found = shopRepository.findById(shopId);
        if (found.isEmpty()) {
            return TransferResult.notFound("Shop " + shopId + " not found");
        }
        Shop shop = found.get();
        if (!shop.getManager().getId().equals(actor.id())) {
            return TransferResult.forbidden("Shop " + shopId + " belongs to another manager");
        }
        Optional<String> invalid = validate(request);
        if (invalid.isPresent()) {
            return TransferResult.validation(invalid.get());
        }

        apply(shop, request);
        return TransferResult.ok(ShopView.from(shopRepository.save(shop)));
    }

    /**
     * Shops with order or return history are kept so the documents stay
     * resolvable.
     */
    @Transactional
    public TransferResult<Long> deleteShop(Actor actor, Long shopId) {
        Optional<Shop> found = shopRepository.findById(shopId);
        if (found.isEmpty()) {
            return TransferResult.notFound("Shop " + shopId + " not found");
        }
        if (!found.get().getManager().getId().equals(actor.id())) {
            return TransferResult.forbidden("Shop " + shopId + " belongs to another manager");
        }
        if (orderRepository.existsByShopId(shopId) || returnRepository.existsByShopId(shopId)) {
            return TransferResult.conflict("Shop " + shopId + " has orders or returns and cannot be deleted");
        }

        shopRepository.delete(found.get());
        auditService.log("DELETE_SHOP", "Shop " + found.get().getName() + " deleted by " + actor.username());
        return TransferResult.ok(shopId);
    }

    @Transactional(readOnly = true)
    public TransferResult<List<ShopView>> listShops(Actor actor, Long managerId) {
        if (!actor.isAdmin()) {
            return TransferResult.forbidden("Only an admin can list all shops");
        }
        List<Shop> shops = managerId != null
                ? shopRepository.findByManagerIdOrderByCreatedAtDesc(managerId)
                : shopRepository.findAllByOrderByCreatedAtDesc();
        return TransferResult.ok(shops.stream().map(ShopView::from).toList());
    }

    @Transactional(readOnly = true)
    public List<ShopView> listMyShops(Actor actor) {
        return shopRepository.findByManagerIdOrderByCreatedAtDesc(actor.id()).stream()
                .map(ShopView::from)
                .toList();
    }

    private static Optional<String> validate(ShopRequest request) {
        if (request == null || request.name() == null || request.name().isBlank()) {
            return Optional.of("Shop name is required");
        }
        if (request.fridgeNumber() == null || request.fridgeNumber().isBlank()) {
            return Optional.of("Fridge number is required");
        }
        return Optional.empty();
    }

    private static void apply(Shop shop, ShopRequest request) {
        shop.setName(request.name().trim());
        shop.setAddress(request.address());
        shop.setPhone(request.phone());
        shop.setFridgeNumber(request.fridgeNumber().trim());
    }
}

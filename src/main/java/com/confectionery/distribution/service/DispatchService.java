package com.confectionery.distribution.service;

import com.confectionery.distribution.dto.DispatchRequest;
import com.confectionery.distribution.dto.DispatchView;
import com.confectionery.distribution.model.*;
import com.confectionery.distribution.repository.DispatchRepository;
import com.confectionery.distribution.repository.UserRepository;
import com.confectionery.distribution.security.Actor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Two-phase pool to manager transfer. Creation moves no stock; goods change
 * hands when the owning manager accepts.
 */
@Service
public class DispatchService {

    private static final Logger log = LoggerFactory.getLogger(DispatchService.class);

    private final DispatchRepository dispatchRepository;
    private final UserRepository userRepository;
    private final StockLedger ledger;
    private final AuditService auditService;

    public DispatchService(DispatchRepository dispatchRepository, UserRepository userRepository,
            StockLedger ledger, AuditService auditService) {
        this.dispatchRepository = dispatchRepository;
        this.userRepository = userRepository;
        this.ledger = ledger;
        this.auditService = auditService;
    }

    @Transactional
    public TransferResult<DispatchView> createDispatch(Actor actor, DispatchRequest request) {
        if (!actor.isAdmin()) {
            return TransferResult.forbidden("Only an admin can create dispatches");
        }
        if (request == null || request.managerId() == null) {
            return TransferResult.validation("Manager is required");
        }
        Optional<String> invalid = ledger.validate(request.items(), true);
        if (invalid.isPresent()) {
            return TransferResult.validation(invalid.get());
        }

        Optional<User> manager = userRepository.findByIdAndRole(request.managerId(), UserRole.MANAGER)
                .filter(User::isActive);
        if (manager.isEmpty()) {
            return TransferResult.notFound("Manager " + request.managerId() + " not found");
        }

        List<AggregatedLine> lines = ledger.aggregate(request.items());
        Map<Long, StockBalance> pool = ledger.lockPool(lines);
        List<Long> missing = ledger.missing(lines, pool);
        if (!missing.isEmpty()) {
            return TransferResult.notFound("Products not in the warehouse: " + missing);
        }
        List<Long> archived = pool.values().stream()
                .filter(b -> b.getProduct().isArchived())
                .map(b -> b.getProduct().getId())
                .toList();
        if (!archived.isEmpty()) {
            return TransferResult.notFound("Products are archived: " + archived);
        }

        List<Shortage> shortages = ledger.findShortages(lines, pool);
        if (!shortages.isEmpty()) {
            return TransferResult.insufficientStock(shortages);
        }

        Dispatch dispatch = new Dispatch();
        dispatch.setManager(manager.get());
        dispatch.setCreatedBy(userRepository.getReferenceById(actor.id()));
        dispatch.setStatus(DispatchStatus.PENDING);
        for (AggregatedLine line : lines) {
            DispatchItem item = new DispatchItem();
            item.setProduct(pool.get(line.productId()).getProduct());
            item.setQuantity(line.quantity());
            item.setPrice(line.price());
            dispatch.addItem(item);
        }
        Dispatch saved = dispatchRepository.save(dispatch);

        log.info("Dispatch {} created for manager {} with {} products", saved.getId(),
                manager.get().getUsername(), lines.size());
        auditService.log("CREATE_DISPATCH", "Dispatch " + saved.getId() + " for " + manager.get().getUsername());
        return TransferResult.ok(DispatchView.from(saved));
    }

    /**
     * Moves the dispatched goods from the pool into the manager's regular stock.
     * Pool quantities are re-checked because they may have changed since the
     * dispatch was created.
     */
    @Transactional
    public TransferResult<DispatchView> acceptDispatch(Actor actor, Long dispatchId) {
        if (!actor.isManager()) {
            return TransferResult.forbidden("Only the receiving manager can accept a dispatch");
        }
        Optional<Dispatch> found = dispatchRepository.findByIdForUpdate(dispatchId);
        if (found.isEmpty()) {
            return TransferResult.notFound("Dispatch " + dispatchId + " not found");
        }
        Dispatch dispatch = found.get();
        if (!dispatch.getManager().getId().equals(actor.id())) {
            return TransferResult.forbidden("Dispatch " + dispatchId + " belongs to another manager");
        }
        if (dispatch.getStatus() != DispatchStatus.PENDING) {
            return TransferResult.conflict("Dispatch " + dispatchId + " is already " + dispatch.getStatus());
        }

        List<AggregatedLine> lines = ledger.aggregate(dispatch.getItems().stream()
                .map(i -> new AggregatedLine(i.getProduct().getId(), i.getQuantity(), i.getPrice()))
                .toList());
        Map<Long, StockBalance> pool = ledger.lockPool(lines);
        List<Long> unavailable = lines.stream()
                .map(AggregatedLine::productId)
                .filter(id -> !pool.containsKey(id) || pool.get(id).getProduct().isArchived())
                .toList();
        if (!unavailable.isEmpty()) {
            log.info("Dispatch {} stays PENDING: products {} archived or gone from the warehouse", dispatchId,
                    unavailable);
            return TransferResult.notFound("Products are archived or not in the warehouse: " + unavailable);
        }
        List<Shortage> shortages = ledger.findShortages(lines, pool);
        if (!shortages.isEmpty()) {
            log.info("Dispatch {} stays PENDING: {} products short", dispatchId, shortages.size());
            return TransferResult.insufficientStock(shortages);
        }
        List<Long> overflowing = ledger.overflowing(lines, ledger.lockManager(actor.id(), false, lines));
        if (!overflowing.isEmpty()) {
            return TransferResult.conflict("Manager balance would exceed the storable quantity: " + overflowing);
        }

        for (AggregatedLine line : lines) {
            StockBalance source = pool.get(line.productId());
            ledger.debit(source, line.quantity());
            ledger.creditManager(dispatch.getManager(), source.getProduct(), false, line.quantity(),
                    line.price(), true);
        }

        dispatch.setStatus(DispatchStatus.SENT);
        dispatch.setAcceptedAt(LocalDateTime.now());
        Dispatch saved = dispatchRepository.save(dispatch);

        auditService.log("ACCEPT_DISPATCH", "Dispatch " + dispatchId + " accepted by " + actor.username());
        return TransferResult.ok(DispatchView.from(saved));
    }

    /**
     * Admins may filter by manager; managers always see only their own dispatches.
     */
    @Transactional(readOnly = true)
    public List<DispatchView> listDispatches(Actor actor, Long managerId, DispatchStatus status) {
        Long owner = actor.isAdmin() ? managerId : actor.id();
        return dispatchRepository.search(owner, status).stream()
                .map(DispatchView::from)
                .toList();
    }

    @Transactional(readOnly = true)
    public TransferResult<DispatchView> getDispatch(Actor actor, Long dispatchId) {
        Optional<Dispatch> found = dispatchRepository.findById(dispatchId);
        if (found.isEmpty()) {
            return TransferResult.notFound("Dispatch " + dispatchId + " not found");
        }
        if (!actor.isAdmin() && !found.get().getManager().getId().equals(actor.id())) {
            return TransferResult.forbidden("Dispatch " + dispatchId + " belongs to another manager");
        }
        return TransferResult.ok(DispatchView.from(found.get()));
    }
}

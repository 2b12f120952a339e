package com.confectionery.distribution.service;

import com.confectionery.distribution.dto.IncomingLine;
import com.confectionery.distribution.dto.IncomingRequest;
import com.confectionery.distribution.dto.IncomingView;
import com.confectionery.distribution.model.Incoming;
import com.confectionery.distribution.model.IncomingItem;
import com.confectionery.distribution.model.StockBalance;
import com.confectionery.distribution.repository.IncomingRepository;
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
 * Supplier receipts into the warehouse pool.
 */
@Service
public class IncomingService {

    private static final Logger log = LoggerFactory.getLogger(IncomingService.class);

    private final IncomingRepository incomingRepository;
    private final UserRepository userRepository;
    private final StockLedger ledger;
    private final AuditService auditService;

    public IncomingService(IncomingRepository incomingRepository, UserRepository userRepository,
            StockLedger ledger, AuditService auditService) {
        this.incomingRepository = incomingRepository;
        this.userRepository = userRepository;
        this.ledger = ledger;
        this.auditService = auditService;
    }

    @Transactional
    public TransferResult<IncomingView> createIncoming(Actor actor, IncomingRequest request) {
        if (!actor.isAdmin()) {
            return TransferResult.forbidden("Only an admin can register incoming goods");
        }
        if (request == null) {
            return TransferResult.validation("Request body is required");
        }
        Optional<String> invalid = ledger.validate(request.items(), false);
        if (invalid.isPresent()) {
            return TransferResult.validation(invalid.get());
        }

        List<AggregatedLine> lines = ledger.aggregate(request.items());
        Map<Long, StockBalance> pool = ledger.lockPool(lines);
        List<Long> unavailable = lines.stream()
                .map(AggregatedLine::productId)
                .filter(id -> !pool.containsKey(id) || pool.get(id).getProduct().isArchived())
                .toList();
        if (!unavailable.isEmpty()) {
            return TransferResult.notFound("Products not found in the warehouse: " + unavailable);
        }
        List<Long> overflowing = ledger.overflowing(lines, pool);
        if (!overflowing.isEmpty()) {
            return TransferResult.conflict("Warehouse balance would exceed the storable quantity: " + overflowing);
        }

        Incoming incoming = new Incoming();
        incoming.setCreatedBy(userRepository.getReferenceById(actor.id()));
        for (AggregatedLine line : lines) {
            ledger.credit(pool.get(line.productId()), line.quantity());
        }
        // One document line per submitted line, priced at the moment of receipt
        for (IncomingLine line : request.items()) {
            StockBalance balance = pool.get(line.productId());
            IncomingItem item = new IncomingItem();
            item.setProduct(balance.getProduct());
            item.setQuantity(line.quantity());
            item.setPriceAtTime(line.price() != null ? line.price() : balance.getPrice());
            incoming.addItem(item);
        }
        Incoming saved = incomingRepository.save(incoming);

        log.info("Incoming {} credited {} products to the warehouse", saved.getId(), lines.size());
        auditService.log("CREATE_INCOMING", "Incoming " + saved.getId() + " with " + lines.size() + " products");
        return TransferResult.ok(IncomingView.from(saved));
    }

    @Transactional(readOnly = true)
    public TransferResult<List<IncomingView>> listIncoming(Actor actor) {
        if (!actor.isAdmin()) {
            return TransferResult.forbidden("Only an admin can view incoming goods");
        }
        return TransferResult.ok(incomingRepository.findAllByOrderByCreatedAtDescIdDesc().stream()
                .map(IncomingView::from)
                .toList());
    }

    @Transactional(readOnly = true)
    public TransferResult<IncomingView> getIncoming(Actor actor, Long incomingId) {
        if (!actor.isAdmin()) {
            return TransferResult.forbidden("Only an admin can view incoming goods");
        }
        return incomingRepository.findById(incomingId)
                .map(i -> TransferResult.ok(IncomingView.from(i)))
                .orElseGet(() -> TransferResult.notFound("Incoming " + incomingId + " not found"));
    }
}

package com.confectionery.distribution.model;

import jakarta.persistence.*;
import lombok.Data;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Quantity of one product held by one owner. A null manager means the central
 * pool; a manager balance with {@code returnBin} set holds goods taken back
 * from shops.
 */
@Entity
@Table(name = "stock_balances", uniqueConstraints = {
        @UniqueConstraint(name = "uk_balance_owner", columnNames = { "product_id", "manager_id", "return_bin" })
}, indexes = {
        @Index(name = "idx_balance_manager", columnList = "manager_id")
})
@Data
public class StockBalance {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(optional = false)
    @JoinColumn(name = "product_id", nullable = false)
    private Product product;

    @ManyToOne
    @JoinColumn(name = "manager_id")
    private User manager;

    @Column(name = "return_bin", nullable = false)
    private boolean returnBin = false;

    @Column(nullable = false)
    private Integer quantity = 0;

    // Owner's live unit price
    @Column(nullable = false, precision = 12, scale = 2)
    private BigDecimal price;

    private LocalDateTime updatedAt;

    @Version
    private Long version;

    @PrePersist
    @PreUpdate
    protected void touch() {
        updatedAt = LocalDateTime.now();
    }
}

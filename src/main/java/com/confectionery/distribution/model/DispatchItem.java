package com.confectionery.distribution.model;

import jakarta.persistence.*;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.math.BigDecimal;

@Entity
@Table(name = "dispatch_items")
@Data
public class DispatchItem {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(optional = false)
    @JoinColumn(name = "dispatch_id", nullable = false)
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private Dispatch dispatch;

    @ManyToOne(optional = false)
    @JoinColumn(name = "product_id", nullable = false)
    private Product product;

    @Column(nullable = false)
    private Integer quantity;

    // Price applied at dispatch time, independent of the product's live price
    @Column(nullable = false, precision = 12, scale = 2)
    private BigDecimal price;
}

package com.confectionery.distribution.model;

import jakarta.persistence.*;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.math.BigDecimal;

@Entity
@Table(name = "shop_order_payments")
@Data
public class ShopOrderPayment {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @OneToOne(optional = false)
    @JoinColumn(name = "order_id", nullable = false, unique = true)
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private ShopOrder order;

    @Column(nullable = false, precision = 12, scale = 2)
    private BigDecimal goodsTotal;

    @Column(nullable = false, precision = 12, scale = 2)
    private BigDecimal bonusTotal;

    @Column(nullable = false, precision = 12, scale = 2)
    private BigDecimal returnsAmount;

    @Column(nullable = false, precision = 12, scale = 2)
    private BigDecimal payableAmount;

    @Column(nullable = false, precision = 12, scale = 2)
    private BigDecimal paidAmount;

    @Column(nullable = false, precision = 12, scale = 2)
    private BigDecimal debtAmount;
}

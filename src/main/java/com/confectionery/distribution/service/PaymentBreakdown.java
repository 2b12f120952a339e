package com.confectionery.distribution.service;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Billing figures of one shop order. Bonus goods are reported but never billed.
 */
public record PaymentBreakdown(
        BigDecimal goodsTotal,
        BigDecimal bonusTotal,
        BigDecimal returnsAmount,
        BigDecimal payableAmount,
        BigDecimal paidAmount,
        BigDecimal debtAmount) {

    private static final BigDecimal ZERO = BigDecimal.ZERO.setScale(2);

    public static PaymentBreakdown calculate(BigDecimal goodsTotal, BigDecimal bonusTotal,
            BigDecimal returnsAmount, BigDecimal paidAmount) {
        BigDecimal goods = money(goodsTotal);
        BigDecimal returns = money(returnsAmount);
        BigDecimal paid = money(paidAmount);

        BigDecimal payable = goods.subtract(returns).max(ZERO);
        BigDecimal debt = payable.subtract(paid).max(ZERO);
        return new PaymentBreakdown(goods, money(bonusTotal), returns, payable, paid, debt);
    }

    public BigDecimal overpayment() {
        return paidAmount.subtract(payableAmount).max(ZERO);
    }

    /**
     * Shop balance after this order: unpaid remainder is added, any overpayment
     * settles older debt down to zero.
     */
    public BigDecimal nextShopDebt(BigDecimal currentDebt) {
        BigDecimal current = money(currentDebt);
        if (debtAmount.signum() > 0) {
            return current.add(debtAmount);
        }
        return current.subtract(overpayment()).max(ZERO);
    }

    private static BigDecimal money(BigDecimal value) {
        return (value == null ? BigDecimal.ZERO : value).setScale(2, RoundingMode.HALF_UP);
    }
}

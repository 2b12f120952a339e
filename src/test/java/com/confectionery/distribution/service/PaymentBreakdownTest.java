package com.confectionery.distribution.service;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

class PaymentBreakdownTest {

    private static BigDecimal money(String value) {
        return new BigDecimal(value);
    }

    @Test
    void bonusIsExcludedAndReturnsAreDeducted() {
        PaymentBreakdown payment = PaymentBreakdown.calculate(money("100"), money("10"), money("10"), money("40"));

        assertEquals(money("100.00"), payment.goodsTotal());
        assertEquals(money("10.00"), payment.bonusTotal());
        assertEquals(money("90.00"), payment.payableAmount());
        assertEquals(money("50.00"), payment.debtAmount());
    }

    @Test
    void payableAndDebtNeverGoNegative() {
        PaymentBreakdown payment = PaymentBreakdown.calculate(money("20"), BigDecimal.ZERO, money("35"), money("5"));

        assertEquals(money("0.00"), payment.payableAmount());
        assertEquals(money("0.00"), payment.debtAmount());
        assertEquals(money("5.00"), payment.overpayment());
    }

    @Test
    void missingAmountsCountAsZero() {
        PaymentBreakdown payment = PaymentBreakdown.calculate(money("12.5"), null, null, null);

        assertEquals(money("12.50"), payment.payableAmount());
        assertEquals(money("12.50"), payment.debtAmount());
        assertEquals(money("0.00"), payment.paidAmount());
    }

    @Test
    void nextShopDebt_AddsUnpaidRemainder() {
        PaymentBreakdown payment = PaymentBreakdown.calculate(money("100"), BigDecimal.ZERO, BigDecimal.ZERO,
                money("60"));

        assertEquals(money("55.00"), payment.nextShopDebt(money("15")));
    }

    @Test
    void nextShopDebt_OverpaymentSettlesOldDebtDownToZero() {
        PaymentBreakdown payment = PaymentBreakdown.calculate(money("100"), BigDecimal.ZERO, BigDecimal.ZERO,
                money("120"));

        assertEquals(money("10.00"), payment.nextShopDebt(money("30")));
        assertEquals(money("0.00"), payment.nextShopDebt(money("5")));
    }
}

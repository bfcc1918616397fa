package com.touristtax.reservation.exception;

import com.touristtax.common.exception.ConflictException;
import com.touristtax.reservation.domain.model.Currency;

import java.math.BigDecimal;

/**
 * Amount or currency reported by the gateway disagrees with the stored payment.
 */
public class AmountMismatchException extends ConflictException {

    public AmountMismatchException(String paymentId, BigDecimal expected, Currency expectedCurrency,
                                   BigDecimal reported, Currency reportedCurrency) {
        super(String.format("Payment %s amount mismatch: expected %s %s, gateway reported %s %s",
                        paymentId, expected, expectedCurrency, reported, reportedCurrency),
                "AMOUNT_MISMATCH");
    }
}

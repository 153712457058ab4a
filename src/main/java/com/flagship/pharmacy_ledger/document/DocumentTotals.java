package com.flagship.pharmacy_ledger.document;

import lombok.Value;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Subtotal, taxes and total of a document, computed from its lines.
 */
@Value
public class DocumentTotals {
    private static final BigDecimal TOLERANCE = new BigDecimal("0.01");

    BigDecimal subtotal;
    BigDecimal cgstAmount;
    BigDecimal sgstAmount;
    BigDecimal totalAmount;

    /**
     * @param declaredTotal total printed on the document, checked when present
     * @throws IllegalArgumentException if the declared total disagrees with the lines
     */
    public static DocumentTotals compute(String documentNumber, BigDecimal subtotal, BigDecimal cgst,
                                         BigDecimal sgst, BigDecimal declaredTotal) {
        BigDecimal sub = subtotal.setScale(2, RoundingMode.HALF_UP);
        BigDecimal c = cgst == null ? BigDecimal.ZERO.setScale(2) : cgst.setScale(2, RoundingMode.HALF_UP);
        BigDecimal s = sgst == null ? BigDecimal.ZERO.setScale(2) : sgst.setScale(2, RoundingMode.HALF_UP);
        if (c.signum() < 0 || s.signum() < 0) {
            throw new IllegalArgumentException("Tax amounts cannot be negative on " + documentNumber);
        }
        BigDecimal total = sub.add(c).add(s);
        if (declaredTotal != null && declaredTotal.subtract(total).abs().compareTo(TOLERANCE) > 0) {
            throw new IllegalArgumentException(String.format(
                    "Declared total %s of %s does not match lines and taxes (%s)",
                    declaredTotal.toPlainString(), documentNumber, total.toPlainString()));
        }
        return new DocumentTotals(sub, c, s, total);
    }
}

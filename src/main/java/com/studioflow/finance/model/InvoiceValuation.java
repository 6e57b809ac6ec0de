package com.studioflow.finance.model;

import com.studioflow.finance.util.MoneyUtils;
import lombok.Getter;
import lombok.ToString;

import java.math.BigDecimal;
import java.util.List;

/**
 * Derived financial state of an invoice. Never stored: built fresh from the invoice's
 * lines, payments and advance allocations every time it is asked for.
 *
 * <pre>
 * subtotal        = sum(line totals), or the flat amount when lines add up to nothing
 * discountAmount  = clamp(subtotal * discount% / 100, 0, subtotal)
 * taxableAmount   = max(subtotal - discountAmount, 0)
 * totalWithTax    = taxableAmount + taxableAmount * tax% / 100
 * amountSettled   = amountReceived + advanceApplied
 * outstanding     = max(totalWithTax - amountSettled, 0)
 * </pre>
 */
@Getter
@ToString
public final class InvoiceValuation {

    private final BigDecimal subtotal;
    private final BigDecimal discountAmount;
    private final BigDecimal taxableAmount;
    private final BigDecimal taxAmount;
    private final BigDecimal totalWithTax;
    private final BigDecimal amountReceived;
    private final BigDecimal advanceApplied;
    private final BigDecimal amountSettled;
    private final BigDecimal outstanding;

    private InvoiceValuation(BigDecimal subtotal, BigDecimal discountAmount, BigDecimal taxableAmount,
            BigDecimal taxAmount, BigDecimal amountReceived, BigDecimal advanceApplied) {
        this.subtotal = subtotal;
        this.discountAmount = discountAmount;
        this.taxableAmount = taxableAmount;
        this.taxAmount = taxAmount;
        this.totalWithTax = MoneyUtils.scale(taxableAmount.add(taxAmount));
        this.amountReceived = amountReceived;
        this.advanceApplied = advanceApplied;
        this.amountSettled = MoneyUtils.scale(amountReceived.add(advanceApplied));
        this.outstanding = MoneyUtils.max(MoneyUtils.scale(totalWithTax.subtract(amountSettled)), MoneyUtils.zero());
    }

    public static InvoiceValuation of(Invoice invoice) {
        BigDecimal linesTotal = lineTotal(invoice.getLines());
        BigDecimal received = MoneyUtils.sum(invoice.getPayments().stream().map(Payment::getAmount));
        BigDecimal applied = MoneyUtils.sum(invoice.getAdvanceAllocations().stream()
                .map(ClientAdvanceAllocation::getAmount));
        return compute(linesTotal, invoice.getAmount(), invoice.getDiscountPercent(), invoice.getTaxPercent(),
                received, applied);
    }

    public static InvoiceValuation compute(BigDecimal linesTotal, BigDecimal flatAmount, BigDecimal discountPercent,
            BigDecimal taxPercent, BigDecimal amountReceived, BigDecimal advanceApplied) {
        BigDecimal lines = MoneyUtils.scale(linesTotal);
        BigDecimal subtotal = lines.signum() != 0 ? lines : MoneyUtils.scale(flatAmount);

        BigDecimal discount = MoneyUtils.percentOf(subtotal, discountPercent);
        discount = MoneyUtils.max(discount, MoneyUtils.zero());
        discount = MoneyUtils.min(discount, subtotal);

        BigDecimal taxable = MoneyUtils.max(MoneyUtils.scale(subtotal.subtract(discount)), MoneyUtils.zero());
        BigDecimal tax = MoneyUtils.percentOf(taxable, taxPercent);

        return new InvoiceValuation(subtotal, discount, taxable, tax,
                MoneyUtils.scale(amountReceived), MoneyUtils.scale(advanceApplied));
    }

    private static BigDecimal lineTotal(List<InvoiceLine> lines) {
        if (lines == null || lines.isEmpty()) {
            return MoneyUtils.zero();
        }
        return MoneyUtils.sum(lines.stream().map(InvoiceLine::getLineTotal));
    }

    public boolean isSettled() {
        return outstanding.signum() <= 0;
    }
}

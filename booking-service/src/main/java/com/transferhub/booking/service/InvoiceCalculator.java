package com.transferhub.booking.service;

import com.transferhub.booking.entity.Booking;
import com.transferhub.booking.entity.CommissionType;
import com.transferhub.booking.entity.Invoice;
import com.transferhub.booking.entity.InvoiceLineItem;
import com.transferhub.booking.exception.InvoiceException;
import com.transferhub.booking.model.BillingParty;
import com.transferhub.booking.model.LineItemRequest;
import com.transferhub.shared.enums.InvoiceStatus;
import com.transferhub.shared.enums.InvoiceType;
import com.transferhub.shared.util.MoneyUtil;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Invoice arithmetic. Produces unsaved invoices; numbering, due dates and persistence
 * belong to InvoiceService.
 *
 * CUSTOMER:      subtotal = sum(customerPrice), profitTotal = subtotal - sum(driverPrice),
 *                total = subtotal + tax
 * FLEET/DRIVER:  subtotal = sum(driverPrice),
 *                commission = subtotal * value / 100 (PERCENTAGE) | count * value (FLAT) | 0,
 *                total = subtotal - commission + tax
 * CUSTOM:        subtotal = sum(quantity * unitPrice), total = subtotal + tax
 *
 * tax = subtotal * taxRatePercent / 100 for every type.
 */
@Component
public class InvoiceCalculator {

    public Invoice generate(InvoiceType type, BillingParty party, List<Booking> bookings, BigDecimal taxRatePercent) {
        if (bookings == null || bookings.isEmpty()) {
            throw new InvoiceException("EMPTY_INVOICE", "An invoice needs at least one booking");
        }
        if (type == InvoiceType.CUSTOM) {
            throw new InvoiceException("INVALID_INVOICE_TYPE", "Custom invoices are not built from bookings");
        }

        List<InvoiceLineItem> lines = new ArrayList<>(bookings.size());
        for (Booking booking : bookings) {
            lines.add(lineFor(type, booking));
        }

        Invoice invoice = Invoice.builder()
                .invoiceType(type)
                .entityId(party.id())
                .entityName(party.name())
                .entityEmail(party.email())
                .status(InvoiceStatus.DRAFT)
                .lineItems(lines)
                .currency(bookings.get(0).getCurrency())
                .build();

        if (type == InvoiceType.CUSTOMER) {
            BigDecimal profitTotal = BigDecimal.ZERO;
            for (InvoiceLineItem line : lines) {
                profitTotal = profitTotal.add(line.getProfit());
            }
            invoice.setProfitTotal(MoneyUtil.round(profitTotal));
        } else {
            invoice.setCommissionType(party.commissionType());
            invoice.setCommissionValue(party.commissionValue());
        }

        BigDecimal subtotal = sumAmounts(lines);
        BigDecimal commission = type.isPayout()
                ? commission(party.commissionType(), party.commissionValue(), subtotal, lines.size())
                : BigDecimal.ZERO;
        applyTotals(invoice, subtotal, commission, taxRatePercent);
        return invoice;
    }

    public Invoice custom(BillingParty billTo, List<LineItemRequest> items, BigDecimal taxRatePercent) {
        if (items == null || items.isEmpty()) {
            throw new InvoiceException("EMPTY_INVOICE", "A custom invoice needs at least one line item");
        }
        List<InvoiceLineItem> lines = customLines(items);

        Invoice invoice = Invoice.builder()
                .invoiceType(InvoiceType.CUSTOM)
                .entityId(billTo.id())
                .entityName(billTo.name())
                .entityEmail(billTo.email())
                .status(InvoiceStatus.DRAFT)
                .lineItems(lines)
                .build();
        applyTotals(invoice, sumAmounts(lines), BigDecimal.ZERO, taxRatePercent);
        return invoice;
    }

    /**
     * Replacement for {@code original}. Null items keep the original lines, null tax rate keeps the
     * original rate. Payout commission is carried over unchanged.
     */
    public Invoice amend(Invoice original, List<LineItemRequest> items, BigDecimal taxRatePercent) {
        List<InvoiceLineItem> lines = items != null && !items.isEmpty()
                ? customLines(items)
                : original.getLineItems().stream().map(l -> l.toBuilder().build()).toList();
        BigDecimal rate = taxRatePercent != null ? taxRatePercent : original.getTaxRatePercent();

        Invoice amended = Invoice.builder()
                .invoiceType(original.getInvoiceType())
                .entityId(original.getEntityId())
                .entityName(original.getEntityName())
                .entityEmail(original.getEntityEmail())
                .status(InvoiceStatus.DRAFT)
                .lineItems(new ArrayList<>(lines))
                .commissionType(original.getCommissionType())
                .commissionValue(original.getCommissionValue())
                .currency(original.getCurrency())
                .paymentTerms(original.getPaymentTerms())
                .supersedesInvoiceId(original.getId())
                .build();

        BigDecimal subtotal = sumAmounts(lines);
        if (original.getInvoiceType() == InvoiceType.CUSTOMER) {
            // driver cost of the invoiced bookings doesn't change with the lines
            BigDecimal driverCost = MoneyUtil.nullToZero(original.getSubtotal())
                    .subtract(MoneyUtil.nullToZero(original.getProfitTotal()));
            amended.setProfitTotal(MoneyUtil.round(subtotal.subtract(driverCost)));
        }

        BigDecimal commission = original.getInvoiceType().isPayout()
                ? MoneyUtil.nullToZero(original.getCommission())
                : BigDecimal.ZERO;
        applyTotals(amended, subtotal, commission, rate);
        return amended;
    }

    BigDecimal commission(CommissionType type, BigDecimal value, BigDecimal subtotal, int bookingCount) {
        if (type == null || value == null) {
            return BigDecimal.ZERO;
        }
        return switch (type) {
            case PERCENTAGE -> MoneyUtil.round(MoneyUtil.percentOf(subtotal, value));
            case FLAT -> MoneyUtil.round(value.multiply(BigDecimal.valueOf(bookingCount)));
        };
    }

    private InvoiceLineItem lineFor(InvoiceType type, Booking booking) {
        BigDecimal customerPrice = MoneyUtil.round(booking.getCustomerPrice());
        BigDecimal driverPrice = MoneyUtil.round(booking.getDriverPrice());
        BigDecimal amount = type == InvoiceType.CUSTOMER ? customerPrice : driverPrice;

        return InvoiceLineItem.builder()
                .bookingId(booking.getId())
                .bookingRef(booking.getBookingRef())
                .description(booking.getPickupLocation() + " → " + booking.getDropoffLocation())
                .serviceDate(booking.getPickupDate())
                .quantity(BigDecimal.ONE)
                .unitPrice(amount)
                .amount(amount)
                .profit(type == InvoiceType.CUSTOMER ? customerPrice.subtract(driverPrice) : null)
                .build();
    }

    private static List<InvoiceLineItem> customLines(List<LineItemRequest> items) {
        List<InvoiceLineItem> lines = new ArrayList<>(items.size());
        for (LineItemRequest item : items) {
            BigDecimal quantity = item.getQuantity() != null ? item.getQuantity() : BigDecimal.ONE;
            BigDecimal unitPrice = MoneyUtil.nullToZero(item.getUnitPrice());
            lines.add(InvoiceLineItem.builder()
                    .description(item.getDescription())
                    .serviceDate(item.getServiceDate())
                    .quantity(quantity)
                    .unitPrice(MoneyUtil.round(unitPrice))
                    .amount(MoneyUtil.round(quantity.multiply(unitPrice)))
                    .build());
        }
        return lines;
    }

    private static BigDecimal sumAmounts(List<InvoiceLineItem> lines) {
        BigDecimal sum = BigDecimal.ZERO;
        for (InvoiceLineItem line : lines) {
            sum = sum.add(MoneyUtil.nullToZero(line.getAmount()));
        }
        return MoneyUtil.round(sum);
    }

    private static void applyTotals(Invoice invoice, BigDecimal subtotal, BigDecimal commission, BigDecimal taxRatePercent) {
        BigDecimal rate = MoneyUtil.nullToZero(taxRatePercent);
        BigDecimal tax = MoneyUtil.round(MoneyUtil.percentOf(subtotal, rate));

        invoice.setSubtotal(subtotal);
        invoice.setCommission(commission);
        invoice.setTaxRatePercent(rate);
        invoice.setTax(tax);
        invoice.setTotal(MoneyUtil.round(subtotal.subtract(commission).add(tax)));
    }
}

package com.transferhub.booking.service;

import com.transferhub.booking.repository.InvoiceRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.YearMonth;
import java.time.format.DateTimeFormatter;

/**
 * INV-{yyyyMM}-{nnnn}, sequenced per calendar month. The unique index on
 * invoice_number rejects the loser if two generations race for the same number.
 */
@Component
@RequiredArgsConstructor
public class InvoiceNumberGenerator {

    private static final DateTimeFormatter MONTH = DateTimeFormatter.ofPattern("yyyyMM");

    private final InvoiceRepository invoiceRepository;

    public String next(YearMonth month) {
        String prefix = "INV-" + month.format(MONTH) + "-";
        int sequence = invoiceRepository.findTopByInvoiceNumberStartingWithOrderByInvoiceNumberDesc(prefix)
                .map(last -> Integer.parseInt(last.getInvoiceNumber().substring(prefix.length())) + 1)
                .orElse(1);
        return prefix + String.format("%04d", sequence);
    }
}

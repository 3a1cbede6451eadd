package com.transferhub.shared.util;

/**
 * Central registry of all Kafka topic names.
 */
public final class KafkaTopics {

    private KafkaTopics() {}

    public static final String BOOKING_CREATED        = "booking.created";
    public static final String BOOKING_PRICE_CHANGED  = "booking.price.changed";
    public static final String BOOKING_REASSIGNED     = "booking.reassigned";
    public static final String BOOKING_COMPLETED      = "booking.completed";
    public static final String INVOICE_GENERATED      = "invoice.generated";
    public static final String INVOICE_ISSUED         = "invoice.issued";
    public static final String INVOICE_PAID           = "invoice.paid";
    public static final String INVOICE_AMENDED        = "invoice.amended";
}

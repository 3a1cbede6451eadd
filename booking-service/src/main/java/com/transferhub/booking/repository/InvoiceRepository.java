package com.transferhub.booking.repository;

import com.transferhub.booking.entity.Invoice;
import com.transferhub.shared.enums.InvoiceType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface InvoiceRepository extends JpaRepository<Invoice, UUID> {

    Optional<Invoice> findTopByInvoiceNumberStartingWithOrderByInvoiceNumberDesc(String prefix);

    List<Invoice> findByInvoiceTypeAndEntityIdOrderByCreatedAtDesc(InvoiceType invoiceType, String entityId);
}

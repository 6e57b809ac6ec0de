package com.studioflow.finance.repository;

import com.studioflow.finance.model.Invoice;
import org.springframework.data.jpa.repository.JpaRepository;
import com.studioflow.finance.model.InvoiceStatus;

import java.util.List;
import java.util.Optional;

public interface InvoiceRepository extends JpaRepository<Invoice, Long> {
    Optional<Invoice> findByInvoiceNumber(String invoiceNumber);

    Optional<Invoice> findTopByOrderByIdDesc();

    List<Invoice> findByStatusNot(InvoiceStatus status); // Aging candidates
}

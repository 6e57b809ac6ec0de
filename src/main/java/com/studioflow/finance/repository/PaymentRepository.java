package com.studioflow.finance.repository;

import com.studioflow.finance.model.Payment;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface PaymentRepository extends JpaRepository<Payment, Long> {
    List<Payment> findByInvoiceIdOrderByPaymentDateAsc(Long invoiceId);

    boolean existsByInvoiceId(Long invoiceId);
}

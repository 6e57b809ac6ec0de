package com.studioflow.finance.repository;

import com.studioflow.finance.model.Receipt;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface ReceiptRepository extends JpaRepository<Receipt, Long> {
    Optional<Receipt> findByPaymentId(Long paymentId);

    boolean existsByPaymentId(Long paymentId);

    long countByReceiptNumberStartingWith(String prefix);
}

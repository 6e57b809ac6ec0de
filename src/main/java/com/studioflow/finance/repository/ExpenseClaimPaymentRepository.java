package com.studioflow.finance.repository;

import com.studioflow.finance.model.ExpenseClaimPayment;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface ExpenseClaimPaymentRepository extends JpaRepository<ExpenseClaimPayment, Long> {
    Optional<ExpenseClaimPayment> findByClaimId(Long claimId);

    boolean existsByClaimId(Long claimId);
}

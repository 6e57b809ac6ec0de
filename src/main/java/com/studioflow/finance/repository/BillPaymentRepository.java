package com.studioflow.finance.repository;

import com.studioflow.finance.model.BillPayment;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface BillPaymentRepository extends JpaRepository<BillPayment, Long> {
    List<BillPayment> findByBillId(Long billId);
}

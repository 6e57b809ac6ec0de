package com.studioflow.finance.repository;

import com.studioflow.finance.model.Bill;
import org.springframework.data.jpa.repository.JpaRepository;
import com.studioflow.finance.model.BillStatus;

import java.util.List;

public interface BillRepository extends JpaRepository<Bill, Long> {
    List<Bill> findByStatusNot(BillStatus status);

    List<Bill> findByVendorId(Long vendorId);
}

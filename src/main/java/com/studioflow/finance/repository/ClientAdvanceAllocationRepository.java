package com.studioflow.finance.repository;

import com.studioflow.finance.model.ClientAdvanceAllocation;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface ClientAdvanceAllocationRepository extends JpaRepository<ClientAdvanceAllocation, Long> {
    List<ClientAdvanceAllocation> findByInvoiceId(Long invoiceId);

    List<ClientAdvanceAllocation> findByAdvanceId(Long advanceId);
}

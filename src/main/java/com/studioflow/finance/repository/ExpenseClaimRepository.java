package com.studioflow.finance.repository;

import com.studioflow.finance.model.ExpenseClaim;
import org.springframework.data.jpa.repository.JpaRepository;
import com.studioflow.finance.model.ExpenseClaimStatus;

import java.util.List;

public interface ExpenseClaimRepository extends JpaRepository<ExpenseClaim, Long> {
    List<ExpenseClaim> findByStatus(ExpenseClaimStatus status);

    List<ExpenseClaim> findByEmployeeOrderByExpenseDateDesc(String employee);
}

package com.studioflow.finance.repository;

import com.studioflow.finance.model.RecurringTransactionRule;
import org.springframework.data.jpa.repository.JpaRepository;

import java.time.LocalDate;
import java.util.List;

public interface RecurringTransactionRuleRepository extends JpaRepository<RecurringTransactionRule, Long> {
    List<RecurringTransactionRule> findByActiveTrueAndNextRunDateLessThanEqual(LocalDate today);
}

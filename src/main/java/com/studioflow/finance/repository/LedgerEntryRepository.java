package com.studioflow.finance.repository;

import com.studioflow.finance.model.LedgerEntry;
import com.studioflow.finance.model.LedgerOriginType;
import com.studioflow.finance.model.TransactionCategory;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

public interface LedgerEntryRepository extends JpaRepository<LedgerEntry, Long> {
    Optional<LedgerEntry> findByOriginKey(String originKey);

    List<LedgerEntry> findByOriginTypeAndOriginId(LedgerOriginType originType, Long originId);

    List<LedgerEntry> findByEntryDateBetweenOrderByEntryDateAscIdAsc(LocalDate from, LocalDate to);

    List<LedgerEntry> findByCategoryAndRelatedPerson(TransactionCategory category, String relatedPerson);

    @Query("SELECT COALESCE(SUM(e.credit), 0) - COALESCE(SUM(e.debit), 0) FROM LedgerEntry e WHERE e.entryDate <= :asOf")
    BigDecimal balanceAsOf(@Param("asOf") LocalDate asOf);

    @Query("SELECT COALESCE(SUM(e.credit), 0) - COALESCE(SUM(e.debit), 0) FROM LedgerEntry e WHERE e.account.id = :accountId AND e.entryDate <= :asOf")
    BigDecimal accountBalanceAsOf(@Param("accountId") Long accountId, @Param("asOf") LocalDate asOf);
}

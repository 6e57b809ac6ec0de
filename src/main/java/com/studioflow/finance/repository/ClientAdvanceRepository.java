package com.studioflow.finance.repository;

import com.studioflow.finance.model.ClientAdvance;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface ClientAdvanceRepository extends JpaRepository<ClientAdvance, Long> {
    List<ClientAdvance> findByProjectIdOrClientIdOrderByReceivedDateDesc(Long projectId, Long clientId);

    List<ClientAdvance> findByClientIdOrderByReceivedDateDesc(Long clientId);
}

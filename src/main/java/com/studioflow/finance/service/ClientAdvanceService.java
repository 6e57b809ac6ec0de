package com.studioflow.finance.service;

import com.studioflow.finance.exception.ResourceNotFoundException;
import com.studioflow.finance.exception.ValidationException;
import com.studioflow.finance.model.*;
import com.studioflow.finance.repository.ClientAdvanceAllocationRepository;
import com.studioflow.finance.repository.ClientAdvanceRepository;
import com.studioflow.finance.util.MoneyUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Client retainers and their application to invoices.
 *
 * <p>Allocation checks the advance's available balance and then writes, without
 * locking the advance; two concurrent allocations can together exceed it.
 */
@Slf4j
@Service
public class ClientAdvanceService {

    private final ClientAdvanceRepository advanceRepository;
    private final ClientAdvanceAllocationRepository allocationRepository;
    private final InvoiceService invoiceService;
    private final LedgerSyncService ledgerSyncService;
    private final AuditService auditService;
    private final Clock clock;

    public ClientAdvanceService(ClientAdvanceRepository advanceRepository,
            ClientAdvanceAllocationRepository allocationRepository, InvoiceService invoiceService,
            LedgerSyncService ledgerSyncService, AuditService auditService, Clock clock) {
        this.advanceRepository = advanceRepository;
        this.allocationRepository = allocationRepository;
        this.invoiceService = invoiceService;
        this.ledgerSyncService = ledgerSyncService;
        this.auditService = auditService;
        this.clock = clock;
    }

    @Transactional
    public ClientAdvance recordAdvance(ClientAdvance advance) {
        if (advance.getClient() == null && advance.getProject() != null) {
            advance.setClient(advance.getProject().getClient());
        }
        if (advance.getClient() == null) {
            throw new ValidationException("client", "Client is required.");
        }
        if (advance.getProject() != null && advance.getProject().getClient() != null
                && !sameId(advance.getProject().getClient().getId(), advance.getClient().getId())) {
            throw new ValidationException("project", "Project does not belong to this client.");
        }
        advance.setAmount(MoneyUtils.requirePositive(advance.getAmount()));
        if (advance.getReceivedDate() == null) {
            advance.setReceivedDate(LocalDate.now(clock));
        }
        String actor = auditService.currentActor();
        advance.setRecordedBy(actor);

        ClientAdvance saved = advanceRepository.save(advance);
        ledgerSyncService.syncClientAdvance(saved);

        log.info("Recorded advance {} of {} from {}", saved.getId(), saved.getAmount(), saved.getClient().getName());
        auditService.log("RECORD_ADVANCE", "Client " + saved.getClient().getName() + ", Amount: "
                + saved.getAmount(), actor);
        return saved;
    }

    /**
     * Edits an advance. Its amount cannot drop below what is already allocated.
     */
    @Transactional
    public ClientAdvance updateAdvance(Long advanceId, ClientAdvance changes) {
        ClientAdvance advance = getAdvance(advanceId);
        BigDecimal amount = MoneyUtils.requirePositive(changes.getAmount());
        BigDecimal allocated = advance.getAllocatedAmount();
        if (amount.compareTo(allocated) < 0) {
            throw new ValidationException("amount", "Amount cannot be less than the " + allocated
                    + " already allocated.");
        }

        advance.setAmount(amount);
        if (changes.getReceivedDate() != null) {
            advance.setReceivedDate(changes.getReceivedDate());
        }
        advance.setAccount(changes.getAccount());
        advance.setMethod(changes.getMethod());
        advance.setReference(changes.getReference());
        advance.setNotes(changes.getNotes());
        advance.setReceivedBy(changes.getReceivedBy());

        ClientAdvance saved = advanceRepository.save(advance);
        ledgerSyncService.syncClientAdvance(saved);
        auditService.log("UPDATE_ADVANCE", "Advance " + saved.getId() + ", Amount: " + saved.getAmount());
        return saved;
    }

    public ClientAdvance getAdvance(Long advanceId) {
        return advanceRepository.findById(advanceId)
                .orElseThrow(() -> new ResourceNotFoundException("Client advance", advanceId));
    }

    /**
     * Applies part of an advance to an invoice, then refreshes the invoice's status.
     */
    @Transactional
    public ClientAdvanceAllocation allocateToInvoice(Long advanceId, Long invoiceId, BigDecimal requested) {
        ClientAdvance advance = getAdvance(advanceId);
        Invoice invoice = invoiceService.getInvoice(invoiceId);
        BigDecimal amount = MoneyUtils.requirePositive(requested);

        if (!belongsTo(advance, invoice)) {
            throw new ValidationException("Advance does not belong to this invoice's project or client.");
        }
        BigDecimal outstanding = invoice.getOutstanding();
        if (amount.compareTo(outstanding) > 0) {
            throw new ValidationException("amount", "Allocation exceeds the invoice outstanding of " + outstanding
                    + ".");
        }
        BigDecimal available = advance.getAvailableAmount();
        if (amount.compareTo(available) > 0) {
            throw new ValidationException("amount", "Allocation exceeds the advance balance of " + available + ".");
        }

        String actor = auditService.currentActor();
        ClientAdvanceAllocation allocation = new ClientAdvanceAllocation();
        allocation.setAdvance(advance);
        allocation.setInvoice(invoice);
        allocation.setAmount(amount);
        allocation.setAllocatedBy(actor);

        ClientAdvanceAllocation saved = allocationRepository.save(allocation);
        advance.getAllocations().add(saved);
        invoice.getAdvanceAllocations().add(saved);

        invoiceService.refreshStatus(invoice, true, LocalDate.now(clock));
        log.info("Allocated {} from advance {} to invoice {}", amount, advanceId, invoice.getInvoiceNumber());
        auditService.log("ALLOCATE_ADVANCE", "Advance " + advanceId + " -> Invoice " + invoice.getInvoiceNumber()
                + ", Amount: " + amount, actor);
        return saved;
    }

    @Transactional
    public void removeAllocation(Long allocationId) {
        ClientAdvanceAllocation allocation = allocationRepository.findById(allocationId)
                .orElseThrow(() -> new ResourceNotFoundException("Advance allocation", allocationId));
        Invoice invoice = allocation.getInvoice();

        allocation.getAdvance().getAllocations().remove(allocation);
        invoice.getAdvanceAllocations().remove(allocation);
        allocationRepository.delete(allocation);

        invoiceService.refreshStatus(invoice, true, LocalDate.now(clock));
        auditService.log("REMOVE_ALLOCATION", "Invoice " + invoice.getInvoiceNumber() + ", Amount: "
                + allocation.getAmount());
    }

    /**
     * Advances with money left that may be applied to the invoice: those recorded for
     * its project or for its billed client.
     */
    @Transactional(readOnly = true)
    public List<ClientAdvance> eligibleAdvances(Long invoiceId) {
        Invoice invoice = invoiceService.getInvoice(invoiceId);
        Client client = invoice.getBilledClient();
        Long projectId = invoice.getProject() != null ? invoice.getProject().getId() : null;
        Long clientId = client != null ? client.getId() : null;
        if (projectId == null && clientId == null)
            return List.of();

        List<ClientAdvance> candidates = projectId != null
                ? advanceRepository.findByProjectIdOrClientIdOrderByReceivedDateDesc(projectId, clientId)
                : advanceRepository.findByClientIdOrderByReceivedDateDesc(clientId);
        return candidates.stream()
                .filter(a -> MoneyUtils.isPositive(a.getAvailableAmount()))
                .collect(Collectors.toList());
    }

    static boolean belongsTo(ClientAdvance advance, Invoice invoice) {
        if (advance.getProject() != null && invoice.getProject() != null
                && sameId(advance.getProject().getId(), invoice.getProject().getId())) {
            return true;
        }
        Client client = invoice.getBilledClient();
        return client != null && advance.getClient() != null && sameId(advance.getClient().getId(), client.getId());
    }

    private static boolean sameId(Long a, Long b) {
        return a != null && Objects.equals(a, b);
    }
}

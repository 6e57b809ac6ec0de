package com.studioflow.finance.service;

import com.studioflow.finance.exception.ValidationException;
import com.studioflow.finance.model.*;
import com.studioflow.finance.repository.ClientAdvanceAllocationRepository;
import com.studioflow.finance.repository.ClientAdvanceRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ClientAdvanceServiceTest {

    private static final LocalDate TODAY = LocalDate.of(2024, 6, 15);

    @Mock
    private ClientAdvanceRepository advanceRepository;
    @Mock
    private ClientAdvanceAllocationRepository allocationRepository;
    @Mock
    private InvoiceService invoiceService;
    @Mock
    private LedgerSyncService ledgerSyncService;
    @Mock
    private AuditService auditService;

    private ClientAdvanceService service;
    private Client client;
    private Project project;
    private Invoice invoice;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2024-06-15T06:00:00Z"), ZoneOffset.UTC);
        service = new ClientAdvanceService(advanceRepository, allocationRepository, invoiceService, ledgerSyncService,
                auditService, clock);

        client = new Client();
        client.setId(1L);
        client.setName("Menon Villa");
        project = new Project();
        project.setId(2L);
        project.setClient(client);

        invoice = new Invoice();
        invoice.setId(3L);
        invoice.setInvoiceNumber("INV-00003");
        invoice.setProject(project);
        invoice.setAmount(new BigDecimal("1000"));
        invoice.setDueDate(TODAY.plusDays(10));
        invoice.setStatus(InvoiceStatus.SENT);
    }

    private ClientAdvance advance(String amount) {
        ClientAdvance advance = new ClientAdvance();
        advance.setId(5L);
        advance.setClient(client);
        advance.setProject(project);
        advance.setAmount(new BigDecimal(amount));
        return advance;
    }

    @Test
    void allocate_ShouldReduceInvoiceOutstandingAndRefreshStatus() {
        ClientAdvance advance = advance("5000");
        when(advanceRepository.findById(5L)).thenReturn(Optional.of(advance));
        when(invoiceService.getInvoice(3L)).thenReturn(invoice);
        when(auditService.currentActor()).thenReturn("meera");
        when(allocationRepository.save(any(ClientAdvanceAllocation.class))).thenAnswer(inv -> inv.getArgument(0));

        ClientAdvanceAllocation allocation = service.allocateToInvoice(5L, 3L, new BigDecimal("400"));

        assertEquals(new BigDecimal("400.00"), allocation.getAmount());
        assertEquals("meera", allocation.getAllocatedBy());
        assertEquals(new BigDecimal("600.00"), invoice.getOutstanding());
        assertEquals(new BigDecimal("4600.00"), advance.getAvailableAmount());
        verify(invoiceService).refreshStatus(invoice, true, TODAY);
    }

    @Test
    void allocate_ShouldRejectMoreThanAdvanceHasLeft() {
        ClientAdvance advance = advance("300");
        when(advanceRepository.findById(5L)).thenReturn(Optional.of(advance));
        when(invoiceService.getInvoice(3L)).thenReturn(invoice);

        assertThrows(ValidationException.class, () -> service.allocateToInvoice(5L, 3L, new BigDecimal("400")));
        verify(allocationRepository, never()).save(any());
    }

    @Test
    void allocate_ShouldRejectMoreThanInvoiceOutstanding() {
        ClientAdvance advance = advance("5000");
        when(advanceRepository.findById(5L)).thenReturn(Optional.of(advance));
        when(invoiceService.getInvoice(3L)).thenReturn(invoice);

        assertThrows(ValidationException.class, () -> service.allocateToInvoice(5L, 3L, new BigDecimal("1000.01")));
    }

    @Test
    void allocate_ShouldRejectAdvanceFromAnotherClient() {
        Client other = new Client();
        other.setId(99L);
        ClientAdvance advance = advance("5000");
        advance.setClient(other);
        advance.setProject(null);
        when(advanceRepository.findById(5L)).thenReturn(Optional.of(advance));
        when(invoiceService.getInvoice(3L)).thenReturn(invoice);

        ValidationException ex = assertThrows(ValidationException.class,
                () -> service.allocateToInvoice(5L, 3L, new BigDecimal("100")));
        assertTrue(ex.getMessage().contains("does not belong"));
    }

    @Test
    void updateAdvance_ShouldNotDropBelowAllocatedAmount() {
        ClientAdvance advance = advance("5000");
        ClientAdvanceAllocation allocation = new ClientAdvanceAllocation();
        allocation.setAmount(new BigDecimal("3000"));
        advance.getAllocations().add(allocation);
        when(advanceRepository.findById(5L)).thenReturn(Optional.of(advance));

        ClientAdvance changes = new ClientAdvance();
        changes.setAmount(new BigDecimal("2999.99"));

        assertThrows(ValidationException.class, () -> service.updateAdvance(5L, changes));
        verifyNoInteractions(ledgerSyncService);
    }

    @Test
    void recordAdvance_ShouldTakeClientFromProjectAndSyncLedger() {
        ClientAdvance advance = new ClientAdvance();
        advance.setProject(project);
        advance.setAmount(new BigDecimal("25000"));
        when(advanceRepository.save(advance)).thenReturn(advance);

        ClientAdvance saved = service.recordAdvance(advance);

        assertSame(client, saved.getClient());
        assertEquals(TODAY, saved.getReceivedDate());
        verify(ledgerSyncService).syncClientAdvance(advance);
    }

    @Test
    void eligibleAdvances_ShouldSkipExhaustedAdvances() {
        ClientAdvance open = advance("1000");
        ClientAdvance used = advance("500");
        ClientAdvanceAllocation allocation = new ClientAdvanceAllocation();
        allocation.setAmount(new BigDecimal("500"));
        used.getAllocations().add(allocation);
        when(invoiceService.getInvoice(3L)).thenReturn(invoice);
        when(advanceRepository.findByProjectIdOrClientIdOrderByReceivedDateDesc(2L, 1L))
                .thenReturn(List.of(open, used));

        assertEquals(List.of(open), service.eligibleAdvances(3L));
    }
}

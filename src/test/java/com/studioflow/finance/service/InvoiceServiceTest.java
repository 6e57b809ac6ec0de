package com.studioflow.finance.service;

import com.studioflow.finance.dto.AgingReport;
import com.studioflow.finance.exception.ValidationException;
import com.studioflow.finance.model.*;
import com.studioflow.finance.repository.InvoiceRepository;
import com.studioflow.finance.repository.PaymentRepository;
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
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class InvoiceServiceTest {

    private static final LocalDate TODAY = LocalDate.of(2024, 6, 15);

    @Mock
    private InvoiceRepository invoiceRepository;
    @Mock
    private PaymentRepository paymentRepository;
    @Mock
    private AuditService auditService;

    private InvoiceService service;
    private Project project;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2024-06-15T06:00:00Z"), ZoneOffset.UTC);
        service = new InvoiceService(invoiceRepository, paymentRepository, auditService, clock);

        Client client = new Client();
        client.setName("Menon Villa");
        project = new Project();
        project.setId(2L);
        project.setClient(client);
    }

    private Invoice invoice(String amount, LocalDate dueDate) {
        Invoice invoice = new Invoice();
        invoice.setProject(project);
        invoice.setAmount(new BigDecimal(amount));
        invoice.setInvoiceDate(dueDate.minusDays(30));
        invoice.setDueDate(dueDate);
        return invoice;
    }

    @Test
    void createInvoice_ShouldContinueNumberSequence() {
        Invoice last = new Invoice();
        last.setInvoiceNumber("INV-00041");
        when(invoiceRepository.findTopByOrderByIdDesc()).thenReturn(Optional.of(last));
        when(invoiceRepository.save(any(Invoice.class))).thenAnswer(inv -> inv.getArgument(0));

        Invoice created = service.createInvoice(invoice("1000", TODAY.plusDays(30)));

        assertEquals("INV-00042", created.getInvoiceNumber());
        assertEquals(InvoiceStatus.SENT, created.getStatus());
    }

    @Test
    void createInvoice_WithPastDueDate_ShouldStoreOverdue() {
        when(invoiceRepository.save(any(Invoice.class))).thenAnswer(inv -> inv.getArgument(0));

        Invoice created = service.createInvoice(invoice("1000", LocalDate.of(2024, 5, 1)));

        assertEquals("INV-00001", created.getInvoiceNumber());
        assertEquals(InvoiceStatus.OVERDUE, created.getStatus());
        assertEquals(InvoiceStatus.OVERDUE, service.refreshStatus(created, false, TODAY));
    }

    @Test
    void createInvoice_ShouldTakeAmountFromLines() {
        when(invoiceRepository.save(any(Invoice.class))).thenAnswer(inv -> inv.getArgument(0));
        Invoice invoice = invoice("0", TODAY.plusDays(30));
        invoice.addLine(new InvoiceLine("Concept design", new BigDecimal("2"), new BigDecimal("450")));
        invoice.addLine(new InvoiceLine("Site visit", BigDecimal.ONE, new BigDecimal("100")));

        Invoice created = service.createInvoice(invoice);

        assertEquals(new BigDecimal("1000.00"), created.getAmount());
        assertEquals(new BigDecimal("1000.00"), created.getSubtotal());
    }

    @Test
    void createInvoice_ShouldRejectAmountThatDisagreesWithLines() {
        Invoice invoice = invoice("1200", TODAY.plusDays(30));
        invoice.addLine(new InvoiceLine("Concept design", new BigDecimal("2"), new BigDecimal("450")));

        ValidationException ex = assertThrows(ValidationException.class, () -> service.createInvoice(invoice));
        assertEquals("amount", ex.getField());
        verify(invoiceRepository, never()).save(any());
    }

    @Test
    void updateInvoice_OfDraft_ShouldRefreshStatusForNewDueDate() {
        Invoice stored = invoice("1000", TODAY.plusDays(30));
        stored.setId(7L);
        stored.setInvoiceNumber("INV-00007");
        stored.setStatus(InvoiceStatus.DRAFT);
        when(invoiceRepository.findById(7L)).thenReturn(Optional.of(stored));
        when(invoiceRepository.save(any(Invoice.class))).thenAnswer(inv -> inv.getArgument(0));

        Invoice changes = invoice("1000", LocalDate.of(2024, 6, 1));
        Invoice updated = service.updateInvoice(7L, changes);

        assertEquals(InvoiceStatus.OVERDUE, updated.getStatus());
        assertEquals(LocalDate.of(2024, 6, 1), updated.getDueDate());
    }

    @Test
    void updateInvoice_ShouldReplaceLinesAndFollowTheirTotal() {
        Invoice stored = invoice("1000", TODAY.plusDays(30));
        stored.setId(7L);
        stored.setStatus(InvoiceStatus.SENT);
        stored.addLine(new InvoiceLine("Concept design", BigDecimal.ONE, new BigDecimal("1000")));
        when(invoiceRepository.findById(7L)).thenReturn(Optional.of(stored));
        when(invoiceRepository.save(any(Invoice.class))).thenAnswer(inv -> inv.getArgument(0));

        Invoice changes = invoice("0", TODAY.plusDays(30));
        changes.addLine(new InvoiceLine("Working drawings", new BigDecimal("3"), new BigDecimal("250")));
        Invoice updated = service.updateInvoice(7L, changes);

        assertEquals(1, updated.getLines().size());
        assertEquals(new BigDecimal("750.00"), updated.getAmount());
        assertSame(updated, updated.getLines().get(0).getInvoice());
        assertEquals(InvoiceStatus.SENT, updated.getStatus());
    }

    @Test
    void createInvoice_ShouldRequireProjectOrLead() {
        Invoice orphan = invoice("1000", TODAY.plusDays(30));
        orphan.setProject(null);

        assertThrows(ValidationException.class, () -> service.createInvoice(orphan));
        verify(invoiceRepository, never()).save(any());
    }

    @Test
    void createInvoice_ShouldRejectDueDateBeforeInvoiceDate() {
        Invoice invoice = invoice("1000", TODAY);
        invoice.setInvoiceDate(TODAY.plusDays(1));

        ValidationException ex = assertThrows(ValidationException.class, () -> service.createInvoice(invoice));
        assertEquals("dueDate", ex.getField());
    }

    @Test
    void deleteInvoice_ShouldRefuseWhenPaymentsExist() {
        Invoice invoice = invoice("1000", TODAY.plusDays(30));
        invoice.setId(7L);
        when(invoiceRepository.findById(7L)).thenReturn(Optional.of(invoice));
        when(paymentRepository.existsByInvoiceId(7L)).thenReturn(true);

        assertThrows(ValidationException.class, () -> service.deleteInvoice(7L));
        verify(invoiceRepository, never()).delete(any());
    }

    @Test
    void refreshStatus_WithoutSave_ShouldLeaveInvoiceUntouched() {
        Invoice invoice = invoice("1000", TODAY.minusDays(1));
        invoice.setStatus(InvoiceStatus.SENT);

        assertEquals(InvoiceStatus.OVERDUE, service.refreshStatus(invoice, false, TODAY));
        assertEquals(InvoiceStatus.SENT, invoice.getStatus());
        verifyNoInteractions(invoiceRepository);
    }

    @Test
    void refreshStatus_WithSave_ShouldPersistPaidInvoice() {
        Invoice invoice = invoice("1000", TODAY.plusDays(5));
        invoice.setStatus(InvoiceStatus.SENT);
        Payment payment = new Payment();
        payment.setAmount(new BigDecimal("1000"));
        invoice.getPayments().add(payment);

        assertEquals(InvoiceStatus.PAID, service.refreshStatus(invoice, true, TODAY));
        assertEquals(InvoiceStatus.PAID, invoice.getStatus());
        verify(invoiceRepository).save(invoice);
    }

    @Test
    void agingReport_ShouldSkipFullySettledInvoices() {
        Invoice overdue = invoice("500", TODAY.minusDays(70));
        overdue.setInvoiceNumber("INV-00001");
        overdue.setStatus(InvoiceStatus.SENT);
        Invoice settled = invoice("800", TODAY.minusDays(5));
        settled.setInvoiceNumber("INV-00002");
        settled.setStatus(InvoiceStatus.SENT);
        Payment payment = new Payment();
        payment.setAmount(new BigDecimal("800"));
        settled.getPayments().add(payment);
        when(invoiceRepository.findByStatusNot(InvoiceStatus.PAID))
                .thenReturn(new ArrayList<>(List.of(settled, overdue)));

        AgingReport report = service.agingReport(TODAY);

        assertEquals(1, report.getRows(AgingReport.BUCKET_61_90).size());
        assertEquals("OVERDUE", report.getRows(AgingReport.BUCKET_61_90).get(0).getStatus());
        assertEquals("Menon Villa", report.getRows(AgingReport.BUCKET_61_90).get(0).getCounterparty());
        assertEquals(new BigDecimal("500.00"), report.getGrandTotal());
        assertEquals(InvoiceStatus.SENT, overdue.getStatus());
    }
}

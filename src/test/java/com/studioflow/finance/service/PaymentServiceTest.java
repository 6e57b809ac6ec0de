package com.studioflow.finance.service;

import com.studioflow.finance.dto.PaymentRequest;
import com.studioflow.finance.event.PaymentRecordedEvent;
import com.studioflow.finance.exception.ValidationException;
import com.studioflow.finance.model.*;
import com.studioflow.finance.repository.AccountRepository;
import com.studioflow.finance.repository.PaymentRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class PaymentServiceTest {

    private static final LocalDate TODAY = LocalDate.of(2024, 6, 15);

    @Mock
    private PaymentRepository paymentRepository;
    @Mock
    private AccountRepository accountRepository;
    @Mock
    private InvoiceService invoiceService;
    @Mock
    private LedgerSyncService ledgerSyncService;
    @Mock
    private ReceiptService receiptService;
    @Mock
    private SettingsService settingsService;
    @Mock
    private AuditService auditService;
    @Mock
    private ApplicationEventPublisher eventPublisher;

    private PaymentService paymentService;
    private Invoice invoice;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2024-06-15T06:00:00Z"), ZoneOffset.UTC);
        paymentService = new PaymentService(paymentRepository, accountRepository, invoiceService, ledgerSyncService,
                receiptService, settingsService, auditService, eventPublisher, clock);

        invoice = new Invoice();
        invoice.setId(1L);
        invoice.setInvoiceNumber("INV-00001");
        invoice.setAmount(new BigDecimal("1000"));
        invoice.setTaxPercent(new BigDecimal("10"));
        invoice.setDueDate(TODAY.plusDays(30));
        invoice.setStatus(InvoiceStatus.SENT);
    }

    private static PaymentRequest request(String amount) {
        return PaymentRequest.builder().amount(new BigDecimal(amount)).method("UPI").build();
    }

    private void savedPaymentsGetIds() {
        when(paymentRepository.save(any(Payment.class))).thenAnswer(inv -> {
            Payment p = inv.getArgument(0);
            p.setId(10L);
            return p;
        });
    }

    @Test
    void recordPayment_ShouldSyncLedgerThenRefreshStatusAndIssueReceipt() {
        when(invoiceService.getInvoice(1L)).thenReturn(invoice);
        when(auditService.currentActor()).thenReturn("meera");
        when(settingsService.isAutoReceipt()).thenReturn(true);
        savedPaymentsGetIds();

        Payment payment = paymentService.recordPayment(1L, request("1100"));

        assertEquals(new BigDecimal("1100.00"), payment.getAmount());
        assertEquals(TODAY, payment.getPaymentDate());
        assertEquals("meera", payment.getRecordedBy());
        assertEquals(new BigDecimal("0.00"), invoice.getOutstanding());

        InOrder order = inOrder(ledgerSyncService, invoiceService, receiptService);
        order.verify(ledgerSyncService).syncPayment(payment);
        order.verify(invoiceService).refreshStatus(invoice, true, TODAY);
        order.verify(receiptService).generateReceipt(payment, null);

        ArgumentCaptor<PaymentRecordedEvent> event = ArgumentCaptor.forClass(PaymentRecordedEvent.class);
        verify(eventPublisher).publishEvent(event.capture());
        assertEquals(10L, event.getValue().getPaymentId());
        assertEquals("INV-00001", event.getValue().getInvoiceNumber());
    }

    @Test
    void recordPayment_ShouldNotIssueReceiptWhenAutoReceiptIsOff() {
        when(invoiceService.getInvoice(1L)).thenReturn(invoice);
        when(settingsService.isAutoReceipt()).thenReturn(false);
        savedPaymentsGetIds();

        paymentService.recordPayment(1L, request("500"));

        verify(receiptService, never()).generateReceipt(any(Payment.class), any());
        verify(ledgerSyncService).syncPayment(any(Payment.class));
    }

    @Test
    void recordPayment_ShouldRejectAmountAboveOutstanding() {
        when(invoiceService.getInvoice(1L)).thenReturn(invoice);

        ValidationException ex = assertThrows(ValidationException.class,
                () -> paymentService.recordPayment(1L, request("1100.01")));

        assertEquals("amount", ex.getField());
        verify(paymentRepository, never()).save(any());
        verifyNoInteractions(ledgerSyncService);
    }

    @Test
    void recordPayment_ShouldRejectSettledInvoice() {
        Payment earlier = new Payment();
        earlier.setAmount(new BigDecimal("1100"));
        invoice.getPayments().add(earlier);
        when(invoiceService.getInvoice(1L)).thenReturn(invoice);

        ValidationException ex = assertThrows(ValidationException.class,
                () -> paymentService.recordPayment(1L, request("10")));

        assertEquals("This invoice is already settled.", ex.getMessage());
    }

    @Test
    void recordPayment_ShouldRejectZeroAmount() {
        when(invoiceService.getInvoice(1L)).thenReturn(invoice);

        assertThrows(ValidationException.class, () -> paymentService.recordPayment(1L, request("0.001")));
        verify(paymentRepository, never()).save(any());
    }

    @Test
    void updatePayment_ShouldAllowAmountUpToOwnShareOfInvoice() {
        Payment existing = new Payment();
        existing.setId(10L);
        existing.setInvoice(invoice);
        existing.setAmount(new BigDecimal("600.00"));
        invoice.getPayments().add(existing);
        when(paymentRepository.findById(10L)).thenReturn(Optional.of(existing));
        when(paymentRepository.save(existing)).thenReturn(existing);

        Payment updated = paymentService.updatePayment(10L, request("1100"));

        assertEquals(new BigDecimal("1100.00"), updated.getAmount());
        verify(ledgerSyncService).syncPayment(existing);
        verify(invoiceService).refreshStatus(invoice, true, TODAY);
        verify(receiptService).refreshFromPayment(existing);
    }

    @Test
    void updatePayment_ShouldRejectAmountBeyondInvoiceTotal() {
        Payment existing = new Payment();
        existing.setId(10L);
        existing.setInvoice(invoice);
        existing.setAmount(new BigDecimal("600.00"));
        invoice.getPayments().add(existing);
        when(paymentRepository.findById(10L)).thenReturn(Optional.of(existing));

        assertThrows(ValidationException.class, () -> paymentService.updatePayment(10L, request("1200")));
        verify(paymentRepository, never()).save(any());
    }

    @Test
    void deletePayment_ShouldRemoveLedgerRowAndDetachReceipt() {
        Payment existing = new Payment();
        existing.setId(10L);
        existing.setInvoice(invoice);
        existing.setAmount(new BigDecimal("1100.00"));
        invoice.getPayments().add(existing);
        when(paymentRepository.findById(10L)).thenReturn(Optional.of(existing));

        paymentService.deletePayment(10L);

        verify(ledgerSyncService).removeEntry(LedgerOrigin.payment(10L));
        verify(receiptService).detachPayment(10L);
        verify(paymentRepository).delete(existing);
        verify(invoiceService).refreshStatus(invoice, true, TODAY);
        assertEquals(new BigDecimal("1100.00"), invoice.getOutstanding());
    }
}

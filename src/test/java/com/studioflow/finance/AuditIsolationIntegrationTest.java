package com.studioflow.finance;

import com.studioflow.finance.model.Client;
import com.studioflow.finance.repository.ClientRepository;
import com.studioflow.finance.service.AuditService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest(properties = "studioflow.finance.recurring-enabled=false")
class AuditIsolationIntegrationTest {

    @Autowired
    private AuditService auditService;
    @Autowired
    private ClientRepository clientRepository;
    @Autowired
    private PlatformTransactionManager transactionManager;

    private Long clientId;

    @AfterEach
    void cleanUp() {
        if (clientId != null) {
            clientRepository.deleteById(clientId);
        }
    }

    @Test
    void failedAuditWrite_ShouldLeaveCallerTransactionCommittable() {
        TransactionTemplate tx = new TransactionTemplate(transactionManager);

        // action is longer than its column, so the insert fails in the database
        assertDoesNotThrow(() -> tx.executeWithoutResult(status -> {
            Client client = new Client();
            client.setName("Kapoor Interiors");
            clientId = clientRepository.save(client).getId();
            auditService.log("A".repeat(300), "Client Kapoor Interiors");
        }));

        assertNotNull(clientId);
        assertTrue(clientRepository.findById(clientId).isPresent());
    }
}

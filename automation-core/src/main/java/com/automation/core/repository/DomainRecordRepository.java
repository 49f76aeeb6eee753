package com.automation.core.repository;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Optional;

/**
 * Read-only access to the business records that event payloads reference.
 * Used to enrich events before conditions are evaluated.
 */
public interface DomainRecordRepository {

    Optional<JsonNode> findInvoice(String invoiceId);

    Optional<JsonNode> findClient(String clientId);

    Optional<JsonNode> findDocument(String documentId);

    Optional<JsonNode> findFormSubmission(String formSubmissionId);
}

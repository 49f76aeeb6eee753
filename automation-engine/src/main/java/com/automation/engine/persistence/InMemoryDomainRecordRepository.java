package com.automation.engine.persistence;

import com.automation.core.repository.DomainRecordRepository;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory DomainRecordRepository. Records are put in by the host or by tests.
 */
public class InMemoryDomainRecordRepository implements DomainRecordRepository {

    private final Map<String, JsonNode> invoices = new ConcurrentHashMap<>();
    private final Map<String, JsonNode> clients = new ConcurrentHashMap<>();
    private final Map<String, JsonNode> documents = new ConcurrentHashMap<>();
    private final Map<String, JsonNode> formSubmissions = new ConcurrentHashMap<>();

    public void putInvoice(String invoiceId, JsonNode invoice) {
        invoices.put(invoiceId, invoice);
    }

    public void putClient(String clientId, JsonNode client) {
        clients.put(clientId, client);
    }

    public void putDocument(String documentId, JsonNode document) {
        documents.put(documentId, document);
    }

    public void putFormSubmission(String formSubmissionId, JsonNode formSubmission) {
        formSubmissions.put(formSubmissionId, formSubmission);
    }

    @Override
    public Optional<JsonNode> findInvoice(String invoiceId) {
        return Optional.ofNullable(invoices.get(invoiceId));
    }

    @Override
    public Optional<JsonNode> findClient(String clientId) {
        return Optional.ofNullable(clients.get(clientId));
    }

    @Override
    public Optional<JsonNode> findDocument(String documentId) {
        return Optional.ofNullable(documents.get(documentId));
    }

    @Override
    public Optional<JsonNode> findFormSubmission(String formSubmissionId) {
        return Optional.ofNullable(formSubmissions.get(formSubmissionId));
    }
}

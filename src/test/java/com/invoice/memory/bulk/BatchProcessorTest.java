package com.invoice.memory.bulk;

import com.fasterxml.jackson.databind.JsonNode;
import com.invoice.memory.api.InvoiceNormalizer;
import com.invoice.memory.core.model.InvoiceDocument;
import com.invoice.memory.memory.MemoryStore;
import com.invoice.memory.memory.MemoryStoreException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import static com.invoice.memory.InvoiceFixtures.*;
import static com.invoice.memory.rules.DefaultCorrectionRules.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class BatchProcessorTest {

    private InvoiceNormalizer normalizer;
    private BatchProcessor processor;

    @BeforeEach
    void setUp() {
        normalizer = InvoiceNormalizer.builder().clock(CLOCK).build();
        processor = new BatchProcessor(normalizer);
        normalizer.getMemoryStore().save(memory(SUPPLIER_GMBH, SERVICE_DATE_PATTERN, 0.9));
        normalizer.getMemoryStore().save(memory(PARTS_AG, CURRENCY_RECOVERY_PATTERN, 0.4));
    }

    @Test
    void process_countsOutcomes() {
        BatchSummary summary = processor.process(List.of(
                supplierInvoice("INV-A-001", "A-001", "2024-02-05"),
                partsInvoice("INV-B-001", "B-001", "2024-02-10"),
                supplierInvoice("INV-A-002", "A-001", "2024-02-06"),
                unknownVendorInvoice("INV-X-001")), null);

        assertEquals(4, summary.total());
        assertEquals(2, summary.autoProcessed());
        assertEquals(1, summary.humanReview());
        assertEquals(1, summary.duplicates());
        assertEquals(0, summary.failed());
        assertEquals(2, normalizer.getReviewService().getPendingCount());
    }

    @Test
    void process_continuesAfterFailure() {
        MemoryStore failing = mock(MemoryStore.class);
        when(failing.memoriesForVendor(PARTS_AG)).thenThrow(new MemoryStoreException("graph unavailable"));
        when(failing.memoriesForVendor(SUPPLIER_GMBH)).thenReturn(List.of());
        BatchProcessor flaky = new BatchProcessor(
                InvoiceNormalizer.builder().memoryStore(failing).clock(CLOCK).build());

        BatchSummary summary = flaky.process(List.of(
                partsInvoice("INV-B-001", "B-001", "2024-02-10"),
                supplierInvoice("INV-A-001", "A-001", "2024-02-05")), ProgressCallback.NOOP);

        assertEquals(1, summary.failed());
        assertEquals(1, summary.autoProcessed());
        assertTrue(summary.hasErrors());
        assertEquals(0, summary.errors().get(0).position());
        assertEquals("INV-B-001", summary.errors().get(0).documentId());
        assertEquals("graph unavailable", summary.errors().get(0).message());
    }

    @Test
    void process_reportsProgress() {
        List<InvoiceDocument> documents = new ArrayList<>();
        for (int i = 0; i < 12; i++) {
            documents.add(unknownVendorInvoice("INV-X-" + i));
        }
        List<Long> reported = new ArrayList<>();

        processor.process(documents, (processed, total, message) -> reported.add(processed));

        assertEquals(List.of(10L, 12L), reported);
    }

    @Test
    void process_streamsJson() throws IOException {
        String input = """
                [
                  {"invoiceId": "INV-A-001", "vendor": "Supplier GmbH", "rawText": "Leistungsdatum: 01.02.2024",
                   "fields": {"invoiceNumber": "A-001", "invoiceDate": "2024-02-05"}},
                  {"invoiceId": "INV-X-001", "vendor": "Unknown Vendor Ltd", "fields": {"invoiceNumber": "X-1"}}
                ]
                """;
        ByteArrayOutputStream output = new ByteArrayOutputStream();

        BatchSummary summary = processor.process(
                new ByteArrayInputStream(input.getBytes(StandardCharsets.UTF_8)), output, null);

        JsonNode results = new InvoiceJsonCodec().getObjectMapper().readTree(output.toByteArray());
        assertEquals(2, summary.total());
        assertEquals(2, results.size());
        assertEquals("2024-02-01", results.get(0).get("normalizedDocument").get("serviceDate").asText());
        assertEquals("NO_CORRECTIONS", results.get(1).get("decision").asText());
    }

    @Test
    void process_malformedJsonFails() {
        assertThrows(IOException.class, () -> processor.process(
                new ByteArrayInputStream("[{".getBytes(StandardCharsets.UTF_8)), new ByteArrayOutputStream(), null));
    }
}

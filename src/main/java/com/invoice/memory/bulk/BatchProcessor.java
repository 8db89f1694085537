package com.invoice.memory.bulk;

import com.invoice.memory.api.InvoiceNormalizer;
import com.invoice.memory.core.model.InvoiceDocument;
import com.invoice.memory.core.model.OutputContract;
import com.invoice.memory.logging.LogContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * Runs a batch of documents through an {@link InvoiceNormalizer}, in order.
 * A document that fails is recorded in the summary and the batch continues.
 */
public class BatchProcessor {
    private static final Logger log = LoggerFactory.getLogger(BatchProcessor.class);
    private static final int PROGRESS_INTERVAL = 10;

    private final InvoiceNormalizer normalizer;
    private final InvoiceJsonCodec codec;

    public BatchProcessor(InvoiceNormalizer normalizer) {
        this(normalizer, new InvoiceJsonCodec());
    }

    public BatchProcessor(InvoiceNormalizer normalizer, InvoiceJsonCodec codec) {
        this.normalizer = normalizer;
        this.codec = codec;
    }

    public BatchSummary process(List<InvoiceDocument> documents, ProgressCallback callback) {
        return process(documents, callback, result -> {});
    }

    /**
     * Processes documents, handing each successful result to {@code sink}.
     */
    public BatchSummary process(List<InvoiceDocument> documents, ProgressCallback callback,
                                Consumer<OutputContract> sink) {
        ProgressCallback cb = callback != null ? callback : ProgressCallback.NOOP;
        long total = documents.size();
        long autoProcessed = 0;
        long humanReview = 0;
        long duplicates = 0;
        List<BatchSummary.BatchError> errors = new ArrayList<>();

        try (LogContext ctx = LogContext.forBatch(LogContext.generateCorrelationId())) {
            normalizer.getMetricsService().recordBatchSize(documents.size());
            for (int i = 0; i < documents.size(); i++) {
                InvoiceDocument document = documents.get(i);
                try {
                    OutputContract result = normalizer.normalize(document);
                    switch (result.decision()) {
                        case DUPLICATE -> duplicates++;
                        case ESCALATED -> humanReview++;
                        default -> autoProcessed++;
                    }
                    sink.accept(result);
                } catch (RuntimeException e) {
                    errors.add(new BatchSummary.BatchError(i, document.documentId(), e.getMessage()));
                    log.warn("batch.error position={} documentId={} error={}", i, document.documentId(),
                            e.getMessage());
                }

                long processed = i + 1L;
                if (processed % PROGRESS_INTERVAL == 0) {
                    cb.onProgress(processed, total, "Processed " + processed + " documents");
                }
            }
        }

        BatchSummary summary = new BatchSummary(total, autoProcessed, humanReview, duplicates,
                errors.size(), errors);
        cb.onProgress(total, total, "Batch completed");
        log.info("batch.completed summary={}", summary);
        return summary;
    }

    /**
     * Reads a JSON array of documents, processes them and writes the results as a JSON array.
     *
     * @throws IOException if the input cannot be parsed or the output cannot be written
     */
    public BatchSummary process(InputStream input, OutputStream output, ProgressCallback callback)
            throws IOException {
        List<InvoiceDocument> documents = codec.readDocuments(input);
        List<OutputContract> results = new ArrayList<>();
        BatchSummary summary = process(documents, callback, results::add);
        codec.writeContracts(results, output);
        return summary;
    }
}

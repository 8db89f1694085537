package com.invoice.memory.bulk;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.invoice.memory.core.model.InvoiceDocument;
import com.invoice.memory.core.model.OutputContract;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.List;

/**
 * JSON reading of invoice documents and writing of pipeline results.
 *
 * <p>Input is either a single document object or an array of them. The
 * {@code invoiceId} property is accepted as an alias of {@code documentId};
 * unknown properties are ignored. Timestamps are written as ISO-8601 strings.</p>
 */
public class InvoiceJsonCodec {

    private static final TypeReference<List<InvoiceDocument>> DOCUMENT_LIST = new TypeReference<>() {};

    private final ObjectMapper objectMapper;

    public InvoiceJsonCodec() {
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .configure(DeserializationFeature.ACCEPT_SINGLE_VALUE_AS_ARRAY, true)
                .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false)
                .configure(SerializationFeature.INDENT_OUTPUT, true);
    }

    public List<InvoiceDocument> readDocuments(InputStream input) throws IOException {
        return objectMapper.readValue(input, DOCUMENT_LIST);
    }

    public List<InvoiceDocument> readDocuments(String json) throws IOException {
        return objectMapper.readValue(json, DOCUMENT_LIST);
    }

    public InvoiceDocument readDocument(String json) throws IOException {
        return objectMapper.readValue(json, InvoiceDocument.class);
    }

    public String writeContract(OutputContract contract) throws IOException {
        return objectMapper.writeValueAsString(contract);
    }

    public void writeContracts(List<OutputContract> contracts, OutputStream output) throws IOException {
        objectMapper.writeValue(output, contracts);
    }

    public ObjectMapper getObjectMapper() {
        return objectMapper;
    }
}

package dev.lexsearch.ingestion;

/**
 * Outcome of one corpus ingestion run.
 *
 * @param documents number of documents ingested
 * @param passages number of passages written to the index
 * @param skippedLines number of lines that were not valid JSON or failed validation
 */
public record IngestionReport(int documents, int passages, int skippedLines) {}

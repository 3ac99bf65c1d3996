package dev.lexsearch.ingestion;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.lexsearch.passage.Passage;
import dev.lexsearch.retrieval.PassageIndex;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Ingests a JSONL corpus into the {@link PassageIndex}: parse and validate -> split into passages
 * -> embed -> store.
 *
 * <p>Lines that are not valid JSON or fail validation are skipped and counted, never fatal. Every
 * embedding is computed <em>before</em> the index is touched, so a failing embedding model leaves
 * the index unchanged. Identifiers are content hashes: ingesting the same corpus twice overwrites
 * the same passages.
 */
@Service
public class CorpusIngestionService {

  private static final Logger log = LoggerFactory.getLogger(CorpusIngestionService.class);

  static final int EMBED_BATCH_SIZE = 256;

  private final PassageIndex passageIndex;
  private final EmbeddingModel embeddingModel;
  private final Validator validator;
  private final ObjectMapper objectMapper;
  private final PassageSplitter splitter = new PassageSplitter();

  public CorpusIngestionService(
      PassageIndex passageIndex,
      EmbeddingModel embeddingModel,
      Validator validator,
      ObjectMapper objectMapper) {
    this.passageIndex = passageIndex;
    this.embeddingModel = embeddingModel;
    this.validator = validator;
    this.objectMapper = objectMapper;
  }

  /**
   * Ingests a JSONL file, one document per line.
   *
   * @param path the corpus file
   * @return counts of ingested documents, stored passages and skipped lines
   * @throws UncheckedIOException if the file cannot be read
   */
  public IngestionReport ingest(Path path) {
    List<CorpusRecord> records = new ArrayList<>();
    int skipped = 0;
    int lineNumber = 0;
    try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      String line;
      while ((line = reader.readLine()) != null) {
        lineNumber++;
        if (line.isBlank()) {
          continue;
        }
        CorpusRecord record = parse(line, lineNumber);
        if (record == null) {
          skipped++;
        } else {
          records.add(record);
        }
      }
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to read corpus " + path, e);
    }

    IngestionReport stored = ingestRecords(records);
    IngestionReport report =
        new IngestionReport(stored.documents(), stored.passages(), skipped + stored.skippedLines());
    log.info(
        "Ingested {} documents ({} passages) from {}, skipped {} lines",
        report.documents(),
        report.passages(),
        path,
        report.skippedLines());
    return report;
  }

  /**
   * Splits, embeds and stores already-parsed records. Records failing validation are skipped.
   *
   * @param records corpus records
   * @return counts of ingested documents, stored passages and skipped records
   */
  public IngestionReport ingestRecords(List<CorpusRecord> records) {
    List<PendingPassage> pending = new ArrayList<>();
    int documents = 0;
    int skipped = 0;

    for (CorpusRecord record : records) {
      String violations = violations(record);
      if (violations != null) {
        log.warn("Skipping corpus record '{}': {}", record.title(), violations);
        skipped++;
        continue;
      }
      List<String> chunks = splitter.split(record.text());
      if (chunks.isEmpty()) {
        skipped++;
        continue;
      }
      String documentId = documentId(record);
      for (int i = 0; i < chunks.size(); i++) {
        pending.add(
            new PendingPassage(passageId(documentId, i), documentId, record, chunks.get(i)));
      }
      documents++;
    }

    if (pending.isEmpty()) {
      return new IngestionReport(0, 0, skipped);
    }

    List<Embedding> embeddings =
        embedAll(
            pending.stream()
                .map(p -> TextSegment.from(embedInput(p.record(), p.chunk())))
                .toList());
    List<Passage> passages = new ArrayList<>(pending.size());
    for (int i = 0; i < pending.size(); i++) {
      passages.add(pending.get(i).toPassage(embeddings.get(i)));
    }
    passageIndex.addAll(passages);
    return new IngestionReport(documents, passages.size(), skipped);
  }

  private @Nullable CorpusRecord parse(String line, int lineNumber) {
    try {
      return objectMapper.readValue(line, CorpusRecord.class);
    } catch (JsonProcessingException e) {
      log.warn(
          "Skipping line {}: not a valid corpus record ({})", lineNumber, e.getOriginalMessage());
      return null;
    }
  }

  private @Nullable String violations(CorpusRecord record) {
    Set<ConstraintViolation<CorpusRecord>> violations = validator.validate(record);
    if (violations.isEmpty()) {
      return null;
    }
    return violations.stream()
        .map(v -> v.getPropertyPath() + ": " + v.getMessage())
        .sorted()
        .collect(Collectors.joining(", "));
  }

  private List<Embedding> embedAll(List<TextSegment> segments) {
    List<Embedding> all = new ArrayList<>(segments.size());
    for (int i = 0; i < segments.size(); i += EMBED_BATCH_SIZE) {
      List<TextSegment> batch =
          segments.subList(i, Math.min(i + EMBED_BATCH_SIZE, segments.size()));
      all.addAll(embeddingModel.embedAll(batch).content());
    }
    if (all.size() != segments.size()) {
      throw new IllegalStateException(
          "Embedding model returned "
              + all.size()
              + " embeddings for "
              + segments.size()
              + " inputs");
    }
    return all;
  }

  /** Title, heading and passage text on separate lines; the embedded form of a passage. */
  static String embedInput(CorpusRecord record, String chunk) {
    return (Objects.requireNonNullElse(record.title(), "")
            + "\n"
            + Objects.requireNonNullElse(record.heading(), "")
            + "\n"
            + chunk)
        .strip();
  }

  /**
   * Stable identifier for a record: the first 128 bits of the SHA-256 of its title and text, in
   * lowercase hex. Re-ingesting an unchanged record therefore replaces its passages in place.
   */
  static String documentId(CorpusRecord record) {
    String identity = Objects.requireNonNullElse(record.title(), "") + "\n" + record.text();
    try {
      byte[] digest =
          MessageDigest.getInstance("SHA-256").digest(identity.getBytes(StandardCharsets.UTF_8));
      return HexFormat.of().formatHex(digest, 0, 16);
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 algorithm not available", e);
    }
  }

  static String passageId(String documentId, int ordinal) {
    return documentId + "-" + ordinal;
  }

  /** A passage cut from a record, waiting for its embedding. */
  private record PendingPassage(
      String id, String documentId, CorpusRecord record, String chunk) {

    Passage toPassage(Embedding embedding) {
      return new Passage(
          id,
          documentId,
          record.title(),
          record.heading(),
          chunk,
          record.text(),
          embedding,
          record.year(),
          record.category());
    }
  }
}

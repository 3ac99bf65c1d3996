package dev.lexsearch.ingestion;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;

/**
 * One line of a JSONL corpus: a document with its metadata and full text.
 *
 * <p>Unknown fields are ignored. {@code text} is the parent context of every passage cut from it.
 *
 * @param title document title (optional)
 * @param year publication year, used as an exact-match filter (optional)
 * @param category document category, used as an exact-match filter (optional)
 * @param heading section heading shared by all passages of the document (optional)
 * @param sectionNo section number within the source (optional, informational)
 * @param text the full document text
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CorpusRecord(
    @Size(max = 1000) String title,
    @PositiveOrZero Integer year,
    @Size(max = 200) String category,
    @Size(max = 1000) String heading,
    @JsonProperty("section_no") String sectionNo,
    @NotBlank String text) {}

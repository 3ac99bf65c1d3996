package dev.lexsearch.passage;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;

/**
 * Row of the {@code passages} table managed by Flyway migrations.
 *
 * <p>The {@code embedding} and generated {@code search_vector} columns are not mapped as JPA
 * fields; they are only read and written through the native queries of {@link PassageRepository}.
 *
 * @see PassageRepository
 */
@Entity
@Table(name = "passages")
public class PassageEntity {

  @Id
  @Column(columnDefinition = "TEXT")
  private String id;

  @Column(name = "doc_id", nullable = false, columnDefinition = "TEXT")
  private String documentId;

  @Column(columnDefinition = "TEXT")
  private String heading;

  @Column(nullable = false, columnDefinition = "TEXT")
  private String text;

  @Column(name = "parent_text", columnDefinition = "TEXT")
  private String parentText;

  private Integer year;

  @Column(columnDefinition = "TEXT")
  private String category;

  @Column(name = "token_count")
  private Integer tokenCount;

  @Column(name = "created_at", insertable = false, updatable = false)
  private Instant createdAt;

  protected PassageEntity() {
    // JPA requires no-arg constructor
  }

  public String getId() {
    return id;
  }

  public String getDocumentId() {
    return documentId;
  }

  public String getHeading() {
    return heading;
  }

  public String getText() {
    return text;
  }

  public String getParentText() {
    return parentText;
  }

  public Integer getYear() {
    return year;
  }

  public String getCategory() {
    return category;
  }

  public Integer getTokenCount() {
    return tokenCount;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}

package dev.lexsearch.fixture;

import dev.langchain4j.data.embedding.Embedding;
import dev.lexsearch.passage.Passage;

/**
 * Lightweight test builder for {@link Passage}. Provides sensible defaults so tests only override
 * what they care about.
 *
 * <pre>{@code
 * Passage passage = new PassageBuilder().id("p1").text("Some content").build();
 * }</pre>
 */
public final class PassageBuilder {

  private String id = "p1";
  private String documentId = "doc-1";
  private String title = "Sample Act";
  private String heading = "Section 1";
  private String text = "Sample passage text for testing.";
  private String parentText;
  private Embedding embedding = Embedding.from(new float[] {1.0f, 0.0f, 0.0f});
  private Integer year;
  private String category;

  public PassageBuilder id(String id) {
    this.id = id;
    return this;
  }

  public PassageBuilder documentId(String documentId) {
    this.documentId = documentId;
    return this;
  }

  public PassageBuilder title(String title) {
    this.title = title;
    return this;
  }

  public PassageBuilder heading(String heading) {
    this.heading = heading;
    return this;
  }

  public PassageBuilder text(String text) {
    this.text = text;
    return this;
  }

  public PassageBuilder parentText(String parentText) {
    this.parentText = parentText;
    return this;
  }

  public PassageBuilder embedding(float... vector) {
    this.embedding = Embedding.from(vector);
    return this;
  }

  public PassageBuilder embedding(Embedding embedding) {
    this.embedding = embedding;
    return this;
  }

  public PassageBuilder year(Integer year) {
    this.year = year;
    return this;
  }

  public PassageBuilder category(String category) {
    this.category = category;
    return this;
  }

  public Passage build() {
    return new Passage(
        id, documentId, title, heading, text, parentText, embedding, year, category);
  }

  /** Shortcut for a passage that differs from the defaults only in id and embedding. */
  public static Passage passage(String id, float... vector) {
    return new PassageBuilder().id(id).embedding(vector).build();
  }
}

package io.intellixity.astql.mongo;

import io.intellixity.astql.query.Hint;
import io.intellixity.astql.spi.NativeStatement;
import org.bson.Document;

import java.util.List;
import java.util.Objects;

/**
 * Structured MongoDB command: which collection method to call and its arguments.
 * <p>
 * Parts that do not apply to {@link #kind()} are null. {@link #toDocument()} gives the wire form with null parts
 * omitted; callers must not mutate the documents held here.
 */
public record MongoCommand(
    Kind kind,
    String collection,
    Document filter,
    Document document,
    List<Document> documents,
    Document update,
    Document options,
    List<Hint> hints
) implements NativeStatement {
  public enum Kind {
    FIND("find"),
    INSERT_ONE("insertOne"),
    INSERT_MANY("insertMany"),
    UPDATE_ONE("updateOne"),
    DELETE_ONE("deleteOne"),
    COUNT_DOCUMENTS("countDocuments");

    private final String operation;

    Kind(String operation) { this.operation = operation; }

    /** Collection method name, e.g. {@code insertMany}. */
    public String operation() { return operation; }
  }

  public MongoCommand {
    Objects.requireNonNull(kind, "kind");
    Objects.requireNonNull(collection, "collection");
    documents = (documents == null) ? null : List.copyOf(documents);
    hints = (hints == null) ? List.of() : List.copyOf(hints);
  }

  public String operation() { return kind.operation(); }

  public Document toDocument() {
    Document d = new Document("operation", kind.operation()).append("collection", collection);
    if (filter != null) d.append("filter", filter);
    if (document != null) d.append("document", document);
    if (documents != null) d.append("documents", documents);
    if (update != null) d.append("update", update);
    if (options != null) d.append("options", options);
    return d;
  }

  /** Relaxed extended JSON of {@link #toDocument()}. */
  public String toJson() {
    return toDocument().toJson();
  }
}

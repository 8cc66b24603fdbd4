package io.intellixity.astql.mongo;

import io.intellixity.astql.query.*;
import io.intellixity.astql.spi.Renderer;
import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Renders a {@link QueryAst} as a {@link MongoCommand}.
 * <p>
 * SELECT maps to {@code find} (projection, sort, limit, skip in {@code options}), INSERT to
 * {@code insertOne}/{@code insertMany}, UPDATE to {@code updateOne} with {@code $set}, DELETE to {@code deleteOne},
 * COUNT to {@code countDocuments}. Joins, grouping and having have no {@code find} equivalent and are rejected.
 * Projection aliases are dropped. Stateless and thread-safe.
 */
public final class MongoRenderer implements Renderer<MongoCommand> {
  private static final Logger log = LoggerFactory.getLogger(MongoRenderer.class);

  public static final String ID = "mongo";

  /** How a condition chain containing OR connectors becomes a filter. */
  public enum OrMode {
    /** Split at OR connectors into AND groups: {@code {$or: [group, group, ...]}}. */
    PRECEDENCE,
    /**
     * Every condition ANDed under one {@code $and}, ignoring OR. Kept for callers that depend on the old output;
     * the filter does not mean what the chain says.
     */
    LEGACY_AND
  }

  private final OrMode orMode;

  public MongoRenderer() {
    this(OrMode.PRECEDENCE);
  }

  public MongoRenderer(OrMode orMode) {
    this.orMode = (orMode == null) ? OrMode.PRECEDENCE : orMode;
  }

  @Override public String id() { return ID; }

  public OrMode orMode() { return orMode; }

  @Override
  public MongoCommand render(QueryAst ast) {
    QueryValidator.validate(ast);

    MongoCommand cmd = switch (ast.operation()) {
      case SELECT -> renderFind(ast);
      case INSERT -> renderInsert(ast);
      case UPDATE -> command(MongoCommand.Kind.UPDATE_ONE, ast, filter(ast), null, null, updateDoc(ast), null);
      case DELETE -> command(MongoCommand.Kind.DELETE_ONE, ast, filter(ast), null, null, null, null);
      case COUNT -> command(MongoCommand.Kind.COUNT_DOCUMENTS, ast, filter(ast), null, null, null, null);
      case AGGREGATE -> throw MongoFilterRenderer.fail(ErrorKind.UNSUPPORTED_OPERATION,
          "operation " + ast.operation() + " is not supported");
    };

    if (log.isDebugEnabled()) {
      log.debug("astql.mongo op={} collection={} filterKeys={} optionKeys={}",
          cmd.operation(), cmd.collection(),
          cmd.filter() == null ? "[]" : cmd.filter().keySet(),
          cmd.options() == null ? "[]" : cmd.options().keySet());
    }
    return cmd;
  }

  private MongoCommand renderFind(QueryAst ast) {
    if (!ast.joins().isEmpty()) throw unsupportedClause("joins");
    if (!ast.grouping().isEmpty()) throw unsupportedClause("groupBy");
    if (!ast.having().isEmpty()) throw unsupportedClause("having");

    Document options = new Document();
    if (!ast.fields().isEmpty()) {
      Document projection = new Document();
      for (SelectField f : ast.fields()) projection.append(f.name(), 1);
      options.append("projection", projection);
    }
    if (!ast.ordering().isEmpty()) {
      Document sort = new Document();
      for (SortField sf : ast.ordering()) sort.append(sf.field(), sf.direction() == SortField.Direction.DESC ? -1 : 1);
      options.append("sort", sort);
    }
    if (ast.limit() != null) options.append("limit", ast.limit());
    if (ast.offset() != null) options.append("skip", ast.offset());

    return command(MongoCommand.Kind.FIND, ast, filter(ast), null, null, null, options.isEmpty() ? null : options);
  }

  private MongoCommand renderInsert(QueryAst ast) {
    if (ast.values().size() == 1) {
      return command(MongoCommand.Kind.INSERT_ONE, ast, null, rowDoc(ast.values().get(0).assignments()), null, null, null);
    }
    List<Document> docs = new ArrayList<>(ast.values().size());
    for (Row r : ast.values()) docs.add(rowDoc(r.assignments()));
    return command(MongoCommand.Kind.INSERT_MANY, ast, null, null, docs, null, null);
  }

  private static Document updateDoc(QueryAst ast) {
    return new Document("$set", rowDoc(ast.updates()));
  }

  private static Document rowDoc(List<Assignment> assignments) {
    Document d = new Document();
    for (Assignment a : assignments) d.append(a.field(), MongoFilterRenderer.toBson(a.value()));
    return d;
  }

  private Document filter(QueryAst ast) {
    List<Condition> cs = ast.conditions();
    if (cs.isEmpty()) return null;
    if (MongoFilterRenderer.allAnd(cs)) return MongoFilterRenderer.precedence(cs);
    if (orMode == OrMode.LEGACY_AND) {
      log.warn("astql.mongo collection={} OR connectors flattened to $and (OrMode.LEGACY_AND); "
          + "the filter matches only documents satisfying every condition", ast.target());
      return MongoFilterRenderer.legacyAnd(cs);
    }
    return MongoFilterRenderer.precedence(cs);
  }

  private static MongoCommand command(MongoCommand.Kind kind, QueryAst ast, Document filter, Document document,
                                      List<Document> documents, Document update, Document options) {
    List<Hint> hints = new ArrayList<>();
    for (Hint h : ast.hints()) if (ID.equals(h.provider())) hints.add(h);
    return new MongoCommand(kind, ast.target(), filter, document, documents, update, options, hints);
  }

  private static RuntimeException unsupportedClause(String clause) {
    return MongoFilterRenderer.fail(ErrorKind.UNSUPPORTED_CLAUSE, clause + " cannot be expressed as a find command");
  }
}

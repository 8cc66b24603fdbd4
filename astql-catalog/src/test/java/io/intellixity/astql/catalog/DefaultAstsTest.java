package io.intellixity.astql.catalog;

import io.intellixity.astql.query.*;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class DefaultAstsTest {
  private static EntityMetadata user() {
    return new EntityMetadata("User", List.of(
        FieldDescriptor.of("id"),
        new FieldDescriptor("Email", "email", null, Map.of("astql", "unique,index:btree")),
        new FieldDescriptor("TenantID", "tenant", null, Map.of("db", "tenant_id", "astql", "security:tenant")),
        new FieldDescriptor("Password", "-", null, Map.of()),
        FieldDescriptor.of("created_at"),
        FieldDescriptor.of("deleted_at")
    ));
  }

  private static EntityMetadata note() {
    return new EntityMetadata("Note", "notes_v2", List.of(FieldDescriptor.of("id"), FieldDescriptor.of("body")));
  }

  @Test
  void targetDefaultsToPluralisedLowerCaseName() {
    assertEquals("users", user().resolvedTarget());
    assertEquals("notes_v2", note().resolvedTarget());
  }

  @Test
  void getSelectsColumnsWithScopeAndIdentity() {
    QueryAst q = DefaultAsts.defaultAst(user(), CrudVerb.GET);

    assertEquals(Operation.SELECT, q.operation());
    assertEquals(List.of("id", "email", "tenant_id", "created_at", "deleted_at"),
        q.fields().stream().map(SelectField::name).toList());
    assertEquals(List.of("tenant_id", "deleted_check", "id"),
        q.conditions().stream().map(Condition::paramName).toList());
    assertEquals(Operator.IS_NULL, q.conditions().get(1).operator());
    assertEquals(Value.NULL, q.conditions().get(2).value());
    assertNull(q.limit());
  }

  @Test
  void listPagesAndOrdersWithoutIdentity() {
    QueryAst q = DefaultAsts.defaultAst(user(), CrudVerb.LIST);

    assertEquals(List.of("tenant_id", "deleted_at"), q.conditions().stream().map(Condition::field).toList());
    assertEquals(List.of(new SortField("created_at", SortField.Direction.DESC)), q.ordering());
    assertEquals(100, q.limit());
    assertEquals(0, q.offset());
  }

  @Test
  void listWithoutCreatedAtHasNoOrdering() {
    QueryAst q = DefaultAsts.defaultAst(note(), CrudVerb.LIST, CatalogConventions.defaults().withListPageSize(25));
    assertTrue(q.ordering().isEmpty());
    assertFalse(q.hasConditions());
    assertEquals(25, q.limit());
  }

  @Test
  void createIsTemplateRowReturningAll() {
    QueryAst q = DefaultAsts.defaultAst(user(), CrudVerb.CREATE);

    assertEquals(Operation.INSERT, q.operation());
    assertEquals(1, q.values().size());
    assertEquals(List.of("created_at", "deleted_at", "email", "id", "tenant_id"), q.values().get(0).fields());
    assertEquals(Value.NULL, q.values().get(0).get("email"));
    assertEquals(List.of("*"), q.returning());
  }

  @Test
  void updateSkipsIdentityCreatedAtAndTenant() {
    QueryAst q = DefaultAsts.defaultAst(user(), CrudVerb.UPDATE);

    assertEquals(List.of("deleted_at", "email"), q.updates().stream().map(Assignment::field).toList());
    assertEquals(List.of("tenant_id", "deleted_check", "id"),
        q.conditions().stream().map(Condition::paramName).toList());
    assertEquals(List.of("*"), q.returning());
  }

  @Test
  void softDeleteBecomesUpdate() {
    QueryAst q = DefaultAsts.defaultAst(user(), CrudVerb.DELETE);
    assertEquals(Operation.UPDATE, q.operation());
    assertEquals(Value.NULL, q.update("deleted_at"));
    assertEquals(1, q.updates().size());
  }

  @Test
  void hardDeleteWithoutDeletedAt() {
    QueryAst q = DefaultAsts.defaultAst(note(), CrudVerb.DELETE);
    assertEquals(Operation.DELETE, q.operation());
    assertEquals(List.of("id"), q.conditions().stream().map(Condition::field).toList());
  }

  @Test
  void countKeepsScopeOnly() {
    QueryAst q = DefaultAsts.defaultAst(user(), CrudVerb.COUNT);
    assertEquals(Operation.COUNT, q.operation());
    assertEquals(List.of("tenant_id", "deleted_at"), q.conditions().stream().map(Condition::field).toList());
  }

  @Test
  void tagDirectivesBecomeHints() {
    QueryAst q = DefaultAsts.defaultAst(user(), CrudVerb.GET);
    assertEquals(List.of(new Hint("sql", "unique", "email"), new Hint("sql", "index", "email:btree")), q.hints());
  }

  @Test
  void strictModeRejectsUnknownDirective() {
    EntityMetadata m = new EntityMetadata("Order", List.of(
        FieldDescriptor.of("id"),
        FieldDescriptor.of("user_id").withTag("astql", "relation:users")));

    UnsupportedDirectiveException ex = assertThrows(UnsupportedDirectiveException.class,
        () -> DefaultAsts.defaultAst(m, CrudVerb.GET));
    assertEquals(ErrorKind.UNSUPPORTED_DIRECTIVE, ex.kind());
    assertEquals("user_id", ex.field());
    assertEquals("relation:users", ex.directive());
  }

  @Test
  void lenientModeKeepsUnknownDirectiveAsHint() {
    EntityMetadata m = new EntityMetadata("Order", List.of(
        FieldDescriptor.of("id"),
        FieldDescriptor.of("user_id").withTag("astql", "relation:users")));

    QueryAst q = DefaultAsts.defaultAst(m, CrudVerb.GET, CatalogConventions.defaults().withStrictDirectives(false));
    assertEquals(List.of(new Hint("astql", "unsupported", "user_id:relation:users")), q.hints());
  }

  @Test
  void crudQueriesCoversEveryVerb() {
    Map<CrudVerb, QueryAst> all = DefaultAsts.crudQueries(user());
    assertEquals(List.of(CrudVerb.values()), List.copyOf(all.keySet()));
    assertEquals(Operation.COUNT, all.get(CrudVerb.COUNT).operation());
  }

  @Test
  void crudQueriesSkipsUpdateWithNothingToSet() {
    EntityMetadata idOnly = new EntityMetadata("Tag", List.of(FieldDescriptor.of("id")));
    Map<CrudVerb, QueryAst> all = DefaultAsts.crudQueries(idOnly);
    assertFalse(all.containsKey(CrudVerb.UPDATE));
    assertTrue(all.containsKey(CrudVerb.DELETE));
    assertEquals("tags", all.get(CrudVerb.GET).target());
  }
}

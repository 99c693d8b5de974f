package io.intellixity.rowgate.jdbc.dialect;

import io.intellixity.rowgate.catalog.ColumnDescriptor;
import io.intellixity.rowgate.catalog.TableDescriptor;
import io.intellixity.rowgate.exec.OffsetPage;
import io.intellixity.rowgate.exec.TableRequest;
import io.intellixity.rowgate.jdbc.SqlStatement;
import io.intellixity.rowgate.policy.Policy;
import io.intellixity.rowgate.policy.PolicyContext;
import io.intellixity.rowgate.policy.PolicyOperation;
import io.intellixity.rowgate.spi.bind.Bind;
import io.intellixity.rowgate.spi.bind.BindOpKind;
import io.intellixity.rowgate.sql.EmptyWriteSetException;
import io.intellixity.rowgate.sql.InvalidColumnSetException;
import io.intellixity.rowgate.value.TypedParam;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class AbstractJdbcSqlDialectTest {
  private static final TableDescriptor USERS = new TableDescriptor("users", "main", null, List.of(
      col(0, "id"), col(1, "email"), col(2, "is_active")), List.of());

  private final TestJsonDialect d = new TestJsonDialect();

  private static ColumnDescriptor col(int pos, String name) {
    return new ColumnDescriptor(pos, name, "TEXT", false, null, pos == 0, pos == 0 ? 1 : null, null, null, null);
  }

  @Test
  void selectWithoutPoliciesHasNoWhere() {
    SqlStatement ss = d.build(USERS, PolicyOperation.SELECT, new TableRequest(), List.of());
    assertEquals("SELECT json_object('id', \"id\", 'email', \"email\", 'is_active', \"is_active\") AS data"
        + " FROM \"main\".\"users\"", ss.sql());
    assertEquals(SqlStatement.ExecKind.QUERY, ss.execKind());
    assertTrue(ss.binds().isEmpty());
  }

  @Test
  void selectAndsFiltersWithGroupedPermissives() {
    List<Policy> ps = List.of(
        Policy.permissive("a", "users", PolicyOperation.SELECT, "is_active = 1", null),
        Policy.permissive("b", "users", PolicyOperation.SELECT, "id = :auth_sub", null));
    TableRequest r = new TableRequest()
        .withFilter("email", new TypedParam.TextParam("a@x"))
        .withContext(PolicyContext.authenticated("7", null, null, null));

    SqlStatement ss = d.build(USERS, PolicyOperation.SELECT, r, ps);

    assertTrue(ss.sql().endsWith(" WHERE \"email\" = :b1 AND ((is_active = 1) OR (id = :auth_sub))"), ss.sql());
    assertEquals(List.of(
        new Bind(new TypedParam.TextParam("a@x"), BindOpKind.FILTER),
        new Bind(new TypedParam.TextParam("7"), BindOpKind.POLICY)), ss.binds());
  }

  @Test
  void nullFilterRendersIsNull() {
    SqlStatement ss = d.build(USERS, PolicyOperation.SELECT,
        TableRequest.where("email", TypedParam.NULL), List.of());
    assertTrue(ss.sql().endsWith(" WHERE \"email\" IS NULL"), ss.sql());
    assertTrue(ss.binds().isEmpty());
  }

  @Test
  void policiesForOtherOperationsOnlyDeny() {
    List<Policy> ps = List.of(Policy.permissive("ins", "users", PolicyOperation.INSERT, null, "is_active = 1"));
    SqlStatement ss = d.build(USERS, PolicyOperation.SELECT, new TableRequest(), ps);
    assertTrue(ss.sql().endsWith(" WHERE 1 = 0"), ss.sql());
  }

  @Test
  void selectProjectionAndPage() {
    TableRequest r = new TableRequest().withProjection(List.of("email")).withPage(new OffsetPage(20, 10));
    SqlStatement ss = d.build(USERS, PolicyOperation.SELECT, r, List.of());
    assertEquals("SELECT json_object('email', \"email\") AS data FROM \"main\".\"users\" LIMIT 10 OFFSET 20", ss.sql());
  }

  @Test
  void insertReturnsDocumentAndCheckGuard() {
    List<Policy> ps = List.of(Policy.permissive("ins", "users", PolicyOperation.INSERT, null, "is_active = 1"));
    TableRequest r = new TableRequest()
        .withValue("email", new TypedParam.TextParam("a@x"))
        .withValue("is_active", new TypedParam.Int64Param(0));

    SqlStatement ss = d.build(USERS, PolicyOperation.INSERT, r, ps);

    assertEquals("INSERT INTO \"main\".\"users\" (\"email\", \"is_active\") VALUES (:b1, :b2)"
        + " RETURNING json_object('id', \"id\", 'email', \"email\", 'is_active', \"is_active\") AS data,"
        + " ((is_active = 1)) AS rowgate_check", ss.sql());
    assertTrue(ss.guarded());
    assertEquals(SqlStatement.ExecKind.QUERY_RETURNING, ss.execKind());
    assertEquals(BindOpKind.INSERT, ss.binds().get(0).opKind());
  }

  @Test
  void insertWithoutPoliciesIsUnguarded() {
    SqlStatement ss = d.build(USERS, PolicyOperation.INSERT,
        new TableRequest().withValue("email", new TypedParam.TextParam("a@x")), List.of());
    assertFalse(ss.guarded());
    assertFalse(ss.sql().contains("rowgate_check"));
  }

  @Test
  void updateBindsFollowTextualOrder() {
    List<Policy> ps = List.of(Policy.permissive("own", "users", PolicyOperation.ALL, "id = :auth_sub", null));
    TableRequest r = new TableRequest()
        .withValue("email", new TypedParam.TextParam("new@x"))
        .withFilter("id", new TypedParam.Int64Param(5))
        .withContext(PolicyContext.authenticated("5", null, null, null));

    SqlStatement ss = d.build(USERS, PolicyOperation.UPDATE, r, ps);

    assertTrue(ss.sql().startsWith("UPDATE \"main\".\"users\" SET \"email\" = :b1 WHERE \"id\" = :b2 AND ((id = :auth_sub))"),
        ss.sql());
    assertTrue(ss.sql().endsWith(", ((id = :auth_sub)) AS rowgate_check"), ss.sql());
    assertEquals(List.of(BindOpKind.UPDATE_SET, BindOpKind.FILTER, BindOpKind.POLICY, BindOpKind.POLICY),
        ss.binds().stream().map(Bind::opKind).toList());
  }

  @Test
  void deleteCombinesFiltersAndUsing() {
    List<Policy> ps = List.of(
        Policy.permissive("p", "users", PolicyOperation.DELETE, "is_active = 0", null),
        Policy.restrictive("r", "users", PolicyOperation.ALL, "id > 1", null));
    SqlStatement ss = d.build(USERS, PolicyOperation.DELETE, TableRequest.where("id", new TypedParam.Int64Param(9)), ps);
    assertEquals("DELETE FROM \"main\".\"users\" WHERE \"id\" = :b1 AND ((is_active = 0) AND (id > 1))", ss.sql());
    assertEquals(SqlStatement.ExecKind.UPDATE, ss.execKind());
  }

  @Test
  void rejectsUnsafeColumnNames() {
    TableRequest r = new TableRequest().withValue("email\"; DROP TABLE users; --", new TypedParam.TextParam("x"));
    InvalidColumnSetException ex = assertThrows(InvalidColumnSetException.class,
        () -> d.build(USERS, PolicyOperation.INSERT, r, List.of()));
    assertEquals("email\"; DROP TABLE users; --", ex.column());

    assertThrows(InvalidColumnSetException.class,
        () -> d.build(USERS, PolicyOperation.SELECT, TableRequest.where("1=1 OR id", TypedParam.NULL), List.of()));
  }

  @Test
  void emptyWritesAreRejected() {
    assertThrows(EmptyWriteSetException.class, () -> d.build(USERS, PolicyOperation.INSERT, new TableRequest(), List.of()));
    assertThrows(EmptyWriteSetException.class, () -> d.build(USERS, PolicyOperation.UPDATE, new TableRequest(), List.of()));
  }

  @Test
  void unknownPolicyParamFailsTheBuild() {
    List<Policy> ps = List.of(Policy.permissive("t", "users", PolicyOperation.SELECT, "tenant = :tenant_id", null));
    assertThrows(IllegalArgumentException.class, () -> d.build(USERS, PolicyOperation.SELECT, new TableRequest(), ps));
  }
}

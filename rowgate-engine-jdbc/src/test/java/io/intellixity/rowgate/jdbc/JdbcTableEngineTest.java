package io.intellixity.rowgate.jdbc;

import io.intellixity.rowgate.catalog.TableNotFoundException;
import io.intellixity.rowgate.jdbc.dialect.TestJsonDialect;
import io.intellixity.rowgate.exec.Propagation;
import io.intellixity.rowgate.spi.bind.DiscoveredBinderRegistry;
import org.junit.jupiter.api.Test;

import javax.sql.DataSource;
import java.io.PrintWriter;
import java.lang.reflect.Proxy;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.logging.Logger;

import static org.junit.jupiter.api.Assertions.*;

final class JdbcTableEngineTest {

  /** Records every call on the connections it hands out and fails the named methods. */
  private static final class ScriptedDataSource implements DataSource {
    final List<String> calls = new ArrayList<>();
    final Set<String> failing;

    ScriptedDataSource(String... failing) {
      this.failing = Set.of(failing);
    }

    @Override
    public Connection getConnection() {
      return (Connection) Proxy.newProxyInstance(getClass().getClassLoader(), new Class<?>[]{Connection.class},
          (proxy, method, args) -> {
            String name = method.getName();
            if (method.getDeclaringClass() == Object.class) {
              return switch (name) {
                case "hashCode" -> System.identityHashCode(proxy);
                case "equals" -> proxy == args[0];
                default -> "ScriptedConnection";
              };
            }
            calls.add(name);
            if (failing.contains(name)) throw new SQLException(name + " failed");
            if (method.getReturnType() == boolean.class) return false;
            return null;
          });
    }

    @Override public Connection getConnection(String user, String password) { return getConnection(); }
    @Override public PrintWriter getLogWriter() { return null; }
    @Override public void setLogWriter(PrintWriter out) {}
    @Override public void setLoginTimeout(int seconds) {}
    @Override public int getLoginTimeout() { return 0; }
    @Override public Logger getParentLogger() { return Logger.getGlobal(); }
    @Override public <T> T unwrap(Class<T> iface) throws SQLException { throw new SQLException("not a wrapper"); }
    @Override public boolean isWrapperFor(Class<?> iface) { return false; }
  }

  private static JdbcTableEngine engine(DataSource ds) {
    return new JdbcTableEngine(new JdbcHandle("scripted", ds), new TestJsonDialect(),
        name -> { throw new TableNotFoundException(name); },
        Propagation.REQUIRED, new DiscoveredBinderRegistry("test", List.of()));
  }

  @Test
  void committedTransactionClosesItsConnection() {
    ScriptedDataSource ds = new ScriptedDataSource();
    assertEquals("x", engine(ds).inTx(() -> "x"));
    assertEquals(List.of("setAutoCommit", "commit", "close"), ds.calls);
  }

  @Test
  void failedBeginClosesTheConnection() {
    ScriptedDataSource ds = new ScriptedDataSource("setAutoCommit");
    RuntimeException ex = assertThrows(RuntimeException.class, () -> engine(ds).inTx(() -> "x"));
    assertInstanceOf(SQLException.class, ex.getCause());
    assertEquals(List.of("setAutoCommit", "close"), ds.calls);
  }

  @Test
  void failedCommitRollsBackAndCloses() {
    ScriptedDataSource ds = new ScriptedDataSource("commit");
    assertThrows(RuntimeException.class, () -> engine(ds).inTx(() -> "x"));
    assertEquals(List.of("setAutoCommit", "commit", "rollback", "close"), ds.calls);
  }

  @Test
  void failedRollbackStillCloses() {
    ScriptedDataSource ds = new ScriptedDataSource("rollback");
    IllegalStateException ex = assertThrows(IllegalStateException.class, () -> engine(ds).inTx(() -> {
      throw new IllegalStateException("work failed");
    }));
    assertEquals(1, ex.getSuppressed().length);
    assertEquals(List.of("setAutoCommit", "rollback", "close"), ds.calls);
  }
}

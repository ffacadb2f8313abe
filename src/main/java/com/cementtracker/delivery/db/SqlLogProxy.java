package com.cementtracker.delivery.db;

import org.apache.logging.log4j.Logger;

import java.lang.reflect.InvocationHandler;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Proxy;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.Statement;
import java.util.Locale;
import java.util.Set;

/**
 * Wraps a connection so every executed statement is written to the {@code SQL} logger with its timing.
 */
final class SqlLogProxy {
    private static final Set<String> EXECUTE_METHODS = Set.of(
            "execute", "executeQuery", "executeUpdate", "executeLargeUpdate", "executeBatch", "executeLargeBatch");
    private static final int MAX_SQL_CHARS = 600;

    private SqlLogProxy() {
    }

    static Connection wrapConnection(Connection delegate, Logger logger) {
        return proxy(Connection.class, (proxy, method, args) -> {
            Object out = invoke(delegate, method, args);
            if (out instanceof PreparedStatement && "prepareStatement".equals(method.getName()) && args != null && args.length > 0 && args[0] instanceof String) {
                String sql = (String) args[0];
                PreparedStatement ps = (PreparedStatement) out;
                return proxy(PreparedStatement.class, (p, m, a) -> logged(ps, m, a, sql, logger));
            }
            if (out instanceof Statement && "createStatement".equals(method.getName())) {
                Statement st = (Statement) out;
                return proxy(Statement.class, (p, m, a) -> logged(st, m, a,
                        a != null && a.length > 0 && a[0] instanceof String ? (String) a[0] : "<batch>", logger));
            }
            return out;
        });
    }

    private static Object logged(Object target, Method method, Object[] args, String sql, Logger logger) throws Throwable {
        if (!EXECUTE_METHODS.contains(method.getName())) {
            return invoke(target, method, args);
        }
        long started = System.nanoTime();
        try {
            Object out = invoke(target, method, args);
            if (logger.isInfoEnabled()) {
                logger.info("SQL ok method={} elapsed_ms={}{} sql={}",
                        method.getName(), elapsedMs(started), rows(out), oneLine(sql));
            }
            return out;
        } catch (Throwable e) {
            logger.warn("SQL fail method={} elapsed_ms={} err={} sql={}",
                    method.getName(), elapsedMs(started), e.getMessage(), oneLine(sql));
            throw e;
        }
    }

    private static Object invoke(Object target, Method method, Object[] args) throws Throwable {
        try {
            return method.invoke(target, args);
        } catch (InvocationTargetException e) {
            throw e.getTargetException();
        }
    }

    private static <T> T proxy(Class<T> type, InvocationHandler handler) {
        return type.cast(Proxy.newProxyInstance(type.getClassLoader(), new Class<?>[]{type}, handler));
    }

    private static String elapsedMs(long startedNanos) {
        return String.format(Locale.US, "%.3f", (System.nanoTime() - startedNanos) / 1_000_000.0);
    }

    private static String rows(Object result) {
        if (result instanceof Integer || result instanceof Long) {
            return " rows=" + result;
        }
        if (result instanceof int[]) {
            return " batch_size=" + ((int[]) result).length;
        }
        return "";
    }

    private static String oneLine(String sql) {
        String normalized = sql == null ? "" : sql.replaceAll("\\s+", " ").trim();
        return normalized.length() <= MAX_SQL_CHARS ? normalized : normalized.substring(0, MAX_SQL_CHARS) + "...";
    }
}

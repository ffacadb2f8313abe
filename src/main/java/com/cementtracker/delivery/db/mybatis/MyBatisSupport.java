package com.cementtracker.delivery.db.mybatis;

import org.apache.ibatis.exceptions.PersistenceException;
import org.apache.ibatis.session.Configuration;
import org.apache.ibatis.session.SqlSession;
import org.apache.ibatis.session.SqlSessionFactory;
import org.apache.ibatis.session.SqlSessionFactoryBuilder;
import org.apache.ibatis.type.JdbcType;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Shared MyBatis bootstrap for the store mappers. Sessions run on connections opened by {@code Database}.
 */
public final class MyBatisSupport {
    private static final SqlSessionFactory FACTORY = buildFactory();

    private MyBatisSupport() {
    }

    public static SqlSession openSession(Connection connection) {
        return FACTORY.openSession(connection);
    }

    /**
     * MyBatis reports JDBC failures unchecked; this recovers the driver's {@link SQLException}
     * so callers can tell a lost connection from a refused statement.
     */
    public static SQLException unwrap(PersistenceException e) {
        for (Throwable cause = e.getCause(); cause != null; cause = cause.getCause()) {
            if (cause instanceof SQLException) {
                return (SQLException) cause;
            }
        }
        return new SQLException(e.getMessage(), e);
    }

    private static SqlSessionFactory buildFactory() {
        Configuration config = new Configuration();
        config.setMapUnderscoreToCamelCase(true);
        config.setJdbcTypeForNull(JdbcType.NULL);

        config.addMapper(DeliveryReportMapper.class);
        config.addMapper(SyncRunMapper.class);

        return new SqlSessionFactoryBuilder().build(config);
    }
}

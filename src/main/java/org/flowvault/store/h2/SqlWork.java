package org.flowvault.store.h2;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * A unit of JDBC work run against a pooled connection.
 *
 * @param <T> result type
 */
@FunctionalInterface
public interface SqlWork<T> {

    T execute(Connection conn) throws SQLException;
}

package com.acme.delivery.persistence.jdbc;

import com.acme.delivery.repository.UnitOfWork;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Savepoint;
import java.util.HashMap;
import java.util.Map;

/**
 * Unit of work over a single pooled JDBC connection. The connection is borrowed lazily on
 * {@link #begin()} or the first {@link #connection()} call and returned to the pool on
 * {@link #close()}, rolling back first if a transaction is still open.
 */
public class JdbcUnitOfWork implements UnitOfWork {

    private static final Logger LOG = LoggerFactory.getLogger(JdbcUnitOfWork.class);

    private final DataSource dataSource;
    private final Map<String, Savepoint> savepoints = new HashMap<>();
    private Connection connection;
    private boolean transactionActive;
    private boolean closed;

    public JdbcUnitOfWork(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public void begin() {
        ensureOpen();
        if (transactionActive) {
            throw new IllegalStateException("Transaction already active");
        }
        try {
            connection().setAutoCommit(false);
            transactionActive = true;
        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "begin transaction", LOG);
        }
    }

    @Override
    public void commit() {
        requireActive("commit");
        try {
            connection.commit();
        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "commit transaction", LOG);
        } finally {
            endTransaction();
        }
    }

    @Override
    public void rollback() {
        requireActive("rollback");
        try {
            connection.rollback();
        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "rollback transaction", LOG);
        } finally {
            endTransaction();
        }
    }

    @Override
    public void savepoint(String name) {
        requireActive("savepoint");
        if (savepoints.containsKey(name)) {
            throw new IllegalArgumentException("Savepoint already exists: " + name);
        }
        try {
            savepoints.put(name, connection.setSavepoint(name));
        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "create savepoint " + name, LOG);
        }
    }

    @Override
    public void rollbackToSavepoint(String name) {
        requireActive("rollback to savepoint");
        Savepoint savepoint = requireSavepoint(name);
        try {
            connection.rollback(savepoint);
        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "rollback to savepoint " + name, LOG);
        }
    }

    @Override
    public void releaseSavepoint(String name) {
        requireActive("release savepoint");
        Savepoint savepoint = requireSavepoint(name);
        try {
            connection.releaseSavepoint(savepoint);
            savepoints.remove(name);
        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "release savepoint " + name, LOG);
        }
    }

    @Override
    public boolean isTransactionActive() {
        return transactionActive;
    }

    @Override
    public Connection connection() {
        ensureOpen();
        if (connection == null) {
            try {
                connection = dataSource.getConnection();
            } catch (SQLException e) {
                throw ExceptionTranslator.translateException(e, "obtain connection", LOG);
            }
        }
        return connection;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        if (connection == null) {
            return;
        }
        try {
            if (transactionActive) {
                LOG.warn("Unit of work closed with an active transaction; rolling back");
                connection.rollback();
                endTransaction();
            }
        } catch (SQLException e) {
            LOG.error("Rollback on close failed", e);
        } finally {
            try {
                connection.close();
            } catch (SQLException e) {
                LOG.warn("Failed to return connection to pool", e);
            }
            connection = null;
        }
    }

    private void endTransaction() {
        transactionActive = false;
        savepoints.clear();
        try {
            connection.setAutoCommit(true);
        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "restore auto-commit", LOG);
        }
    }

    private Savepoint requireSavepoint(String name) {
        Savepoint savepoint = savepoints.get(name);
        if (savepoint == null) {
            throw new IllegalArgumentException("Unknown savepoint: " + name);
        }
        return savepoint;
    }

    private void requireActive(String operation) {
        ensureOpen();
        if (!transactionActive) {
            throw new IllegalStateException("No active transaction for " + operation);
        }
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("Unit of work is closed");
        }
    }
}

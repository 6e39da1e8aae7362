package com.acme.delivery.persistence.jdbc;

import com.acme.delivery.repository.UnitOfWork;
import com.acme.delivery.repository.UnitOfWorkFactory;
import jakarta.inject.Singleton;

import javax.sql.DataSource;

@Singleton
public class JdbcUnitOfWorkFactory implements UnitOfWorkFactory {

    private final DataSource dataSource;

    public JdbcUnitOfWorkFactory(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public UnitOfWork create() {
        return new JdbcUnitOfWork(dataSource);
    }
}

package com.programmersdiary.chatscheduler.scheduling;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.jdbc.datasource.DriverManagerDataSource;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;
import java.util.UUID;

/**
 * Fresh H2 in-memory store per call.
 */
final class InMemorySchedules {

    private InMemorySchedules() {
    }

    static DataSource newDataSource() {
        return new DriverManagerDataSource(
                "jdbc:h2:mem:schedules-" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1;LOCK_TIMEOUT=10000", "sa", "");
    }

    static ScheduledJobRepository newRepository() {
        return newRepository(newDataSource());
    }

    static ScheduledJobRepository newRepository(DataSource dataSource) {
        var repository = new ScheduledJobRepository(
                new JdbcTemplate(dataSource),
                new TransactionTemplate(new DataSourceTransactionManager(dataSource)));
        repository.init();
        return repository;
    }
}

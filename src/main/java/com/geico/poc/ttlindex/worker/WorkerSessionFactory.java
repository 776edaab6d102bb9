package com.geico.poc.ttlindex.worker;

import com.geico.poc.ttlindex.supervisor.WorkerStartupException;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.jdbc.DataSourceProperties;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.jdbc.datasource.DriverManagerDataSource;
import org.springframework.jdbc.datasource.SingleConnectionDataSource;
import org.springframework.stereotype.Component;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Opens dedicated worker sessions against the configured database
 * ({@code spring.datasource.*}), outside the connection pool.
 */
@Component
public class WorkerSessionFactory {

    @Autowired
    private DataSourceProperties dataSourceProperties;

    /**
     * Open a session tagged with {@code applicationName} and check it is connected
     * to the database with the given oid.
     *
     * @throws WorkerStartupException if the connection fails or lands in another database
     */
    public WorkerSession open(long databaseOid, String applicationName) {
        DriverManagerDataSource dataSource = new DriverManagerDataSource(
            dataSourceProperties.determineUrl(),
            dataSourceProperties.determineUsername(),
            dataSourceProperties.determinePassword());

        Connection connection;
        try {
            connection = dataSource.getConnection();
        } catch (SQLException e) {
            throw new WorkerStartupException("TTL background worker: could not connect: " + e.getMessage(), e);
        }

        try {
            SingleConnectionDataSource single = new SingleConnectionDataSource(connection, true);
            JdbcTemplate jdbc = new JdbcTemplate(single);

            jdbc.queryForObject("SELECT set_config('application_name', ?, false)", String.class, applicationName);

            Long sessionOid = jdbc.queryForObject(
                "SELECT CAST(oid AS BIGINT) FROM pg_database WHERE datname = current_database()", Long.class);
            if (sessionOid == null || sessionOid != databaseOid) {
                throw new WorkerStartupException("TTL background worker: configured database has oid " +
                                                 sessionOid + ", expected " + databaseOid);
            }

            Integer pid = jdbc.queryForObject("SELECT pg_backend_pid()", Integer.class);
            return new WorkerSession(connection, jdbc, new DataSourceTransactionManager(single),
                                     pid != null ? pid : 0, databaseOid);
        } catch (RuntimeException e) {
            WorkerSession.closeQuietly(connection);
            throw e;
        }
    }
}

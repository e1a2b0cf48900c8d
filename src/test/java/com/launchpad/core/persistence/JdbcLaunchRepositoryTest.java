package com.launchpad.core.persistence;

import com.launchpad.core.model.LaunchPersistenceException;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.Test;

import java.sql.SQLException;
import java.time.Clock;
import java.util.UUID;

import javax.sql.DataSource;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class JdbcLaunchRepositoryTest extends LaunchRepositoryContractTest {

    @Override
    protected LaunchRepository createRepository(Clock clock) throws Exception {
        var dataSource = new JdbcDataSource();
        dataSource.setURL("jdbc:h2:mem:launchpad-" + UUID.randomUUID()
                + ";MODE=PostgreSQL;DATABASE_TO_LOWER=TRUE;DB_CLOSE_DELAY=-1");
        dataSource.setUser("sa");
        var jdbc = new JdbcLaunchRepository(dataSource, clock);
        jdbc.createTables();
        jdbc.createTables();
        return jdbc;
    }

    @Test
    void unreachableDatabaseIsPersistenceError() throws Exception {
        DataSource broken = mock(DataSource.class);
        when(broken.getConnection()).thenThrow(new SQLException("connection refused"));
        var jdbc = new JdbcLaunchRepository(broken, clock);

        LaunchPersistenceException e = assertThrows(LaunchPersistenceException.class, () -> jdbc.findById("L-1"));
        assertEquals("L-1", e.getLaunchId());
        assertThrows(LaunchPersistenceException.class, jdbc::findAll);
    }
}

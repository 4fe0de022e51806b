package com.phillippitts.structurecoach.repository;

import com.phillippitts.structurecoach.exception.StorageException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.function.Supplier;

/**
 * Shared helpers for the JDBC repositories.
 */
final class JdbcSupport {

    private static final Logger LOG = LogManager.getLogger(JdbcSupport.class);

    private JdbcSupport() {}

    /**
     * Runs a {@code MERGE ... KEY} statement. Two first-time merges on one key can both take
     * the insert path; the one that loses on the unique key is run again and then updates.
     */
    static int merge(JdbcTemplate jdbcTemplate, String sql, Object... args) {
        try {
            return jdbcTemplate.update(sql, args);
        } catch (DuplicateKeyException e) {
            LOG.debug("Concurrent insert on merge key, retrying as update: {}", e.getMostSpecificCause().getMessage());
            return jdbcTemplate.update(sql, args);
        }
    }

    /**
     * Runs a data-access call, translating Spring's {@link DataAccessException} into the
     * application's {@link StorageException}.
     */
    static <T> T storage(String operation, Supplier<T> call) {
        try {
            return call.get();
        } catch (DataAccessException e) {
            throw new StorageException(operation, e);
        }
    }

    static Timestamp ts(Instant instant) {
        return instant == null ? null : Timestamp.from(instant);
    }

    static Instant instant(Timestamp ts) {
        return ts == null ? null : ts.toInstant();
    }
}

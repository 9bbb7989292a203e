package com.adsintel.optimizer.source;

import com.adsintel.optimizer.model.TrafficRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.sql.Timestamp;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Reads paid clicks from the sales database's clicks table.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class JdbcTrafficSource implements TrafficSource {

    static final String QUERY = """
        SELECT data, kuda, cost, conv, otkudaAds
        FROM clicks
        WHERE data >= ?
        AND otkudaAds = 'y'
        ORDER BY data
        """;

    private final JdbcTemplate jdbcTemplate;
    private final TrafficRecordMapper mapper;

    @Override
    public List<TrafficRecord> fetch(int windowDays) {
        if (windowDays <= 0) {
            throw new IllegalArgumentException("windowDays must be > 0");
        }
        Timestamp since = Timestamp.valueOf(LocalDateTime.now().minusDays(windowDays));
        log.info("Fetching paid clicks since {}", since);
        try {
            return jdbcTemplate.query(QUERY, mapper, since);
        } catch (DataAccessException e) {
            throw new TrafficDataUnavailableException("Could not read clicks for the last " + windowDays + " days", e);
        }
    }
}

package com.adsintel.optimizer.source;

import com.adsintel.optimizer.model.TrafficRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;

/**
 * Maps a row of the clicks table to a TrafficRecord.
 *
 * clicks columns used:
 *   data       DATETIME   click time
 *   kuda       TEXT       landing URL
 *   cost       VARCHAR    click cost, may be empty or garbage
 *   conv       VARCHAR    conversion tag
 *   otkudaAds  CHAR(1)    'y' when the click came from Ads
 */
@Component
@Slf4j
public class TrafficRecordMapper implements RowMapper<TrafficRecord> {

    @Override
    public TrafficRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
        Timestamp ts = rs.getTimestamp("data");
        return TrafficRecord.builder()
                .timestamp(ts != null ? ts.toLocalDateTime() : null)
                .destinationUrl(emptyToNull(rs.getString("kuda")))
                .cost(parseCost(rs.getString("cost")))
                .conversionKind(emptyToNull(rs.getString("conv")))
                .paidChannel("y".equalsIgnoreCase(trim(rs.getString("otkudaAds"))))
                .build();
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    BigDecimal parseCost(String val) {
        if (val == null || val.isBlank()) return null;
        try {
            BigDecimal cost = new BigDecimal(val.trim().replace(',', '.'));
            return cost.signum() < 0 ? null : cost;
        } catch (NumberFormatException e) {
            log.debug("Unparseable cost '{}', treating as 0", val);
            return null;
        }
    }

    private String emptyToNull(String val) {
        return (val == null || val.isBlank()) ? null : val.trim();
    }

    private String trim(String val) {
        return val == null ? "" : val.trim();
    }
}

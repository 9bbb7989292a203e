package com.adsintel.optimizer.source;

import com.adsintel.optimizer.model.TrafficRecord;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import java.sql.ResultSet;
import java.sql.Timestamp;
import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class TrafficRecordMapperTest {

    private final TrafficRecordMapper mapper = new TrafficRecordMapper();

    @Test
    void mapsClickRow() throws Exception {
        ResultSet rs = mock(ResultSet.class);
        LocalDateTime at = LocalDateTime.of(2024, 3, 1, 12, 30);
        when(rs.getTimestamp("data")).thenReturn(Timestamp.valueOf(at));
        when(rs.getString("kuda")).thenReturn(" https://shop.example/?gclid=abc ");
        when(rs.getString("cost")).thenReturn("1,25");
        when(rs.getString("conv")).thenReturn("registr");
        when(rs.getString("otkudaAds")).thenReturn("Y");

        TrafficRecord record = mapper.mapRow(rs, 0);

        assertThat(record.getTimestamp()).isEqualTo(at);
        assertThat(record.getDestinationUrl()).isEqualTo("https://shop.example/?gclid=abc");
        assertThat(record.getCost()).isEqualByComparingTo("1.25");
        assertThat(record.getConversionKind()).isEqualTo("registr");
        assertThat(record.isPaidChannel()).isTrue();
    }

    @Test
    void emptyColumnsBecomeNulls() throws Exception {
        ResultSet rs = mock(ResultSet.class);
        when(rs.getString("kuda")).thenReturn("");
        when(rs.getString("conv")).thenReturn("  ");
        when(rs.getString("otkudaAds")).thenReturn(null);

        TrafficRecord record = mapper.mapRow(rs, 3);

        assertThat(record.getTimestamp()).isNull();
        assertThat(record.getDestinationUrl()).isNull();
        assertThat(record.getCost()).isNull();
        assertThat(record.getConversionKind()).isNull();
        assertThat(record.isPaidChannel()).isFalse();
    }

    @Test
    void parsesPlainCost() {
        assertThat(mapper.parseCost("0.35")).isEqualByComparingTo("0.35");
        assertThat(mapper.parseCost(" 12 ")).isEqualByComparingTo("12");
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"  ", "n/a", "-3.00", "1.2.3"})
    void unusableCostIsNull(String raw) {
        assertThat(mapper.parseCost(raw)).isNull();
    }
}

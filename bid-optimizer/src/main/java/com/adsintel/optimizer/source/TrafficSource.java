package com.adsintel.optimizer.source;

import com.adsintel.optimizer.model.TrafficRecord;

import java.util.List;

/**
 * Supplies paid-channel clicks inside the attribution window.
 */
public interface TrafficSource {

    /**
     * @param windowDays how many days back from now to include
     * @return records already filtered to the paid channel, never null
     * @throws TrafficDataUnavailableException when the log cannot be read
     */
    List<TrafficRecord> fetch(int windowDays);
}

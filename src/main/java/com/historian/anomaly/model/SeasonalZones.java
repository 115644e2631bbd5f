package com.historian.anomaly.model;

import com.historian.anomaly.exception.InvalidConfigurationException;

import java.time.DateTimeException;
import java.time.ZoneId;
import java.time.ZoneOffset;

final class SeasonalZones {

    private SeasonalZones() {}

    static ZoneId resolve(String zone) {
        if (zone == null || zone.isBlank()) {
            return ZoneOffset.UTC;
        }
        try {
            return ZoneId.of(zone);
        } catch (DateTimeException e) {
            throw new InvalidConfigurationException("seasonalZone", "Unknown time zone: " + zone);
        }
    }
}

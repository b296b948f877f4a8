package com.yoursp.dssp.model.protocol;

import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;

/**
 * Parsing of {@code xs:dateTime} values as they appear on the wire.
 */
public final class XmlDateTimes {

    private XmlDateTimes() {
    }

    /**
     * Values with an offset keep it; values without one are read in the
     * system default zone.
     *
     * @throws DateTimeParseException when the value is not an ISO-8601 date-time
     */
    public static OffsetDateTime parse(String value) {
        String trimmed = value.trim();
        try {
            return OffsetDateTime.parse(trimmed);
        } catch (DateTimeParseException e) {
            return LocalDateTime.parse(trimmed).atZone(ZoneId.systemDefault()).toOffsetDateTime();
        }
    }
}

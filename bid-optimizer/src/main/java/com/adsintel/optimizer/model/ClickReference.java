package com.adsintel.optimizer.model;

import java.time.LocalDate;

/**
 * A click identifier together with the day the click happened.
 * clickDate is null when the click log row has no timestamp.
 */
public record ClickReference(ClickIdentifier identifier, LocalDate clickDate) {

    public static ClickReference gclid(String value, LocalDate clickDate) {
        return new ClickReference(new ClickIdentifier(ClickIdentifier.Family.GCLID, value), clickDate);
    }

    public static ClickReference gbraid(String value, LocalDate clickDate) {
        return new ClickReference(new ClickIdentifier(ClickIdentifier.Family.GBRAID, value), clickDate);
    }

    public String value() {
        return identifier.value();
    }

    public ClickIdentifier.Family family() {
        return identifier.family();
    }
}

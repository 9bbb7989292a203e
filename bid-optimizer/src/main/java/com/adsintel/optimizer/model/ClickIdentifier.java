package com.adsintel.optimizer.model;

/**
 * Click tracking token pulled from a landing URL. The value is opaque.
 */
public record ClickIdentifier(Family family, String value) {

    public enum Family {
        GCLID("gclid"), GBRAID("gbraid");

        private final String parameter;

        Family(String parameter) {
            this.parameter = parameter;
        }

        public String parameter() {
            return parameter;
        }
    }
}

package com.hospitality.staysync.entity;

/**
 * Country codes we know a guest language for.
 * Country is not language: several countries map onto the same label.
 */
public enum Language {
    NETHERLANDS("nl", "Dutch"),
    BELGIUM("be", "Dutch"),
    GERMANY("de", "German"),
    AUSTRIA("at", "German"),
    SWITZERLAND("ch", "German"),
    FRANCE("fr", "French"),
    UNITED_KINGDOM("gb", "English"),
    IRELAND("ie", "English"),
    UNITED_STATES("us", "English"),
    SPAIN("es", "Spanish"),
    ITALY("it", "Italian"),
    PORTUGAL("pt", "Portuguese");

    /**
     * Label stored when no language can be derived.
     */
    public static final String NONE = "None";

    private final String countryCode;
    private final String label;

    Language(String countryCode, String label) {
        this.countryCode = countryCode;
        this.label = label;
    }

    public String getCountryCode() {
        return countryCode;
    }

    public String getLabel() {
        return label;
    }
}

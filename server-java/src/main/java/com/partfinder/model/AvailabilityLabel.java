package com.partfinder.model;

public enum AvailabilityLabel {
    LIKELY("Likely In Stock"),
    POSSIBLE("May Have In Stock"),
    CALL_TO_CONFIRM("Call to Confirm"),
    UNLIKELY("Unlikely to Have");

    private final String displayText;

    AvailabilityLabel(String displayText) {
        this.displayText = displayText;
    }

    public String getDisplayText() {
        return displayText;
    }

    public static AvailabilityLabel forLikelihood(int likelihood) {
        if (likelihood >= 85) {
            return LIKELY;
        }
        if (likelihood >= 70) {
            return POSSIBLE;
        }
        if (likelihood >= 50) {
            return CALL_TO_CONFIRM;
        }
        return UNLIKELY;
    }
}

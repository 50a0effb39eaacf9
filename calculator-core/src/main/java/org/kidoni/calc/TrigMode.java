package org.kidoni.calc;

import java.util.Locale;

public enum TrigMode {
    RADIANS("rad"),
    DEGREES("deg");

    private final String label;

    TrigMode(String label) {
        this.label = label;
    }

    /**
     * @param value {@code rad} or {@code deg}, in any case
     * @throws CalcException of kind {@link ErrorKind#VALIDATION} for anything else
     */
    public static TrigMode parse(String value) {
        if (value != null) {
            String normalized = value.toLowerCase(Locale.ROOT);
            for (TrigMode mode : values()) {
                if (mode.label.equals(normalized)) {
                    return mode;
                }
            }
        }
        throw new CalcException(ErrorKind.VALIDATION, "Mode must be 'rad' or 'deg'.");
    }

    @Override
    public String toString() {
        return label;
    }
}

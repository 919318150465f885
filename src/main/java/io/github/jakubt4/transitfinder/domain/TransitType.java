package io.github.jakubt4.transitfinder.domain;

public enum TransitType {

    /** Satellite silhouette lies inside the body's disk. */
    FULL_DISK("Transit"),
    /** Satellite passes beside or grazes the disk. */
    PARTIAL("Close Pass");

    private final String label;

    TransitType(final String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static TransitType classify(final double separationRadians, final double angularRadiusRadians) {
        return separationRadians < angularRadiusRadians ? FULL_DISK : PARTIAL;
    }
}

package com.hellblazer.viewstream.resource;

/**
 * Enumeration of the kinds of content a pooled viewport can present
 */
public enum ViewportType {
    STACK("Stack Viewport", "Ordered 2D image stack"),
    VOLUME("Volume Viewport", "3D volume / MPR");

    private final String displayName;
    private final String description;

    ViewportType(String displayName, String description) {
        this.displayName = displayName;
        this.description = description;
    }

    public String getDisplayName() {
        return displayName;
    }

    public String getDescription() {
        return description;
    }
}

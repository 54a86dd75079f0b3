package com.fluxreader.services.navigation;

public enum NavigationDirection {
    PREVIOUS("previous"),
    NEXT("next");

    private final String label;

    NavigationDirection(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}

package com.fluxreader.core.queue;

public enum CollectionKind {
    FEED("feed"),
    CATEGORY("category");

    private final String label;

    CollectionKind(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}

package com.fluxreader.common.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Response body of the entry listing endpoints.
 */
public class EntriesPage {
    private int total;
    private List<Entry> entries = new ArrayList<>();

    public EntriesPage() {
    }

    public EntriesPage(int total, List<Entry> entries) {
        this.total = total;
        this.entries = entries;
    }

    public int getTotal() { return total; }

    public List<Entry> getEntries() {
        return entries != null ? entries : List.of();
    }

    public boolean isEmpty() {
        return getEntries().isEmpty();
    }

    public Entry first() {
        return isEmpty() ? null : getEntries().get(0);
    }
}

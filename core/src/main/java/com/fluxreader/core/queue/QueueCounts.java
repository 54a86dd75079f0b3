package com.fluxreader.core.queue;

public record QueueCounts(int status, int bookmark, int feed, int category) {

    public int total() {
        return status + bookmark + feed + category;
    }

    public boolean isEmpty() {
        return total() == 0;
    }
}

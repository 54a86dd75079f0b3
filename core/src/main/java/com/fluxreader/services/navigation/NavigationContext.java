package com.fluxreader.services.navigation;

import java.util.List;

/**
 * The listing an entry was opened from. It scopes previous/next navigation.
 */
public final class NavigationContext {

    public enum Type { GLOBAL, UNREAD, STARRED, FEED, CATEGORY, LOCAL }

    private static final NavigationContext GLOBAL = new NavigationContext(Type.GLOBAL, null, List.of());

    private final Type type;
    private final Long id;
    private final List<Long> orderedEntryIds;

    private NavigationContext(Type type, Long id, List<Long> orderedEntryIds) {
        this.type = type;
        this.id = id;
        this.orderedEntryIds = orderedEntryIds;
    }

    public static NavigationContext global() {
        return GLOBAL;
    }

    public static NavigationContext unread() {
        return new NavigationContext(Type.UNREAD, null, List.of());
    }

    public static NavigationContext starred() {
        return new NavigationContext(Type.STARRED, null, List.of());
    }

    public static NavigationContext feed(long feedId) {
        return new NavigationContext(Type.FEED, feedId, List.of());
    }

    public static NavigationContext category(long categoryId) {
        return new NavigationContext(Type.CATEGORY, categoryId, List.of());
    }

    /**
     * Local listing; navigation steps through {@code orderedEntryIds} by position.
     */
    public static NavigationContext local(List<Long> orderedEntryIds) {
        return new NavigationContext(Type.LOCAL, null, List.copyOf(orderedEntryIds));
    }

    public Type getType() {
        return type;
    }

    public Long getId() {
        return id;
    }

    public List<Long> getOrderedEntryIds() {
        return orderedEntryIds;
    }

    public boolean isLocal() {
        return type == Type.LOCAL;
    }

    @Override
    public String toString() {
        return id != null ? type + ":" + id : type.toString();
    }
}

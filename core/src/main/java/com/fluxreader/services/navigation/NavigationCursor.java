package com.fluxreader.services.navigation;

import com.fluxreader.api.EntryQuery;
import com.fluxreader.common.model.EntryStatus;
import com.fluxreader.core.config.Configuration;
import com.fluxreader.services.store.EntryMetadata;
import com.fluxreader.services.store.EntryPaths;

import java.util.List;

/**
 * Resolves the neighbour of an entry: by publish time on the server, by id in the
 * local store when offline, or by position in a local listing.
 */
public class NavigationCursor {

    private final EntryPaths paths;
    private final Configuration config;

    public NavigationCursor(EntryPaths paths, Configuration config) {
        this.paths = paths;
        this.config = config;
    }

    /**
     * One-entry query for the neighbour published right before (next) or right after (previous)
     * the reference, scoped like the listing it was opened from.
     */
    public EntryQuery buildQuery(EntryMetadata reference, long publishedUnix, NavigationDirection direction,
                                 NavigationContext context) {
        EntryQuery.Builder query = EntryQuery.builder()
                .order(config.order)
                .limit(1);

        boolean unreadOnly = config.hideReadEntries || context.getType() == NavigationContext.Type.UNREAD;
        if (unreadOnly) {
            query.status(EntryStatus.UNREAD);
        } else {
            query.status(EntryStatus.UNREAD, EntryStatus.READ);
        }

        switch (context.getType()) {
            case FEED:
                query.feedId(context.getId() != null ? context.getId()
                        : reference.getFeed() != null && reference.getFeed().id() > 0 ? reference.getFeed().id() : null);
                break;
            case CATEGORY:
                query.categoryId(context.getId() != null ? context.getId()
                        : reference.getCategory() != null ? reference.getCategory().id() : null);
                break;
            case STARRED:
                query.starred(true);
                break;
            default:
                break;
        }

        if (direction == NavigationDirection.PREVIOUS) {
            query.direction("asc").publishedAfter(publishedUnix);
        } else {
            query.direction("desc").publishedBefore(publishedUnix);
        }
        return query.build();
    }

    /**
     * Offline approximation: the closest downloaded id above (next) or below (previous) the current one.
     */
    public Long findAdjacentLocalId(long currentId, NavigationDirection direction) {
        Long target = null;
        for (long id : paths.listEntryIds()) {
            boolean candidate = direction == NavigationDirection.PREVIOUS
                    ? id < currentId && (target == null || id > target)
                    : id > currentId && (target == null || id < target);
            if (candidate && paths.isDownloaded(id)) {
                target = id;
            }
        }
        return target;
    }

    /**
     * @return the neighbour in the list, or null at either end or when the current id is not listed
     */
    public static Long adjacentInList(List<Long> orderedIds, long currentId, NavigationDirection direction) {
        int index = orderedIds.indexOf(currentId);
        if (index < 0) return null;
        int target = direction == NavigationDirection.NEXT ? index + 1 : index - 1;
        return target >= 0 && target < orderedIds.size() ? orderedIds.get(target) : null;
    }
}

package com.fluxreader.api;

import com.fluxreader.common.model.EntriesPage;
import com.fluxreader.common.model.Entry;
import com.fluxreader.common.model.EntryStatus;

import java.util.List;
import java.util.Map;

/**
 * Stateless access to the feed server's entry, feed and category endpoints.
 * Implementations must not throw; every failure is reported through {@link ApiResult}.
 */
public interface EntryGateway {

    ApiResult<EntriesPage> getEntries(EntryQuery query);

    ApiResult<Entry> getEntry(long entryId);

    /**
     * Bulk status update. {@code extraFields} are merged into the request body.
     */
    ApiResult<Void> updateEntries(List<Long> entryIds, Map<String, Object> extraFields);

    default ApiResult<Void> updateStatus(List<Long> entryIds, EntryStatus status) {
        return updateEntries(entryIds, Map.of("status", status.wireName()));
    }

    ApiResult<Void> toggleBookmark(long entryId);

    ApiResult<Void> markFeedAsRead(long feedId);

    ApiResult<Void> markCategoryAsRead(long categoryId);

    /**
     * Current user, used as a connection test.
     */
    ApiResult<Map<String, Object>> getMe();
}

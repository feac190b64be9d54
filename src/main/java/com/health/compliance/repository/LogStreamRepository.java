package com.health.compliance.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.Record;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.WritePolicy;
import com.health.compliance.model.LogQuery;
import com.health.compliance.model.PageCursor;
import com.health.compliance.model.PagedResponse;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Read side shared by the three append-only log streams. Listings are ordered by timestamp, then
 * event id, both descending, so records written in the same millisecond keep a stable position
 * across pages.
 */
public abstract class LogStreamRepository<T> extends AerospikeRepositorySupport {

    protected LogStreamRepository(AerospikeClient client, String namespace,
                                  WritePolicy writePolicy, Policy readPolicy) {
        super(client, namespace, writePolicy, readPolicy);
    }

    protected abstract String setName();

    protected abstract T mapRecord(Record record);

    protected abstract long timestampOf(T event);

    protected abstract String idOf(T event);

    protected abstract boolean matches(LogQuery query, T event);

    public T findById(String eventId) {
        Record record = get(setName(), eventId);
        if (record == null) return null;
        return mapRecord(record);
    }

    /**
     * All records matching the query, newest first.
     */
    public List<T> findAll(LogQuery query) {
        List<T> results = scan(setName(), this::mapRecord, e -> matches(query, e));
        results.sort(newestFirst());
        return results;
    }

    /**
     * One page of matching records, newest first, positioned after {@code before} if given.
     *
     * @param before a {@link PageCursor} taken from a previous page's {@code nextCursor}
     * @throws IllegalArgumentException if {@code before} is not a valid cursor
     */
    public PagedResponse<T> find(LogQuery query, int limit, String before) {
        PageCursor cursor = PageCursor.parse(before);
        List<T> results = scan(setName(), this::mapRecord,
                e -> matches(query, e) && (cursor == null || cursor.precedes(timestampOf(e), idOf(e))));
        results.sort(newestFirst());

        boolean hasMore = results.size() > limit;
        List<T> page = hasMore ? new ArrayList<>(results.subList(0, limit)) : results;
        String nextCursor = null;
        if (hasMore) {
            T last = page.get(page.size() - 1);
            nextCursor = PageCursor.of(timestampOf(last), idOf(last)).toString();
        }
        return new PagedResponse<>(page, hasMore, nextCursor);
    }

    private Comparator<T> newestFirst() {
        Comparator<T> byTimestamp = Comparator.comparingLong(this::timestampOf);
        Comparator<T> byId = Comparator.comparing(this::idOf, Comparator.nullsFirst(Comparator.naturalOrder()));
        return byTimestamp.thenComparing(byId).reversed();
    }
}

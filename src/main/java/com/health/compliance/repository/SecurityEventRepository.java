package com.health.compliance.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.Bin;
import com.aerospike.client.Record;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.WritePolicy;
import com.health.compliance.config.AerospikeConfig;
import com.health.compliance.model.LogQuery;
import com.health.compliance.model.SecurityEvent;
import com.health.compliance.model.SecurityEventType;
import com.health.compliance.model.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.util.UUID;

@Repository
public class SecurityEventRepository extends LogStreamRepository<SecurityEvent> {

    private static final Logger log = LoggerFactory.getLogger(SecurityEventRepository.class);

    static final int MAX_RESOLVE_ATTEMPTS = 5;

    public SecurityEventRepository(AerospikeClient client,
                                   @Qualifier("aerospikeNamespace") String namespace,
                                   @Qualifier("defaultWritePolicy") WritePolicy writePolicy,
                                   @Qualifier("defaultReadPolicy") Policy readPolicy) {
        super(client, namespace, writePolicy, readPolicy);
    }

    public SecurityEvent append(SecurityEvent event) {
        if (event.getEventId() == null) {
            event.setEventId(UUID.randomUUID().toString());
        }
        event.setTimestamp(System.currentTimeMillis());
        event.setResolved(false);
        event.setResolvedBy(null);
        event.setResolvedAt(0);
        event.setResolutionNotes(null);

        create(AerospikeConfig.SET_SECURITY_EVENTS, event.getEventId(),
                new Bin("eventId", event.getEventId()),
                stringBin("actorId", event.getActorId()),
                stringBin("actorName", event.getActorUsername()),
                stringBin("actorRole", event.getActorRole()),
                enumBin("eventType", event.getEventType()),
                stringBin("descr", event.getDescription()),
                enumBin("severity", event.getSeverity()),
                stringBin("ip", event.getIpAddress()),
                stringBin("userAgent", event.getUserAgent()),
                new Bin("ts", event.getTimestamp()),
                new Bin("context", toJson(event.getContext())),
                new Bin("resolved", false),
                stringBin("resolvedBy", null),
                new Bin("resolvedAt", 0L),
                stringBin("resNotes", null),
                stringBin("dedupKey", event.getDedupKey()));
        return event;
    }

    /**
     * Mark an event resolved. Guarded by the record generation so concurrent resolvers never
     * interleave their fields; a lost race is retried against the fresh record. An event that is
     * already resolved keeps its resolver and time, only the notes are overwritten.
     *
     * @return the updated event, or null if no event has this id
     */
    public SecurityEvent resolve(String eventId, String resolvedBy, String notes) {
        for (int attempt = 1; attempt <= MAX_RESOLVE_ATTEMPTS; attempt++) {
            Record record = get(AerospikeConfig.SET_SECURITY_EVENTS, eventId);
            if (record == null) return null;

            SecurityEvent event = mapRecord(record);
            boolean written;
            if (event.isResolved()) {
                written = compareAndSet(AerospikeConfig.SET_SECURITY_EVENTS, eventId, record.generation,
                        stringBin("resNotes", notes));
                if (written) {
                    event.setResolutionNotes(notes);
                    log.debug("Security event {} already resolved by {}, notes overwritten", eventId, event.getResolvedBy());
                }
            } else {
                long now = System.currentTimeMillis();
                written = compareAndSet(AerospikeConfig.SET_SECURITY_EVENTS, eventId, record.generation,
                        new Bin("resolved", true),
                        stringBin("resolvedBy", resolvedBy),
                        new Bin("resolvedAt", now),
                        stringBin("resNotes", notes));
                if (written) {
                    event.setResolved(true);
                    event.setResolvedBy(resolvedBy);
                    event.setResolvedAt(now);
                    event.setResolutionNotes(notes);
                }
            }
            if (written) return event;
        }
        throw new IllegalStateException("Could not resolve security event " + eventId
                + " after " + MAX_RESOLVE_ATTEMPTS + " concurrent update attempts");
    }

    /**
     * Claim a de-duplication key for a new alert. The claim record is keyed by the de-duplication
     * key itself and only one writer can create or refresh it, so concurrent detection runs raise
     * an aggregate alert at most once.
     *
     * @return false if the key was already claimed at or after {@code since}
     */
    public boolean claimDedupKey(String dedupKey, long since) {
        long now = System.currentTimeMillis();
        Record existing = get(AerospikeConfig.SET_ALERT_DEDUP, dedupKey);
        if (existing == null) {
            return createIfAbsent(AerospikeConfig.SET_ALERT_DEDUP, dedupKey,
                    new Bin("dedupKey", dedupKey),
                    new Bin("claimedAt", now));
        }
        if (existing.getLong("claimedAt") >= since) {
            return false;
        }
        return compareAndSet(AerospikeConfig.SET_ALERT_DEDUP, dedupKey, existing.generation,
                new Bin("claimedAt", now));
    }

    /**
     * Drop a claim whose alert could not be written, so the next run can raise it.
     */
    public void releaseDedupKey(String dedupKey) {
        client.delete(writePolicy, key(AerospikeConfig.SET_ALERT_DEDUP, dedupKey));
    }

    @Override
    protected String setName() {
        return AerospikeConfig.SET_SECURITY_EVENTS;
    }

    @Override
    protected long timestampOf(SecurityEvent event) {
        return event.getTimestamp();
    }

    @Override
    protected String idOf(SecurityEvent event) {
        return event.getEventId();
    }

    @Override
    protected boolean matches(LogQuery query, SecurityEvent event) {
        return query.matches(event);
    }

    @Override
    protected SecurityEvent mapRecord(Record record) {
        return SecurityEvent.builder()
                .eventId(record.getString("eventId"))
                .actorId(emptyToNull(record.getString("actorId")))
                .actorUsername(emptyToNull(record.getString("actorName")))
                .actorRole(emptyToNull(record.getString("actorRole")))
                .eventType(readEnum(SecurityEventType.class, record.getString("eventType")))
                .description(record.getString("descr"))
                .severity(readEnum(Severity.class, record.getString("severity")))
                .ipAddress(emptyToNull(record.getString("ip")))
                .userAgent(emptyToNull(record.getString("userAgent")))
                .timestamp(record.getLong("ts"))
                .context(readObjectMap(record.getString("context")))
                .resolved(record.getBoolean("resolved"))
                .resolvedBy(emptyToNull(record.getString("resolvedBy")))
                .resolvedAt(record.getLong("resolvedAt"))
                .resolutionNotes(emptyToNull(record.getString("resNotes")))
                .dedupKey(emptyToNull(record.getString("dedupKey")))
                .build();
    }
}

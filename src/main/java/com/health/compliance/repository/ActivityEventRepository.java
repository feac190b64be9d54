package com.health.compliance.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.Bin;
import com.aerospike.client.Record;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.WritePolicy;
import com.health.compliance.config.AerospikeConfig;
import com.health.compliance.model.ActivityEvent;
import com.health.compliance.model.ActivityEventType;
import com.health.compliance.model.LogQuery;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.util.UUID;

@Repository
public class ActivityEventRepository extends LogStreamRepository<ActivityEvent> {

    public ActivityEventRepository(AerospikeClient client,
                                   @Qualifier("aerospikeNamespace") String namespace,
                                   @Qualifier("defaultWritePolicy") WritePolicy writePolicy,
                                   @Qualifier("defaultReadPolicy") Policy readPolicy) {
        super(client, namespace, writePolicy, readPolicy);
    }

    /**
     * Append a new event. The id (when absent) and the timestamp are assigned here.
     */
    public ActivityEvent append(ActivityEvent event) {
        if (event.getEventId() == null) {
            event.setEventId(UUID.randomUUID().toString());
        }
        event.setTimestamp(System.currentTimeMillis());

        create(AerospikeConfig.SET_ACTIVITY_EVENTS, event.getEventId(),
                new Bin("eventId", event.getEventId()),
                stringBin("actorId", event.getActorId()),
                stringBin("actorName", event.getActorUsername()),
                stringBin("actorRole", event.getActorRole()),
                enumBin("eventType", event.getEventType()),
                stringBin("resType", event.getResourceType()),
                stringBin("resId", event.getResourceId()),
                stringBin("descr", event.getDescription()),
                stringBin("ip", event.getIpAddress()),
                stringBin("userAgent", event.getUserAgent()),
                new Bin("ts", event.getTimestamp()),
                new Bin("context", toJson(event.getContext())));
        return event;
    }

    @Override
    protected String setName() {
        return AerospikeConfig.SET_ACTIVITY_EVENTS;
    }

    @Override
    protected long timestampOf(ActivityEvent event) {
        return event.getTimestamp();
    }

    @Override
    protected String idOf(ActivityEvent event) {
        return event.getEventId();
    }

    @Override
    protected boolean matches(LogQuery query, ActivityEvent event) {
        return query.matches(event);
    }

    @Override
    protected ActivityEvent mapRecord(Record record) {
        return ActivityEvent.builder()
                .eventId(record.getString("eventId"))
                .actorId(emptyToNull(record.getString("actorId")))
                .actorUsername(emptyToNull(record.getString("actorName")))
                .actorRole(emptyToNull(record.getString("actorRole")))
                .eventType(readEnum(ActivityEventType.class, record.getString("eventType")))
                .resourceType(record.getString("resType"))
                .resourceId(record.getString("resId"))
                .description(record.getString("descr"))
                .ipAddress(emptyToNull(record.getString("ip")))
                .userAgent(emptyToNull(record.getString("userAgent")))
                .timestamp(record.getLong("ts"))
                .context(readObjectMap(record.getString("context")))
                .build();
    }
}

package com.health.compliance.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.Bin;
import com.aerospike.client.Record;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.WritePolicy;
import com.health.compliance.config.AerospikeConfig;
import com.health.compliance.model.AccessEvent;
import com.health.compliance.model.AccessType;
import com.health.compliance.model.LogQuery;
import com.health.compliance.model.ReasonStatus;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.util.UUID;

@Repository
public class AccessEventRepository extends LogStreamRepository<AccessEvent> {

    public AccessEventRepository(AerospikeClient client,
                                 @Qualifier("aerospikeNamespace") String namespace,
                                 @Qualifier("defaultWritePolicy") WritePolicy writePolicy,
                                 @Qualifier("defaultReadPolicy") Policy readPolicy) {
        super(client, namespace, writePolicy, readPolicy);
    }

    public AccessEvent append(AccessEvent event) {
        if (event.getEventId() == null) {
            event.setEventId(UUID.randomUUID().toString());
        }
        event.setTimestamp(System.currentTimeMillis());

        create(AerospikeConfig.SET_ACCESS_EVENTS, event.getEventId(),
                new Bin("eventId", event.getEventId()),
                stringBin("actorId", event.getActorId()),
                stringBin("actorName", event.getActorUsername()),
                stringBin("actorRole", event.getActorRole()),
                stringBin("subjectId", event.getSubjectId()),
                enumBin("accessType", event.getAccessType()),
                stringBin("reason", event.getReason()),
                enumBin("reasonStatus", event.getReasonStatus()),
                stringBin("recordType", event.getRecordType()),
                stringBin("recordId", event.getRecordId()),
                stringBin("ip", event.getIpAddress()),
                stringBin("userAgent", event.getUserAgent()),
                new Bin("ts", event.getTimestamp()),
                new Bin("context", toJson(event.getContext())));
        return event;
    }

    @Override
    protected String setName() {
        return AerospikeConfig.SET_ACCESS_EVENTS;
    }

    @Override
    protected long timestampOf(AccessEvent event) {
        return event.getTimestamp();
    }

    @Override
    protected String idOf(AccessEvent event) {
        return event.getEventId();
    }

    @Override
    protected boolean matches(LogQuery query, AccessEvent event) {
        return query.matches(event);
    }

    @Override
    protected AccessEvent mapRecord(Record record) {
        return AccessEvent.builder()
                .eventId(record.getString("eventId"))
                .actorId(emptyToNull(record.getString("actorId")))
                .actorUsername(emptyToNull(record.getString("actorName")))
                .actorRole(emptyToNull(record.getString("actorRole")))
                .subjectId(emptyToNull(record.getString("subjectId")))
                .accessType(readEnum(AccessType.class, record.getString("accessType")))
                .reason(record.getString("reason"))
                .reasonStatus(readEnum(ReasonStatus.class, record.getString("reasonStatus")))
                .recordType(record.getString("recordType"))
                .recordId(record.getString("recordId"))
                .ipAddress(emptyToNull(record.getString("ip")))
                .userAgent(emptyToNull(record.getString("userAgent")))
                .timestamp(record.getLong("ts"))
                .context(readObjectMap(record.getString("context")))
                .build();
    }
}

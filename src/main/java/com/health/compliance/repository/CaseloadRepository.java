package com.health.compliance.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.Bin;
import com.aerospike.client.Record;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.WritePolicy;
import com.fasterxml.jackson.core.type.TypeReference;
import com.health.compliance.config.AerospikeConfig;
import com.health.compliance.engine.CaseloadDirectory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Read model of provider clinical assignments, synced from the scheduling side of the platform.
 */
@Repository
public class CaseloadRepository extends AerospikeRepositorySupport implements CaseloadDirectory {

    private static final Logger log = LoggerFactory.getLogger(CaseloadRepository.class);

    public CaseloadRepository(AerospikeClient client,
                              @Qualifier("aerospikeNamespace") String namespace,
                              @Qualifier("defaultWritePolicy") WritePolicy writePolicy,
                              @Qualifier("defaultReadPolicy") Policy readPolicy) {
        super(client, namespace, writePolicy, readPolicy);
    }

    /**
     * Replace a provider's caseload.
     */
    public void save(String providerId, Collection<String> patientIds) {
        List<String> sorted = new ArrayList<>(new TreeSet<>(patientIds));
        String json;
        try {
            json = objectMapper.writeValueAsString(sorted);
        } catch (Exception e) {
            throw new IllegalArgumentException("Caseload for " + providerId + " is not serializable", e);
        }
        client.put(writePolicy, key(AerospikeConfig.SET_PROVIDER_CASELOADS, providerId),
                new Bin("providerId", providerId),
                new Bin("patientIds", json),
                new Bin("updatedAt", System.currentTimeMillis()));
        log.info("Caseload for provider {} updated: {} patients", providerId, sorted.size());
    }

    @Override
    public Set<String> caseloadOf(String providerId) {
        Record record = get(AerospikeConfig.SET_PROVIDER_CASELOADS, providerId);
        if (record == null) return Collections.emptySet();
        String json = record.getString("patientIds");
        if (json == null || json.isEmpty()) return Collections.emptySet();
        try {
            return new TreeSet<>(objectMapper.readValue(json, new TypeReference<List<String>>() {}));
        } catch (Exception e) {
            throw new IllegalStateException("Corrupt caseload record for provider " + providerId, e);
        }
    }
}

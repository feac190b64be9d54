package com.health.compliance.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.AerospikeException;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.ResultCode;
import com.aerospike.client.policy.GenerationPolicy;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.RecordExistsAction;
import com.aerospike.client.policy.ScanPolicy;
import com.aerospike.client.policy.WritePolicy;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Shared plumbing for the Aerospike-backed repositories: scans, JSON bins, create-only and
 * generation-checked writes.
 */
public abstract class AerospikeRepositorySupport {

    private static final Logger log = LoggerFactory.getLogger(AerospikeRepositorySupport.class);

    protected final AerospikeClient client;
    protected final String namespace;
    protected final WritePolicy writePolicy;
    protected final Policy readPolicy;
    protected final ObjectMapper objectMapper;

    private final WritePolicy createOnlyPolicy;

    protected AerospikeRepositorySupport(AerospikeClient client, String namespace,
                                         WritePolicy writePolicy, Policy readPolicy) {
        this.client = client;
        this.namespace = namespace;
        this.writePolicy = writePolicy;
        this.readPolicy = readPolicy;
        this.objectMapper = new ObjectMapper();

        this.createOnlyPolicy = new WritePolicy(writePolicy);
        this.createOnlyPolicy.recordExistsAction = RecordExistsAction.CREATE_ONLY;
    }

    protected Key key(String set, String id) {
        return new Key(namespace, set, id);
    }

    /**
     * Insert a new record. Fails with KEY_EXISTS_ERROR if the id is already taken.
     */
    protected void create(String set, String id, Bin... bins) {
        client.put(createOnlyPolicy, key(set, id), bins);
    }

    /**
     * Insert a new record unless the id is taken.
     *
     * @return false when a record with this id already exists
     */
    protected boolean createIfAbsent(String set, String id, Bin... bins) {
        try {
            create(set, id, bins);
            return true;
        } catch (AerospikeException e) {
            if (e.getResultCode() == ResultCode.KEY_EXISTS_ERROR) {
                log.debug("Record {}/{} already exists", set, id);
                return false;
            }
            throw e;
        }
    }

    protected Record get(String set, String id) {
        return client.get(readPolicy, key(set, id));
    }

    /**
     * Write bins only if the record is still at {@code generation}.
     *
     * @return false when another writer got there first
     */
    protected boolean compareAndSet(String set, String id, int generation, Bin... bins) {
        WritePolicy policy = new WritePolicy(writePolicy);
        policy.recordExistsAction = RecordExistsAction.UPDATE_ONLY;
        policy.generationPolicy = GenerationPolicy.EXPECT_GEN_EQUAL;
        policy.generation = generation;
        try {
            client.put(policy, key(set, id), bins);
            return true;
        } catch (AerospikeException e) {
            if (e.getResultCode() == ResultCode.GENERATION_ERROR) {
                log.debug("Generation conflict on {}/{} at generation {}", set, id, generation);
                return false;
            }
            throw e;
        }
    }

    protected <T> List<T> scan(String set, Function<Record, T> mapper, Predicate<T> filter) {
        List<T> results = new ArrayList<>();
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;

        client.scanAll(scanPolicy, namespace, set,
                (key, record) -> {
                    try {
                        T item = mapper.apply(record);
                        if (filter.test(item)) {
                            synchronized (results) {
                                results.add(item);
                            }
                        }
                    } catch (Exception e) {
                        log.warn("Failed to read {} record: {}", set, e.getMessage());
                    }
                });
        return results;
    }

    protected String toJson(Map<String, ?> map) {
        try {
            return objectMapper.writeValueAsString(map != null ? map : Collections.emptyMap());
        } catch (Exception e) {
            log.error("Failed to serialize map", e);
            return "{}";
        }
    }

    protected Map<String, Object> readObjectMap(String json) {
        if (json == null || json.isEmpty()) return new LinkedHashMap<>();
        try {
            return objectMapper.readValue(json, new TypeReference<LinkedHashMap<String, Object>>() {});
        } catch (Exception e) {
            log.error("Failed to deserialize map", e);
            return new LinkedHashMap<>();
        }
    }

    protected Map<String, String> readStringMap(String json) {
        if (json == null || json.isEmpty()) return new LinkedHashMap<>();
        try {
            return objectMapper.readValue(json, new TypeReference<LinkedHashMap<String, String>>() {});
        } catch (Exception e) {
            log.error("Failed to deserialize map", e);
            return new LinkedHashMap<>();
        }
    }

    protected static Bin stringBin(String name, String value) {
        return new Bin(name, value != null ? value : "");
    }

    protected static Bin enumBin(String name, Enum<?> value) {
        return new Bin(name, value != null ? value.name() : "");
    }

    protected static String emptyToNull(String value) {
        return value != null && !value.isEmpty() ? value : null;
    }

    protected static <E extends Enum<E>> E readEnum(Class<E> type, String value) {
        return value != null && !value.isEmpty() ? Enum.valueOf(type, value) : null;
    }
}

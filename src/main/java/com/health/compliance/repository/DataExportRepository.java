package com.health.compliance.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.Bin;
import com.aerospike.client.Record;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.WritePolicy;
import com.health.compliance.config.AerospikeConfig;
import com.health.compliance.model.DataExport;
import com.health.compliance.model.JobStatus;
import com.health.compliance.model.LogStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

@Repository
public class DataExportRepository extends AerospikeRepositorySupport {

    private static final Logger log = LoggerFactory.getLogger(DataExportRepository.class);

    public DataExportRepository(AerospikeClient client,
                                @Qualifier("aerospikeNamespace") String namespace,
                                @Qualifier("defaultWritePolicy") WritePolicy writePolicy,
                                @Qualifier("defaultReadPolicy") Policy readPolicy) {
        super(client, namespace, writePolicy, readPolicy);
    }

    public void create(DataExport export) {
        create(AerospikeConfig.SET_DATA_EXPORTS, export.getExportId(),
                new Bin("exportId", export.getExportId()),
                stringBin("requestedBy", export.getRequestedBy()),
                enumBin("stream", export.getStream()),
                enumBin("status", export.getStatus()),
                new Bin("filters", toJson(export.getFilters())),
                stringBin("artifact", export.getArtifactPath()),
                new Bin("createdAt", export.getCreatedAt()),
                new Bin("updatedAt", export.getUpdatedAt()),
                new Bin("completedAt", export.getCompletedAt()),
                stringBin("errorMsg", export.getErrorMessage()));
    }

    public DataExport findById(String exportId) {
        Record record = get(AerospikeConfig.SET_DATA_EXPORTS, exportId);
        if (record == null) return null;
        return mapRecord(record);
    }

    /**
     * Exports newest first, optionally only those of one requester.
     */
    public List<DataExport> findByRequester(String requestedBy, int limit) {
        List<DataExport> results = scan(AerospikeConfig.SET_DATA_EXPORTS, this::mapRecord,
                e -> requestedBy == null || requestedBy.equals(e.getRequestedBy()));
        results.sort(Comparator.comparingLong(DataExport::getCreatedAt).reversed());
        return results.size() > limit ? new ArrayList<>(results.subList(0, limit)) : results;
    }

    public List<DataExport> findByStatus(JobStatus status) {
        return scan(AerospikeConfig.SET_DATA_EXPORTS, this::mapRecord, e -> e.getStatus() == status);
    }

    /**
     * Same contract as {@link ComplianceReportRepository#transition}. Terminal transitions stamp
     * completedAt; FAILED stores the error message.
     */
    public boolean transition(String exportId, JobStatus expected, JobStatus next,
                              String artifactPath, String errorMessage) {
        if (!expected.canTransitionTo(next)) {
            throw new IllegalStateException("Illegal export transition " + expected + " -> " + next);
        }
        if (next == JobStatus.COMPLETED && (artifactPath == null || artifactPath.isBlank())) {
            throw new IllegalArgumentException("Export " + exportId + " cannot complete without an artifact");
        }

        Record record = get(AerospikeConfig.SET_DATA_EXPORTS, exportId);
        if (record == null) return false;

        String current = record.getString("status");
        if (!expected.name().equals(current)) {
            log.debug("Export {} is {}, not {}, skipping transition to {}", exportId, current, expected, next);
            return false;
        }

        long now = System.currentTimeMillis();
        List<Bin> bins = new ArrayList<>();
        bins.add(enumBin("status", next));
        bins.add(new Bin("updatedAt", now));
        if (next.isTerminal()) bins.add(new Bin("completedAt", now));
        if (artifactPath != null) bins.add(stringBin("artifact", artifactPath));
        if (errorMessage != null) bins.add(stringBin("errorMsg", errorMessage));

        return compareAndSet(AerospikeConfig.SET_DATA_EXPORTS, exportId, record.generation,
                bins.toArray(new Bin[0]));
    }

    private DataExport mapRecord(Record record) {
        return DataExport.builder()
                .exportId(record.getString("exportId"))
                .requestedBy(emptyToNull(record.getString("requestedBy")))
                .stream(readEnum(LogStream.class, record.getString("stream")))
                .status(readEnum(JobStatus.class, record.getString("status")))
                .filters(readStringMap(record.getString("filters")))
                .artifactPath(emptyToNull(record.getString("artifact")))
                .createdAt(record.getLong("createdAt"))
                .updatedAt(record.getLong("updatedAt"))
                .completedAt(record.getLong("completedAt"))
                .errorMessage(emptyToNull(record.getString("errorMsg")))
                .build();
    }
}

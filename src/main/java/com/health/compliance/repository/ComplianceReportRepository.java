package com.health.compliance.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.Bin;
import com.aerospike.client.Record;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.WritePolicy;
import com.health.compliance.config.AerospikeConfig;
import com.health.compliance.model.ArtifactFormat;
import com.health.compliance.model.ComplianceReport;
import com.health.compliance.model.JobStatus;
import com.health.compliance.model.ReportType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

@Repository
public class ComplianceReportRepository extends AerospikeRepositorySupport {

    private static final Logger log = LoggerFactory.getLogger(ComplianceReportRepository.class);

    public ComplianceReportRepository(AerospikeClient client,
                                      @Qualifier("aerospikeNamespace") String namespace,
                                      @Qualifier("defaultWritePolicy") WritePolicy writePolicy,
                                      @Qualifier("defaultReadPolicy") Policy readPolicy) {
        super(client, namespace, writePolicy, readPolicy);
    }

    public void create(ComplianceReport report) {
        create(AerospikeConfig.SET_COMPLIANCE_REPORTS, report.getReportId(),
                new Bin("reportId", report.getReportId()),
                enumBin("reportType", report.getReportType()),
                stringBin("reportDate", dateString(report.getReportDate())),
                stringBin("startDate", dateString(report.getStartDate())),
                stringBin("endDate", dateString(report.getEndDate())),
                stringBin("requestedBy", report.getRequestedBy()),
                enumBin("status", report.getStatus()),
                enumBin("format", report.getFormat()),
                new Bin("params", toJson(report.getParameters())),
                stringBin("artifact", report.getArtifactPath()),
                stringBin("notes", report.getNotes()),
                new Bin("createdAt", report.getCreatedAt()),
                new Bin("updatedAt", report.getUpdatedAt()),
                stringBin("idemKey", report.getIdempotencyKey()));
    }

    public ComplianceReport findById(String reportId) {
        Record record = get(AerospikeConfig.SET_COMPLIANCE_REPORTS, reportId);
        if (record == null) return null;
        return mapRecord(record);
    }

    public List<ComplianceReport> findRecent(int limit) {
        List<ComplianceReport> results = scan(AerospikeConfig.SET_COMPLIANCE_REPORTS, this::mapRecord, r -> true);
        results.sort(Comparator.comparingLong(ComplianceReport::getCreatedAt).reversed());
        return results.size() > limit ? new ArrayList<>(results.subList(0, limit)) : results;
    }

    public List<ComplianceReport> findByStatus(JobStatus status) {
        return scan(AerospikeConfig.SET_COMPLIANCE_REPORTS, this::mapRecord, r -> r.getStatus() == status);
    }

    public List<ComplianceReport> findByIdempotencyKey(String idempotencyKey) {
        return scan(AerospikeConfig.SET_COMPLIANCE_REPORTS, this::mapRecord,
                r -> idempotencyKey.equals(r.getIdempotencyKey()));
    }

    public List<ComplianceReport> findCompletedBefore(long createdBefore) {
        return scan(AerospikeConfig.SET_COMPLIANCE_REPORTS, this::mapRecord,
                r -> r.getStatus() == JobStatus.COMPLETED && r.getCreatedAt() < createdBefore);
    }

    /**
     * Move a report from {@code expected} to {@code next}. Only applies if the stored status is
     * still {@code expected} (guard against two runners claiming the same job).
     *
     * @return true if updated, false if the report is missing or its status already changed
     * @throws IllegalStateException if the transition is not allowed by {@link JobStatus}
     * @throws IllegalArgumentException if completing without an artifact
     */
    public boolean transition(String reportId, JobStatus expected, JobStatus next,
                              String artifactPath, String notes) {
        if (!expected.canTransitionTo(next)) {
            throw new IllegalStateException("Illegal report transition " + expected + " -> " + next);
        }
        if (next == JobStatus.COMPLETED && (artifactPath == null || artifactPath.isBlank())) {
            throw new IllegalArgumentException("Report " + reportId + " cannot complete without an artifact");
        }

        Record record = get(AerospikeConfig.SET_COMPLIANCE_REPORTS, reportId);
        if (record == null) return false;

        String current = record.getString("status");
        if (!expected.name().equals(current)) {
            log.debug("Report {} is {}, not {}, skipping transition to {}", reportId, current, expected, next);
            return false;
        }

        List<Bin> bins = new ArrayList<>();
        bins.add(enumBin("status", next));
        bins.add(new Bin("updatedAt", System.currentTimeMillis()));
        if (artifactPath != null) bins.add(stringBin("artifact", artifactPath));
        if (notes != null) bins.add(stringBin("notes", notes));

        return compareAndSet(AerospikeConfig.SET_COMPLIANCE_REPORTS, reportId, record.generation,
                bins.toArray(new Bin[0]));
    }

    private ComplianceReport mapRecord(Record record) {
        return ComplianceReport.builder()
                .reportId(record.getString("reportId"))
                .reportType(readEnum(ReportType.class, record.getString("reportType")))
                .reportDate(parseDate(record.getString("reportDate")))
                .startDate(parseDate(record.getString("startDate")))
                .endDate(parseDate(record.getString("endDate")))
                .requestedBy(emptyToNull(record.getString("requestedBy")))
                .status(readEnum(JobStatus.class, record.getString("status")))
                .format(readEnum(ArtifactFormat.class, record.getString("format")))
                .parameters(readStringMap(record.getString("params")))
                .artifactPath(emptyToNull(record.getString("artifact")))
                .notes(emptyToNull(record.getString("notes")))
                .createdAt(record.getLong("createdAt"))
                .updatedAt(record.getLong("updatedAt"))
                .idempotencyKey(emptyToNull(record.getString("idemKey")))
                .build();
    }

    private static String dateString(LocalDate date) {
        return date != null ? date.toString() : null;
    }

    private static LocalDate parseDate(String value) {
        return value != null && !value.isEmpty() ? LocalDate.parse(value) : null;
    }
}

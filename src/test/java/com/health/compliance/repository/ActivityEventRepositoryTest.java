package com.health.compliance.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.ScanCallback;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.ScanPolicy;
import com.aerospike.client.policy.WritePolicy;
import com.health.compliance.model.ActivityEvent;
import com.health.compliance.model.LogQuery;
import com.health.compliance.model.PagedResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;

import static com.health.compliance.testutil.TestDataFactory.NOW;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doAnswer;

@ExtendWith(MockitoExtension.class)
class ActivityEventRepositoryTest {

    @Mock
    private AerospikeClient client;

    private ActivityEventRepository repository;

    @BeforeEach
    void setUp() {
        repository = new ActivityEventRepository(client, "test", new WritePolicy(), new Policy());
    }

    private void stubScan(List<Record> records) {
        doAnswer(invocation -> {
            ScanCallback callback = invocation.getArgument(3);
            for (Record record : records) {
                callback.scanCallback(new Key("test", "activity_events", (String) record.getValue("eventId")), record);
            }
            return null;
        }).when(client).scanAll(any(ScanPolicy.class), anyString(), anyString(), any(ScanCallback.class));
    }

    private static Record record(String eventId, long ts) {
        return new Record(Map.of("eventId", eventId, "eventType", "LOGIN", "ts", ts), 1, 0);
    }

    @Test
    void find_sameMillisecondRecords_pagedWithoutGaps() {
        stubScan(List.of(record("E-a", NOW), record("E-b", NOW), record("E-c", NOW - 1)));
        LogQuery all = LogQuery.builder().build();

        PagedResponse<ActivityEvent> first = repository.find(all, 1, null);
        PagedResponse<ActivityEvent> second = repository.find(all, 1, first.nextCursor());
        PagedResponse<ActivityEvent> third = repository.find(all, 1, second.nextCursor());

        assertThat(first.data()).extracting(ActivityEvent::getEventId).containsExactly("E-b");
        assertThat(first.nextCursor()).isEqualTo(NOW + ":E-b");
        assertThat(second.data()).extracting(ActivityEvent::getEventId).containsExactly("E-a");
        assertThat(third.data()).extracting(ActivityEvent::getEventId).containsExactly("E-c");
        assertThat(third.hasMore()).isFalse();
    }

    @Test
    void find_bareTimestampCursor_returnsStrictlyOlder() {
        stubScan(List.of(record("E-a", NOW), record("E-b", NOW), record("E-c", NOW - 1)));

        PagedResponse<ActivityEvent> page = repository.find(LogQuery.builder().build(), 10, String.valueOf(NOW));

        assertThat(page.data()).extracting(ActivityEvent::getEventId).containsExactly("E-c");
        assertThat(page.nextCursor()).isNull();
    }

    @Test
    void find_malformedCursor_rejected() {
        assertThatThrownBy(() -> repository.find(LogQuery.builder().build(), 10, "yesterday"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("before");
    }
}

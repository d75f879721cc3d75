package com.enterprise.sheetconvert.store;

import com.enterprise.sheetconvert.exception.StoreException;
import com.enterprise.sheetconvert.model.ErrorKind;
import com.enterprise.sheetconvert.model.JobRecord;
import com.enterprise.sheetconvert.model.JobStatus;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;
import software.amazon.awssdk.services.dynamodb.model.ConditionalCheckFailedException;
import software.amazon.awssdk.services.dynamodb.model.DynamoDbException;
import software.amazon.awssdk.services.dynamodb.model.GetItemRequest;
import software.amazon.awssdk.services.dynamodb.model.GetItemResponse;
import software.amazon.awssdk.services.dynamodb.model.PutItemRequest;
import software.amazon.awssdk.services.dynamodb.model.PutItemResponse;
import software.amazon.awssdk.services.dynamodb.model.QueryRequest;
import software.amazon.awssdk.services.dynamodb.model.QueryResponse;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class DynamoDbJobStoreTest {

    private static final Instant CREATED = Instant.parse("2026-04-01T09:15:30.250Z");

    private final DynamoDbClient client = mock(DynamoDbClient.class);
    private final DynamoDbJobStore store = new DynamoDbJobStore(client, "jobs");

    private static JobRecord failedJob() {
        return JobRecord.builder()
                .jobId("j1")
                .ownerId("o1")
                .fileName("a.pdf")
                .status(JobStatus.FAILED)
                .sourceKey("uploads/o1/j1/a.pdf")
                .errorKind(ErrorKind.NO_TABLES_FOUND)
                .errorDetail("No tables were found in the document.")
                .createdAt(CREATED)
                .updatedAt(CREATED.plusSeconds(5))
                .confirmedAt(CREATED.plusMillis(400))
                .processingStartedAt(CREATED.plusSeconds(1))
                .attemptCount(1)
                .quotaCounted(true)
                .extractionAttempted(true)
                .warnings(List.of("Detected tables are sparse"))
                .version(3)
                .build();
    }

    @Test
    void itemsUseSortableTimestampsAndErrorCodes() {
        Map<String, AttributeValue> item = store.toItem(failedJob());

        assertThat(item.get("created_at").s()).isEqualTo("2026-04-01T09:15:30.250Z");
        assertThat(item.get("error_kind").s()).isEqualTo("NoTablesFound");
        assertThat(item.get("version").n()).isEqualTo("3");
        assertThat(item).doesNotContainKey("result_key");

        JobRecord read = store.mapToRecord(item);
        assertThat(read).isEqualTo(failedJob());
    }

    @Test
    void createRefusesToOverwrite() {
        when(client.putItem(any(PutItemRequest.class)))
                .thenThrow(ConditionalCheckFailedException.builder().message("exists").build());

        assertThatThrownBy(() -> store.create(failedJob())).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void compareAndSetIsConditionalOnTheVersion() {
        when(client.putItem(any(PutItemRequest.class))).thenReturn(PutItemResponse.builder().build());

        assertThat(store.compareAndSet(2, failedJob())).isTrue();

        ArgumentCaptor<PutItemRequest> captor = ArgumentCaptor.forClass(PutItemRequest.class);
        verify(client).putItem(captor.capture());
        assertThat(captor.getValue().conditionExpression()).isEqualTo("#v = :expected");
        assertThat(captor.getValue().expressionAttributeValues().get(":expected").n()).isEqualTo("2");
        assertThat(captor.getValue().item().get("version").n()).isEqualTo("3");
    }

    @Test
    void lostRaceReturnsFalse() {
        when(client.putItem(any(PutItemRequest.class)))
                .thenThrow(ConditionalCheckFailedException.builder().message("version changed").build());

        assertThat(store.compareAndSet(2, failedJob())).isFalse();
    }

    @Test
    void missingItemIsEmpty() {
        when(client.getItem(any(GetItemRequest.class))).thenReturn(GetItemResponse.builder().build());

        assertThat(store.find("nope")).isEmpty();
    }

    @Test
    void ownerQueryReadsOnePageAndResumesFromTheCursor() {
        when(client.query(any(QueryRequest.class)))
                .thenReturn(QueryResponse.builder()
                        .items(List.of(store.toItem(failedJob())))
                        .lastEvaluatedKey(Map.of(
                                "owner_id", AttributeValue.builder().s("o1").build(),
                                "created_at", AttributeValue.builder().s("2026-04-01T09:15:30.250Z").build(),
                                "job_id", AttributeValue.builder().s("j1").build()))
                        .build())
                .thenReturn(QueryResponse.builder().items(List.of()).build());

        JobPage first = store.findByOwner("o1", 1, null);
        JobPage second = store.findByOwner("o1", 1, JobCursor.decode(first.getNext().encode()));

        assertThat(first.getJobs()).extracting(JobRecord::getJobId).containsExactly("j1");
        assertThat(first.getNext()).isEqualTo(new JobCursor(CREATED, "j1"));
        assertThat(second.getJobs()).isEmpty();
        assertThat(second.getNext()).isNull();

        ArgumentCaptor<QueryRequest> captor = ArgumentCaptor.forClass(QueryRequest.class);
        verify(client, times(2)).query(captor.capture());
        QueryRequest firstRequest = captor.getAllValues().get(0);
        assertThat(firstRequest.indexName()).isEqualTo(DynamoDbJobStore.OWNER_INDEX);
        assertThat(firstRequest.scanIndexForward()).isFalse();
        assertThat(firstRequest.limit()).isEqualTo(1);
        assertThat(firstRequest.hasExclusiveStartKey()).isFalse();
        Map<String, AttributeValue> startKey = captor.getAllValues().get(1).exclusiveStartKey();
        assertThat(startKey.get("created_at").s()).isEqualTo("2026-04-01T09:15:30.250Z");
        assertThat(startKey.get("job_id").s()).isEqualTo("j1");
        assertThat(startKey.get("owner_id").s()).isEqualTo("o1");
    }

    @Test
    void statusQueryFollowsEveryPage() {
        Map<String, AttributeValue> first = store.toItem(failedJob());
        Map<String, AttributeValue> second = store.toItem(failedJob().toBuilder().jobId("j0").build());
        when(client.query(any(QueryRequest.class)))
                .thenReturn(QueryResponse.builder()
                        .items(List.of(first))
                        .lastEvaluatedKey(Map.of("job_id", AttributeValue.builder().s("j1").build()))
                        .build())
                .thenReturn(QueryResponse.builder().items(List.of(second)).build());

        List<JobRecord> jobs = store.findByStatusUpdatedBefore(JobStatus.FAILED, CREATED.plusSeconds(60));

        assertThat(jobs).extracting(JobRecord::getJobId).containsExactly("j1", "j0");
        ArgumentCaptor<QueryRequest> captor = ArgumentCaptor.forClass(QueryRequest.class);
        verify(client, times(2)).query(captor.capture());
        assertThat(captor.getAllValues().get(0).indexName()).isEqualTo(DynamoDbJobStore.STATUS_INDEX);
        assertThat(captor.getAllValues().get(1).exclusiveStartKey()).containsKey("job_id");
    }

    @Test
    void serviceErrorsBecomeStoreExceptions() {
        when(client.getItem(any(GetItemRequest.class)))
                .thenThrow(DynamoDbException.builder().message("unavailable").statusCode(500).build());

        assertThatThrownBy(() -> store.find("j1")).isInstanceOf(StoreException.class);
    }
}

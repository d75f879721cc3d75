package com.enterprise.sheetconvert.store;

import com.enterprise.sheetconvert.exception.StoreException;
import com.enterprise.sheetconvert.model.ErrorKind;
import com.enterprise.sheetconvert.model.JobRecord;
import com.enterprise.sheetconvert.model.JobStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;
import software.amazon.awssdk.services.dynamodb.model.ConditionalCheckFailedException;
import software.amazon.awssdk.services.dynamodb.model.DynamoDbException;
import software.amazon.awssdk.services.dynamodb.model.GetItemRequest;
import software.amazon.awssdk.services.dynamodb.model.GetItemResponse;
import software.amazon.awssdk.services.dynamodb.model.PutItemRequest;
import software.amazon.awssdk.services.dynamodb.model.QueryRequest;
import software.amazon.awssdk.services.dynamodb.model.QueryResponse;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

import static com.enterprise.sheetconvert.store.DynamoDbAttributes.attr;
import static com.enterprise.sheetconvert.store.DynamoDbAttributes.bool;
import static com.enterprise.sheetconvert.store.DynamoDbAttributes.instant;
import static com.enterprise.sheetconvert.store.DynamoDbAttributes.num;
import static com.enterprise.sheetconvert.store.DynamoDbAttributes.putIfPresent;
import static com.enterprise.sheetconvert.store.DynamoDbAttributes.readBool;
import static com.enterprise.sheetconvert.store.DynamoDbAttributes.readInstant;
import static com.enterprise.sheetconvert.store.DynamoDbAttributes.readLong;
import static com.enterprise.sheetconvert.store.DynamoDbAttributes.str;

/**
 * Jobs table: partition key {@code job_id}; GSI {@code OwnerIndex} ({@code owner_id},
 * {@code created_at}) and GSI {@code StatusIndex} ({@code status}, {@code updated_at}),
 * both projecting all attributes.
 */
@Slf4j
@Repository
@ConditionalOnProperty(name = "conversion.store", havingValue = "dynamodb", matchIfMissing = true)
public class DynamoDbJobStore implements JobStore {

    static final String OWNER_INDEX = "OwnerIndex";
    static final String STATUS_INDEX = "StatusIndex";

    private final DynamoDbClient dynamoDbClient;
    private final String tableName;

    public DynamoDbJobStore(DynamoDbClient dynamoDbClient,
            @Value("${aws.dynamodb.jobs-table}") String tableName) {
        this.dynamoDbClient = dynamoDbClient;
        this.tableName = tableName;
    }

    @Override
    public void create(JobRecord job) {
        try {
            dynamoDbClient.putItem(PutItemRequest.builder()
                    .tableName(tableName)
                    .item(toItem(job))
                    .conditionExpression("attribute_not_exists(job_id)")
                    .build());
        } catch (ConditionalCheckFailedException e) {
            throw new IllegalStateException("Job already exists: " + job.getJobId(), e);
        } catch (DynamoDbException e) {
            throw new StoreException("Failed to create job " + job.getJobId(), e);
        }
        log.info("Created job record: jobId={}, owner={}, file={}", job.getJobId(), job.getOwnerId(), job.getFileName());
    }

    @Override
    public Optional<JobRecord> find(String jobId) {
        GetItemResponse response;
        try {
            response = dynamoDbClient.getItem(GetItemRequest.builder()
                    .tableName(tableName)
                    .key(Map.of("job_id", attr(jobId)))
                    .consistentRead(true)
                    .build());
        } catch (DynamoDbException e) {
            throw new StoreException("Failed to read job " + jobId, e);
        }

        if (!response.hasItem() || response.item().isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(mapToRecord(response.item()));
    }

    @Override
    public boolean compareAndSet(long expectedVersion, JobRecord next) {
        try {
            dynamoDbClient.putItem(PutItemRequest.builder()
                    .tableName(tableName)
                    .item(toItem(next))
                    .conditionExpression("#v = :expected")
                    .expressionAttributeNames(Map.of("#v", "version"))
                    .expressionAttributeValues(Map.of(":expected", num(expectedVersion)))
                    .build());
        } catch (ConditionalCheckFailedException e) {
            log.debug("Version conflict on jobId={}, expected version {}", next.getJobId(), expectedVersion);
            return false;
        } catch (DynamoDbException e) {
            throw new StoreException("Failed to update job " + next.getJobId(), e);
        }
        log.info("Job updated: jobId={}, status={}, version={}", next.getJobId(), next.getStatus(), next.getVersion());
        return true;
    }

    @Override
    public JobPage findByOwner(String ownerId, int limit, JobCursor after) {
        QueryRequest.Builder request = QueryRequest.builder()
                .tableName(tableName)
                .indexName(OWNER_INDEX)
                .keyConditionExpression("owner_id = :o")
                .expressionAttributeValues(Map.of(":o", attr(ownerId)))
                .scanIndexForward(false)
                .limit(limit);
        if (after != null) {
            request.exclusiveStartKey(Map.of(
                    "owner_id", attr(ownerId),
                    "created_at", instant(after.getCreatedAt()),
                    "job_id", attr(after.getJobId())));
        }

        QueryResponse response;
        try {
            response = dynamoDbClient.query(request.build());
        } catch (DynamoDbException e) {
            throw new StoreException("Failed to list jobs of " + ownerId, e);
        }
        List<JobRecord> records = response.items().stream().map(this::mapToRecord).collect(Collectors.toList());
        JobCursor next = null;
        if (response.hasLastEvaluatedKey() && !response.lastEvaluatedKey().isEmpty()) {
            Map<String, AttributeValue> last = response.lastEvaluatedKey();
            next = new JobCursor(readInstant(last, "created_at"), str(last, "job_id"));
        }
        return new JobPage(records, next);
    }

    @Override
    public List<JobRecord> findByStatusUpdatedBefore(JobStatus status, Instant cutoff) {
        return query(QueryRequest.builder()
                .tableName(tableName)
                .indexName(STATUS_INDEX)
                .keyConditionExpression("#st = :s AND updated_at < :cutoff")
                .expressionAttributeNames(Map.of("#st", "status"))
                .expressionAttributeValues(Map.of(
                        ":s", attr(status.name()),
                        ":cutoff", instant(cutoff))));
    }

    // ─── helpers ────────────────────────────────────────────────────────────

    private List<JobRecord> query(QueryRequest.Builder request) {
        List<JobRecord> records = new ArrayList<>();
        Map<String, AttributeValue> startKey = null;
        try {
            do {
                if (startKey != null) {
                    request.exclusiveStartKey(startKey);
                }
                QueryResponse response = dynamoDbClient.query(request.build());
                for (Map<String, AttributeValue> item : response.items()) {
                    records.add(mapToRecord(item));
                }
                startKey = response.hasLastEvaluatedKey() && !response.lastEvaluatedKey().isEmpty()
                        ? response.lastEvaluatedKey()
                        : null;
            } while (startKey != null);
        } catch (DynamoDbException e) {
            throw new StoreException("Failed to query jobs table " + tableName, e);
        }
        return records;
    }

    Map<String, AttributeValue> toItem(JobRecord job) {
        Map<String, AttributeValue> item = new HashMap<>();
        item.put("job_id", attr(job.getJobId()));
        item.put("owner_id", attr(job.getOwnerId()));
        item.put("status", attr(job.getStatus().name()));
        item.put("source_key", attr(job.getSourceKey()));
        item.put("created_at", instant(job.getCreatedAt()));
        item.put("updated_at", instant(job.getUpdatedAt()));
        item.put("attempt_count", num(job.getAttemptCount()));
        item.put("quota_counted", bool(job.isQuotaCounted()));
        item.put("extraction_attempted", bool(job.isExtractionAttempted()));
        item.put("version", num(job.getVersion()));
        putIfPresent(item, "file_name", job.getFileName() != null ? attr(job.getFileName()) : null);
        putIfPresent(item, "result_key", job.getResultKey() != null ? attr(job.getResultKey()) : null);
        putIfPresent(item, "error_kind", job.getErrorKind() != null ? attr(job.getErrorKind().code()) : null);
        putIfPresent(item, "error_detail", job.getErrorDetail() != null ? attr(job.getErrorDetail()) : null);
        putIfPresent(item, "confirmed_at", job.getConfirmedAt() != null ? instant(job.getConfirmedAt()) : null);
        putIfPresent(item, "processing_started_at",
                job.getProcessingStartedAt() != null ? instant(job.getProcessingStartedAt()) : null);
        putIfPresent(item, "table_count", job.getTableCount() != null ? num(job.getTableCount()) : null);
        putIfPresent(item, "strategy", job.getStrategy() != null ? attr(job.getStrategy()) : null);
        if (job.getWarnings() != null && !job.getWarnings().isEmpty()) {
            item.put("warnings", AttributeValue.builder()
                    .l(job.getWarnings().stream().map(DynamoDbAttributes::attr).collect(Collectors.toList()))
                    .build());
        }
        return item;
    }

    JobRecord mapToRecord(Map<String, AttributeValue> item) {
        String errorKind = str(item, "error_kind");
        String tableCount = item.containsKey("table_count") ? item.get("table_count").n() : null;
        List<String> warnings = item.containsKey("warnings")
                ? item.get("warnings").l().stream().map(AttributeValue::s).collect(Collectors.toList())
                : List.of();
        return JobRecord.builder()
                .jobId(str(item, "job_id"))
                .ownerId(str(item, "owner_id"))
                .fileName(str(item, "file_name"))
                .status(JobStatus.valueOf(str(item, "status")))
                .sourceKey(str(item, "source_key"))
                .resultKey(str(item, "result_key"))
                .errorKind(errorKind != null ? ErrorKind.fromCode(errorKind) : null)
                .errorDetail(str(item, "error_detail"))
                .createdAt(readInstant(item, "created_at"))
                .updatedAt(readInstant(item, "updated_at"))
                .confirmedAt(readInstant(item, "confirmed_at"))
                .processingStartedAt(readInstant(item, "processing_started_at"))
                .attemptCount((int) readLong(item, "attempt_count"))
                .quotaCounted(readBool(item, "quota_counted"))
                .extractionAttempted(readBool(item, "extraction_attempted"))
                .tableCount(tableCount != null ? Integer.valueOf(tableCount) : null)
                .strategy(str(item, "strategy"))
                .warnings(List.copyOf(warnings))
                .version(readLong(item, "version"))
                .build();
    }
}

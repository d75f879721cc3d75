package com.enterprise.sheetconvert.store;

import com.enterprise.sheetconvert.exception.StoreException;
import com.enterprise.sheetconvert.model.QuotaDecision;
import com.enterprise.sheetconvert.model.QuotaRecord;
import com.enterprise.sheetconvert.model.Tier;
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
import software.amazon.awssdk.services.dynamodb.model.ReturnValue;
import software.amazon.awssdk.services.dynamodb.model.UpdateItemRequest;
import software.amazon.awssdk.services.dynamodb.model.UpdateItemResponse;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

import static com.enterprise.sheetconvert.store.DynamoDbAttributes.attr;
import static com.enterprise.sheetconvert.store.DynamoDbAttributes.instant;
import static com.enterprise.sheetconvert.store.DynamoDbAttributes.num;
import static com.enterprise.sheetconvert.store.DynamoDbAttributes.readInstant;
import static com.enterprise.sheetconvert.store.DynamoDbAttributes.readLong;
import static com.enterprise.sheetconvert.store.DynamoDbAttributes.str;

/**
 * Quotas table: partition key {@code owner_id}.
 *
 * Reservation is a conditional increment ({@code tier = FREE AND used_count < limit}),
 * so two concurrent reservations at the boundary cannot both succeed. A counter from an
 * earlier window is first reset with a version-checked update.
 */
@Slf4j
@Repository
@ConditionalOnProperty(name = "conversion.store", havingValue = "dynamodb", matchIfMissing = true)
public class DynamoDbQuotaStore implements QuotaStore {

    // lost races against rollovers, releases or tier changes before giving up
    private static final int MAX_RESERVE_ATTEMPTS = 3;

    private final DynamoDbClient dynamoDbClient;
    private final String tableName;

    public DynamoDbQuotaStore(DynamoDbClient dynamoDbClient,
            @Value("${aws.dynamodb.quotas-table}") String tableName) {
        this.dynamoDbClient = dynamoDbClient;
        this.tableName = tableName;
    }

    @Override
    public QuotaRecord getOrCreate(String ownerId, Instant periodAnchor, Instant now) {
        Map<String, AttributeValue> item = new HashMap<>();
        item.put("owner_id", attr(ownerId));
        item.put("tier", attr(Tier.FREE.name()));
        item.put("used_count", num(0));
        item.put("period_anchor", instant(periodAnchor));
        item.put("updated_at", instant(now));
        item.put("version", num(0));
        try {
            dynamoDbClient.putItem(PutItemRequest.builder()
                    .tableName(tableName)
                    .item(item)
                    .conditionExpression("attribute_not_exists(owner_id)")
                    .build());
            log.info("Created quota record: owner={}", ownerId);
        } catch (ConditionalCheckFailedException e) {
            log.debug("Quota record already exists: owner={}", ownerId);
        } catch (DynamoDbException e) {
            throw new StoreException("Failed to create quota record for " + ownerId, e);
        }
        return read(ownerId);
    }

    @Override
    public QuotaDecision reserve(String ownerId, int allotment, Instant windowStart, Instant now) {
        QuotaRecord record = getOrCreate(ownerId, windowStart, now);
        for (int attempt = 0; attempt < MAX_RESERVE_ATTEMPTS; attempt++) {
            if (record.getTier() == Tier.PAID) {
                return QuotaDecision.allowedUncounted();
            }
            if (record.getPeriodAnchor().isBefore(windowStart)) {
                rollover(record, windowStart, now);
            } else if (tryIncrement(ownerId, allotment, windowStart, now)) {
                return QuotaDecision.allowedCounted();
            }
            record = read(ownerId);
            if (record.getTier() == Tier.FREE && !record.getPeriodAnchor().isBefore(windowStart)
                    && record.getUsedCount() >= allotment) {
                return QuotaDecision.denied();
            }
        }
        // the owner is under the limit, so a denial would fail the job for nothing
        throw new StoreException("Quota reservation for " + ownerId + " kept losing races after "
                + MAX_RESERVE_ATTEMPTS + " attempts", null);
    }

    @Override
    public void release(String ownerId, Instant now) {
        try {
            dynamoDbClient.updateItem(UpdateItemRequest.builder()
                    .tableName(tableName)
                    .key(Map.of("owner_id", attr(ownerId)))
                    .updateExpression("SET used_count = used_count - :one, updated_at = :now, #v = #v + :one")
                    .conditionExpression("used_count > :zero")
                    .expressionAttributeNames(Map.of("#v", "version"))
                    .expressionAttributeValues(Map.of(
                            ":one", num(1),
                            ":zero", num(0),
                            ":now", instant(now)))
                    .build());
            log.info("Released quota slot: owner={}", ownerId);
        } catch (ConditionalCheckFailedException e) {
            log.debug("Nothing to release for owner={}", ownerId);
        } catch (DynamoDbException e) {
            throw new StoreException("Failed to release quota for " + ownerId, e);
        }
    }

    @Override
    public QuotaRecord applyTier(String ownerId, Tier tier, Instant periodAnchor, Instant now) {
        try {
            UpdateItemResponse response = dynamoDbClient.updateItem(UpdateItemRequest.builder()
                    .tableName(tableName)
                    .key(Map.of("owner_id", attr(ownerId)))
                    .updateExpression("SET #tier = :tier, updated_at = :now, "
                            + "used_count = if_not_exists(used_count, :zero), "
                            + "period_anchor = if_not_exists(period_anchor, :anchor), "
                            + "#v = if_not_exists(#v, :zero) + :one")
                    .expressionAttributeNames(Map.of("#v", "version", "#tier", "tier"))
                    .expressionAttributeValues(Map.of(
                            ":tier", attr(tier.name()),
                            ":now", instant(now),
                            ":zero", num(0),
                            ":one", num(1),
                            ":anchor", instant(periodAnchor)))
                    .returnValues(ReturnValue.ALL_NEW)
                    .build());
            log.info("Tier changed: owner={}, tier={}", ownerId, tier);
            return mapToRecord(response.attributes());
        } catch (DynamoDbException e) {
            throw new StoreException("Failed to change tier for " + ownerId, e);
        }
    }

    // ─── helpers ────────────────────────────────────────────────────────────

    private boolean tryIncrement(String ownerId, int allotment, Instant windowStart, Instant now) {
        try {
            dynamoDbClient.updateItem(UpdateItemRequest.builder()
                    .tableName(tableName)
                    .key(Map.of("owner_id", attr(ownerId)))
                    .updateExpression("SET used_count = used_count + :one, updated_at = :now, #v = #v + :one")
                    .conditionExpression("#tier = :free AND used_count < :limit AND period_anchor >= :window")
                    .expressionAttributeNames(Map.of("#v", "version", "#tier", "tier"))
                    .expressionAttributeValues(Map.of(
                            ":one", num(1),
                            ":now", instant(now),
                            ":free", attr(Tier.FREE.name()),
                            ":limit", num(allotment),
                            ":window", instant(windowStart)))
                    .build());
            return true;
        } catch (ConditionalCheckFailedException e) {
            return false;
        } catch (DynamoDbException e) {
            throw new StoreException("Failed to reserve quota for " + ownerId, e);
        }
    }

    private void rollover(QuotaRecord record, Instant windowStart, Instant now) {
        try {
            dynamoDbClient.updateItem(UpdateItemRequest.builder()
                    .tableName(tableName)
                    .key(Map.of("owner_id", attr(record.getOwnerId())))
                    .updateExpression("SET used_count = :zero, period_anchor = :window, updated_at = :now, #v = #v + :one")
                    .conditionExpression("#v = :expected")
                    .expressionAttributeNames(Map.of("#v", "version"))
                    .expressionAttributeValues(Map.of(
                            ":zero", num(0),
                            ":one", num(1),
                            ":window", instant(windowStart),
                            ":now", instant(now),
                            ":expected", num(record.getVersion())))
                    .build());
            log.info("Quota window rolled over: owner={}, anchor={}", record.getOwnerId(), windowStart);
        } catch (ConditionalCheckFailedException e) {
            log.debug("Concurrent quota update during rollover: owner={}", record.getOwnerId());
        } catch (DynamoDbException e) {
            throw new StoreException("Failed to reset quota for " + record.getOwnerId(), e);
        }
    }

    private QuotaRecord read(String ownerId) {
        GetItemResponse response;
        try {
            response = dynamoDbClient.getItem(GetItemRequest.builder()
                    .tableName(tableName)
                    .key(Map.of("owner_id", attr(ownerId)))
                    .consistentRead(true)
                    .build());
        } catch (DynamoDbException e) {
            throw new StoreException("Failed to read quota for " + ownerId, e);
        }
        if (!response.hasItem() || response.item().isEmpty()) {
            throw new StoreException("Quota record vanished for " + ownerId, null);
        }
        return mapToRecord(response.item());
    }

    QuotaRecord mapToRecord(Map<String, AttributeValue> item) {
        return QuotaRecord.builder()
                .ownerId(str(item, "owner_id"))
                .tier(Tier.valueOf(str(item, "tier")))
                .usedCount((int) readLong(item, "used_count"))
                .periodAnchor(readInstant(item, "period_anchor"))
                .updatedAt(readInstant(item, "updated_at"))
                .version(readLong(item, "version"))
                .build();
    }
}

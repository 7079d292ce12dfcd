/*******************************************************************************
 * This file is part of OpenNMS(R).
 *
 * Copyright (C) 2021 The OpenNMS Group, Inc.
 * OpenNMS(R) is Copyright (C) 1999-2021 The OpenNMS Group, Inc.
 *
 * OpenNMS(R) is a registered trademark of The OpenNMS Group, Inc.
 *
 * OpenNMS(R) is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as published
 * by the Free Software Foundation, either version 3 of the License,
 * or (at your option) any later version.
 *
 * OpenNMS(R) is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Affero General Public License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with OpenNMS(R).  If not, see:
 *      http://www.gnu.org/licenses/
 *
 * For more information contact:
 *     OpenNMS(R) Licensing <license@opennms.org>
 *     http://www.opennms.org/
 *     http://www.opennms.com/
 *******************************************************************************/

package org.opennms.timeseries.bigquery.warehouse;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import org.json.JSONObject;
import org.opennms.timeseries.bigquery.BigQueryStorageConfig;
import org.opennms.timeseries.bigquery.StorageException;
import org.opennms.timeseries.bigquery.StoredRecord;
import org.opennms.timeseries.bigquery.sql.SqlQuery;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.auth.oauth2.GoogleCredentials;
import com.google.cloud.bigquery.BigQuery;
import com.google.cloud.bigquery.BigQueryError;
import com.google.cloud.bigquery.BigQueryOptions;
import com.google.cloud.bigquery.FieldValue;
import com.google.cloud.bigquery.FieldValueList;
import com.google.cloud.bigquery.InsertAllRequest;
import com.google.cloud.bigquery.InsertAllResponse;
import com.google.cloud.bigquery.QueryJobConfiguration;
import com.google.cloud.bigquery.TableId;
import com.google.common.annotations.VisibleForTesting;

import io.github.resilience4j.bulkhead.BulkheadFullException;
import io.github.resilience4j.bulkhead.ThreadPoolBulkhead;
import io.github.resilience4j.bulkhead.ThreadPoolBulkheadConfig;

/**
 * {@link Warehouse} backed by a BigQuery table with the columns
 * {@code metricname STRING, tags STRING, value FLOAT64, timestamp TIMESTAMP}.
 * Writes use the streaming insert API, reads run standard SQL query jobs.
 */
public class BigQueryWarehouse implements Warehouse {
    private static final Logger LOG = LoggerFactory.getLogger(BigQueryWarehouse.class);

    // log at most this many rejected rows per insert
    private static final int MAX_LOGGED_INSERT_ERRORS = 10;

    private static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter
            .ofPattern("uuuu-MM-dd HH:mm:ss.SSS")
            .withZone(ZoneOffset.UTC);

    private final BigQuery bigQuery;
    private final TableId tableId;
    private final ThreadPoolBulkhead bulkhead;

    public BigQueryWarehouse(final BigQuery bigQuery, final BigQueryStorageConfig config) {
        this.bigQuery = Objects.requireNonNull(bigQuery);
        this.tableId = TableId.of(config.getDatasetId(), config.getTableId());
        ThreadPoolBulkheadConfig bulkheadConfig = ThreadPoolBulkheadConfig.custom()
                .maxThreadPoolSize(config.getMaxConcurrentWarehouseCalls())
                .coreThreadPoolSize(config.getMaxConcurrentWarehouseCalls())
                .queueCapacity(config.getMaxConcurrentWarehouseCalls() * 4)
                .build();
        this.bulkhead = ThreadPoolBulkhead.of("bigqueryCalls", bulkheadConfig);
    }

    /**
     * Creates the BigQuery client from the configuration. If a service account key is configured it is used
     * as credentials and, when no project id was given, provides the project id.
     */
    public static BigQueryWarehouse create(final BigQueryStorageConfig config) throws IOException {
        final BigQueryOptions.Builder options = BigQueryOptions.newBuilder();
        String projectId = config.getProjectId();
        if (config.hasCredentialsFile()) {
            final byte[] key = Files.readAllBytes(Paths.get(config.getCredentialsFile()));
            if (projectId == null || projectId.isBlank()) {
                projectId = new JSONObject(new String(key, StandardCharsets.UTF_8)).getString("project_id");
            }
            options.setCredentials(GoogleCredentials.fromStream(new ByteArrayInputStream(key)));
        }
        options.setProjectId(projectId);
        LOG.info("Using BigQuery table {}.{} in project {}", config.getDatasetId(), config.getTableId(), projectId);
        return new BigQueryWarehouse(options.build().getService(), config);
    }

    @Override
    public void insert(final List<StoredRecord> records, final Duration timeout) throws StorageException {
        final InsertAllRequest.Builder request = InsertAllRequest.newBuilder(tableId)
                .setSkipInvalidRows(true);
        records.forEach(r -> request.addRow(toRow(r)));

        final InsertAllResponse response = call(() -> bigQuery.insertAll(request.build()), timeout, "insert");
        if (response.hasErrors()) {
            final Map<Long, List<BigQueryError>> errors = response.getInsertErrors();
            errors.entrySet().stream()
                    .limit(MAX_LOGGED_INSERT_ERRORS)
                    .forEach(e -> LOG.warn("Row {} ({}) was rejected: {}", e.getKey(), records.get(e.getKey().intValue()), e.getValue()));
            throw new StorageException(String.format("%d of %d rows could not be inserted into %s",
                    errors.size(), records.size(), tableId.getDataset() + "." + tableId.getTable()));
        }
    }

    @Override
    public List<ResultRow> query(final SqlQuery query, final Duration timeout) throws StorageException {
        final QueryJobConfiguration job = QueryJobConfiguration.newBuilder(query.getText())
                .setUseLegacySql(false)
                .setJobTimeoutMs(timeout.toMillis())
                .build();
        // all pages are fetched within the deadline
        return call(() -> {
            final List<ResultRow> rows = new ArrayList<>();
            for (FieldValueList row : bigQuery.query(job).iterateAll()) {
                rows.add(toResultRow(row));
            }
            return rows;
        }, timeout, "query");
    }

    @VisibleForTesting
    static Map<String, Object> toRow(final StoredRecord record) {
        final Map<String, Object> row = new HashMap<>();
        row.put("value", record.getValue());
        row.put("metricname", record.getMetricName());
        row.put("timestamp", TIMESTAMP_FORMAT.format(Instant.ofEpochMilli(record.getTimestampMillis())));
        row.put("tags", record.getTags());
        return row;
    }

    @VisibleForTesting
    static ResultRow toResultRow(final FieldValueList row) throws StorageException {
        final FieldValue metricName = row.get("metricname");
        final FieldValue tags = row.get("tags");
        final FieldValue timestamp = row.get("timestamp");
        final FieldValue value = row.get("value");
        if (metricName.isNull() || timestamp.isNull() || value.isNull()) {
            throw new StorageException(String.format("Row with NULL column returned: metricname=%s, timestamp=%s, value=%s",
                    metricName.getValue(), timestamp.getValue(), value.getValue()));
        }
        return new ResultRow(
                metricName.getStringValue(),
                tags.isNull() ? null : tags.getStringValue(),
                timestamp.getLongValue(),
                value.getDoubleValue());
    }

    private <T> T call(final Callable<T> callable, final Duration timeout, final String operation) throws StorageException {
        final CompletableFuture<T> future;
        try {
            future = bulkhead.executeCallable(callable).toCompletableFuture();
        } catch (BulkheadFullException e) {
            throw new StorageException(String.format("Too many concurrent BigQuery calls, rejecting %s.", operation), e);
        }
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new StorageException(String.format("BigQuery %s timed out after %sms.", operation, timeout.toMillis()), e);
        } catch (ExecutionException e) {
            final Throwable cause = unwrap(e.getCause());
            if (cause instanceof StorageException) {
                throw (StorageException) cause;
            }
            throw new StorageException(String.format("BigQuery %s failed.", operation), cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StorageException(String.format("Interrupted while waiting for BigQuery %s.", operation), e);
        }
    }

    private static Throwable unwrap(Throwable t) {
        Throwable cause = t;
        while (cause instanceof CompletionException && cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause;
    }

    @Override
    public void close() {
        try {
            bulkhead.close();
        } catch (Exception e) {
            LOG.warn("Error while shutting down the BigQuery call pool.", e);
        }
    }
}

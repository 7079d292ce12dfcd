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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsInAnyOrder;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.instanceOf;
import static org.hamcrest.Matchers.nullValue;
import static org.junit.Assert.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.opennms.timeseries.bigquery.Fixtures.matcher;
import static org.opennms.timeseries.bigquery.Fixtures.query;
import static org.opennms.timeseries.bigquery.Fixtures.readRequest;
import static prometheus.PrometheusTypes.LabelMatcher.Type.EQ;

import java.time.Duration;
import java.util.Arrays;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.concurrent.TimeoutException;

import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import org.mockito.ArgumentCaptor;
import org.opennms.timeseries.bigquery.BigQueryStorage;
import org.opennms.timeseries.bigquery.BigQueryStorageConfig;
import org.opennms.timeseries.bigquery.StorageException;
import org.opennms.timeseries.bigquery.StoredRecord;
import org.opennms.timeseries.bigquery.metrics.DropwizardStorageMetrics;
import org.opennms.timeseries.bigquery.sql.MatcherTranslator;
import org.opennms.timeseries.bigquery.sql.SqlQuery;

import com.codahale.metrics.MetricRegistry;
import com.google.cloud.bigquery.BigQuery;
import com.google.cloud.bigquery.BigQueryError;
import com.google.cloud.bigquery.BigQueryException;
import com.google.cloud.bigquery.Field;
import com.google.cloud.bigquery.FieldValue;
import com.google.cloud.bigquery.FieldValueList;
import com.google.cloud.bigquery.InsertAllRequest;
import com.google.cloud.bigquery.InsertAllResponse;
import com.google.cloud.bigquery.LegacySQLTypeName;
import com.google.cloud.bigquery.QueryJobConfiguration;
import com.google.cloud.bigquery.TableId;
import com.google.cloud.bigquery.TableResult;
import com.google.common.collect.ImmutableList;

public class BigQueryWarehouseTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    private final List<StoredRecord> records = Arrays.asList(
            new StoredRecord(1.5, "cpu", 1602783564123L, "{\"host\":\"a\"}"),
            new StoredRecord(2.0, "mem", 1602783565000L, "{}"));

    private BigQuery bigQuery;
    private BigQueryWarehouse warehouse;

    @Before
    public void setUp() {
        bigQuery = mock(BigQuery.class);
        warehouse = new BigQueryWarehouse(bigQuery, BigQueryStorageConfig.builder()
                .datasetId("prometheus")
                .tableId("metrics")
                .maxConcurrentWarehouseCalls(2)
                .build());
    }

    @After
    public void tearDown() {
        warehouse.close();
    }

    @Test
    public void shouldInsertAllRecordsInOneRequest() throws StorageException {
        InsertAllResponse response = mock(InsertAllResponse.class);
        when(response.hasErrors()).thenReturn(false);
        when(bigQuery.insertAll(any(InsertAllRequest.class))).thenReturn(response);

        warehouse.insert(records, TIMEOUT);

        ArgumentCaptor<InsertAllRequest> captor = ArgumentCaptor.forClass(InsertAllRequest.class);
        verify(bigQuery).insertAll(captor.capture());
        InsertAllRequest request = captor.getValue();
        assertThat(request.getTable(), equalTo(TableId.of("prometheus", "metrics")));
        assertThat(request.skipInvalidRows(), equalTo(true));
        assertThat(request.getRows(), hasSize(2));
        Map<String, Object> first = request.getRows().get(0).getContent();
        assertThat(first.get("metricname"), equalTo("cpu"));
        assertThat(first.get("tags"), equalTo("{\"host\":\"a\"}"));
        assertThat(first.get("value"), equalTo(1.5));
        assertThat(first.get("timestamp"), equalTo("2020-10-15 17:39:24.123"));
    }

    @Test
    public void shouldFailOnRejectedRows() {
        InsertAllResponse response = mock(InsertAllResponse.class);
        when(response.hasErrors()).thenReturn(true);
        when(response.getInsertErrors()).thenReturn(Collections.singletonMap(1L,
                Collections.singletonList(new BigQueryError("invalid", "value", "not a number"))));
        when(bigQuery.insertAll(any(InsertAllRequest.class))).thenReturn(response);

        StorageException e = assertThrows(StorageException.class, () -> warehouse.insert(records, TIMEOUT));
        assertThat(e.getMessage(), equalTo("1 of 2 rows could not be inserted into prometheus.metrics"));
    }

    @Test
    public void shouldWrapClientErrors() {
        BigQueryException failure = new BigQueryException(500, "backend error");
        when(bigQuery.insertAll(any(InsertAllRequest.class))).thenThrow(failure);

        StorageException e = assertThrows(StorageException.class, () -> warehouse.insert(records, TIMEOUT));
        assertThat(e.getCause(), equalTo(failure));
    }

    @Test
    public void shouldRunStandardSqlQueryJob() throws Exception {
        SqlQuery sql = new MatcherTranslator("prometheus", "metrics").translate(query(0, 10, matcher(EQ, "__name__", "cpu")));
        TableResult result = mock(TableResult.class);
        when(result.iterateAll()).thenReturn(ImmutableList.of(
                row("cpu", "{\"host\":\"a\"}", "1000", "1.5"),
                row("cpu", null, "2000", "2.5")));
        when(bigQuery.query(any(QueryJobConfiguration.class))).thenReturn(result);

        List<ResultRow> rows = ImmutableList.copyOf(warehouse.query(sql, TIMEOUT));

        ArgumentCaptor<QueryJobConfiguration> captor = ArgumentCaptor.forClass(QueryJobConfiguration.class);
        verify(bigQuery).query(captor.capture());
        assertThat(captor.getValue().getQuery(), equalTo(sql.getText()));
        assertThat(captor.getValue().useLegacySql(), equalTo(false));
        assertThat(captor.getValue().getJobTimeoutMs(), equalTo(TIMEOUT.toMillis()));

        assertThat(rows, hasSize(2));
        assertThat(rows.get(0).getMetricName(), equalTo("cpu"));
        assertThat(rows.get(0).getTags(), equalTo("{\"host\":\"a\"}"));
        assertThat(rows.get(0).getTimestampMillis(), equalTo(1000L));
        assertThat(rows.get(0).getValue(), equalTo(1.5));
        assertThat(rows.get(1).getTags(), nullValue());
    }

    @Test
    public void shouldTimeOutSlowCalls() throws Exception {
        SqlQuery sql = new MatcherTranslator("prometheus", "metrics").translate(query(0, 10));
        when(bigQuery.query(any(QueryJobConfiguration.class))).thenAnswer(invocation -> {
            Thread.sleep(1000);
            return null;
        });

        StorageException e = assertThrows(StorageException.class, () -> warehouse.query(sql, Duration.ofMillis(100)));
        assertThat(e.getMessage(), equalTo("BigQuery query timed out after 100ms."));
        assertThat(e.getCause(), instanceOf(TimeoutException.class));
    }

    @Test
    public void shouldTimeOutSlowInserts() {
        when(bigQuery.insertAll(any(InsertAllRequest.class))).thenAnswer(invocation -> {
            Thread.sleep(1000);
            return null;
        });

        StorageException e = assertThrows(StorageException.class, () -> warehouse.insert(records, Duration.ofMillis(100)));
        assertThat(e.getMessage(), equalTo("BigQuery insert timed out after 100ms."));
        assertThat(e.getCause(), instanceOf(TimeoutException.class));
    }

    @Test
    public void shouldFetchAllPagesWithinTheCall() throws Exception {
        BigQueryException failure = new BigQueryException(503, "page fetch failed");
        TableResult result = mock(TableResult.class);
        when(result.iterateAll()).thenReturn(() -> new Iterator<FieldValueList>() {
            private int served;

            @Override
            public boolean hasNext() {
                if (served == 1) {
                    throw failure;
                }
                return true;
            }

            @Override
            public FieldValueList next() {
                served++;
                return row("cpu", "{}", "1000", "1.0");
            }
        });
        when(bigQuery.query(any(QueryJobConfiguration.class))).thenReturn(result);
        SqlQuery sql = new MatcherTranslator("prometheus", "metrics").translate(query(0, 10));

        StorageException e = assertThrows(StorageException.class, () -> warehouse.query(sql, TIMEOUT));
        assertThat(e.getCause(), equalTo(failure));

        // surfaces as a checked failure of the whole read
        MetricRegistry registry = new MetricRegistry();
        BigQueryStorage storage = new BigQueryStorage(BigQueryStorageConfig.builder()
                .datasetId("prometheus")
                .tableId("metrics")
                .build(), warehouse, new DropwizardStorageMetrics(registry));
        e = assertThrows(StorageException.class, () -> storage.read(readRequest(query(0, 10, matcher(EQ, "__name__", "cpu")))));
        assertThat(e.getCause(), equalTo(failure));
    }

    @Test
    public void shouldTimeOutSlowPaging() throws Exception {
        TableResult result = mock(TableResult.class);
        when(result.iterateAll()).thenReturn(() -> new Iterator<FieldValueList>() {
            @Override
            public boolean hasNext() {
                try {
                    Thread.sleep(1000);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return false;
            }

            @Override
            public FieldValueList next() {
                throw new NoSuchElementException();
            }
        });
        when(bigQuery.query(any(QueryJobConfiguration.class))).thenReturn(result);
        SqlQuery sql = new MatcherTranslator("prometheus", "metrics").translate(query(0, 10));

        StorageException e = assertThrows(StorageException.class, () -> warehouse.query(sql, Duration.ofMillis(100)));
        assertThat(e.getMessage(), equalTo("BigQuery query timed out after 100ms."));
    }

    @Test
    public void shouldRejectRowsWithNullColumns() throws Exception {
        assertThrows(StorageException.class, () -> BigQueryWarehouse.toResultRow(row(null, "{}", "1000", "1.0")));
        assertThrows(StorageException.class, () -> BigQueryWarehouse.toResultRow(row("cpu", "{}", null, "1.0")));
        assertThrows(StorageException.class, () -> BigQueryWarehouse.toResultRow(row("cpu", "{}", "1000", null)));

        TableResult result = mock(TableResult.class);
        when(result.iterateAll()).thenReturn(ImmutableList.of(row("cpu", "{}", "1000", null)));
        when(bigQuery.query(any(QueryJobConfiguration.class))).thenReturn(result);
        SqlQuery sql = new MatcherTranslator("prometheus", "metrics").translate(query(0, 10));

        StorageException e = assertThrows(StorageException.class, () -> warehouse.query(sql, TIMEOUT));
        assertThat(e.getMessage(), containsString("NULL column"));
    }

    @Test
    public void shouldFormatTimestampsInUtc() {
        Map<String, Object> row = BigQueryWarehouse.toRow(new StoredRecord(1, "up", 0, "{}"));
        assertThat(row.get("timestamp"), equalTo("1970-01-01 00:00:00.000"));
        assertThat(row.keySet(), containsInAnyOrder("metricname", "tags", "value", "timestamp"));
    }

    private static FieldValueList row(String metricName, String tags, String timestamp, String value) {
        return FieldValueList.of(
                Arrays.asList(
                        FieldValue.of(FieldValue.Attribute.PRIMITIVE, metricName),
                        FieldValue.of(FieldValue.Attribute.PRIMITIVE, tags),
                        FieldValue.of(FieldValue.Attribute.PRIMITIVE, timestamp),
                        FieldValue.of(FieldValue.Attribute.PRIMITIVE, value)),
                Field.of("metricname", LegacySQLTypeName.STRING),
                Field.of("tags", LegacySQLTypeName.STRING),
                Field.of("timestamp", LegacySQLTypeName.INTEGER),
                Field.of("value", LegacySQLTypeName.FLOAT));
    }
}

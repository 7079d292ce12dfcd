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

package org.opennms.timeseries.bigquery.metrics;

import java.util.Objects;
import java.util.concurrent.TimeUnit;

import com.codahale.metrics.Meter;
import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.Timer;

public class DropwizardStorageMetrics implements StorageMetrics {

    public static final String IGNORED_SAMPLES = "storage_bigquery_ignored_samples";
    public static final String RECORDS_FETCHED = "storage_bigquery_records_fetched";
    public static final String BATCH_WRITE_DURATION = "storage_bigquery_batch_write_duration_seconds";
    public static final String SQL_QUERY_COUNT = "storage_bigquery_sql_query_count";
    public static final String SQL_QUERY_DURATION = "storage_bigquery_sql_query_duration_seconds";

    private final Meter ignoredSamples;
    private final Meter recordsFetched;
    private final Timer batchWriteDuration;
    private final Meter sqlQueryCount;
    private final Timer sqlQueryDuration;

    public DropwizardStorageMetrics(final MetricRegistry metrics) {
        Objects.requireNonNull(metrics);
        this.ignoredSamples = metrics.meter(IGNORED_SAMPLES);
        this.recordsFetched = metrics.meter(RECORDS_FETCHED);
        this.batchWriteDuration = metrics.timer(BATCH_WRITE_DURATION);
        this.sqlQueryCount = metrics.meter(SQL_QUERY_COUNT);
        this.sqlQueryDuration = metrics.timer(SQL_QUERY_DURATION);
    }

    @Override
    public void ignoredSample() {
        ignoredSamples.mark();
    }

    @Override
    public void recordsFetched(long count) {
        recordsFetched.mark(count);
    }

    @Override
    public void batchWriteDuration(long nanos) {
        batchWriteDuration.update(nanos, TimeUnit.NANOSECONDS);
    }

    @Override
    public void sqlQuery() {
        sqlQueryCount.mark();
    }

    @Override
    public void sqlQueryDuration(long nanos) {
        sqlQueryDuration.update(nanos, TimeUnit.NANOSECONDS);
    }
}

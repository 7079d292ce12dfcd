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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.equalTo;

import java.util.concurrent.TimeUnit;

import org.junit.Test;

import com.codahale.metrics.MetricRegistry;

public class DropwizardStorageMetricsTest {

    @Test
    public void shouldRegisterAndUpdateMetrics() {
        MetricRegistry registry = new MetricRegistry();
        StorageMetrics metrics = new DropwizardStorageMetrics(registry);

        metrics.ignoredSample();
        metrics.ignoredSample();
        metrics.recordsFetched(7);
        metrics.batchWriteDuration(TimeUnit.MILLISECONDS.toNanos(20));
        metrics.sqlQuery();
        metrics.sqlQueryDuration(TimeUnit.MILLISECONDS.toNanos(5));

        assertThat(registry.getMeters().get(DropwizardStorageMetrics.IGNORED_SAMPLES).getCount(), equalTo(2L));
        assertThat(registry.getMeters().get(DropwizardStorageMetrics.RECORDS_FETCHED).getCount(), equalTo(7L));
        assertThat(registry.getMeters().get(DropwizardStorageMetrics.SQL_QUERY_COUNT).getCount(), equalTo(1L));
        assertThat(registry.getTimers().get(DropwizardStorageMetrics.BATCH_WRITE_DURATION).getCount(), equalTo(1L));
        assertThat(registry.getTimers().get(DropwizardStorageMetrics.SQL_QUERY_DURATION).getSnapshot().getMax(),
                equalTo(TimeUnit.MILLISECONDS.toNanos(5)));
    }

    @Test
    public void shouldShareMetricsBetweenInstances() {
        MetricRegistry registry = new MetricRegistry();
        new DropwizardStorageMetrics(registry).ignoredSample();
        new DropwizardStorageMetrics(registry).ignoredSample();

        assertThat(registry.meter(DropwizardStorageMetrics.IGNORED_SAMPLES).getCount(), equalTo(2L));
    }
}

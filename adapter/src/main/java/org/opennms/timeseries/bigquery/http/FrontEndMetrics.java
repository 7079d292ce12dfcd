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

package org.opennms.timeseries.bigquery.http;

import static com.codahale.metrics.MetricRegistry.name;

import java.util.concurrent.TimeUnit;

import com.codahale.metrics.Meter;
import com.codahale.metrics.MetricRegistry;

/**
 * Request level metrics of the HTTP endpoints, labeled by backend name where applicable.
 */
public class FrontEndMetrics {

    private final MetricRegistry metrics;
    private final Meter receivedSamples;
    private final Meter writeErrors;
    private final Meter readErrors;

    public FrontEndMetrics(final MetricRegistry metrics) {
        this.metrics = metrics;
        this.receivedSamples = metrics.meter("storage_bigquery_received_samples");
        this.writeErrors = metrics.meter("storage_bigquery_write_errors");
        this.readErrors = metrics.meter("storage_bigquery_read_errors");
    }

    public void receivedSamples(long count) {
        receivedSamples.mark(count);
    }

    public void sentSamples(String remote, long count) {
        metrics.meter(name("storage_bigquery_sent_samples", remote)).mark(count);
    }

    public void failedSamples(String remote, long count) {
        metrics.meter(name("storage_bigquery_failed_samples", remote)).mark(count);
    }

    public void sentBatchDuration(String remote, long nanos) {
        metrics.timer(name("storage_bigquery_sent_batch_duration_seconds", remote)).update(nanos, TimeUnit.NANOSECONDS);
    }

    public void writeError() {
        writeErrors.mark();
    }

    public void readError() {
        readErrors.mark();
    }

    public void writeApiDuration(String remote, long nanos) {
        metrics.timer(name("storage_bigquery_write_api_seconds", remote)).update(nanos, TimeUnit.NANOSECONDS);
    }

    public void readApiDuration(String remote, long nanos) {
        metrics.timer(name("storage_bigquery_read_api_seconds", remote)).update(nanos, TimeUnit.NANOSECONDS);
    }
}

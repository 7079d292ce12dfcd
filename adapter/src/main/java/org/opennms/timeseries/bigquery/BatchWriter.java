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

package org.opennms.timeseries.bigquery;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import org.opennms.timeseries.bigquery.metrics.StorageMetrics;
import org.opennms.timeseries.bigquery.warehouse.Warehouse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import prometheus.PrometheusTypes;

/**
 * Flattens the samples of all given series into a single batch and inserts it with one warehouse call.
 */
public class BatchWriter {
    private static final Logger LOG = LoggerFactory.getLogger(BatchWriter.class);

    private final Warehouse warehouse;
    private final RowCodec codec;
    private final StorageMetrics metrics;
    private final Duration timeout;

    public BatchWriter(final Warehouse warehouse, final RowCodec codec, final StorageMetrics metrics, final Duration timeout) {
        this.warehouse = Objects.requireNonNull(warehouse);
        this.codec = Objects.requireNonNull(codec);
        this.metrics = Objects.requireNonNull(metrics);
        this.timeout = Objects.requireNonNull(timeout);
    }

    public void write(final List<PrometheusTypes.TimeSeries> timeseries) throws StorageException {
        final List<StoredRecord> batch = new ArrayList<>(timeseries.size());
        for (PrometheusTypes.TimeSeries ts : timeseries) {
            metrics.recordsFetched(ts.getSamplesCount());
            // the labels are shared by all samples of the series, encode them once
            final String metricName = RowCodec.metricNameOf(ts.getLabelsList());
            final String tags = RowCodec.tagsFromLabels(ts.getLabelsList());
            for (PrometheusTypes.Sample sample : ts.getSamplesList()) {
                codec.encode(metricName, tags, sample.getValue(), sample.getTimestamp()).ifPresent(batch::add);
            }
        }
        if (batch.isEmpty()) {
            LOG.debug("Nothing to write for {} series.", timeseries.size());
            return;
        }

        final long begin = System.nanoTime();
        warehouse.insert(batch, timeout);
        metrics.batchWriteDuration(System.nanoTime() - begin);
        LOG.trace("Wrote {} records.", batch.size());
    }
}

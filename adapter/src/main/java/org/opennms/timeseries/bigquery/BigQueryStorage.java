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
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

import org.opennms.timeseries.bigquery.metrics.StorageMetrics;
import org.opennms.timeseries.bigquery.sql.MatcherTranslator;
import org.opennms.timeseries.bigquery.sql.SqlQuery;
import org.opennms.timeseries.bigquery.warehouse.Warehouse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import prometheus.PrometheusRemote;
import prometheus.PrometheusTypes;

/**
 * Prometheus remote storage on top of a BigQuery table.
 * Writes flatten all samples of a request into one streaming insert, reads run one query per
 * sub-query and merge all returned rows into a single result.
 */
public class BigQueryStorage implements RemoteWriter, RemoteReader {
    private static final Logger LOG = LoggerFactory.getLogger(BigQueryStorage.class);

    public static final String NAME = "bigquerydb";

    private final Warehouse warehouse;
    private final StorageMetrics metrics;
    private final Duration timeout;
    private final BatchWriter batchWriter;
    private final MatcherTranslator translator;

    public BigQueryStorage(final BigQueryStorageConfig config, final Warehouse warehouse, final StorageMetrics metrics) {
        Objects.requireNonNull(config);
        this.warehouse = Objects.requireNonNull(warehouse);
        this.metrics = Objects.requireNonNull(metrics);
        this.timeout = Duration.ofMillis(config.getTimeoutInMs());
        this.batchWriter = new BatchWriter(warehouse, new RowCodec(metrics), metrics, timeout);
        this.translator = new MatcherTranslator(config.getDatasetId(), config.getTableId());
    }

    @Override
    public void write(final List<PrometheusTypes.TimeSeries> timeseries) throws StorageException {
        batchWriter.write(timeseries);
    }

    @Override
    public PrometheusRemote.ReadResponse read(final PrometheusRemote.ReadRequest request) throws StorageException {
        final ResultMerger merger = new ResultMerger();
        for (PrometheusRemote.Query query : request.getQueriesList()) {
            final SqlQuery sql = translator.translate(query);
            metrics.sqlQuery();
            final long begin = System.nanoTime();
            final long rows = merger.merge(warehouse.query(sql, timeout));
            final long duration = System.nanoTime() - begin;
            metrics.sqlQueryDuration(duration);
            LOG.debug("bigquery sql query returned {} rows in {}ms", rows, TimeUnit.NANOSECONDS.toMillis(duration));
        }

        return PrometheusRemote.ReadResponse.newBuilder()
                .addResults(PrometheusRemote.QueryResult.newBuilder()
                        .addAllTimeseries(merger.toSeries()))
                .build();
    }

    @Override
    public String getName() {
        return NAME;
    }
}

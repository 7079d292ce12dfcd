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

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import org.opennms.timeseries.bigquery.warehouse.ResultRow;

import com.google.common.hash.HashFunction;
import com.google.common.hash.Hasher;
import com.google.common.hash.Hashing;

import prometheus.PrometheusTypes;

/**
 * Groups the rows of all sub-queries of one read request into time series.
 * Rows with the same label set end up in the same series, no matter which sub-query returned them.
 * Series are returned in the order they were first seen, samples in the order of the rows.
 * <p>
 * Instances are not thread safe and are meant to live for a single read request.
 */
public class ResultMerger {

    private static final HashFunction FINGERPRINT = Hashing.farmHashFingerprint64();
    private static final byte SEPARATOR = (byte) 0xff;

    private final Map<Long, PrometheusTypes.TimeSeries.Builder> series = new LinkedHashMap<>();

    /**
     * Adds the rows of a sub-query.
     *
     * @return the number of rows consumed
     * @throws MalformedTagsException if the tags of a row cannot be decoded, the merger must be discarded then
     */
    public long merge(final Iterable<ResultRow> rows) throws MalformedTagsException {
        long count = 0;
        for (ResultRow row : rows) {
            final List<PrometheusTypes.Label> labels = RowCodec.labelsFromRow(row.getMetricName(), row.getTags());
            series.computeIfAbsent(fingerprint(labels), fp -> PrometheusTypes.TimeSeries.newBuilder().addAllLabels(labels))
                    .addSamples(PrometheusTypes.Sample.newBuilder()
                            .setTimestamp(row.getTimestampMillis())
                            .setValue(row.getValue()));
            count++;
        }
        return count;
    }

    public List<PrometheusTypes.TimeSeries> toSeries() {
        return series.values().stream()
                .map(PrometheusTypes.TimeSeries.Builder::build)
                .collect(Collectors.toList());
    }

    /**
     * Merges the rows of several sub-queries in the given order.
     */
    public static List<PrometheusTypes.TimeSeries> mergeAll(final List<? extends Iterable<ResultRow>> results) throws MalformedTagsException {
        final ResultMerger merger = new ResultMerger();
        for (Iterable<ResultRow> rows : results) {
            merger.merge(rows);
        }
        return merger.toSeries();
    }

    /**
     * Hash of a label set which does not depend on the order of the labels. Only meaningful within the running process.
     */
    public static long fingerprint(final List<PrometheusTypes.Label> labels) {
        final List<PrometheusTypes.Label> sorted = new ArrayList<>(labels);
        sorted.sort(Comparator.comparing(PrometheusTypes.Label::getName).thenComparing(PrometheusTypes.Label::getValue));
        final Hasher hasher = FINGERPRINT.newHasher();
        for (PrometheusTypes.Label label : sorted) {
            hasher.putString(label.getName(), StandardCharsets.UTF_8)
                    .putByte(SEPARATOR)
                    .putString(label.getValue(), StandardCharsets.UTF_8)
                    .putByte(SEPARATOR);
        }
        return hasher.hash().asLong();
    }
}

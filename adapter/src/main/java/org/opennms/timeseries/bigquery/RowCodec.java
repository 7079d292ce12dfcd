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

import java.io.IOException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;

import org.opennms.timeseries.bigquery.metrics.StorageMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import prometheus.PrometheusTypes;

/**
 * Converts between Prometheus label sets and the row layout of the warehouse table.
 * The metric name lives in its own column, all other labels are kept together as a JSON object.
 */
public class RowCodec {
    private static final Logger LOG = LoggerFactory.getLogger(RowCodec.class);

    // Label name indicating the metric name of a timeseries.
    public static final String METRIC_NAME_LABEL = "__name__";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final StorageMetrics metrics;

    public RowCodec(final StorageMetrics metrics) {
        this.metrics = Objects.requireNonNull(metrics);
    }

    /**
     * Builds the record for one sample, or nothing if the value cannot be stored.
     * Every skipped sample is reported to {@link StorageMetrics#ignoredSample()}.
     */
    public Optional<StoredRecord> encode(final List<PrometheusTypes.Label> labels, final double value, final long timestampMillis) {
        return encode(metricNameOf(labels), tagsFromLabels(labels), value, timestampMillis);
    }

    Optional<StoredRecord> encode(final String metricName, final String tags, final double value, final long timestampMillis) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            LOG.debug("cannot send to bigquery, skipping sample: metric={}, value={}, timestamp={}", metricName, value, timestampMillis);
            metrics.ignoredSample();
            return Optional.empty();
        }
        return Optional.of(new StoredRecord(value, metricName, timestampMillis, tags));
    }

    /** Returns the value of the metric name label, or an empty string if the series has none. */
    public static String metricNameOf(final List<PrometheusTypes.Label> labels) {
        String metricName = "";
        for (PrometheusTypes.Label label : labels) {
            if (METRIC_NAME_LABEL.equals(label.getName())) {
                metricName = label.getValue();
            }
        }
        return metricName;
    }

    /**
     * Serializes all labels but the metric name into a JSON object with keys in lexicographical order.
     * If a label name appears more than once the last value wins.
     */
    public static String tagsFromLabels(final List<PrometheusTypes.Label> labels) {
        final SortedMap<String, String> tags = new TreeMap<>();
        for (PrometheusTypes.Label label : labels) {
            if (!METRIC_NAME_LABEL.equals(label.getName())) {
                tags.put(label.getName(), label.getValue());
            }
        }
        try {
            return MAPPER.writeValueAsString(tags);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize labels " + tags, e);
        }
    }

    /**
     * Decodes a stored tags column into label name/value pairs.
     *
     * @throws MalformedTagsException if the column is not a JSON object whose values are all strings
     */
    public static SortedMap<String, String> decodeTags(final String tags) throws MalformedTagsException {
        if (tags == null) {
            throw new MalformedTagsException("tags column is null");
        }
        final JsonNode node;
        try {
            node = MAPPER.readTree(tags);
        } catch (IOException e) {
            throw new MalformedTagsException("tags column is not valid JSON: " + tags, e);
        }
        if (node == null || !node.isObject()) {
            throw new MalformedTagsException("tags column is not a JSON object: " + tags);
        }
        final SortedMap<String, String> decoded = new TreeMap<>();
        for (Iterator<Map.Entry<String, JsonNode>> it = node.fields(); it.hasNext(); ) {
            Map.Entry<String, JsonNode> field = it.next();
            if (!field.getValue().isTextual()) {
                throw new MalformedTagsException(String.format("tag '%s' is not a string: %s", field.getKey(), tags));
            }
            decoded.put(field.getKey(), field.getValue().textValue());
        }
        return decoded;
    }

    /**
     * Rebuilds the full label set of a stored row, sorted by label name.
     */
    public static List<PrometheusTypes.Label> labelsFromRow(final String metricName, final String tags) throws MalformedTagsException {
        final SortedMap<String, String> labels = decodeTags(tags);
        labels.put(METRIC_NAME_LABEL, metricName);
        final List<PrometheusTypes.Label> labelPairs = new ArrayList<>(labels.size());
        labels.forEach((name, value) -> labelPairs.add(PrometheusTypes.Label.newBuilder()
                .setName(name)
                .setValue(value)
                .build()));
        return labelPairs;
    }
}

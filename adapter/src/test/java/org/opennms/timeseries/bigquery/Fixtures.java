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

import java.util.Arrays;

import prometheus.PrometheusRemote;
import prometheus.PrometheusTypes;

/**
 * Builders for the protobuf messages used throughout the tests.
 */
public final class Fixtures {

    private Fixtures() {
    }

    public static PrometheusTypes.Label label(String name, String value) {
        return PrometheusTypes.Label.newBuilder().setName(name).setValue(value).build();
    }

    public static PrometheusTypes.Sample sample(long timestamp, double value) {
        return PrometheusTypes.Sample.newBuilder().setTimestamp(timestamp).setValue(value).build();
    }

    /** Labels given as name, value, name, value... */
    public static PrometheusTypes.TimeSeries series(String[] labels, PrometheusTypes.Sample... samples) {
        if (labels.length % 2 == 1) {
            throw new IllegalArgumentException("labels must have an even number of arguments");
        }
        PrometheusTypes.TimeSeries.Builder builder = PrometheusTypes.TimeSeries.newBuilder();
        for (int i = 0; i < labels.length; i += 2) {
            builder.addLabels(label(labels[i], labels[i + 1]));
        }
        return builder.addAllSamples(Arrays.asList(samples)).build();
    }

    public static String[] labels(String... labels) {
        return labels;
    }

    public static PrometheusTypes.LabelMatcher matcher(PrometheusTypes.LabelMatcher.Type type, String name, String value) {
        return PrometheusTypes.LabelMatcher.newBuilder().setType(type).setName(name).setValue(value).build();
    }

    public static PrometheusRemote.Query query(long start, long end, PrometheusTypes.LabelMatcher... matchers) {
        return PrometheusRemote.Query.newBuilder()
                .setStartTimestampMs(start)
                .setEndTimestampMs(end)
                .addAllMatchers(Arrays.asList(matchers))
                .build();
    }

    public static PrometheusRemote.ReadRequest readRequest(PrometheusRemote.Query... queries) {
        return PrometheusRemote.ReadRequest.newBuilder().addAllQueries(Arrays.asList(queries)).build();
    }
}

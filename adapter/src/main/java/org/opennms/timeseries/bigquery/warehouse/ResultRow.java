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

import java.util.StringJoiner;

/**
 * A row returned by a read query. {@code tags} is passed on undecoded and may be {@code null}
 * if the warehouse returned NULL for the column.
 */
public final class ResultRow {
    private final String metricName;
    private final String tags;
    private final long timestampMillis;
    private final double value;

    public ResultRow(final String metricName, final String tags, final long timestampMillis, final double value) {
        this.metricName = metricName;
        this.tags = tags;
        this.timestampMillis = timestampMillis;
        this.value = value;
    }

    public String getMetricName() {
        return metricName;
    }

    public String getTags() {
        return tags;
    }

    public long getTimestampMillis() {
        return timestampMillis;
    }

    public double getValue() {
        return value;
    }

    @Override
    public String toString() {
        return new StringJoiner(", ", ResultRow.class.getSimpleName() + "[", "]")
                .add("metricName='" + metricName + "'")
                .add("tags='" + tags + "'")
                .add("timestampMillis=" + timestampMillis)
                .add("value=" + value)
                .toString();
    }
}

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

import java.util.Objects;
import java.util.StringJoiner;

/**
 * One row of the warehouse table: a single sample of a series.
 * The tags hold every label except the metric name, encoded as a JSON object.
 */
public final class StoredRecord {
    private final double value;
    private final String metricName;
    private final long timestampMillis;
    private final String tags;

    public StoredRecord(final double value, final String metricName, final long timestampMillis, final String tags) {
        this.value = value;
        this.metricName = Objects.requireNonNull(metricName);
        this.timestampMillis = timestampMillis;
        this.tags = Objects.requireNonNull(tags);
    }

    public double getValue() {
        return value;
    }

    public String getMetricName() {
        return metricName;
    }

    public long getTimestampMillis() {
        return timestampMillis;
    }

    public String getTags() {
        return tags;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        StoredRecord that = (StoredRecord) o;
        return Double.compare(that.value, value) == 0
                && timestampMillis == that.timestampMillis
                && metricName.equals(that.metricName)
                && tags.equals(that.tags);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, metricName, timestampMillis, tags);
    }

    @Override
    public String toString() {
        return new StringJoiner(", ", StoredRecord.class.getSimpleName() + "[", "]")
                .add("metricName='" + metricName + "'")
                .add("timestampMillis=" + timestampMillis)
                .add("value=" + value)
                .add("tags='" + tags + "'")
                .toString();
    }
}

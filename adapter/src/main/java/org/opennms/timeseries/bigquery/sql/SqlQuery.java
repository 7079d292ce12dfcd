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

package org.opennms.timeseries.bigquery.sql;

import java.util.Objects;

import prometheus.PrometheusRemote;

/**
 * Query text generated for one sub-query of a read request, together with the sub-query it was built from.
 */
public final class SqlQuery {
    private final String text;
    private final PrometheusRemote.Query source;

    public SqlQuery(final String text, final PrometheusRemote.Query source) {
        this.text = Objects.requireNonNull(text);
        this.source = Objects.requireNonNull(source);
    }

    public String getText() {
        return text;
    }

    public PrometheusRemote.Query getSource() {
        return source;
    }

    @Override
    public String toString() {
        return text;
    }
}

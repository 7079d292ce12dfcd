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

import static org.opennms.timeseries.bigquery.RowCodec.METRIC_NAME_LABEL;
import static org.opennms.timeseries.bigquery.sql.SqlLiterals.quote;
import static org.opennms.timeseries.bigquery.sql.SqlLiterals.quoteRegex;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

import org.opennms.timeseries.bigquery.UnsupportedMatcherException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import prometheus.PrometheusRemote;
import prometheus.PrometheusTypes;

/**
 * Builds the SQL for a remote read sub-query.
 * Matchers on the metric name compare the {@code metricname} column, all other matchers compare the
 * value extracted from the JSON encoded {@code tags} column. A missing label compares as {@code ""}.
 */
public class MatcherTranslator {
    private static final Logger LOG = LoggerFactory.getLogger(MatcherTranslator.class);

    // Label names which can be used as-is in a JSONPath
    public static final Pattern LABEL_NAME_PATTERN = Pattern.compile("^[a-zA-Z_][a-zA-Z0-9_]*$");

    private static final String EMPTY_JSON_STRING = "'\"\"'";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final String table;

    public MatcherTranslator(final String datasetId, final String tableId) {
        this.table = SqlLiterals.quoteIdentifier(datasetId + "." + tableId);
    }

    public SqlQuery translate(final PrometheusRemote.Query query) throws UnsupportedMatcherException {
        final List<String> predicates = new ArrayList<>(query.getMatchersCount() + 2);
        for (PrometheusTypes.LabelMatcher matcher : query.getMatchersList()) {
            predicates.add(toPredicate(matcher));
        }
        predicates.add(String.format("timestamp >= TIMESTAMP_MILLIS(%d)", query.getStartTimestampMs()));
        predicates.add(String.format("timestamp <= TIMESTAMP_MILLIS(%d)", query.getEndTimestampMs()));

        final String sql = String.format("SELECT metricname, tags, UNIX_MILLIS(timestamp) AS timestamp, value FROM %s WHERE %s ORDER BY timestamp",
                table, String.join(" AND ", predicates));
        LOG.debug("bigquery read: {}", sql);
        return new SqlQuery(sql, query);
    }

    static String toPredicate(final PrometheusTypes.LabelMatcher matcher) throws UnsupportedMatcherException {
        if (METRIC_NAME_LABEL.equals(matcher.getName())) {
            switch (matcher.getType()) {
                case EQ:
                    return "metricname = " + quote(matcher.getValue());
                case NEQ:
                    return "metricname != " + quote(matcher.getValue());
                case RE:
                    return "REGEXP_CONTAINS(metricname, " + quoteRegex(matcher.getValue()) + ")";
                case NRE:
                    return "NOT REGEXP_CONTAINS(metricname, " + quoteRegex(matcher.getValue()) + ")";
                default:
                    throw new UnsupportedMatcherException(matcher);
            }
        }

        final String extracted = String.format("IFNULL(JSON_EXTRACT(tags, %s), %s)", quote(jsonPath(matcher.getName())), EMPTY_JSON_STRING);
        switch (matcher.getType()) {
            case EQ:
                return extracted + " = " + quote(toJsonString(matcher.getValue()));
            case NEQ:
                return extracted + " != " + quote(toJsonString(matcher.getValue()));
            case RE:
                return "REGEXP_CONTAINS(" + extracted + ", " + quoteRegex(quotedRegex(matcher.getValue())) + ")";
            case NRE:
                return "NOT REGEXP_CONTAINS(" + extracted + ", " + quoteRegex(quotedRegex(matcher.getValue())) + ")";
            default:
                throw new UnsupportedMatcherException(matcher);
        }
    }

    /**
     * JSON_EXTRACT keeps the quotes of the string value, so the pattern has to match them too.
     * The group keeps an alternation inside the quotes.
     */
    static String quotedRegex(final String regex) {
        return "\"(?:" + regex + ")\"";
    }

    static String jsonPath(final String labelName) {
        if (LABEL_NAME_PATTERN.matcher(labelName).matches()) {
            return "$." + labelName;
        }
        return "$['" + labelName.replace("\\", "\\\\").replace("'", "\\'") + "']";
    }

    static String toJsonString(final String value) {
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot encode " + value + " as JSON string", e);
        }
    }
}

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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.not;
import static org.junit.Assert.assertThrows;
import static org.opennms.timeseries.bigquery.Fixtures.label;
import static org.opennms.timeseries.bigquery.Fixtures.labels;
import static org.opennms.timeseries.bigquery.Fixtures.sample;
import static org.opennms.timeseries.bigquery.Fixtures.series;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.Test;
import org.opennms.timeseries.bigquery.warehouse.ResultRow;

import prometheus.PrometheusTypes;

public class ResultMergerTest {

    private final List<ResultRow> firstQuery = Arrays.asList(
            new ResultRow("cpu", "{\"host\":\"a\",\"dc\":\"x\"}", 1000, 1.0),
            new ResultRow("cpu", "{\"host\":\"b\"}", 1000, 2.0),
            new ResultRow("cpu", "{\"dc\":\"x\",\"host\":\"a\"}", 2000, 3.0));

    private final List<ResultRow> secondQuery = Arrays.asList(
            new ResultRow("cpu", "{\"host\":\"b\"}", 3000, 4.0),
            new ResultRow("mem", "{}", 3000, 5.0));

    @Test
    public void shouldGroupRowsByLabelSetAcrossQueries() throws MalformedTagsException {
        List<PrometheusTypes.TimeSeries> series = ResultMerger.mergeAll(Arrays.asList(firstQuery, secondQuery));

        assertThat(series, contains(
                series(labels("__name__", "cpu", "dc", "x", "host", "a"), sample(1000, 1.0), sample(2000, 3.0)),
                series(labels("__name__", "cpu", "host", "b"), sample(1000, 2.0), sample(3000, 4.0)),
                series(labels("__name__", "mem"), sample(3000, 5.0))));
    }

    @Test
    public void shouldProduceIdenticalResultsForIdenticalInput() throws MalformedTagsException {
        List<PrometheusTypes.TimeSeries> first = ResultMerger.mergeAll(Arrays.asList(firstQuery, secondQuery));
        List<PrometheusTypes.TimeSeries> second = ResultMerger.mergeAll(Arrays.asList(firstQuery, secondQuery));

        assertThat(second, equalTo(first));
        for (int i = 0; i < first.size(); i++) {
            assertThat(Arrays.equals(second.get(i).toByteArray(), first.get(i).toByteArray()), equalTo(true));
        }
    }

    @Test
    public void shouldFailOnMalformedTags() {
        List<ResultRow> broken = Arrays.asList(
                new ResultRow("cpu", "{\"host\":\"a\"}", 1000, 1.0),
                new ResultRow("cpu", "{\"host\":", 2000, 1.0));
        ResultMerger merger = new ResultMerger();
        assertThrows(MalformedTagsException.class, () -> merger.merge(broken));
        assertThrows(MalformedTagsException.class,
                () -> ResultMerger.mergeAll(Collections.singletonList(Collections.singletonList(new ResultRow("cpu", null, 1, 1)))));
    }

    @Test
    public void shouldCountMergedRows() throws MalformedTagsException {
        ResultMerger merger = new ResultMerger();
        assertThat(merger.merge(firstQuery), equalTo(3L));
        assertThat(merger.merge(Collections.emptyList()), equalTo(0L));
        assertThat(merger.toSeries(), hasSize(2));
    }

    @Test
    public void fingerprintShouldNotDependOnLabelOrder() {
        long fp1 = ResultMerger.fingerprint(Arrays.asList(label("__name__", "cpu"), label("host", "a"), label("dc", "x")));
        long fp2 = ResultMerger.fingerprint(Arrays.asList(label("dc", "x"), label("host", "a"), label("__name__", "cpu")));
        assertThat(fp1, equalTo(fp2));

        // moving characters between name and value must not collide
        long fp3 = ResultMerger.fingerprint(Arrays.asList(label("ab", "c")));
        long fp4 = ResultMerger.fingerprint(Arrays.asList(label("a", "bc")));
        assertThat(fp3, not(equalTo(fp4)));
    }
}

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

import java.time.Duration;
import java.util.List;

import org.opennms.timeseries.bigquery.StorageException;
import org.opennms.timeseries.bigquery.StoredRecord;
import org.opennms.timeseries.bigquery.sql.SqlQuery;

/**
 * The analytical store holding the samples. Both calls must give up once the timeout has elapsed
 * and report that as a {@link StorageException}; retrying is left to the caller.
 */
public interface Warehouse extends AutoCloseable {

    /**
     * Inserts all records with a single streaming insert. The call fails if any record was rejected.
     */
    void insert(List<StoredRecord> records, Duration timeout) throws StorageException;

    /**
     * Runs the query and reads all of its rows before returning, in the order produced by the query.
     */
    List<ResultRow> query(SqlQuery query, Duration timeout) throws StorageException;

    @Override
    void close();
}

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
import java.util.Collections;

import org.opennms.timeseries.bigquery.http.RemoteStorageServer;
import org.opennms.timeseries.bigquery.metrics.DropwizardStorageMetrics;
import org.opennms.timeseries.bigquery.warehouse.BigQueryWarehouse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.codahale.metrics.MetricRegistry;

/**
 * Starts the remote storage adapter, configured through {@code PROMBQ_*} environment variables.
 */
public class Main {
    private static final Logger LOG = LoggerFactory.getLogger(Main.class);

    public static void main(String[] args) {
        final BigQueryStorageConfig config;
        try {
            config = BigQueryStorageConfig.fromEnvironment(System.getenv(), System.getProperties());
        } catch (IllegalArgumentException e) {
            LOG.error("Invalid configuration: {}", e.getMessage());
            System.exit(2);
            return;
        }
        LOG.info("configuration settings: {}", config);

        final BigQueryWarehouse warehouse;
        try {
            warehouse = BigQueryWarehouse.create(config);
        } catch (IOException | RuntimeException e) {
            LOG.error("failed to create new bigquery client", e);
            System.exit(1);
            return;
        }

        final MetricRegistry metrics = new MetricRegistry();
        final BigQueryStorage storage = new BigQueryStorage(config, warehouse, new DropwizardStorageMetrics(metrics));
        final RemoteStorageServer server = new RemoteStorageServer(config,
                Collections.singletonList(storage),
                Collections.singletonList(storage),
                metrics);

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            server.stop();
            warehouse.close();
        }, "shutdown"));

        LOG.info("starting up...");
        try {
            server.start();
        } catch (IllegalStateException e) {
            LOG.error("failed to listen on {}", config.getListenAddress(), e);
            System.exit(1);
        }
    }
}

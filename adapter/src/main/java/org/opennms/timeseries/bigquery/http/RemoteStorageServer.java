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

package org.opennms.timeseries.bigquery.http;

import static io.undertow.UndertowOptions.SHUTDOWN_TIMEOUT;

import java.net.InetSocketAddress;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import org.opennms.timeseries.bigquery.BigQueryStorageConfig;
import org.opennms.timeseries.bigquery.RemoteReader;
import org.opennms.timeseries.bigquery.RemoteWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.codahale.metrics.MetricRegistry;
import com.google.common.base.Preconditions;

import io.undertow.Handlers;
import io.undertow.Undertow;
import io.undertow.server.RoutingHandler;
import io.undertow.server.handlers.BlockingHandler;

/**
 * HTTP endpoints of the adapter: {@code POST /write}, {@code POST /read} and the telemetry path.
 */
public class RemoteStorageServer {
    private static final Logger LOG = LoggerFactory.getLogger(RemoteStorageServer.class);

    private final BigQueryStorageConfig config;
    private final List<RemoteWriter> writers;
    private final List<RemoteReader> readers;
    private final MetricRegistry metrics;

    private Undertow undertow;
    private ExecutorService writeExecutor;

    public RemoteStorageServer(final BigQueryStorageConfig config, final List<RemoteWriter> writers,
                               final List<RemoteReader> readers, final MetricRegistry metrics) {
        this.config = Objects.requireNonNull(config);
        this.writers = Objects.requireNonNull(writers);
        this.readers = Objects.requireNonNull(readers);
        this.metrics = Objects.requireNonNull(metrics);
    }

    public synchronized void start() {
        Preconditions.checkState(undertow == null, "server already started");
        final FrontEndMetrics frontEndMetrics = new FrontEndMetrics(metrics);
        writeExecutor = Executors.newFixedThreadPool(Math.max(1, writers.size()) * config.getMaxConcurrentWarehouseCalls());

        final RoutingHandler routes = Handlers.routing()
                .post("/write", new BlockingHandler(new WriteHandler(writers, writeExecutor, frontEndMetrics)))
                .post("/read", new BlockingHandler(new ReadHandler(readers, frontEndMetrics)))
                .get(config.getTelemetryPath(), new MetricsHandler(metrics));

        undertow = Undertow.builder()
                .addHttpListener(config.getListenPort(), config.getListenHost())
                .setHandler(routes)
                .setServerOption(SHUTDOWN_TIMEOUT, 5000)
                .build();
        try {
            undertow.start();
        } catch (RuntimeException e) {
            undertow = null;
            writeExecutor.shutdownNow();
            throw new IllegalStateException("Error on starting HTTP server on " + config.getListenAddress(), e);
        }
        LOG.info("HTTP server started on {}:{}", config.getListenHost(), getPort());
    }

    /** The port actually bound, useful when listening on port 0. */
    public int getPort() {
        Preconditions.checkState(undertow != null, "server not started");
        return ((InetSocketAddress) undertow.getListenerInfo().get(0).getAddress()).getPort();
    }

    public synchronized void stop() {
        if (undertow == null) {
            return;
        }
        LOG.warn("stopping http server...");
        undertow.stop();
        undertow = null;
        writeExecutor.shutdown();
        try {
            if (!writeExecutor.awaitTermination(10, TimeUnit.SECONDS)) {
                writeExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            writeExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        LOG.warn("http server shutdown, and connections closed");
    }
}

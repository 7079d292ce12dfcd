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

import static org.opennms.timeseries.bigquery.http.Responses.sendError;

import java.io.IOException;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;

import org.opennms.timeseries.bigquery.RemoteWriter;
import org.opennms.timeseries.bigquery.StorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.ImmutableList;

import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.StatusCodes;
import prometheus.PrometheusRemote;
import prometheus.PrometheusTypes;

/**
 * Handles remote write requests by sending the time series to every writer in parallel.
 * Failures of a writer are logged and counted but are not reported back to the sender.
 * Must run on a worker thread with blocking IO enabled.
 */
public class WriteHandler implements HttpHandler {
    private static final Logger LOG = LoggerFactory.getLogger(WriteHandler.class);

    private final List<RemoteWriter> writers;
    private final ExecutorService executor;
    private final FrontEndMetrics metrics;

    public WriteHandler(final List<RemoteWriter> writers, final ExecutorService executor, final FrontEndMetrics metrics) {
        this.writers = ImmutableList.copyOf(writers);
        this.executor = Objects.requireNonNull(executor);
        this.metrics = Objects.requireNonNull(metrics);
    }

    @Override
    public void handleRequest(final HttpServerExchange exchange) {
        LOG.debug("write request received: method={}, path={}", exchange.getRequestMethod(), exchange.getRequestPath());
        final long begin = System.nanoTime();

        final byte[] compressed;
        try {
            compressed = exchange.getInputStream().readAllBytes();
        } catch (IOException e) {
            LOG.error("read error", e);
            metrics.writeError();
            sendError(exchange, StatusCodes.INTERNAL_SERVER_ERROR, e.getMessage());
            return;
        }

        final PrometheusRemote.WriteRequest request;
        try {
            request = RemoteStorageCodec.decodeWriteRequest(compressed);
        } catch (IOException e) {
            LOG.error("decode error: {}", e.getMessage());
            metrics.writeError();
            sendError(exchange, StatusCodes.BAD_REQUEST, e.getMessage());
            return;
        }
        metrics.receivedSamples(countSamples(request.getTimeseriesList()));

        final CompletableFuture<?>[] sends = writers.stream()
                .map(w -> CompletableFuture.runAsync(() -> sendSamples(w, request.getTimeseriesList()), executor))
                .toArray(CompletableFuture[]::new);
        CompletableFuture.allOf(sends).join();

        exchange.setStatusCode(StatusCodes.OK);
        exchange.endExchange();

        final long duration = System.nanoTime() - begin;
        if (!writers.isEmpty()) {
            metrics.writeApiDuration(writers.get(0).getName(), duration);
        }
        LOG.debug("write request completed in {}ns", duration);
    }

    private void sendSamples(final RemoteWriter writer, final List<PrometheusTypes.TimeSeries> timeseries) {
        final long begin = System.nanoTime();
        final long samples = countSamples(timeseries);
        try {
            writer.write(timeseries);
            metrics.sentSamples(writer.getName(), samples);
            metrics.sentBatchDuration(writer.getName(), System.nanoTime() - begin);
            LOG.debug("sent {} samples to {}", samples, writer.getName());
        } catch (StorageException | RuntimeException e) {
            LOG.warn("error sending {} samples to remote storage {}", samples, writer.getName(), e);
            metrics.failedSamples(writer.getName(), samples);
            metrics.writeError();
        }
    }

    private static long countSamples(final List<PrometheusTypes.TimeSeries> timeseries) {
        return timeseries.stream().mapToLong(PrometheusTypes.TimeSeries::getSamplesCount).sum();
    }
}

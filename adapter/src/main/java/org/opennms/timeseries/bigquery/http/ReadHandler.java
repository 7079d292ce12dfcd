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

import org.opennms.timeseries.bigquery.RemoteReader;
import org.opennms.timeseries.bigquery.StorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.ImmutableList;

import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;
import io.undertow.util.StatusCodes;
import prometheus.PrometheusRemote;

/**
 * Handles remote read requests. Exactly one reader must be configured.
 */
public class ReadHandler implements HttpHandler {
    private static final Logger LOG = LoggerFactory.getLogger(ReadHandler.class);

    private final List<RemoteReader> readers;
    private final FrontEndMetrics metrics;

    public ReadHandler(final List<RemoteReader> readers, final FrontEndMetrics metrics) {
        this.readers = ImmutableList.copyOf(readers);
        this.metrics = Objects.requireNonNull(metrics);
    }

    @Override
    public void handleRequest(final HttpServerExchange exchange) {
        LOG.debug("read request received: method={}, path={}", exchange.getRequestMethod(), exchange.getRequestPath());
        final long begin = System.nanoTime();

        final byte[] compressed;
        try {
            compressed = exchange.getInputStream().readAllBytes();
        } catch (IOException e) {
            LOG.error("read error", e);
            metrics.readError();
            sendError(exchange, StatusCodes.INTERNAL_SERVER_ERROR, e.getMessage());
            return;
        }

        final PrometheusRemote.ReadRequest request;
        try {
            request = RemoteStorageCodec.decodeReadRequest(compressed);
        } catch (IOException e) {
            LOG.error("decode error: {}", e.getMessage());
            metrics.readError();
            sendError(exchange, StatusCodes.BAD_REQUEST, e.getMessage());
            return;
        }

        // TODO: merge the responses of several readers, needs a merge across ReadResponses
        if (readers.size() != 1) {
            metrics.readError();
            sendError(exchange, StatusCodes.INTERNAL_SERVER_ERROR, String.format("expected exactly one reader, found %d readers", readers.size()));
            return;
        }
        final RemoteReader reader = readers.get(0);

        final byte[] data;
        try {
            data = RemoteStorageCodec.encodeReadResponse(reader.read(request));
        } catch (StorageException | IOException e) {
            LOG.warn("error executing query {} on {}", request, reader.getName(), e);
            metrics.readError();
            sendError(exchange, StatusCodes.INTERNAL_SERVER_ERROR, e.getMessage());
            return;
        }

        exchange.setStatusCode(StatusCodes.OK);
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, RemoteStorageCodec.PROTOBUF_CONTENT_TYPE);
        exchange.getResponseHeaders().put(Headers.CONTENT_ENCODING, RemoteStorageCodec.SNAPPY_ENCODING);
        try {
            exchange.getOutputStream().write(data);
        } catch (IOException e) {
            LOG.warn("error writing response of {}", reader.getName(), e);
            metrics.readError();
            return;
        }
        exchange.endExchange();

        final long duration = System.nanoTime() - begin;
        metrics.readApiDuration(reader.getName(), duration);
        LOG.debug("read request completed in {}ns", duration);
    }
}

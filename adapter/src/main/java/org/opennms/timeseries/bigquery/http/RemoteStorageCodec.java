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

import java.io.IOException;

import org.xerial.snappy.Snappy;

import prometheus.PrometheusRemote;

/**
 * Wire format of the remote read/write protocol: protobuf messages in snappy block format.
 */
public final class RemoteStorageCodec {

    public static final String PROTOBUF_CONTENT_TYPE = "application/x-protobuf";
    public static final String SNAPPY_ENCODING = "snappy";

    private RemoteStorageCodec() {
    }

    public static PrometheusRemote.WriteRequest decodeWriteRequest(final byte[] compressed) throws IOException {
        return PrometheusRemote.WriteRequest.parseFrom(uncompress(compressed));
    }

    public static PrometheusRemote.ReadRequest decodeReadRequest(final byte[] compressed) throws IOException {
        return PrometheusRemote.ReadRequest.parseFrom(uncompress(compressed));
    }

    public static byte[] encodeReadResponse(final PrometheusRemote.ReadResponse response) throws IOException {
        return Snappy.compress(response.toByteArray());
    }

    private static byte[] uncompress(final byte[] compressed) throws IOException {
        if (!Snappy.isValidCompressedBuffer(compressed)) {
            throw new IOException("Request body is not a valid snappy block");
        }
        return Snappy.uncompress(compressed);
    }
}

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

import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Properties;
import java.util.StringJoiner;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public class BigQueryStorageConfig {
    public static final String ENV_PROJECT_ID = "PROMBQ_GCP_PROJECT_ID";
    public static final String ENV_CREDENTIALS_FILE = "PROMBQ_GCP_JSON";
    public static final String ENV_DATASET = "PROMBQ_DATASET";
    public static final String ENV_TABLE = "PROMBQ_TABLE";
    public static final String ENV_TIMEOUT = "PROMBQ_TIMEOUT";
    public static final String ENV_LISTEN = "PROMBQ_LISTEN";
    public static final String ENV_TELEMETRY = "PROMBQ_TELEMETRY";
    public static final String ENV_MAX_CONCURRENT_CALLS = "PROMBQ_MAX_CONCURRENT_CALLS";

    // Go style durations as used by the Prometheus tooling, e.g. 30s, 1m30s, 500ms
    private static final Pattern DURATION_PART = Pattern.compile("(\\d+)(ms|s|m|h)");

    private final String projectId;
    private final String credentialsFile;
    private final String datasetId;
    private final String tableId;
    private final long timeoutInMs;
    private final String listenAddress;
    private final String telemetryPath;
    private final int maxConcurrentWarehouseCalls;

    public BigQueryStorageConfig(Builder builder) {
        this.projectId = builder.projectId;
        this.credentialsFile = builder.credentialsFile;
        this.datasetId = Objects.requireNonNull(builder.datasetId, "datasetId");
        this.tableId = Objects.requireNonNull(builder.tableId, "tableId");
        if (builder.timeoutInMs <= 0) {
            throw new IllegalArgumentException("timeoutInMs must be positive, got " + builder.timeoutInMs);
        }
        this.timeoutInMs = builder.timeoutInMs;
        this.listenAddress = Objects.requireNonNull(builder.listenAddress);
        this.telemetryPath = Objects.requireNonNull(builder.telemetryPath);
        if (builder.maxConcurrentWarehouseCalls < 1) {
            throw new IllegalArgumentException("maxConcurrentWarehouseCalls must be at least 1, got " + builder.maxConcurrentWarehouseCalls);
        }
        this.maxConcurrentWarehouseCalls = builder.maxConcurrentWarehouseCalls;
    }

    /**
     * Reads the configuration from the {@code PROMBQ_*} environment variables. A system property with the
     * lower case name and {@code .} instead of {@code _} (e.g. {@code prombq.dataset}) takes precedence.
     *
     * @throws IllegalArgumentException if a required setting is missing or a value cannot be parsed
     */
    public static BigQueryStorageConfig fromEnvironment(final Map<String, String> env, final Properties props) {
        final Builder builder = builder();
        lookup(ENV_PROJECT_ID, env, props).ifPresent(builder::projectId);
        lookup(ENV_CREDENTIALS_FILE, env, props).ifPresent(builder::credentialsFile);
        builder.datasetId(lookup(ENV_DATASET, env, props)
                .orElseThrow(() -> new IllegalArgumentException(ENV_DATASET + " is required")));
        builder.tableId(lookup(ENV_TABLE, env, props)
                .orElseThrow(() -> new IllegalArgumentException(ENV_TABLE + " is required")));
        lookup(ENV_TIMEOUT, env, props).ifPresent(t -> builder.timeoutInMs(parseDuration(t).toMillis()));
        lookup(ENV_LISTEN, env, props).ifPresent(builder::listenAddress);
        lookup(ENV_TELEMETRY, env, props).ifPresent(builder::telemetryPath);
        lookup(ENV_MAX_CONCURRENT_CALLS, env, props).ifPresent(n -> builder.maxConcurrentWarehouseCalls(Integer.parseInt(n)));

        final BigQueryStorageConfig config = builder.build();
        if (!config.hasCredentialsFile() && !config.hasProjectId()) {
            throw new IllegalArgumentException(ENV_PROJECT_ID + " is required when " + ENV_CREDENTIALS_FILE + " is not provided");
        }
        return config;
    }

    private static Optional<String> lookup(final String envName, final Map<String, String> env, final Properties props) {
        final String propertyName = envName.toLowerCase().replace('_', '.');
        String value = props.getProperty(propertyName);
        if (value == null || value.isBlank()) {
            value = env.get(envName);
        }
        return value == null || value.isBlank() ? Optional.empty() : Optional.of(value.trim());
    }

    public static Duration parseDuration(final String value) {
        final Matcher m = DURATION_PART.matcher(value);
        Duration duration = Duration.ZERO;
        int end = 0;
        while (m.find()) {
            if (m.start() != end) {
                break;
            }
            final long amount = Long.parseLong(m.group(1));
            switch (m.group(2)) {
                case "ms":
                    duration = duration.plusMillis(amount);
                    break;
                case "s":
                    duration = duration.plusSeconds(amount);
                    break;
                case "m":
                    duration = duration.plusMinutes(amount);
                    break;
                default:
                    duration = duration.plusHours(amount);
            }
            end = m.end();
        }
        if (end == 0 || end != value.length()) {
            throw new IllegalArgumentException("Invalid duration: '" + value + "'");
        }
        return duration;
    }

    public String getProjectId() {
        return projectId;
    }

    public boolean hasProjectId() {
        return projectId != null && projectId.trim().length() > 0;
    }

    public String getCredentialsFile() {
        return credentialsFile;
    }

    public boolean hasCredentialsFile() {
        return credentialsFile != null && credentialsFile.trim().length() > 0;
    }

    public String getDatasetId() {
        return datasetId;
    }

    public String getTableId() {
        return tableId;
    }

    public long getTimeoutInMs() {
        return timeoutInMs;
    }

    public String getListenAddress() {
        return listenAddress;
    }

    /** Host part of the listen address, all interfaces if omitted. */
    public String getListenHost() {
        final int idx = listenAddress.lastIndexOf(':');
        final String host = idx < 0 ? "" : listenAddress.substring(0, idx);
        return host.isEmpty() ? "0.0.0.0" : host;
    }

    public int getListenPort() {
        final int idx = listenAddress.lastIndexOf(':');
        try {
            return Integer.parseInt(listenAddress.substring(idx + 1));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid listen address: '" + listenAddress + "'", e);
        }
    }

    public String getTelemetryPath() {
        return telemetryPath;
    }

    public int getMaxConcurrentWarehouseCalls() {
        return maxConcurrentWarehouseCalls;
    }

    public static Builder builder() {
        return new Builder();
    }

    public final static class Builder {
        private String projectId = null;
        private String credentialsFile = null;
        private String datasetId;
        private String tableId;
        private long timeoutInMs = 30000;
        private String listenAddress = ":9201";
        private String telemetryPath = "/metrics";
        private int maxConcurrentWarehouseCalls = 10;

        public Builder projectId(final String projectId) {
            this.projectId = projectId;
            return this;
        }

        public Builder credentialsFile(final String credentialsFile) {
            this.credentialsFile = credentialsFile;
            return this;
        }

        public Builder datasetId(final String datasetId) {
            this.datasetId = datasetId;
            return this;
        }

        public Builder tableId(final String tableId) {
            this.tableId = tableId;
            return this;
        }

        public Builder timeoutInMs(final long timeoutInMs) {
            this.timeoutInMs = timeoutInMs;
            return this;
        }

        public Builder listenAddress(final String listenAddress) {
            this.listenAddress = listenAddress;
            return this;
        }

        public Builder telemetryPath(final String telemetryPath) {
            this.telemetryPath = telemetryPath;
            return this;
        }

        public Builder maxConcurrentWarehouseCalls(final int maxConcurrentWarehouseCalls) {
            this.maxConcurrentWarehouseCalls = maxConcurrentWarehouseCalls;
            return this;
        }

        public BigQueryStorageConfig build() {
            return new BigQueryStorageConfig(this);
        }
    }

    @Override
    public String toString() {
        return new StringJoiner(", ", BigQueryStorageConfig.class.getSimpleName() + "[", "]")
                .add("projectId='" + projectId + "'")
                .add("credentialsFile='" + credentialsFile + "'")
                .add("datasetId='" + datasetId + "'")
                .add("tableId='" + tableId + "'")
                .add("timeoutInMs=" + timeoutInMs)
                .add("listenAddress='" + listenAddress + "'")
                .add("telemetryPath='" + telemetryPath + "'")
                .add("maxConcurrentWarehouseCalls=" + maxConcurrentWarehouseCalls)
                .toString();
    }
}

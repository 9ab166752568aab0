/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.mars.zephyr.agent.observability;

import dev.mars.zephyr.agent.config.AgentConfig;
import io.opentelemetry.exporter.otlp.trace.OtlpGrpcSpanExporter;
import io.opentelemetry.exporter.prometheus.PrometheusHttpServer;
import io.opentelemetry.sdk.OpenTelemetrySdk;
import io.opentelemetry.sdk.metrics.SdkMeterProvider;
import io.opentelemetry.sdk.resources.Resource;
import io.opentelemetry.sdk.trace.SdkTracerProvider;
import io.opentelemetry.sdk.trace.export.BatchSpanProcessor;
import io.vertx.core.VertxOptions;
import io.vertx.tracing.opentelemetry.OpenTelemetryOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Installs the global OpenTelemetry SDK before the executor's Vert.x instance
 * is created. Every WebClient request then produces a client span: task-queue
 * polls, accept/status/complete/fail reports, executor API calls for devices
 * and workspaces, and requests to the Claude messages endpoint. Spans go to
 * the OTLP collector at {@code zephyr.agent.telemetry.otlp.endpoint}.
 *
 * <p>The counters and gauges of {@link AgentMetrics} are read through the
 * Prometheus endpoint on {@code zephyr.agent.telemetry.prometheus.port}.
 * Spans carry the agent name, provider mode and model as resource attributes
 * so traces from several executors can be told apart.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 * @version 1.0 (OpenTelemetry)
 */
public final class AgentTelemetryConfig {

    private static final Logger logger = LoggerFactory.getLogger(AgentTelemetryConfig.class);

    private AgentTelemetryConfig() {
    }

    /**
     * Returns {@code options} with tracing switched on, or untouched when
     * {@code zephyr.agent.telemetry.enabled} is false.
     *
     * @param agentName becomes {@code service.instance.id}
     */
    public static VertxOptions configure(VertxOptions options, String agentName) {
        AgentConfig config = AgentConfig.get();
        if (!config.isTelemetryEnabled()) {
            logger.info("Telemetry disabled");
            return options;
        }

        Resource resource = Resource.getDefault().toBuilder()
                .put("service.name", "zephyr-agent")
                .put("service.version", config.getVersion())
                .put("service.instance.id", agentName)
                .put("zephyr.provider.mode", config.getProviderMode())
                .put("zephyr.provider.model", config.getProviderModel())
                .build();

        OtlpGrpcSpanExporter spanExporter = OtlpGrpcSpanExporter.builder()
                .setEndpoint(config.getOtlpEndpoint())
                .build();

        SdkTracerProvider tracerProvider = SdkTracerProvider.builder()
                .addSpanProcessor(BatchSpanProcessor.builder(spanExporter).build())
                .setResource(resource)
                .build();

        PrometheusHttpServer prometheusReader = PrometheusHttpServer.builder()
                .setPort(config.getPrometheusPort())
                .build();

        SdkMeterProvider meterProvider = SdkMeterProvider.builder()
                .setResource(resource)
                .registerMetricReader(prometheusReader)
                .build();

        OpenTelemetrySdk openTelemetry = OpenTelemetrySdk.builder()
                .setTracerProvider(tracerProvider)
                .setMeterProvider(meterProvider)
                .buildAndRegisterGlobal();

        logger.info("Telemetry enabled (prometheus port {}, otlp {})", config.getPrometheusPort(), config.getOtlpEndpoint());
        return options.setTracingOptions(new OpenTelemetryOptions(openTelemetry));
    }
}

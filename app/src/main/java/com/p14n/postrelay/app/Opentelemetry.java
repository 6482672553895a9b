package com.p14n.postrelay.app;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.trace.propagation.W3CTraceContextPropagator;
import io.opentelemetry.context.propagation.ContextPropagators;
import io.opentelemetry.exporter.otlp.trace.OtlpGrpcSpanExporter;
import io.opentelemetry.sdk.OpenTelemetrySdk;
import io.opentelemetry.sdk.metrics.SdkMeterProvider;
import io.opentelemetry.sdk.resources.Resource;
import io.opentelemetry.sdk.trace.SdkTracerProvider;
import io.opentelemetry.sdk.trace.export.BatchSpanProcessor;

public class Opentelemetry {
        private static final AttributeKey<String> SERVICE_NAME = AttributeKey.stringKey("service.name");

        public static OpenTelemetrySdk create(String serviceName, String collectorEndpoint) {
                Resource resource = Resource.getDefault()
                                .merge(Resource.create(Attributes.of(SERVICE_NAME, serviceName)));

                SdkMeterProvider meterProvider = SdkMeterProvider.builder()
                                .setResource(resource)
                                .build();

                OtlpGrpcSpanExporter spanExporter = OtlpGrpcSpanExporter.builder()
                                .setEndpoint(collectorEndpoint)
                                .build();

                SdkTracerProvider tracerProvider = SdkTracerProvider.builder()
                                .addSpanProcessor(BatchSpanProcessor.builder(spanExporter).build())
                                .setResource(resource)
                                .build();

                return OpenTelemetrySdk.builder()
                                .setMeterProvider(meterProvider)
                                .setTracerProvider(tracerProvider)
                                .setPropagators(ContextPropagators.create(W3CTraceContextPropagator.getInstance()))
                                .build();
        }

        public static OpenTelemetry createOrNoop(String serviceName, String collectorEndpoint) {
                if (collectorEndpoint == null || collectorEndpoint.isBlank()) {
                        return OpenTelemetry.noop();
                }
                return create(serviceName, collectorEndpoint);
        }
}

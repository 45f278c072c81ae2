package ca.gc.cra.safestream.infrastructure.metrics;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.Meter;
import io.opentelemetry.api.metrics.MeterProvider;
import io.opentelemetry.exporter.otlp.metrics.OtlpGrpcMetricExporter;
import io.opentelemetry.sdk.common.CompletableResultCode;
import io.opentelemetry.sdk.metrics.SdkMeterProvider;
import io.opentelemetry.sdk.metrics.export.MetricReader;
import io.opentelemetry.sdk.metrics.export.PeriodicMetricReader;
import io.opentelemetry.sdk.resources.Resource;
import java.lang.management.ManagementFactory;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the OpenTelemetry meter used by {@link OpenTelemetryMetricsAdapter}.
 */
final class OpenTelemetryBootstrap {
  private static final Logger log = LoggerFactory.getLogger(OpenTelemetryBootstrap.class);
  private static final String INSTRUMENTATION_SCOPE = "ca.gc.cra.safestream";
  private static final Duration SHUTDOWN_TIMEOUT = Duration.ofSeconds(5);
  private static final AttributeKey<String> SERVICE_NAME = AttributeKey.stringKey("service.name");
  private static final AttributeKey<String> SERVICE_NAMESPACE = AttributeKey.stringKey("service.namespace");
  private static final AttributeKey<String> SERVICE_INSTANCE_ID = AttributeKey.stringKey("service.instance.id");

  private OpenTelemetryBootstrap() {
    // Utility class
  }

  /**
   * Initializes metrics export; any failure degrades to a noop meter.
   *
   * @param exporter exporter mode
   * @param endpoint OTLP endpoint, used only for {@link ExporterMode#OTLP}
   * @param interval export interval
   */
  static BootstrapResult initialize(ExporterMode exporter, String endpoint, Duration interval) {
    Objects.requireNonNull(exporter, "exporter");
    if (exporter == ExporterMode.NONE) {
      log.info("OpenTelemetry metrics exporter disabled (exporter=none)");
      return BootstrapResult.noop();
    }
    try {
      OtlpGrpcMetricExporter otlp = OtlpGrpcMetricExporter.builder()
          .setEndpoint(Objects.requireNonNull(endpoint, "endpoint"))
          .build();
      MetricReader reader = PeriodicMetricReader.builder(otlp).setInterval(interval).build();
      BootstrapResult result = build(reader);
      log.info("OpenTelemetry metrics exporting to {} every {}", endpoint, interval);
      return result;
    } catch (RuntimeException ex) {
      log.error("Failed to initialize OpenTelemetry metrics; using noop meter", ex);
      return BootstrapResult.noop();
    }
  }

  static BootstrapResult forTesting(MetricReader reader) {
    return build(Objects.requireNonNull(reader, "reader"));
  }

  private static BootstrapResult build(MetricReader reader) {
    SdkMeterProvider provider = SdkMeterProvider.builder()
        .setResource(buildResource())
        .registerMetricReader(reader)
        .build();
    return new BootstrapResult(provider.get(INSTRUMENTATION_SCOPE), provider);
  }

  private static Resource buildResource() {
    Attributes attributes = Attributes.builder()
        .put(SERVICE_NAME, "safestream")
        .put(SERVICE_NAMESPACE, "ca.gc.cra")
        .put(SERVICE_INSTANCE_ID, ManagementFactory.getRuntimeMXBean().getName())
        .build();
    return Resource.getDefault().merge(Resource.create(attributes));
  }

  enum ExporterMode {
    OTLP,
    NONE;

    /**
     * Parses an exporter name.
     *
     * @throws IllegalArgumentException for names other than {@code otlp} and {@code none}
     */
    static ExporterMode from(String raw) {
      if (raw == null || raw.isBlank()) {
        return NONE;
      }
      return switch (raw.trim().toLowerCase(Locale.ROOT)) {
        case "none" -> NONE;
        case "otlp" -> OTLP;
        default -> throw new IllegalArgumentException("Unknown metrics exporter '" + raw + "'");
      };
    }
  }

  static final class BootstrapResult implements AutoCloseable {
    private final Meter meter;
    private final SdkMeterProvider provider;

    private BootstrapResult(Meter meter, SdkMeterProvider provider) {
      this.meter = meter;
      this.provider = provider;
    }

    static BootstrapResult noop() {
      return new BootstrapResult(MeterProvider.noop().get(INSTRUMENTATION_SCOPE), null);
    }

    Meter meter() {
      return meter;
    }

    boolean isNoop() {
      return provider == null;
    }

    void forceFlush() {
      if (provider == null) {
        return;
      }
      CompletableResultCode result = provider.forceFlush().join(SHUTDOWN_TIMEOUT.toSeconds(), TimeUnit.SECONDS);
      if (!result.isSuccess()) {
        log.warn("OpenTelemetry metrics flush did not complete within {}", SHUTDOWN_TIMEOUT);
      }
    }

    @Override
    public void close() {
      if (provider == null) {
        return;
      }
      CompletableResultCode shutdown = provider.shutdown().join(SHUTDOWN_TIMEOUT.toSeconds(), TimeUnit.SECONDS);
      if (!shutdown.isSuccess()) {
        log.warn("Timed out waiting for OpenTelemetry meter provider shutdown");
      }
    }
  }
}

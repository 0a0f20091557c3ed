/**
 * Metrics adapters bridging {@link ca.gc.cra.harness.application.port.MetricsPort} to OpenTelemetry.
 * <p><strong>Concurrency:</strong> Adapters are thread-safe and cache instruments per metric key.</p>
 * <p><strong>Metrics:</strong> Publishes under the {@code process.*}, {@code pool.*}, {@code buffer.*} and
 * {@code memory.*} namespaces.</p>
 */
package ca.gc.cra.harness.infrastructure.metrics;

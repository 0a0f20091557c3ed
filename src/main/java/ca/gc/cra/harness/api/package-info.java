/**
 * Command-line entry points: {@code exec}, {@code await} and {@code stats}.
 * <p><strong>Role:</strong> Driving adapters; parse {@code key=value} arguments, merge configuration, wire
 * services through {@link ca.gc.cra.harness.config.CompositionRoot} and map outcomes to
 * {@link ca.gc.cra.harness.api.ExitCode}.</p>
 * <p><strong>Concurrency:</strong> Commands run on the calling thread; the supervisor and pool start their own
 * daemon threads and are torn down before the command returns.</p>
 */
package ca.gc.cra.harness.api;

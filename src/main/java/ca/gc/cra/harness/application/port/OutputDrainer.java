package ca.gc.cra.harness.application.port;

import java.io.InputStream;
import java.util.function.Consumer;

/**
 * Port that continuously reads a child's output and hands decoded text to a consumer.
 *
 * <p>Draining keeps the child from blocking on a full pipe. Implementations run in the background and
 * stop at end of stream.</p>
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface OutputDrainer {
  /**
   * Starts draining {@code stream} until end of stream.
   *
   * @param pid owning process id, used for thread naming and log context
   * @param stream merged stdout/stderr of the child
   * @param sink receiver of UTF-8 decoded chunks
   */
  void drain(long pid, InputStream stream, Consumer<String> sink);
}

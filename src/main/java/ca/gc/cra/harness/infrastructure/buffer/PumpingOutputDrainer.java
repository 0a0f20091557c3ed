package ca.gc.cra.harness.infrastructure.buffer;

import ca.gc.cra.harness.application.port.OutputDrainer;
import ca.gc.cra.harness.infrastructure.exec.ExecutorFactories;
import ca.gc.cra.harness.logging.Logs;
import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.concurrent.ThreadFactory;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * {@link OutputDrainer} that reads each child's output on its own daemon thread.
 *
 * <p>Bytes are decoded as UTF-8 incrementally, so a multi-byte character split across two reads is
 * delivered whole. Malformed input is replaced rather than rejected.</p>
 *
 * @since 0.1.0
 */
public final class PumpingOutputDrainer implements OutputDrainer {
  private static final Logger log = LoggerFactory.getLogger(PumpingOutputDrainer.class);
  private static final int DEFAULT_BUFFER_SIZE = 8 * 1024;
  private static final int LOG_PREVIEW_BYTES = 256;

  private final BufferPool buffers;
  private final ThreadFactory threads;

  public PumpingOutputDrainer() {
    this(new BufferPool(DEFAULT_BUFFER_SIZE, 16));
  }

  public PumpingOutputDrainer(BufferPool buffers) {
    this.buffers = Objects.requireNonNull(buffers, "buffers");
    this.threads = ExecutorFactories.daemonThreads("harness-output", null);
  }

  @Override
  public void drain(long pid, InputStream stream, Consumer<String> sink) {
    Objects.requireNonNull(stream, "stream");
    Objects.requireNonNull(sink, "sink");
    Thread pump = threads.newThread(() -> pump(pid, stream, sink));
    pump.start();
  }

  void pump(long pid, InputStream stream, Consumer<String> sink) {
    MDC.put("pid", Long.toString(pid));
    CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
        .onMalformedInput(CodingErrorAction.REPLACE)
        .onUnmappableCharacter(CodingErrorAction.REPLACE);
    try (InputStream in = stream; BufferPool.Lease lease = buffers.acquire()) {
      byte[] array = lease.array();
      ByteBuffer pending = ByteBuffer.allocate(array.length + 8);
      CharBuffer chars = CharBuffer.allocate(array.length + 8);
      int read;
      while ((read = in.read(array)) != -1) {
        pending.put(array, 0, read);
        pending.flip();
        decoder.decode(pending, chars, false);
        pending.compact();
        emit(chars, sink);
      }
      pending.flip();
      decoder.decode(pending, chars, true);
      decoder.flush(chars);
      emit(chars, sink);
    } catch (IOException ex) {
      // Closing the process streams on exit surfaces here; nothing left to read.
      log.debug("Output stream of pid {} closed: {}", pid, ex.getMessage());
    } catch (RuntimeException ex) {
      log.warn("Output consumer for pid {} failed; output is no longer delivered", pid, ex);
    } finally {
      MDC.remove("pid");
    }
  }

  private static void emit(CharBuffer chars, Consumer<String> sink) {
    chars.flip();
    if (chars.hasRemaining()) {
      String chunk = chars.toString();
      if (log.isTraceEnabled()) {
        log.trace("output {}", Logs.preview(chunk, LOG_PREVIEW_BYTES));
      }
      sink.accept(chunk);
    }
    chars.clear();
  }
}

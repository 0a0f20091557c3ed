package ca.gc.cra.harness.infrastructure.memory;

import ca.gc.cra.harness.application.port.MemoryProbe;
import ca.gc.cra.harness.domain.pool.MemorySample;
import java.io.IOException;
import java.lang.management.ManagementFactory;
import java.lang.management.MemoryMXBean;
import java.lang.management.MemoryUsage;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link MemoryProbe} backed by the platform {@link MemoryMXBean}.
 * <p><strong>Role:</strong> Adapter on the infrastructure side of the memory port.</p>
 * <p>Heap figures come from the MX bean. Resident set size is read from the {@code VmRSS} line of
 * {@code /proc/self/status}; elsewhere it is reported as {@code -1}.</p>
 * <p><strong>Thread-safety:</strong> Stateless apart from a one-shot warning flag; safe for concurrent use.</p>
 *
 * @since 0.1.0
 */
public final class JvmMemoryProbe implements MemoryProbe {
  private static final Logger log = LoggerFactory.getLogger(JvmMemoryProbe.class);
  private static final Path PROC_STATUS = Paths.get("/proc/self/status");

  private final MemoryMXBean memoryBean;
  private final Path statusFile;
  private final AtomicBoolean rssWarned = new AtomicBoolean();

  public JvmMemoryProbe() {
    this(ManagementFactory.getMemoryMXBean(), PROC_STATUS);
  }

  JvmMemoryProbe(MemoryMXBean memoryBean, Path statusFile) {
    this.memoryBean = Objects.requireNonNull(memoryBean, "memoryBean");
    this.statusFile = Objects.requireNonNull(statusFile, "statusFile");
  }

  @Override
  public MemorySample sample() {
    MemoryUsage heap = memoryBean.getHeapMemoryUsage();
    return new MemorySample(heap.getUsed(), heap.getCommitted(), readRss());
  }

  @Override
  public boolean requestGc() {
    memoryBean.gc();
    return true;
  }

  long readRss() {
    if (!Files.isReadable(statusFile)) {
      return -1L;
    }
    try {
      List<String> lines = Files.readAllLines(statusFile, StandardCharsets.US_ASCII);
      for (String line : lines) {
        if (line.startsWith("VmRSS:")) {
          return parseKilobytes(line.substring("VmRSS:".length()));
        }
      }
    } catch (IOException | NumberFormatException ex) {
      if (rssWarned.compareAndSet(false, true)) {
        log.warn("Unable to read resident set size from {}", statusFile, ex);
      }
    }
    return -1L;
  }

  private static long parseKilobytes(String value) {
    String trimmed = value.trim().toLowerCase(Locale.ROOT);
    if (trimmed.endsWith("kb")) {
      trimmed = trimmed.substring(0, trimmed.length() - 2).trim();
    }
    return Long.parseLong(trimmed) * 1024L;
  }
}

package ca.gc.cra.harness.infrastructure.buffer;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

class PumpingOutputDrainerTest {

  @Test
  void multiByteCharactersSplitAcrossReadsAreDeliveredWhole() {
    byte[] bytes = "café ✓ done".getBytes(StandardCharsets.UTF_8);
    BufferPool pool = new BufferPool(4, 2);
    PumpingOutputDrainer drainer = new PumpingOutputDrainer(pool);
    List<String> chunks = new ArrayList<>();

    drainer.pump(42L, new ByteArrayInputStream(bytes), chunks::add);

    assertEquals("café ✓ done", String.join("", chunks));
    assertEquals(1, pool.idleCount(), "lease returned to the pool");
  }

  @Test
  void buffersAreReusedAcrossPumps() {
    BufferPool pool = new BufferPool(16, 4);
    PumpingOutputDrainer drainer = new PumpingOutputDrainer(pool);
    List<String> chunks = new ArrayList<>();

    drainer.pump(1L, stream("one"), chunks::add);
    drainer.pump(2L, stream("two"), chunks::add);

    assertEquals(List.of("one", "two"), chunks);
    assertEquals(1L, pool.allocations());
  }

  @Test
  void drainRunsOnBackgroundThread() throws InterruptedException {
    PumpingOutputDrainer drainer = new PumpingOutputDrainer();
    List<String> chunks = new CopyOnWriteArrayList<>();
    CountDownLatch done = new CountDownLatch(1);

    drainer.drain(7L, stream("background"), chunk -> {
      chunks.add(Thread.currentThread().getName() + ":" + chunk);
      done.countDown();
    });

    assertTrue(done.await(5, TimeUnit.SECONDS));
    assertEquals(1, chunks.size());
    assertTrue(chunks.get(0).startsWith("harness-output-"));
  }

  private static InputStream stream(String text) {
    return new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8));
  }
}

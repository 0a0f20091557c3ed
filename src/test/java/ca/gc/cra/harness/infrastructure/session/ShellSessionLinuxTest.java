package ca.gc.cra.harness.infrastructure.session;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.harness.application.pool.ResourcePool;
import ca.gc.cra.harness.application.port.ClockPort;
import ca.gc.cra.harness.application.port.ExitHookRegistry;
import ca.gc.cra.harness.application.port.MetricsPort;
import ca.gc.cra.harness.application.process.ProcessSupervisor;
import ca.gc.cra.harness.application.wait.Waiter;
import ca.gc.cra.harness.config.PoolSettings;
import ca.gc.cra.harness.domain.wait.WaitOptions;
import ca.gc.cra.harness.infrastructure.buffer.PumpingOutputDrainer;
import ca.gc.cra.harness.infrastructure.compress.GzipCompressionCodec;
import ca.gc.cra.harness.infrastructure.exec.ExecutorFactories;
import ca.gc.cra.harness.infrastructure.exec.PosixSignalSender;
import ca.gc.cra.harness.infrastructure.exec.ProcessBuilderLauncher;
import ca.gc.cra.harness.infrastructure.memory.JvmMemoryProbe;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

@EnabledOnOs(OS.LINUX)
class ShellSessionLinuxTest {
  @TempDir
  Path workDir;

  private Waiter waiter;
  private ProcessSupervisor supervisor;
  private ResourcePool<SessionConfig, ShellSession> pool;

  @BeforeEach
  void setUp() {
    waiter = new Waiter();
    supervisor = new ProcessSupervisor(
        new ProcessBuilderLauncher(),
        new PosixSignalSender(),
        new PumpingOutputDrainer(),
        ExitHookRegistry.NONE,
        waiter,
        ClockPort.SYSTEM,
        MetricsPort.NO_OP);
    pool = ResourcePool.builder(new ShellSessionFactory(supervisor, waiter))
        .poolSettings(PoolSettings.defaults().withMaxPoolSize(2))
        .memoryProbe(new JvmMemoryProbe())
        .compressionCodec(new GzipCompressionCodec())
        .scheduler(ExecutorFactories.newMaintenanceScheduler("session-test"))
        .build();
  }

  @AfterEach
  void tearDown() throws InterruptedException {
    pool.destroy();
    supervisor.shutdown(Duration.ofSeconds(2));
    supervisor.destroy();
  }

  @Test
  void sessionRunsCommandsInConfiguredDirectoryAndEnvironment() throws Exception {
    SessionConfig config = SessionConfig.defaults()
        .withWorkingDirectory(workDir)
        .withEnvironment(Map.of("GREETING", "bonjour"));
    ShellSession session = pool.acquire(config);

    session.sendLine("echo \"$GREETING from $(pwd)\"");

    assertTrue(session.waitForOutput("bonjour from " + workDir.toRealPath(), WaitOptions.defaults()).success(),
        session.output());
  }

  @Test
  void releasedSessionIsClearedAndReused() throws Exception {
    ShellSession first = pool.acquire(SessionConfig.defaults());
    first.sendLine("echo first-run");
    assertTrue(first.waitForOutput("first-run", WaitOptions.defaults()).success());

    pool.release(first);
    ShellSession second = pool.acquire(SessionConfig.defaults());

    assertSame(first, second);
    assertEquals("", second.output());
    assertEquals(1, pool.getMetrics().pool().totalCreated());
  }

  @Test
  void exitedShellIsDestroyedOnRelease() throws Exception {
    ShellSession session = pool.acquire(SessionConfig.defaults());
    session.sendLine("exit 0");
    assertTrue(waiter.waitForProcessExit(session::isAlive, WaitOptions.processExitDefaults()).success());

    pool.release(session);

    assertEquals(0, pool.getMetrics().pool().total());
    assertEquals(1, pool.getMetrics().pool().resetFailures());
  }

  @Test
  void closeEscalatesToKillWhenTermIsIgnored() throws Exception {
    ShellSession session = ShellSession.start(supervisor, waiter,
        SessionConfig.defaults().withCloseTimeout(Duration.ofMillis(300)));
    session.sendLine("trap '' TERM; echo trapped");
    assertTrue(session.waitForOutput("trapped", WaitOptions.defaults()).success());

    session.close();

    assertTrue(waiter.waitForProcessExit(session::isAlive, WaitOptions.processExitDefaults()).success());
    assertFalse(session.isAlive());
  }
}

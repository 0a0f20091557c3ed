package ca.gc.cra.harness.infrastructure.exec;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.harness.application.port.ClockPort;
import ca.gc.cra.harness.application.port.ExitHookRegistry;
import ca.gc.cra.harness.application.port.MetricsPort;
import ca.gc.cra.harness.application.process.ProcessSupervisor;
import ca.gc.cra.harness.application.process.ProcessSupervisorListener;
import ca.gc.cra.harness.application.wait.Waiter;
import ca.gc.cra.harness.domain.process.ManagedProcess;
import ca.gc.cra.harness.domain.process.ProcessOptions;
import ca.gc.cra.harness.domain.process.ProcessStatus;
import ca.gc.cra.harness.domain.process.Signal;
import ca.gc.cra.harness.domain.wait.WaitOptions;
import ca.gc.cra.harness.infrastructure.buffer.PumpingOutputDrainer;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;

@EnabledOnOs(OS.LINUX)
class ProcessSupervisorLinuxTest {
  private ProcessSupervisor supervisor;
  private Waiter waiter;

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
  }

  @AfterEach
  void tearDown() throws InterruptedException {
    supervisor.shutdown(Duration.ofSeconds(2));
    supervisor.destroy();
  }

  @Test
  void capturesOutputAndExitCode() throws Exception {
    StringBuffer output = new StringBuffer();
    CompletableFuture<Integer> exitCode = new CompletableFuture<>();
    supervisor.addListener(new ProcessSupervisorListener() {
      @Override
      public void onProcessExited(ManagedProcess process, int code) {
        exitCode.complete(code);
      }
    });

    supervisor.start("sh", List.of("-c", "echo ready; exit 4"),
        ProcessOptions.defaults().withOutputConsumer(output::append));

    assertEquals(4, exitCode.get(10, TimeUnit.SECONDS));
    assertTrue(waiter.waitForOutput(output::toString, "ready", WaitOptions.defaults()).success());
  }

  @Test
  void termStopsCooperativeProcess() throws Exception {
    ManagedProcess process = supervisor.start("sleep", List.of("30"), ProcessOptions.defaults());

    assertTrue(supervisor.kill(process.pid(), Signal.TERM));

    assertTrue(waiter.waitForProcessExit(() -> supervisor.isRunning(process.pid()),
        WaitOptions.processExitDefaults()).success());
    assertTrue(supervisor.find(process.pid()).map(p -> p.status() == ProcessStatus.EXITED).orElse(true));
  }

  @Test
  void shutdownKillsProcessThatIgnoresTerm() throws Exception {
    ManagedProcess stubborn = supervisor.start("sh", List.of("-c", "trap '' TERM; sleep 30"),
        ProcessOptions.defaults());
    // let the shell install its trap before signalling
    Thread.sleep(300);

    int exited = supervisor.shutdown(Duration.ofSeconds(2));

    assertEquals(1, exited);
    assertFalse(supervisor.isRunning(stubborn.pid()));
    assertFalse(ProcessHandle.of(stubborn.pid()).map(ProcessHandle::isAlive).orElse(false));
  }
}

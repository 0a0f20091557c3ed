package ca.gc.cra.harness.infrastructure.exec;

import ca.gc.cra.harness.application.port.ProcessLauncher;
import ca.gc.cra.harness.domain.process.ProcessOptions;
import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Launches processes with {@link ProcessBuilder}.
 *
 * <p>Detached launches are prefixed with {@code setsid} when it is installed, which makes the child the
 * leader of a new session and process group whose id equals its pid. Without {@code setsid} the child
 * shares the JVM's group and signals target the pid and its descendants instead.</p>
 *
 * @since 0.1.0
 */
public final class ProcessBuilderLauncher implements ProcessLauncher {
  private static final Logger log = LoggerFactory.getLogger(ProcessBuilderLauncher.class);
  private static final List<Path> SETSID_CANDIDATES =
      List.of(Path.of("/usr/bin/setsid"), Path.of("/bin/setsid"));

  private final Optional<Path> setsid;

  public ProcessBuilderLauncher() {
    this(findSetsid());
  }

  /**
   * Creates a launcher with an explicit {@code setsid} location.
   *
   * @param setsid path to {@code setsid}; empty disables process-group creation
   */
  public ProcessBuilderLauncher(Optional<Path> setsid) {
    this.setsid = Objects.requireNonNull(setsid, "setsid");
  }

  @Override
  public LaunchedProcess launch(String command, List<String> args, ProcessOptions options) throws IOException {
    Objects.requireNonNull(command, "command");
    boolean ownGroup = options.detached() && setsid.isPresent();
    List<String> commandLine = new ArrayList<>(args.size() + 2);
    if (ownGroup) {
      commandLine.add(setsid.get().toString());
    }
    commandLine.add(command);
    commandLine.addAll(args);

    ProcessBuilder builder = new ProcessBuilder(commandLine);
    builder.redirectErrorStream(true);
    if (options.outputConsumer().isEmpty()) {
      builder.redirectOutput(ProcessBuilder.Redirect.DISCARD);
    }
    options.workingDirectory().map(Path::toFile).ifPresent(builder::directory);
    builder.environment().putAll(options.environment());

    Process process = builder.start();
    log.debug("Launched pid {}: {}", process.pid(), commandLine);
    return new LaunchedProcess(process, ownGroup ? OptionalLong.of(process.pid()) : OptionalLong.empty());
  }

  static Optional<Path> findSetsid() {
    if (File.separatorChar != '/') {
      return Optional.empty();
    }
    for (Path candidate : SETSID_CANDIDATES) {
      if (Files.isExecutable(candidate)) {
        return Optional.of(candidate);
      }
    }
    return Optional.empty();
  }
}

package ca.on.oicr.gsi.baker.cli;

import ca.on.oicr.gsi.baker.core.DeferredStorageFilesystem;
import ca.on.oicr.gsi.baker.core.RegistrationOrchestrator;
import java.io.IOException;
import java.nio.file.Path;
import picocli.CommandLine;

/** Subcommand to register a manifest's recipes with the configured workflow engine */
@CommandLine.Command(
    name = "register",
    description = "Register every recipe in a manifest and print the registered jobs")
public class CommandRegister extends BaseBatchCommand {
  @CommandLine.Option(
      names = {"-c", "--config", "--configuration"},
      required = true,
      description = "The JSON configuration of the workflow engine and automation hooks")
  private Path configuration;

  @Override
  protected RegistrationOrchestrator orchestrator() throws IOException {
    final var config = InputFiles.configuration(configuration);
    final var automation = config.startup();
    return new RegistrationOrchestrator(
        new DeferredStorageFilesystem(),
        loader(),
        config.getEngine(),
        automation,
        config.getBotTokenSecret());
  }
}

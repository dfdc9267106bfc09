package ca.on.oicr.gsi.baker.cli;

import java.util.concurrent.Callable;
import picocli.CommandLine;

/** Main entry point from the command line */
@CommandLine.Command(
    name = "baker",
    mixinStandardHelpOptions = true,
    version = "1.0",
    description = "Registers recipes with a workflow engine")
public class Main implements Callable<Integer> {
  static CommandLine commandLine() {
    final var cmd =
        new CommandLine(new Main())
            .addSubcommand("register", new CommandRegister())
            .addSubcommand("check", new CommandCheck());
    cmd.setExpandAtFiles(false);
    cmd.setExecutionStrategy(new CommandLine.RunLast());
    return cmd;
  }

  public static void main(String[] args) {
    System.exit(commandLine().execute(args));
  }

  @Override
  public Integer call() throws Exception {
    System.err.println("Please specify a command or --help to see what commands are available.");
    return 1;
  }
}

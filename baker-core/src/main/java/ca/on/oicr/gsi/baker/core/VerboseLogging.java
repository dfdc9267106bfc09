package ca.on.oicr.gsi.baker.core;

import ca.on.oicr.gsi.baker.Recipe;
import ca.on.oicr.gsi.baker.TaskBody;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Raises the recipe library's logger to its most verbose level while a task runs
 *
 * <p>The previous level is restored when the task finishes, whether it returns or throws.
 */
public final class VerboseLogging implements TaskBody {
  /**
   * Wrap a task body
   *
   * @param body the body to run verbosely
   */
  public static TaskBody wrap(TaskBody body) {
    return new VerboseLogging(body);
  }

  private final TaskBody body;

  private VerboseLogging(TaskBody body) {
    this.body = body;
  }

  @Override
  public Object run() throws Exception {
    final var logger = Logger.getLogger(Recipe.LOGGER_NAME);
    final var previous = logger.getLevel();
    logger.setLevel(Level.ALL);
    try {
      return body.run();
    } finally {
      logger.setLevel(previous);
    }
  }
}

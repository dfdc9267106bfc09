package ca.on.oicr.gsi.baker;

/** The work performed by a single task of a pipeline job */
@FunctionalInterface
public interface TaskBody {

  /**
   * Perform the work
   *
   * @return the task's result, passed along to the workflow engine
   * @throws Exception if the task fails; the workflow engine decides whether to retry it
   */
  Object run() throws Exception;
}

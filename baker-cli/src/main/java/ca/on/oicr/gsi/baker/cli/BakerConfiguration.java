package ca.on.oicr.gsi.baker.cli;

import ca.on.oicr.gsi.baker.AutomationHookRegistrar;
import ca.on.oicr.gsi.baker.WorkflowEngineClient;
import ca.on.oicr.gsi.baker.core.RegistrationOrchestrator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.Optional;

/** Configuration file format for registering recipes */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class BakerConfiguration {
  private AutomationHookRegistrar automation;
  private String botTokenSecret = RegistrationOrchestrator.DEFAULT_BOT_TOKEN_SECRET;
  private WorkflowEngineClient engine;

  public AutomationHookRegistrar getAutomation() {
    return automation;
  }

  public String getBotTokenSecret() {
    return botTokenSecret;
  }

  public WorkflowEngineClient getEngine() {
    return engine;
  }

  public void setAutomation(AutomationHookRegistrar automation) {
    this.automation = automation;
  }

  public void setBotTokenSecret(String botTokenSecret) {
    this.botTokenSecret = botTokenSecret;
  }

  public void setEngine(WorkflowEngineClient engine) {
    this.engine = engine;
  }

  /**
   * Check and initialise every configured plugin
   *
   * @return the automation hook registrar, if one is configured
   */
  public Optional<AutomationHookRegistrar> startup() {
    if (engine == null) {
      throw new IllegalStateException("No workflow engine is configured.");
    }
    if (botTokenSecret == null || botTokenSecret.isBlank()) {
      throw new IllegalStateException("The bot token secret name must not be empty.");
    }
    engine.startup();
    if (automation != null) {
      automation.startup();
    }
    return Optional.ofNullable(automation);
  }
}

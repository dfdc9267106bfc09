package ca.on.oicr.gsi.baker.prefect;

import ca.on.oicr.gsi.baker.JsonBodyHandler;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.prometheus.client.Counter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.lang.System.Logger;
import java.lang.System.Logger.Level;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.time.Duration;

/**
 * Common configuration and transport for talking to a Prefect server's GraphQL API
 *
 * <p>Subclasses are configured from JSON. The server URL is required; the API key is sent as a
 * bearer token if provided.
 */
public abstract class BasePrefectClient {
  static final HttpClient CLIENT =
      HttpClient.newBuilder()
          .version(HttpClient.Version.HTTP_1_1)
          .followRedirects(HttpClient.Redirect.NORMAL)
          .connectTimeout(Duration.ofSeconds(20))
          .build();
  static final ObjectMapper MAPPER =
      new ObjectMapper()
          .registerModule(new JavaTimeModule())
          .disable(SerializationFeature.WRITE_DURATIONS_AS_TIMESTAMPS);
  static final Counter PREFECT_FAILURES =
      Counter.build(
              "baker_prefect_failed_requests",
              "The number of failed GraphQL requests to the Prefect server")
          .labelNames("target")
          .register();
  static final Counter PREFECT_REQUESTS =
      Counter.build(
              "baker_prefect_total_requests",
              "The number of GraphQL requests to the Prefect server")
          .labelNames("target")
          .register();
  private static final Logger LOGGER = System.getLogger(BasePrefectClient.class.getName());

  /**
   * Extract the result of a GraphQL request from the response
   *
   * @param url the server the request was sent to, for error messages
   * @param statusCode the HTTP status of the response
   * @param body the parsed response body
   * @return the <code>data</code> object of the response
   * @throws IOException if the server rejected the request or reported errors
   */
  static JsonNode data(String url, int statusCode, JsonNode body) throws IOException {
    if (statusCode / 100 != 2) {
      throw new IOException(String.format("Prefect server %s returned HTTP %d", url, statusCode));
    }
    final var errors = body.path("errors");
    if (errors.isArray() && errors.size() > 0) {
      throw new IOException(
          String.format(
              "Prefect server %s reported: %s", url, errors.get(0).path("message").asText()));
    }
    final var data = body.path("data");
    if (!data.isObject()) {
      throw new IOException(String.format("Prefect server %s returned no data", url));
    }
    return data;
  }

  /**
   * Create the body of a GraphQL request
   *
   * @param query the query or mutation
   * @param variables the values of the variables it uses
   */
  static ObjectNode request(String query, ObjectNode variables) {
    final var body = MAPPER.createObjectNode();
    body.put("query", query);
    body.set("variables", variables);
    return body;
  }

  private String apiKey;
  private int timeout = 60;
  private String url;

  /**
   * Send a GraphQL request to the server
   *
   * @param query the query or mutation
   * @param variables the values of the variables it uses
   * @return the <code>data</code> object of the response
   */
  protected final JsonNode execute(String query, ObjectNode variables)
      throws IOException, InterruptedException {
    PREFECT_REQUESTS.labels(url).inc();
    try {
      final var builder =
          HttpRequest.newBuilder(URI.create(url))
              .header("Content-type", "application/json")
              .timeout(Duration.ofSeconds(timeout))
              .POST(
                  HttpRequest.BodyPublishers.ofString(
                      MAPPER.writeValueAsString(request(query, variables))));
      if (apiKey != null) {
        builder.header("Authorization", "Bearer " + apiKey);
      }
      final var response =
          CLIENT.send(builder.build(), new JsonBodyHandler<>(MAPPER, JsonNode.class));
      if (response.statusCode() / 100 != 2) {
        throw new IOException(
            String.format("Prefect server %s returned HTTP %d", url, response.statusCode()));
      }
      final JsonNode body;
      try {
        body = response.body().get();
      } catch (UncheckedIOException e) {
        throw new IOException(
            String.format("Prefect server %s returned an unreadable response", url), e.getCause());
      }
      return data(url, response.statusCode(), body);
    } catch (IOException | RuntimeException e) {
      PREFECT_FAILURES.labels(url).inc();
      LOGGER.log(Level.WARNING, String.format("Request to Prefect server %s failed", url), e);
      throw e;
    }
  }

  public int getTimeout() {
    return timeout;
  }

  public String getUrl() {
    return url;
  }

  /** An object for building request variables */
  protected final ObjectNode object() {
    return MAPPER.createObjectNode();
  }

  public void setApiKey(String apiKey) {
    this.apiKey = apiKey;
  }

  public void setTimeout(int timeout) {
    this.timeout = timeout;
  }

  public void setUrl(String url) {
    this.url = url;
  }

  /** Check the configuration is usable */
  public void startup() {
    if (url == null || url.isBlank()) {
      throw new IllegalStateException("Prefect server URL is not configured.");
    }
    if (timeout < 1) {
      throw new IllegalStateException("Prefect request timeout must be positive.");
    }
    URI.create(url);
  }
}

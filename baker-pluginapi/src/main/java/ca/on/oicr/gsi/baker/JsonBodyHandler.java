package ca.on.oicr.gsi.baker;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.net.http.HttpResponse;
import java.net.http.HttpResponse.BodySubscriber;
import java.net.http.HttpResponse.BodySubscribers;
import java.util.function.Supplier;

/**
 * Parses an HTTP response body as JSON
 *
 * <p>The body is parsed lazily, when the supplier is called, so the caller can inspect the status
 * code first.
 *
 * @param <T> the type of the body
 */
public final class JsonBodyHandler<T> implements HttpResponse.BodyHandler<Supplier<T>> {
  private final Class<T> clazz;
  private final ObjectMapper mapper;

  public JsonBodyHandler(ObjectMapper mapper, Class<T> clazz) {
    this.mapper = mapper;
    this.clazz = clazz;
  }

  @Override
  public BodySubscriber<Supplier<T>> apply(HttpResponse.ResponseInfo responseInfo) {
    return BodySubscribers.mapping(BodySubscribers.ofInputStream(), this::toSupplier);
  }

  private Supplier<T> toSupplier(InputStream input) {
    return () -> {
      try (final var stream = input) {
        return mapper.readValue(stream, clazz);
      } catch (IOException e) {
        throw new UncheckedIOException(e);
      }
    };
  }
}

package ca.gc.cra.mosaic.api;

import ca.gc.cra.mosaic.application.pipeline.DecodeFailure;
import ca.gc.cra.mosaic.application.pipeline.DecodeResult;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Renders a {@link DecodeResult} as the one-line JSON report printed by {@code mosaic decode}.
 *
 * <p>Success: {@code {"data":TEXT,"sha256":HASH|null}}, or {@code {"out":PATH,"sha256":...}} when the text
 * went to a file. Failure: {@code {"error":MESSAGE,"kind":KIND,"sha256":HASH|null,"missing":[...]}}, with
 * {@code missing} present only for missing chunks.</p>
 *
 * @since 0.1.0
 */
final class DecodeReportWriter {
  private static final JsonFactory JSON = new JsonFactory();

  private DecodeReportWriter() {}

  static String render(DecodeResult result, Path out) {
    Objects.requireNonNull(result, "result");
    StringWriter buffer = new StringWriter();
    try (JsonGenerator gen = JSON.createGenerator(buffer)) {
      gen.writeStartObject();
      if (result.succeeded()) {
        if (out == null) {
          gen.writeStringField("data", result.text());
        } else {
          gen.writeStringField("out", out.toString());
        }
        writeHash(gen, result.sha256());
      } else {
        DecodeFailure failure = result.failure();
        gen.writeStringField("error", failure.message());
        gen.writeStringField("kind", failure.kind().name());
        writeHash(gen, result.sha256());
        if (!failure.missingIndices().isEmpty()) {
          gen.writeArrayFieldStart("missing");
          for (int index : failure.missingIndices()) {
            gen.writeNumber(index);
          }
          gen.writeEndArray();
        }
      }
      gen.writeEndObject();
    } catch (IOException ex) {
      throw new UncheckedIOException("Unable to render decode report", ex);
    }
    return buffer.toString();
  }

  private static void writeHash(JsonGenerator gen, String hash) throws IOException {
    if (hash == null) {
      gen.writeNullField("sha256");
    } else {
      gen.writeStringField("sha256", hash);
    }
  }
}

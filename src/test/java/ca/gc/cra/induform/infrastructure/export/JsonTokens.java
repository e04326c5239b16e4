package ca.gc.cra.induform.infrastructure.export;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/** Streams a JSON document and collects the values of a named field wherever it appears. */
final class JsonTokens {
  private static final JsonFactory FACTORY = new JsonFactory();

  private JsonTokens() {}

  static List<String> valuesOf(String json, String field) throws IOException {
    List<String> values = new ArrayList<>();
    try (JsonParser parser = FACTORY.createParser(json)) {
      while (parser.nextToken() != null) {
        if (parser.currentToken() == JsonToken.FIELD_NAME && field.equals(parser.currentName())) {
          JsonToken value = parser.nextToken();
          values.add(value.isScalarValue() ? parser.getText() : value.asString());
        }
      }
    }
    return values;
  }

  static JsonToken rootToken(String json) throws IOException {
    try (JsonParser parser = FACTORY.createParser(json)) {
      JsonToken root = parser.nextToken();
      parser.skipChildren();
      if (parser.nextToken() != null) {
        throw new IOException("trailing content after root value");
      }
      return root;
    }
  }
}

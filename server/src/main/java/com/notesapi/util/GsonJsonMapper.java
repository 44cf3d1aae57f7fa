package com.notesapi.util;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonSyntaxException;
import com.google.gson.TypeAdapter;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonToken;
import com.google.gson.stream.JsonWriter;
import io.javalin.json.JsonMapper;
import java.io.IOException;
import java.lang.reflect.Type;
import org.jetbrains.annotations.NotNull;

/**
 * Javalin {@link JsonMapper} backed by Gson, so request and response bodies use the same JSON
 * library as the rest of the server.
 *
 * <p>Null fields are left out of rendered JSON. Booleans and strings are read strictly: a
 * {@code "yes"} for a boolean or a number for a string is rejected instead of being coerced. Parse
 * failures surface as Gson's {@link com.google.gson.JsonParseException}.
 */
public final class GsonJsonMapper implements JsonMapper {

  private final Gson gson;

  public GsonJsonMapper() {
    this(
        new GsonBuilder()
            .disableHtmlEscaping()
            .registerTypeAdapter(Boolean.class, new StrictBooleanAdapter())
            .registerTypeAdapter(boolean.class, new StrictBooleanAdapter())
            .registerTypeAdapter(String.class, new StrictStringAdapter())
            .create());
  }

  public GsonJsonMapper(Gson gson) {
    this.gson = gson;
  }

  @NotNull
  @Override
  public String toJsonString(@NotNull Object obj, @NotNull Type type) {
    return gson.toJson(obj, type);
  }

  @NotNull
  @Override
  public <T> T fromJsonString(@NotNull String json, @NotNull Type targetType) {
    return gson.fromJson(json, targetType);
  }

  private static JsonSyntaxException unexpected(String expected, JsonReader in) throws IOException {
    return new JsonSyntaxException(
        "Expected " + expected + " but was " + in.peek() + " at path " + in.getPath());
  }

  /** Accepts only JSON {@code true}, {@code false} and {@code null}. */
  private static final class StrictBooleanAdapter extends TypeAdapter<Boolean> {
    @Override
    public void write(JsonWriter out, Boolean value) throws IOException {
      if (value == null) {
        out.nullValue();
      } else {
        out.value(value);
      }
    }

    @Override
    public Boolean read(JsonReader in) throws IOException {
      JsonToken token = in.peek();
      if (token == JsonToken.NULL) {
        in.nextNull();
        return null;
      }
      if (token != JsonToken.BOOLEAN) {
        throw unexpected("a boolean", in);
      }
      return in.nextBoolean();
    }
  }

  /** Accepts only JSON strings and {@code null}. */
  private static final class StrictStringAdapter extends TypeAdapter<String> {
    @Override
    public void write(JsonWriter out, String value) throws IOException {
      out.value(value);
    }

    @Override
    public String read(JsonReader in) throws IOException {
      JsonToken token = in.peek();
      if (token == JsonToken.NULL) {
        in.nextNull();
        return null;
      }
      if (token != JsonToken.STRING) {
        throw unexpected("a string", in);
      }
      return in.nextString();
    }
  }
}

package sid.cli;

import com.google.gson.Gson;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;
import com.google.gson.reflect.TypeToken;
import java.lang.reflect.Type;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/** Typed access to the {@code params} object of a command request. */
final class Params {
  private static final Gson GSON = new Gson();
  private static final Type MAP_TYPE = new TypeToken<Map<String, Object>>() {}.getType();

  private final JsonObject json;

  Params(JsonObject json) {
    this.json = json == null ? new JsonObject() : json;
  }

  boolean has(String name) {
    return json.has(name) && !json.get(name).isJsonNull();
  }

  JsonElement raw(String name) {
    return json.get(name);
  }

  String requireString(String name) {
    return optionalString(name).orElseThrow(() -> CommandException.missing(name));
  }

  String string(String name, String defaultValue) {
    return optionalString(name).orElse(defaultValue);
  }

  Optional<String> optionalString(String name) {
    if (!has(name)) {
      return Optional.empty();
    }
    JsonElement element = json.get(name);
    if (!element.isJsonPrimitive() || !element.getAsJsonPrimitive().isString()) {
      throw CommandException.invalid("'" + name + "' must be a string");
    }
    return Optional.of(element.getAsString());
  }

  double number(String name, double defaultValue) {
    if (!has(name)) {
      return defaultValue;
    }
    JsonPrimitive primitive = numeric(name);
    double value = primitive.getAsDouble();
    if (Double.isNaN(value) || Double.isInfinite(value)) {
      throw CommandException.invalid("'" + name + "' must be finite");
    }
    return value;
  }

  int integer(String name, int defaultValue) {
    if (!has(name)) {
      return defaultValue;
    }
    double value = numeric(name).getAsDouble();
    if (value != Math.rint(value) || value < Integer.MIN_VALUE || value > Integer.MAX_VALUE) {
      throw CommandException.invalid("'" + name + "' must be an integer");
    }
    return (int) value;
  }

  Optional<JsonObject> object(String name) {
    if (!has(name)) {
      return Optional.empty();
    }
    JsonElement element = json.get(name);
    if (!element.isJsonObject()) {
      throw CommandException.invalid("'" + name + "' must be an object");
    }
    return Optional.of(element.getAsJsonObject());
  }

  /** Object parameter as plain Java values; null members are dropped. */
  Map<String, Object> map(String name) {
    Optional<JsonObject> object = object(name);
    if (object.isEmpty()) {
      return Map.of();
    }
    Map<String, Object> decoded = GSON.fromJson(object.get(), MAP_TYPE);
    Map<String, Object> result = new LinkedHashMap<>();
    decoded.forEach(
        (key, value) -> {
          if (value != null) {
            result.put(key, value);
          }
        });
    return result;
  }

  private JsonPrimitive numeric(String name) {
    JsonElement element = json.get(name);
    if (!element.isJsonPrimitive() || !element.getAsJsonPrimitive().isNumber()) {
      throw CommandException.invalid("'" + name + "' must be a number");
    }
    return element.getAsJsonPrimitive();
  }
}

package sid.cli;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonObject;
import java.util.LinkedHashMap;
import java.util.Map;

/** Builds the success and error envelopes returned for every command. */
final class ResponseBuilder {
  private final Gson gson = new GsonBuilder().disableHtmlEscaping().serializeNulls().create();

  JsonObject success(String command, Map<String, Object> result, long elapsedMs) {
    Map<String, Object> root = new LinkedHashMap<>();
    root.put("status", "success");
    root.put("command", command);
    root.put("result", result);
    root.put("execution_time_ms", elapsedMs);
    return gson.toJsonTree(root).getAsJsonObject();
  }

  JsonObject error(String command, String message, String errorCode, long elapsedMs) {
    Map<String, Object> root = new LinkedHashMap<>();
    root.put("status", "error");
    if (command != null && !command.isEmpty()) {
      root.put("command", command);
    }
    root.put("error", message == null ? errorCode : message);
    root.put("error_code", errorCode);
    root.put("execution_time_ms", elapsedMs);
    return gson.toJsonTree(root).getAsJsonObject();
  }

  String toLine(JsonObject response) {
    return gson.toJson(response);
  }
}

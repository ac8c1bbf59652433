package agents.dataagent.services;

import agents.dataagent.config.Env;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.Vertx;
import io.vertx.core.buffer.Buffer;
import io.vertx.core.json.DecodeException;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.client.HttpRequest;
import io.vertx.ext.web.client.HttpResponse;
import io.vertx.ext.web.client.WebClient;
import io.vertx.ext.web.client.WebClientOptions;

import static agents.dataagent.Driver.logLevel;

/**
 * Service for interacting with an LLM Chat Completions API.
 * This is a singleton service (not a verticle) that can be used by any verticle.
 * Supports any OpenAI-compatible API endpoint (Groq by default).
 */
public class LlmAPIService implements CompletionService {
  private static LlmAPIService instance;
  private WebClient webClient;
  private Vertx vertx;

  // LLM configuration loaded from environment variables
  private String LLM_API_KEY;
  private String LLM_API_URL;
  private String LLM_CHAT_COMPLETIONS_PATH;
  private String LLM_MODEL_NAME;
  private int LLM_REQUEST_TIMEOUT_MS;

  private LlmAPIService() {
    // Private constructor for singleton
  }

  /**
   * Get the singleton instance
   * @return The LlmAPIService instance
   */
  public static synchronized LlmAPIService getInstance() {
    if (instance == null) {
      instance = new LlmAPIService();
    }
    return instance;
  }

  /**
   * Initialize the service with Vertx instance
   * @param vertx The Vertx instance
   * @return true if initialization successful, false if configuration missing
   */
  public boolean setupService(Vertx vertx) {
    this.vertx = vertx;

    try {
      this.LLM_API_KEY = Env.getRequired("LLM_API_KEY");
      this.LLM_API_URL = Env.get("LLM_API_URL", "api.groq.com");
      this.LLM_CHAT_COMPLETIONS_PATH = Env.get("LLM_CHAT_COMPLETIONS_PATH", "/openai/v1/chat/completions");
      this.LLM_MODEL_NAME = Env.get("LLM_MODEL_NAME", "llama-3.3-70b-versatile");
      this.LLM_REQUEST_TIMEOUT_MS = Env.getInt("LLM_REQUEST_TIMEOUT_MS", 60_000);

      // Log loaded configuration (without API key)
      LogUtil.logInfo(vertx, "LLM Service Configuration loaded:", "LlmAPIService", "Configuration", "Info");
      LogUtil.logDetail(vertx, "  API URL: " + LLM_API_URL, "LlmAPIService", "Configuration", "Info");
      LogUtil.logDetail(vertx, "  Endpoint: " + LLM_CHAT_COMPLETIONS_PATH, "LlmAPIService", "Configuration", "Info");
      LogUtil.logDetail(vertx, "  Model: " + LLM_MODEL_NAME, "LlmAPIService", "Configuration", "Info");
      LogUtil.logDetail(vertx, "  Timeout: " + LLM_REQUEST_TIMEOUT_MS + "ms", "LlmAPIService", "Configuration", "Info");
      LogUtil.logDetail(vertx, "  API Key: [CONFIGURED]", "LlmAPIService", "Configuration", "Info");

    } catch (IllegalStateException e) {
      LogUtil.logError(vertx, "ERROR: " + e.getMessage(), "LlmAPIService", "Configuration", "Error");
      LogUtil.logError(vertx, "LLM service disabled due to missing configuration", "LlmAPIService", "Configuration", "Error");
      return false;
    }

    WebClientOptions options = new WebClientOptions()
      .setUserAgent("Data-Agent/1.0")
      .setConnectTimeout(5000);
    if (!isAbsolute(LLM_API_URL)) {
      options.setSsl(true).setTrustAll(false);
    }

    this.webClient = WebClient.create(vertx, options);

    LogUtil.logInfo(vertx, "LlmAPIService initialized successfully", "LlmAPIService", "StartUp", "System");
    return true;
  }

  /**
   * Check if the service is properly initialized
   * @return true if service is ready to use
   */
  public boolean isInitialized() {
    return webClient != null && LLM_API_KEY != null;
  }

  @Override
  public Future<JsonObject> completeJson(String systemPrompt, String userPrompt, double temperature, int maxTokens) {
    JsonArray messages = new JsonArray()
      .add(new JsonObject().put("role", "system").put("content", systemPrompt))
      .add(new JsonObject().put("role", "user").put("content", userPrompt));

    return chatCompletion(messages, temperature, maxTokens, true).map(response -> {
      String content = messageContent(response);
      return extractJsonObject(content);
    });
  }

  /**
   * Make a chat completion request to the LLM API
   * @param messages The messages array for the conversation
   * @param temperature The temperature parameter (0.0 - 1.0)
   * @param maxTokens Maximum tokens in response
   * @param jsonMode Request a JSON-object response
   * @return Future containing the raw LLM response
   */
  public Future<JsonObject> chatCompletion(JsonArray messages, double temperature, int maxTokens, boolean jsonMode) {
    Promise<JsonObject> promise = Promise.promise();

    if (!isInitialized()) {
      promise.fail("LlmAPIService not properly initialized - check LLM configuration in .env.local");
      return promise.future();
    }

    JsonObject requestBody = new JsonObject()
      .put("model", LLM_MODEL_NAME)
      .put("messages", messages)
      .put("temperature", temperature)
      .put("max_tokens", maxTokens);
    if (jsonMode) {
      requestBody.put("response_format", new JsonObject().put("type", "json_object"));
    }

    if (logLevel >= 4) {
      LogUtil.logData(vertx, "Sending request to LLM API: " + requestBody.encode(), "LlmAPIService", "Service", "System");
    }

    HttpRequest<Buffer> request = (isAbsolute(LLM_API_URL)
        ? webClient.postAbs(LLM_API_URL + LLM_CHAT_COMPLETIONS_PATH)
        : webClient.post(443, LLM_API_URL, LLM_CHAT_COMPLETIONS_PATH))
      .timeout(LLM_REQUEST_TIMEOUT_MS)
      .putHeader("Authorization", "Bearer " + LLM_API_KEY)
      .putHeader("Content-Type", "application/json");

    LogUtil.logDetail(vertx, "Calling LLM API at " + LLM_API_URL + LLM_CHAT_COMPLETIONS_PATH, "LlmAPIService", "API", "Request");

    request.sendJsonObject(requestBody).onComplete(ar -> {
      if (ar.succeeded()) {
        HttpResponse<Buffer> response = ar.result();

        if (response.statusCode() == 200) {
          try {
            JsonObject responseBody = response.bodyAsJsonObject();

            JsonObject usage = responseBody.getJsonObject("usage", new JsonObject());
            LogUtil.logDetail(vertx,
              "LLM API call successful - Tokens: " + usage.getInteger("total_tokens", 0) +
              " (prompt: " + usage.getInteger("prompt_tokens", 0) +
              " completion: " + usage.getInteger("completion_tokens", 0) + ")", "LlmAPIService", "API", "Success");

            promise.complete(responseBody);
          } catch (DecodeException e) {
            promise.fail("Failed to parse LLM API response: " + e.getMessage());
          }
        } else if (response.statusCode() == 429) {
          LogUtil.logError(vertx, "LLM API rate limit exceeded", "LlmAPIService", "API", "RateLimit");
          promise.fail("Rate limit: " + errorMessage(response, "Rate limit exceeded"));
        } else if (response.statusCode() == 401) {
          LogUtil.logError(vertx, "LLM API authentication failed - invalid API key", "LlmAPIService", "API", "Auth");
          promise.fail("Invalid LLM API key");
        } else {
          String errorBody = errorMessage(response, "Unknown error");
          LogUtil.logError(vertx, "LLM API error " + response.statusCode() + ": " + errorBody, "LlmAPIService", "API", "Error");
          promise.fail("LLM API error (" + response.statusCode() + "): " + errorBody);
        }
      } else {
        // Network or timeout error
        String errorMessage = String.valueOf(ar.cause().getMessage());

        if (errorMessage.contains("timeout")) {
          LogUtil.logError(vertx, "LLM API request timeout", "LlmAPIService", "API", "Timeout");
          promise.fail("Request timeout - LLM API took too long to respond");
        } else {
          LogUtil.logError(vertx, "LLM API connection failed: " + errorMessage, "LlmAPIService", "API", "Network");
          promise.fail("Failed to connect to LLM API: " + errorMessage);
        }
      }
    });

    return promise.future();
  }

  /**
   * Text of the first choice of a chat completion response.
   */
  static String messageContent(JsonObject response) {
    JsonArray choices = response.getJsonArray("choices");
    if (choices == null || choices.isEmpty()) {
      throw new IllegalStateException("LLM response has no choices");
    }
    String content = choices.getJsonObject(0).getJsonObject("message", new JsonObject()).getString("content");
    if (content == null || content.isBlank()) {
      throw new IllegalStateException("LLM response has empty content");
    }
    return content;
  }

  /**
   * Parse the JSON object in a reply, tolerating prose or code fences around it:
   * the text from the first '{' to the last '}' is parsed.
   */
  public static JsonObject extractJsonObject(String content) {
    int start = content.indexOf('{');
    int end = content.lastIndexOf('}');
    if (start < 0 || end <= start) {
      throw new IllegalStateException("No JSON object found in LLM response");
    }
    try {
      return new JsonObject(content.substring(start, end + 1));
    } catch (DecodeException e) {
      throw new IllegalStateException("Invalid JSON in LLM response: " + e.getMessage(), e);
    }
  }

  private static String errorMessage(HttpResponse<Buffer> response, String fallback) {
    try {
      JsonObject error = response.bodyAsJsonObject();
      if (error == null) {
        return fallback;
      }
      Object detail = error.getValue("error");
      if (detail instanceof JsonObject) {
        return ((JsonObject) detail).getString("message", fallback);
      }
      return detail == null ? fallback : String.valueOf(detail);
    } catch (DecodeException e) {
      return response.bodyAsString();
    }
  }

  private static boolean isAbsolute(String url) {
    return url.startsWith("http://") || url.startsWith("https://");
  }
}

package com.clouddeploy.vault;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-process KV v2 Vault API: token checks, approle login and secret reads.
 */
public final class FakeVaultServer implements AutoCloseable {
  private static final ObjectMapper MAPPER = new ObjectMapper();

  public static final String APPROLE_TOKEN = "s.approle-session";

  private final HttpServer server;
  private final Map<String, JsonNode> secrets = new ConcurrentHashMap<>();
  private final Set<String> acceptedTokens = ConcurrentHashMap.newKeySet();
  private final List<String> requests = new CopyOnWriteArrayList<>();
  private final List<String> namespaces = new CopyOnWriteArrayList<>();

  private volatile String roleId;
  private volatile String secretId;
  private volatile boolean approleOmitsToken;

  public FakeVaultServer() throws IOException {
    this.server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
    this.server.createContext("/", new Handler());
    this.server.start();
  }

  public String address() {
    return "http://127.0.0.1:" + server.getAddress().getPort();
  }

  public URI baseUri() {
    return URI.create(address());
  }

  public FakeVaultServer acceptToken(String token) {
    acceptedTokens.add(token);
    return this;
  }

  public FakeVaultServer acceptAppRole(String roleId, String secretId) {
    this.roleId = roleId;
    this.secretId = secretId;
    acceptedTokens.add(APPROLE_TOKEN);
    return this;
  }

  public FakeVaultServer approleOmitsToken() {
    this.approleOmitsToken = true;
    return this;
  }

  /**
   * Stores a KV v2 secret; {@code path} includes the {@code data} segment.
   */
  public FakeVaultServer putSecret(String path, Map<String, ?> data) {
    secrets.put(path, MAPPER.valueToTree(data));
    return this;
  }

  /**
   * Serves {@code body} verbatim for {@code path}.
   */
  public FakeVaultServer putRawResponse(String path, String body) {
    try {
      secrets.put(path, MAPPER.createObjectNode().set("raw", MAPPER.readTree(body)));
    } catch (IOException e) {
      throw new IllegalArgumentException(e);
    }
    return this;
  }

  /**
   * "METHOD path" of every request received, in order.
   */
  public List<String> requests() {
    return requests;
  }

  public List<String> namespaces() {
    return namespaces;
  }

  @Override
  public void close() {
    server.stop(0);
  }

  private final class Handler implements HttpHandler {
    @Override
    public void handle(HttpExchange exchange) throws IOException {
      String method = exchange.getRequestMethod();
      String path = exchange.getRequestURI().getPath();
      requests.add(method + " " + path);
      String namespace = exchange.getRequestHeaders().getFirst(VaultSession.NAMESPACE_HEADER);
      if (namespace != null) {
        namespaces.add(namespace);
      }

      if (!path.startsWith("/v1/")) {
        respond(exchange, 404, errors("unsupported path"));
        return;
      }
      String apiPath = path.substring("/v1/".length());

      if ("POST".equals(method) && "auth/approle/login".equals(apiPath)) {
        JsonNode body = MAPPER.readTree(exchange.getRequestBody().readAllBytes());
        boolean valid = roleId != null
            && roleId.equals(body.path("role_id").asText())
            && secretId != null
            && secretId.equals(body.path("secret_id").asText());
        if (!valid) {
          respond(exchange, 400, errors("invalid role or secret ID"));
          return;
        }
        ObjectNode response = MAPPER.createObjectNode();
        ObjectNode auth = response.putObject("auth");
        if (!approleOmitsToken) {
          auth.put("client_token", APPROLE_TOKEN);
        }
        respond(exchange, 200, response.toString());
        return;
      }

      if (!"GET".equals(method)) {
        respond(exchange, 405, errors("method not allowed"));
        return;
      }

      String token = exchange.getRequestHeaders().getFirst(VaultSession.TOKEN_HEADER);
      if (token == null || !acceptedTokens.contains(token)) {
        respond(exchange, 403, errors("permission denied"));
        return;
      }

      JsonNode secret = secrets.get(apiPath);
      if (secret == null) {
        respond(exchange, 404, errors());
        return;
      }
      if (secret.has("raw")) {
        respond(exchange, 200, secret.get("raw").toString());
        return;
      }

      ObjectNode response = MAPPER.createObjectNode();
      ObjectNode data = response.putObject("data");
      data.set("data", secret);
      data.putObject("metadata").put("version", 1);
      respond(exchange, 200, response.toString());
    }
  }

  private static String errors(String... messages) {
    ObjectNode body = MAPPER.createObjectNode();
    var array = body.putArray("errors");
    for (String message : messages) {
      array.add(message);
    }
    return body.toString();
  }

  private static void respond(HttpExchange exchange, int status, String body) throws IOException {
    byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
    exchange.getResponseHeaders().add("Content-Type", "application/json");
    exchange.sendResponseHeaders(status, bytes.length);
    try (OutputStream os = exchange.getResponseBody()) {
      os.write(bytes);
    }
  }
}

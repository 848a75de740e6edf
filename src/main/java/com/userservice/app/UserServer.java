package com.userservice.app;

import com.google.gson.JsonParseException;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;
import com.userservice.core.DuplicateEmailException;
import com.userservice.core.User;
import com.userservice.db.UserRepository;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.sql.SQLException;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * HTTP front end for the users resource.
 *
 * <ul>
 *   <li>{@code GET /health}: liveness, always {@code {"status":"ok"}}</li>
 *   <li>{@code GET /users}: every user as a JSON array</li>
 *   <li>{@code GET /users/{id}}: one user, 404 if absent</li>
 *   <li>{@code POST /users}: create from {@code {"name","email"}}, 409 on a taken email</li>
 * </ul>
 *
 * <p>Database failures are answered with 500 and logged; the driver message is not
 * sent to the client.</p>
 */
public class UserServer {
    private static final Logger logger = Logger.getLogger(UserServer.class.getName());
    private static final String JSON_CONTENT_TYPE = "application/json; charset=utf-8";
    private static final int STOP_DELAY_SECONDS = 1;
    // Both fields are capped at 100 characters, so real bodies are far smaller
    static final int MAX_BODY_BYTES = 4096;

    private final UserRepository repository;
    private final int port;
    private final int threads;
    private HttpServer server;
    private ExecutorService executor;

    public UserServer(UserRepository repository, int port, int threads) {
        this.repository = repository;
        this.port = port;
        this.threads = threads;
    }

    /**
     * Bind the listener and register the handlers.
     *
     * @throws IOException if the port cannot be bound
     */
    public void start() throws IOException {
        server = HttpServer.create(new InetSocketAddress(port), 0);

        server.createContext("/health", new HealthHandler());
        server.createContext("/users", new UsersHandler());
        server.createContext("/", new NotFoundHandler());

        executor = Executors.newFixedThreadPool(threads);
        server.setExecutor(executor);
        server.start();

        logger.info("User server started on port " + getPort());
    }

    /**
     * Stop accepting requests, give in-flight ones a moment to finish, then
     * release the handler threads.
     */
    public void stop() {
        if (server == null) {
            return;
        }
        server.stop(STOP_DELAY_SECONDS);
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        server = null;
        logger.info("User server stopped");
    }

    /**
     * @return the bound port; differs from the configured one when that was 0
     */
    public int getPort() {
        if (server == null) {
            throw new IllegalStateException("Server not started");
        }
        return server.getAddress().getPort();
    }

    private abstract static class JsonHandler implements HttpHandler {

        @Override
        public void handle(HttpExchange exchange) throws IOException {
            try {
                handleRequest(exchange);
            } catch (SQLException e) {
                logger.log(Level.SEVERE, "Database error on " + describe(exchange), e);
                sendErrorIfPossible(exchange, 500, "Internal Server Error");
            } catch (Exception e) {
                logger.log(Level.SEVERE, "Unexpected error handling " + describe(exchange), e);
                sendErrorIfPossible(exchange, 500, "Internal Server Error");
            } finally {
                exchange.close();
            }
        }

        abstract void handleRequest(HttpExchange exchange) throws Exception;

        static void sendJson(HttpExchange exchange, int statusCode, Object body) throws IOException {
            byte[] response = JsonSupport.GSON.toJson(body).getBytes(StandardCharsets.UTF_8);

            exchange.getResponseHeaders().set("Content-Type", JSON_CONTENT_TYPE);
            exchange.sendResponseHeaders(statusCode, response.length);

            try (OutputStream os = exchange.getResponseBody()) {
                os.write(response);
            }
        }

        static void sendError(HttpExchange exchange, int statusCode, String message) throws IOException {
            sendJson(exchange, statusCode, Map.of("error", message));
        }

        static void sendMethodNotAllowed(HttpExchange exchange, String allowed) throws IOException {
            exchange.getResponseHeaders().set("Allow", allowed);
            sendError(exchange, 405, "Method Not Allowed");
        }

        private static void sendErrorIfPossible(HttpExchange exchange, int statusCode, String message) {
            // -1 means no status line has gone out yet
            if (exchange.getResponseCode() != -1) {
                return;
            }
            try {
                sendError(exchange, statusCode, message);
            } catch (IOException e) {
                logger.log(Level.WARNING, "Failed to send error response", e);
            }
        }

        private static String describe(HttpExchange exchange) {
            return exchange.getRequestMethod() + " " + exchange.getRequestURI().getPath();
        }
    }

    private static class HealthHandler extends JsonHandler {
        @Override
        void handleRequest(HttpExchange exchange) throws IOException {
            String path = exchange.getRequestURI().getPath();
            if (!"/health".equals(path) && !"/health/".equals(path)) {
                sendError(exchange, 404, "Not Found");
                return;
            }
            if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
                sendMethodNotAllowed(exchange, "GET");
                return;
            }
            sendJson(exchange, 200, Map.of("status", "ok"));
        }
    }

    private class UsersHandler extends JsonHandler {
        @Override
        void handleRequest(HttpExchange exchange) throws IOException, SQLException {
            String rest = exchange.getRequestURI().getPath().substring("/users".length());
            if (rest.endsWith("/")) {
                rest = rest.substring(0, rest.length() - 1);
            }

            if (rest.isEmpty()) {
                handleCollection(exchange);
            } else if (rest.startsWith("/") && rest.indexOf('/', 1) < 0) {
                handleItem(exchange, rest.substring(1));
            } else {
                sendError(exchange, 404, "Not Found");
            }
        }

        private void handleCollection(HttpExchange exchange) throws IOException, SQLException {
            String method = exchange.getRequestMethod().toUpperCase();
            switch (method) {
                case "GET":
                    sendJson(exchange, 200, repository.findAll());
                    break;
                case "POST":
                    createUser(exchange);
                    break;
                default:
                    sendMethodNotAllowed(exchange, "GET, POST");
            }
        }

        private void handleItem(HttpExchange exchange, String rawId) throws IOException, SQLException {
            if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
                sendMethodNotAllowed(exchange, "GET");
                return;
            }

            int id;
            try {
                id = Integer.parseInt(rawId);
            } catch (NumberFormatException e) {
                sendError(exchange, 400, "User id must be an integer");
                return;
            }

            Optional<User> user = repository.findById(id);
            if (user.isPresent()) {
                sendJson(exchange, 200, user.get());
            } else {
                sendError(exchange, 404, "User " + id + " not found");
            }
        }

        private void createUser(HttpExchange exchange) throws IOException, SQLException {
            byte[] raw = exchange.getRequestBody().readNBytes(MAX_BODY_BYTES + 1);
            if (raw.length > MAX_BODY_BYTES) {
                sendError(exchange, 413, "Request body exceeds " + MAX_BODY_BYTES + " bytes");
                return;
            }
            String body = new String(raw, StandardCharsets.UTF_8);

            CreateUserRequest request;
            try {
                request = JsonSupport.parseStrict(body, CreateUserRequest.class);
                if (request == null) {
                    throw new IllegalArgumentException("Request body is required");
                }
                request.validate();
            } catch (JsonParseException e) {
                sendError(exchange, 400, "Malformed JSON body");
                return;
            } catch (IllegalArgumentException e) {
                sendError(exchange, 400, e.getMessage());
                return;
            }

            try {
                User created = repository.create(request.getName(), request.getEmail());
                exchange.getResponseHeaders().set("Location", "/users/" + created.getId());
                sendJson(exchange, 201, created);
            } catch (DuplicateEmailException e) {
                logger.fine(e.getMessage());
                sendError(exchange, 409, e.getMessage());
            }
        }
    }

    private static class NotFoundHandler extends JsonHandler {
        @Override
        void handleRequest(HttpExchange exchange) throws IOException {
            sendError(exchange, 404, "Not Found");
        }
    }
}

package com.userservice.app;

import com.userservice.config.ServiceConfig;
import com.userservice.db.Database;
import com.userservice.db.SchemaInitializer;
import com.userservice.db.UserRepository;
import org.json.JSONArray;
import org.json.JSONObject;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.HttpURLConnection;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end requests against a server bound to an ephemeral port.
 */
class UserServerTest {

    private Database database;
    private UserRepository repository;
    private UserServer server;

    @BeforeEach
    void setUp() throws Exception {
        database = new Database(ServiceConfig.builder()
                .jdbcUrl("jdbc:h2:mem:http-" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1")
                .poolMinSize(1)
                .poolMaxSize(4)
                .build());
        database.initialize();
        new SchemaInitializer(database).ensureTables();
        repository = new UserRepository(database);

        server = new UserServer(repository, 0, 2);
        server.start();
    }

    @AfterEach
    void tearDown() {
        server.stop();
        database.close();
    }

    @Test
    void healthReturnsOk() throws Exception {
        Response response = request("GET", "/health", null);

        assertEquals(200, response.status);
        assertTrue(response.contentType.contains("application/json"));
        assertEquals("ok", new JSONObject(response.body).getString("status"));
        assertEquals(1, new JSONObject(response.body).length());
    }

    @Test
    void listUsersReturnsEmptyArray() throws Exception {
        Response response = request("GET", "/users/", null);

        assertEquals(200, response.status);
        assertEquals(0, new JSONArray(response.body).length());
    }

    @Test
    void listUsersReturnsStoredRows() throws Exception {
        repository.create("Ada", "ada@example.com");
        repository.create("Grace", "grace@example.com");

        Response response = request("GET", "/users", null);

        assertEquals(200, response.status);
        JSONArray users = new JSONArray(response.body);
        assertEquals(2, users.length());

        JSONObject first = users.getJSONObject(0);
        assertEquals("Ada", first.getString("name"));
        assertEquals("ada@example.com", first.getString("email"));
        assertTrue(first.getInt("id") > 0);
        assertTrue(first.getString("created_at").matches("\\d{4}-\\d{2}-\\d{2}T\\d{2}:\\d{2}:\\d{2}.*"));
    }

    @Test
    void createUserReturns201WithLocation() throws Exception {
        Response response = request("POST", "/users/",
                "{\"name\": \"Ada\", \"email\": \"ada@example.com\"}");

        assertEquals(201, response.status);
        JSONObject created = new JSONObject(response.body);
        assertEquals("Ada", created.getString("name"));
        assertEquals("/users/" + created.getInt("id"), response.location);
        assertEquals(1, repository.count());
    }

    @Test
    void createUserWithTakenEmailReturns409() throws Exception {
        repository.create("Ada", "ada@example.com");

        Response response = request("POST", "/users",
                "{\"name\": \"Impostor\", \"email\": \"ada@example.com\"}");

        assertEquals(409, response.status);
        assertTrue(new JSONObject(response.body).getString("error").contains("ada@example.com"));
    }

    @Test
    void createUserRejectsInvalidBodies() throws Exception {
        assertEquals(400, request("POST", "/users", "{\"email\": \"ada@example.com\"}").status);
        assertEquals(400, request("POST", "/users", "{\"name\": \"Ada\", \"email\": \"not-an-email\"}").status);
        assertEquals(400, request("POST", "/users", "{not json").status);
        assertEquals(400, request("POST", "/users", "").status);
        assertEquals(0, repository.count());
    }

    @Test
    void createUserRejectsLenientJson() throws Exception {
        assertEquals(400, request("POST", "/users", "{name: Ada, email: 'ada@example.com'}").status);
        assertEquals(400, request("POST", "/users", "{'name': 'Ada', 'email': 'ada@example.com'}").status);
        assertEquals(400, request("POST", "/users",
                "{\"name\": \"Ada\", \"email\": \"ada@example.com\"} trailing").status);
        assertEquals(0, repository.count());
    }

    @Test
    void createUserRejectsOversizedBody() throws Exception {
        String padding = "x".repeat(UserServer.MAX_BODY_BYTES);
        Response response = request("POST", "/users",
                "{\"name\": \"" + padding + "\", \"email\": \"ada@example.com\"}");

        assertEquals(413, response.status);
        assertEquals(0, repository.count());
    }

    @Test
    void getUserById() throws Exception {
        int id = repository.create("Ada", "ada@example.com").getId();

        Response found = request("GET", "/users/" + id, null);
        assertEquals(200, found.status);
        assertEquals("ada@example.com", new JSONObject(found.body).getString("email"));

        assertEquals(404, request("GET", "/users/" + (id + 1), null).status);
        assertEquals(400, request("GET", "/users/abc", null).status);
    }

    @Test
    void unsupportedMethodsAndPaths() throws Exception {
        assertEquals(405, request("DELETE", "/users", null).status);
        assertEquals(405, request("POST", "/health", "{}").status);
        assertEquals(404, request("GET", "/nothing-here", null).status);
        assertEquals(404, request("GET", "/users/1/friends", null).status);
    }

    @Test
    void databaseFailureBecomes500WithoutDriverDetails() throws Exception {
        database.close();

        Response response = request("GET", "/users", null);

        assertEquals(500, response.status);
        assertEquals("Internal Server Error", new JSONObject(response.body).getString("error"));
        // liveness does not touch the database
        assertEquals(200, request("GET", "/health", null).status);
    }

    private Response request(String method, String path, String body) throws IOException {
        URL url = new URL("http://localhost:" + server.getPort() + path);
        HttpURLConnection conn = (HttpURLConnection) url.openConnection();
        conn.setRequestMethod(method);
        conn.setConnectTimeout(5000);
        conn.setReadTimeout(5000);

        if (body != null) {
            conn.setDoOutput(true);
            conn.setRequestProperty("Content-Type", "application/json");
            try (OutputStream os = conn.getOutputStream()) {
                os.write(body.getBytes(StandardCharsets.UTF_8));
            }
        }

        try {
            int status = conn.getResponseCode();
            InputStream stream = status >= 400 ? conn.getErrorStream() : conn.getInputStream();
            String text = "";
            if (stream != null) {
                try (InputStream in = stream) {
                    text = new String(in.readAllBytes(), StandardCharsets.UTF_8);
                }
            }
            return new Response(status, text, conn.getHeaderField("Content-Type"), conn.getHeaderField("Location"));
        } finally {
            conn.disconnect();
        }
    }

    private static final class Response {
        final int status;
        final String body;
        final String contentType;
        final String location;

        Response(int status, String body, String contentType, String location) {
            this.status = status;
            this.body = body;
            this.contentType = contentType;
            this.location = location;
        }
    }
}

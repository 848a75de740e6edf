package com.userservice.app;

import com.userservice.config.ServiceConfig;
import com.userservice.db.Database;
import org.json.JSONArray;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.net.HttpURLConnection;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class UserServiceAppTest {

    private UserServiceApp app;

    private static ServiceConfig.Builder config() {
        return ServiceConfig.builder()
                .jdbcUrl("jdbc:h2:mem:app-" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1")
                .poolMinSize(1)
                .poolMaxSize(2)
                .httpPort(0);
    }

    @AfterEach
    void tearDown() {
        if (app != null) {
            app.stop();
        }
    }

    @Test
    void startServesBothEndpointsOnBootstrappedTable() throws Exception {
        app = new UserServiceApp(config().build());
        app.start();

        assertEquals(200, status("/health"));

        HttpURLConnection conn = open("/users/");
        assertEquals(200, conn.getResponseCode());
        String body = new String(conn.getInputStream().readAllBytes(), StandardCharsets.UTF_8);
        assertEquals(0, new JSONArray(body).length());
        conn.disconnect();
    }

    @Test
    void stopClosesThePool() throws Exception {
        app = new UserServiceApp(config().build());
        app.start();
        Database database = app.getDatabase();

        app.stop();

        assertTrue(database.isClosed());
        assertEquals(0, database.stats().getOpenConnections());
        assertThrows(IllegalStateException.class, () -> app.getPort());

        // stopping again is harmless
        app.stop();
    }

    @Test
    void databaseFailureAbortsStartup() {
        app = new UserServiceApp(config().jdbcUrl("jdbc:nosuchdriver:nowhere").build());

        RuntimeException e = assertThrows(RuntimeException.class, () -> app.start());

        assertEquals("Database initialization failed", e.getMessage());
        assertNull(app.getDatabase());
    }

    @Test
    void portConflictAbortsStartupAndReleasesThePool() {
        app = new UserServiceApp(config().build());
        app.start();

        UserServiceApp second = new UserServiceApp(config().httpPort(app.getPort()).build());
        RuntimeException e = assertThrows(RuntimeException.class, second::start);

        assertEquals("HTTP server initialization failed", e.getMessage());
        assertNull(second.getDatabase());
    }

    private int status(String path) throws Exception {
        HttpURLConnection conn = open(path);
        try {
            return conn.getResponseCode();
        } finally {
            conn.disconnect();
        }
    }

    private HttpURLConnection open(String path) throws Exception {
        URL url = new URL("http://localhost:" + app.getPort() + path);
        HttpURLConnection conn = (HttpURLConnection) url.openConnection();
        conn.setConnectTimeout(5000);
        conn.setReadTimeout(5000);
        return conn;
    }
}

// file: client/src/test/java/io/annolite/client/CliTest.java
package io.annolite.client;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CliTest {

    @Test
    void base_url_flag_is_stripped_before_command() {
        var parsed = Cli.parseBaseUrl(new String[]{"--base-url", "http://h:9000", "undo", "a.svs"});

        assertEquals("http://h:9000", parsed.getKey());
        assertArrayEquals(new String[]{"undo", "a.svs"}, parsed.getValue());
    }

    @Test
    void default_base_url_when_flag_absent() {
        var parsed = Cli.parseBaseUrl(new String[]{"counts"});

        assertEquals("http://localhost:8080", parsed.getKey());
        assertArrayEquals(new String[]{"counts"}, parsed.getValue());
    }

    @Test
    void navigation_commands_map_to_session_posts() {
        assertEquals(new Cli.Call("POST", "/sessions/a.svs/undo", 200), Cli.toCall(new String[]{"undo", "a.svs"}));
        assertEquals(new Cli.Call("POST", "/sessions/a.svs/prev-bookmark", 200), Cli.toCall(new String[]{"prev", "a.svs"}));
        assertEquals(new Cli.Call("POST", "/sessions/a.svs/bookmark", 202), Cli.toCall(new String[]{"bookmark", "a.svs"}));
        assertEquals(new Cli.Call("DELETE", "/sessions/a.svs", 200), Cli.toCall(new String[]{"close", "a.svs"}));
    }

    @Test
    void snapshots_accepts_optional_index() {
        assertEquals("/sessions/a.svs/snapshots", Cli.toCall(new String[]{"snapshots", "a.svs"}).path());
        assertEquals("/sessions/a.svs/snapshots/47", Cli.toCall(new String[]{"snapshots", "a.svs", "47"}).path());
    }

    @Test
    void image_name_is_url_encoded() {
        assertEquals("/sessions/my%20slide.svs", Cli.toCall(new String[]{"status", "my slide.svs"}).path());
    }

    @Test
    void bad_arguments_are_rejected() {
        assertThrows(Cli.CliException.class, () -> Cli.toCall(new String[]{}));
        assertThrows(Cli.CliException.class, () -> Cli.toCall(new String[]{"undo"}));
        assertThrows(Cli.CliException.class, () -> Cli.toCall(new String[]{"undo", "a", "b"}));
        assertThrows(Cli.CliException.class, () -> Cli.toCall(new String[]{"counts", "a"}));
        assertThrows(Cli.CliException.class, () -> Cli.toCall(new String[]{"teleport", "a"}));
        assertThrows(Cli.CliException.class, () -> Cli.parseBaseUrl(new String[]{"--base-url"}));
    }

    @Test
    void server_refusal_is_not_a_usage_error() {
        var undo = Cli.toCall(new String[]{"undo", "a.svs"});

        var e = assertThrows(Cli.RequestFailedException.class,
                () -> Cli.checkResponse(undo, 409, "{\"error\":\"no such transition\"}"));
        assertTrue(e.getMessage().contains("409"));
        assertTrue(e.getMessage().contains("no such transition"));
    }

    @Test
    void expected_status_returns_body() {
        var bookmark = Cli.toCall(new String[]{"bookmark", "a.svs"});

        assertEquals("{\"status\":\"accepted\"}", Cli.checkResponse(bookmark, 202, "{\"status\":\"accepted\"}"));
        assertThrows(Cli.RequestFailedException.class, () -> Cli.checkResponse(bookmark, 200, "{}"));
    }
}

package club.ppmc.bridge.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

import club.ppmc.bridge.model.SpawnSpec;
import club.ppmc.bridge.service.RouteResolver;
import club.ppmc.bridge.service.SpawnRegistry;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.server.ServletServerHttpRequest;
import org.springframework.http.server.ServletServerHttpResponse;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;
import org.springframework.web.socket.WebSocketHandler;

class RouteHandshakeInterceptorTest {

    private RouteHandshakeInterceptor interceptor;
    private SpawnSpec echo;
    private MockHttpServletResponse servletResponse;
    private Map<String, Object> attributes;

    @BeforeEach
    void setUp() {
        echo = new SpawnSpec("echo", "cat", List.of(), Map.of());
        interceptor = new RouteHandshakeInterceptor(new RouteResolver(new SpawnRegistry(Map.of("echo", echo))));
        servletResponse = new MockHttpServletResponse();
        attributes = new HashMap<>();
    }

    @Test
    void knownServerProceedsWithHandshake() {
        boolean proceed = handshake("/mcp/echo");

        assertThat(proceed).isTrue();
        assertThat(attributes).containsEntry(RouteHandshakeInterceptor.SPAWN_SPEC_ATTRIBUTE, echo);
        assertThat(servletResponse.getStatus()).isEqualTo(200);
    }

    @Test
    void unknownServerIsRejectedWith404() {
        boolean proceed = handshake("/mcp/unknown-name");

        assertThat(proceed).isFalse();
        assertThat(servletResponse.getStatus()).isEqualTo(404);
        assertThat(attributes).isEmpty();
    }

    @Test
    void malformedPathIsRejectedWith404() {
        boolean proceed = handshake("/mcp/echo/nested");

        assertThat(proceed).isFalse();
        assertThat(servletResponse.getStatus()).isEqualTo(404);
    }

    @Test
    void percentEncodedNameIsNotDecodedBeforeMatching() {
        boolean proceed = handshake("/mcp/ec%68o");

        assertThat(proceed).isFalse();
        assertThat(servletResponse.getStatus()).isEqualTo(404);
        assertThat(attributes).isEmpty();
    }

    private boolean handshake(String path) {
        var request = new ServletServerHttpRequest(new MockHttpServletRequest("GET", path));
        var response = new ServletServerHttpResponse(servletResponse);
        return interceptor.beforeHandshake(request, response, mock(WebSocketHandler.class), attributes);
    }
}

package club.ppmc.bridge.service;

import static org.assertj.core.api.Assertions.assertThat;

import club.ppmc.bridge.model.SpawnSpec;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

class RouteResolverTest {

    private RouteResolver resolver;
    private SpawnSpec fetch;

    @BeforeEach
    void setUp() {
        fetch = new SpawnSpec("fetch", "uvx", List.of("mcp-server-fetch"), Map.of());
        var underscored = new SpawnSpec("my_tool-2", "cat", List.of(), Map.of());
        resolver = new RouteResolver(new SpawnRegistry(Map.of("fetch", fetch, "my_tool-2", underscored)));
    }

    @Test
    void resolvesKnownName() {
        assertThat(resolver.resolve("/mcp/fetch")).containsSame(fetch);
        assertThat(resolver.resolve("/mcp/my_tool-2")).isPresent();
    }

    @Test
    void unknownNameResolvesToNothing() {
        assertThat(resolver.resolve("/mcp/unknown-name")).isEmpty();
        assertThat(resolver.extractName("/mcp/unknown-name")).contains("unknown-name");
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {
            "/mcp/",
            "/mcp",
            "/mcp/fetch/",
            "/mcp/fetch/extra",
            "/mcp/fe.tch",
            "/mcp/fetch%20",
            "/mcp/../fetch",
            "mcp/fetch",
            "/MCP/fetch",
            "/api/mcp/fetch",
            "/mcp/fetch?x=1"
    })
    void rejectsPathsOfTheWrongShape(String path) {
        assertThat(resolver.extractName(path)).isEmpty();
        assertThat(resolver.resolve(path)).isEmpty();
    }
}

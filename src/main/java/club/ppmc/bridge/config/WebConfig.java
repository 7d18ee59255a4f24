/**
 * WebConfig.java
 *
 * 全局 Spring Web MVC 配置。
 * 允许其他来源的浏览器页面读取 /health 与 /servers；WebSocket 端点的来源检查在 WebSocketConfig 中单独配置。
 */
package club.ppmc.bridge.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
public class WebConfig implements WebMvcConfigurer {

    private final String[] allowedOriginPatterns;

    public WebConfig(@Value("${bridge.websocket.allowed-origins:*}") String[] allowedOriginPatterns) {
        this.allowedOriginPatterns = allowedOriginPatterns;
    }

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        registry.addMapping("/health").allowedOriginPatterns(allowedOriginPatterns).allowedMethods("GET");
        registry.addMapping("/servers").allowedOriginPatterns(allowedOriginPatterns).allowedMethods("GET");
    }
}

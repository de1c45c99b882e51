package com.onextel.CampaignDialerApplication.config;

import com.onextel.CampaignDialerApplication.stream.LiveCallSessionRouter;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {
    public static final String STREAM_PATH = "/api/webhooks/carrier/stream";

    private final LiveCallSessionRouter liveCallSessionRouter;

    public WebSocketConfig(LiveCallSessionRouter liveCallSessionRouter) {
        this.liveCallSessionRouter = liveCallSessionRouter;
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(liveCallSessionRouter, STREAM_PATH)
                .setAllowedOrigins("*");
    }
}

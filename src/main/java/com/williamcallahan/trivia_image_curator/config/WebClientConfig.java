/**
 * Configuration for the shared WebClient builder
 * - Sets connection, read and write timeouts
 * - Raises the in-memory buffer so full-resolution Commons files fit
 */
package com.williamcallahan.trivia_image_curator.config;

import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import io.netty.handler.timeout.WriteTimeoutHandler;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

@Configuration
public class WebClientConfig {

    /**
     * Creates a pre-configured WebClient Builder bean
     * - Connection timeout of 5000ms
     * - Read and write timeouts of 30 seconds (large originals stream slowly)
     * - Follows redirects, since Commons file URLs may redirect to a mirror
     * - Buffer limit taken from curation.storage.max-download-size
     *
     * @param curationProperties bound curation.* properties
     * @return A WebClient Builder instance
     */
    @Bean
    public WebClient.Builder webClientBuilder(CurationProperties curationProperties) {
        HttpClient httpClient = HttpClient.create()
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, 5000)
            .followRedirect(true)
            .doOnConnected(conn -> conn
                .addHandlerLast(new ReadTimeoutHandler(30, TimeUnit.SECONDS))
                .addHandlerLast(new WriteTimeoutHandler(30, TimeUnit.SECONDS))
            )
            .responseTimeout(Duration.ofSeconds(30));

        int maxInMemorySize = (int) Math.min(Integer.MAX_VALUE,
            curationProperties.getStorage().getMaxDownloadSize().toBytes());

        ExchangeStrategies exchangeStrategies = ExchangeStrategies.builder()
            .codecs(configurer -> configurer
                .defaultCodecs()
                .maxInMemorySize(maxInMemorySize))
            .build();

        return WebClient.builder()
            .exchangeStrategies(exchangeStrategies)
            .defaultHeader("User-Agent", curationProperties.getWikimedia().getUserAgent())
            .clientConnector(new ReactorClientHttpConnector(httpClient));
    }
}

package com.github.dimitryivaniuta.keygateway.proxy.forward;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.net.URI;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withException;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;

class RestClientUpstreamClientTest {

    private static final URI TARGET = URI.create("https://api.example.com/v1/chat/completions");

    private MockRestServiceServer server;
    private RestClientUpstreamClient client;

    @BeforeEach
    void setUp() {
        RestClient.Builder builder = RestClient.builder();
        server = MockRestServiceServer.bindTo(builder).build();
        client = new RestClientUpstreamClient(builder.build());
    }

    @Test
    void shouldSendMethodHeadersAndBodyAndReturnAnswer() {
        byte[] body = "{\"model\":\"m\"}".getBytes(StandardCharsets.UTF_8);
        server.expect(requestTo(TARGET))
                .andExpect(method(HttpMethod.POST))
                .andExpect(header(HttpHeaders.AUTHORIZATION, "Bearer A"))
                .andExpect(content().bytes(body))
                .andRespond(withStatus(HttpStatus.OK)
                        .contentType(MediaType.APPLICATION_JSON)
                        .header("X-Test", "1")
                        .body("{\"id\":\"x\"}"));

        HttpHeaders headers = new HttpHeaders();
        headers.set(HttpHeaders.AUTHORIZATION, "Bearer A");
        headers.setContentType(MediaType.APPLICATION_JSON);

        UpstreamResponse res = client.exchange(HttpMethod.POST, TARGET, headers, body);

        server.verify();
        assertThat(res.status()).isEqualTo(200);
        assertThat(res.headers().getFirst("X-Test")).isEqualTo("1");
        assertThat(res.headers().getContentType()).isEqualTo(MediaType.APPLICATION_JSON);
        assertThat(new String(res.body(), StandardCharsets.UTF_8)).isEqualTo("{\"id\":\"x\"}");
    }

    @Test
    void errorStatusesShouldBeReturnedNotThrown() {
        server.expect(requestTo(TARGET))
                .andRespond(withStatus(HttpStatus.TOO_MANY_REQUESTS).body("upstream quota"));

        UpstreamResponse res = client.exchange(HttpMethod.GET, TARGET, new HttpHeaders(), null);

        assertThat(res.status()).isEqualTo(429);
        assertThat(new String(res.body(), StandardCharsets.UTF_8)).isEqualTo("upstream quota");
    }

    @Test
    void serverErrorsShouldBeReturnedNotThrown() {
        server.expect(requestTo(TARGET)).andRespond(withStatus(HttpStatus.SERVICE_UNAVAILABLE));

        assertThat(client.exchange(HttpMethod.GET, TARGET, new HttpHeaders(), new byte[0]).status()).isEqualTo(503);
    }

    @Test
    void connectFailureShouldRaiseUpstreamUnavailable() {
        server.expect(requestTo(TARGET)).andRespond(withException(new ConnectException("Connection refused")));

        assertThatThrownBy(() -> client.exchange(HttpMethod.GET, TARGET, new HttpHeaders(), null))
                .isInstanceOf(UpstreamUnavailableException.class)
                .hasMessageContaining("Connection refused")
                .extracting("timeout")
                .isEqualTo(false);
    }

    @Test
    void timeoutShouldBeFlagged() {
        server.expect(requestTo(TARGET)).andRespond(withException(new SocketTimeoutException("Read timed out")));

        assertThatThrownBy(() -> client.exchange(HttpMethod.GET, TARGET, new HttpHeaders(), null))
                .isInstanceOf(UpstreamUnavailableException.class)
                .extracting("timeout")
                .isEqualTo(true);
    }
}

package com.adtech.stream.config;

import com.adtech.common.config.ConfigurationException;
import com.adtech.common.error.ConnectionException;
import com.adtech.common.retry.RetryPolicy;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.hc.client5.http.classic.methods.HttpPost;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.core5.http.ClassicHttpRequest;
import org.apache.hc.core5.http.io.HttpClientResponseHandler;
import org.apache.hc.core5.http.io.entity.EntityUtils;
import org.apache.hc.core5.http.message.BasicClassicHttpResponse;
import org.junit.Before;
import org.junit.Test;
import org.mockito.stubbing.Answer;

import java.io.IOException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.List;
import java.util.Map;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * DebeziumConnectorRegistrar 단위 테스트 (Kafka Connect 응답은 mock)
 */
public class DebeziumConnectorRegistrarTest {

    private final DebeziumSettings settings = new DebeziumSettings("http://connect:8083", "adtech-postgres-connector",
            "postgres", 5432, "replicator", "secret", "adtech", "postgres");

    private CloseableHttpClient httpClient;
    private Deque<Integer> responseCodes;
    private List<ClassicHttpRequest> requests;
    private Answer<Object> connectAnswer;
    private DebeziumConnectorRegistrar registrar;

    @Before
    @SuppressWarnings("unchecked")
    public void setUp() throws Exception {
        httpClient = mock(CloseableHttpClient.class);
        responseCodes = new ArrayDeque<>();
        requests = new ArrayList<>();
        connectAnswer = invocation -> {
            requests.add(invocation.getArgument(0));
            HttpClientResponseHandler<?> handler = invocation.getArgument(1);
            return handler.handleResponse(new BasicClassicHttpResponse(responseCodes.removeFirst()));
        };
        when(httpClient.execute(any(ClassicHttpRequest.class), any(HttpClientResponseHandler.class)))
                .thenAnswer(connectAnswer);
        registrar = new DebeziumConnectorRegistrar(settings, httpClient, RetryPolicy.immediate(1));
    }

    @Test
    public void testConnectorConfigCapturesSourceTables() {
        // When
        Map<String, String> config = registrar.connectorConfig();

        // Then
        assertEquals("io.debezium.connector.postgresql.PostgresConnector", config.get("connector.class"));
        assertEquals("public.advertiser,public.campaign,public.impressions,public.clicks",
                config.get("table.include.list"));
        assertEquals("pgoutput", config.get("plugin.name"));
        assertEquals("postgres", config.get("topic.prefix"));
        assertEquals("connect", config.get("time.precision.mode"));
        assertEquals("string", config.get("decimal.handling.mode"));
        assertEquals("5432", config.get("database.port"));
        // envelope(op/before/after/source)을 그대로 유지
        assertFalse(config.containsKey("transforms"));
    }

    @Test
    public void testExistingConnectorIsLeftUntouched() throws Exception {
        // Given: GET /connectors/{name} → 200
        responseCodes.add(200);

        // When
        boolean created = registrar.register();

        // Then
        assertFalse(created);
        assertEquals(1, requests.size());
        assertEquals("GET", requests.get(0).getMethod());
        assertEquals("/connectors/adtech-postgres-connector", requests.get(0).getUri().getPath());
    }

    @Test
    public void testMissingConnectorIsCreated() throws Exception {
        // Given: 404 → 201
        responseCodes.addAll(Arrays.asList(404, 201));

        // When
        boolean created = registrar.register();

        // Then
        assertTrue(created);
        assertEquals(2, requests.size());
        HttpPost post = (HttpPost) requests.get(1);
        assertEquals("/connectors", post.getUri().getPath());

        JsonNode body = new ObjectMapper().readTree(EntityUtils.toString(post.getEntity()));
        assertEquals("adtech-postgres-connector", body.get("name").asText());
        assertEquals("adtech", body.get("config").get("database.dbname").asText());
    }

    @Test
    public void testConcurrentCreationIsNotAnError() throws Exception {
        // Given: 404 → 409 Conflict
        responseCodes.addAll(Arrays.asList(404, 409));

        // When & Then
        assertFalse(registrar.register());
    }

    @Test(expected = ConnectionException.class)
    public void testServerErrorIsConnectionFailure() throws Exception {
        responseCodes.add(503);
        registrar.register();
    }

    @Test(expected = ConfigurationException.class)
    public void testRejectedConfigIsConfigurationError() throws Exception {
        responseCodes.addAll(Arrays.asList(404, 400));
        registrar.register();
    }

    @Test(expected = ConnectionException.class)
    @SuppressWarnings("unchecked")
    public void testUnreachableConnect() throws Exception {
        // Given
        doThrow(new IOException("Connection refused"))
                .when(httpClient).execute(any(ClassicHttpRequest.class), any(HttpClientResponseHandler.class));

        // When
        registrar.register();
    }

    @Test
    @SuppressWarnings("unchecked")
    public void testWaitsUntilConnectIsUp() throws Exception {
        // Given: Kafka Connect 기동 전 (접속 거부 2회) → 404 → 201
        registrar = new DebeziumConnectorRegistrar(settings, httpClient, RetryPolicy.immediate(5));
        doThrow(new IOException("Connection refused"))
                .doThrow(new IOException("Connection refused"))
                .doAnswer(connectAnswer)
                .when(httpClient).execute(any(ClassicHttpRequest.class), any(HttpClientResponseHandler.class));
        responseCodes.addAll(Arrays.asList(404, 201));

        // When
        boolean created = registrar.register();

        // Then
        assertTrue(created);
        assertEquals(Arrays.asList("GET", "POST"), Arrays.asList(requests.get(0).getMethod(), requests.get(1).getMethod()));
    }

    @Test
    @SuppressWarnings("unchecked")
    public void testGivesUpWhenConnectStaysUnavailable() throws Exception {
        // Given: 계속 503
        registrar = new DebeziumConnectorRegistrar(settings, httpClient, RetryPolicy.immediate(3));
        responseCodes.addAll(Arrays.asList(503, 503, 503));

        try {
            // When
            registrar.register();
            fail("Expected ConnectionException");
        } catch (ConnectionException e) {
            // Then: 설정한 횟수만큼만 시도
            verify(httpClient, times(3)).execute(any(ClassicHttpRequest.class), any(HttpClientResponseHandler.class));
        }
    }

    @Test
    public void testRejectedConfigIsNotRetried() throws Exception {
        // Given
        registrar = new DebeziumConnectorRegistrar(settings, httpClient, RetryPolicy.immediate(3));
        responseCodes.addAll(Arrays.asList(404, 400));

        try {
            // When
            registrar.register();
            fail("Expected ConfigurationException");
        } catch (ConfigurationException e) {
            // Then
            assertEquals(2, requests.size());
        }
    }
}

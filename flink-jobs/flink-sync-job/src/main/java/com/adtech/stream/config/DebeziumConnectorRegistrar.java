package com.adtech.stream.config;

import com.adtech.common.config.ConfigurationException;
import com.adtech.common.error.ConnectionException;
import com.adtech.common.error.SyncException;
import com.adtech.common.model.SourceTable;
import com.adtech.common.retry.RetryPolicy;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.hc.client5.http.classic.methods.HttpGet;
import org.apache.hc.client5.http.classic.methods.HttpPost;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.core5.http.ClassicHttpRequest;
import org.apache.hc.core5.http.ContentType;
import org.apache.hc.core5.http.HttpStatus;
import org.apache.hc.core5.http.io.entity.EntityUtils;
import org.apache.hc.core5.http.io.entity.StringEntity;
import org.apache.hc.core5.util.Timeout;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Kafka Connect REST API 로 Debezium PostgreSQL connector 를 등록합니다.
 * <p>
 * 이미 같은 이름의 connector 가 있으면 건드리지 않습니다 (재기동해도 안전).
 * Kafka Connect 가 아직 기동 중이면 (접속 실패, 5xx) debezium.wait.* 설정만큼 기다리며 다시 시도합니다.
 * Stream Processor 가 op / before / after / source 를 모두 사용하므로 envelope 을 풀어내는
 * ExtractNewRecordState 같은 transform 은 설정하지 않습니다.
 */
public class DebeziumConnectorRegistrar implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(DebeziumConnectorRegistrar.class);
    private static final ObjectMapper objectMapper = new ObjectMapper();

    private static final String JSON_CONVERTER = "org.apache.kafka.connect.json.JsonConverter";

    private final DebeziumSettings settings;
    private final CloseableHttpClient httpClient;
    private final RetryPolicy retryPolicy;

    public DebeziumConnectorRegistrar(DebeziumSettings settings) {
        this(settings,
             HttpClients.custom()
                        .setDefaultRequestConfig(RequestConfig.custom()
                                                              .setConnectionRequestTimeout(Timeout.ofSeconds(10))
                                                              .setResponseTimeout(Timeout.ofSeconds(30))
                                                              .build())
                        .build(),
             RetryPolicy.fixed(settings.getWaitAttempts(), settings.getWaitInterval()));
    }

    DebeziumConnectorRegistrar(DebeziumSettings settings, CloseableHttpClient httpClient, RetryPolicy retryPolicy) {
        this.settings = settings;
        this.httpClient = httpClient;
        this.retryPolicy = retryPolicy;
    }

    /**
     * @return connector 를 새로 만들었으면 true, 이미 있었으면 false
     * @throws ConnectionException 재시도를 모두 소진해도 Kafka Connect 에 접속할 수 없거나 5xx 응답
     */
    public boolean register() throws ConnectionException {
        try {
            return retryPolicy.execute("Register Debezium connector " + settings.getConnectorName(),
                    this::registerOnce);
        } catch (ConnectionException e) {
            throw e;
        } catch (SyncException e) {
            throw new IllegalStateException("Unexpected failure registering connector", e);
        }
    }

    private boolean registerOnce() throws ConnectionException {
        String name = settings.getConnectorName();

        ConnectResponse existing = send(new HttpGet(settings.getConnectUrl() + "/connectors/" + name));
        if (existing.code == HttpStatus.SC_OK) {
            LOG.info("✅ Debezium connector '{}' 가 이미 존재합니다. 등록 생략", name);
            return false;
        }
        if (existing.code != HttpStatus.SC_NOT_FOUND) {
            throw new ConnectionException("Kafka Connect returned " + existing.code
                    + " for connector " + name + ": " + existing.body);
        }

        HttpPost post = new HttpPost(settings.getConnectUrl() + "/connectors");
        post.setEntity(new StringEntity(requestBody(), ContentType.APPLICATION_JSON));
        ConnectResponse created = send(post);

        if (created.code == HttpStatus.SC_CREATED || created.code == HttpStatus.SC_OK) {
            LOG.info("✅ Debezium connector '{}' 등록 완료: tables={}", name, tableIncludeList());
            return true;
        }
        if (created.code == HttpStatus.SC_CONFLICT) {
            // 다른 인스턴스가 먼저 등록
            LOG.info("✅ Debezium connector '{}' 가 동시에 등록되었습니다", name);
            return false;
        }
        if (created.code >= HttpStatus.SC_INTERNAL_SERVER_ERROR) {
            throw new ConnectionException("Kafka Connect returned " + created.code + ": " + created.body);
        }
        throw new ConfigurationException("Kafka Connect rejected connector " + name
                + " (" + created.code + "): " + created.body);
    }

    /**
     * POST /connectors 요청 본문
     */
    String requestBody() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("name", settings.getConnectorName());
        body.put("config", connectorConfig());
        try {
            return objectMapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialize connector config", e);
        }
    }

    Map<String, String> connectorConfig() {
        Map<String, String> config = new LinkedHashMap<>();
        config.put("connector.class", "io.debezium.connector.postgresql.PostgresConnector");
        config.put("tasks.max", "1");
        config.put("database.hostname", settings.getHostname());
        config.put("database.port", String.valueOf(settings.getPort()));
        config.put("database.user", settings.getUser());
        config.put("database.password", settings.getPassword());
        config.put("database.dbname", settings.getDbname());
        config.put("topic.prefix", settings.getTopicPrefix());
        config.put("table.include.list", tableIncludeList());
        config.put("plugin.name", "pgoutput");
        // timestamp → epoch millis, date → epoch days, numeric → "2.50"
        config.put("time.precision.mode", "connect");
        config.put("decimal.handling.mode", "string");
        config.put("key.converter", JSON_CONVERTER);
        config.put("key.converter.schemas.enable", "false");
        config.put("value.converter", JSON_CONVERTER);
        config.put("value.converter.schemas.enable", "false");
        return config;
    }

    static String tableIncludeList() {
        return Arrays.stream(SourceTable.values())
                     .map(t -> "public." + t.getTableName())
                     .collect(Collectors.joining(","));
    }

    private ConnectResponse send(ClassicHttpRequest request) throws ConnectionException {
        try {
            return httpClient.execute(request, response -> new ConnectResponse(
                    response.getCode(),
                    response.getEntity() != null ? EntityUtils.toString(response.getEntity()) : ""));
        } catch (IOException e) {
            throw new ConnectionException("Kafka Connect unreachable at " + settings.getConnectUrl(), e);
        }
    }

    @Override
    public void close() throws IOException {
        httpClient.close();
    }

    private static final class ConnectResponse {
        private final int code;
        private final String body;

        private ConnectResponse(int code, String body) {
            this.code = code;
            this.body = body;
        }
    }
}

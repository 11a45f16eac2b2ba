package net.scanward.integration.spring.http;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import net.scanward.core.model.RunConfig;
import net.scanward.core.spi.RunTrigger;
import net.scanward.core.spi.RunTriggerException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

import java.util.List;

/**
 * 스캔 서비스의 run 엔드포인트를 호출해 원격 스캔을 시작한다.
 * {@code POST {base}/integrity/run?mode=..&trigger=schedule} → {@code {"run_id": ..}}
 */
public final class HttpRunTrigger implements RunTrigger {
    private static final Logger log = LoggerFactory.getLogger(HttpRunTrigger.class);

    public static final String DEFAULT_PATH = "/integrity/run";
    public static final String TRIGGER_SOURCE = "schedule";

    private final RestClient client;
    private final String path;
    private final String authToken;

    public HttpRunTrigger(RestClient client, String path, String authToken) {
        this.client = client;
        this.path = path == null || path.isBlank() ? DEFAULT_PATH : path;
        this.authToken = authToken;
    }

    @Override
    public String trigger(RunRequest request) throws RunTriggerException {
        RunConfig cfg = request.runConfig() == null ? RunConfig.defaults() : request.runConfig();
        TriggerBody body = new TriggerBody(cfg.entities(), request.scheduleId(), request.executionId());

        TriggerResponse response;
        try {
            response = client.post()
                    .uri(b -> b.path(path)
                            .queryParam("mode", cfg.mode())
                            .queryParam("trigger", TRIGGER_SOURCE)
                            .build())
                    .headers(h -> {
                        if (authToken != null && !authToken.isBlank()) h.setBearerAuth(authToken);
                    })
                    .contentType(MediaType.APPLICATION_JSON)
                    .accept(MediaType.APPLICATION_JSON)
                    .body(body)
                    .retrieve()
                    .body(TriggerResponse.class);
        } catch (RestClientResponseException e) {
            int status = e.getStatusCode().value();
            throw new RunTriggerException("scan service responded " + status + ": " + e.getResponseBodyAsString(),
                    "HTTP_" + status, e);
        } catch (ResourceAccessException e) {
            throw new RunTriggerException("scan service unreachable: " + e.getMessage(), "UNAVAILABLE", e);
        }

        if (response == null || response.runId() == null || response.runId().isBlank()) {
            throw new RunTriggerException("scan service response carried no run_id", "NO_RUN_ID");
        }
        log.debug("scan started for schedule {}: run={} status={}",
                request.scheduleId(), response.runId(), response.status());
        return response.runId();
    }

    record TriggerBody(List<String> entities,
                       @JsonProperty("schedule_id") String scheduleId,
                       @JsonProperty("execution_id") String executionId) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record TriggerResponse(@JsonProperty("run_id") String runId,
                           @JsonProperty("status") String status) {}
}

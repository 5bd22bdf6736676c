package com.realtime.connect.poller;

import com.realtime.connect.common.ConnectException;
import com.realtime.connect.common.ErrorCode;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

import java.time.Duration;

/**
 * GET /api/connections/pending/count 호출. 연결/읽기 타임아웃이 지나면 TRANSIENT.
 */
public class RestPendingCountClient implements PendingCountSource {

    static final String PATH = "/api/connections/pending/count";

    private final RestClient rest;
    private final String accessToken;

    public RestPendingCountClient(String baseUrl, String accessToken, Duration timeout) {
        this(RestClient.builder()
                .baseUrl(baseUrl)
                .requestFactory(requestFactory(timeout))
                .build(), accessToken);
    }

    RestPendingCountClient(RestClient rest, String accessToken) {
        this.rest = rest;
        this.accessToken = accessToken;
    }

    private static SimpleClientHttpRequestFactory requestFactory(Duration timeout) {
        SimpleClientHttpRequestFactory f = new SimpleClientHttpRequestFactory();
        f.setConnectTimeout(timeout);
        f.setReadTimeout(timeout);
        return f;
    }

    @Override
    public long fetchPendingCount() {
        try {
            Long count = rest.get()
                    .uri(PATH)
                    .header(HttpHeaders.AUTHORIZATION, "Bearer " + accessToken)
                    .retrieve()
                    .body(Long.class);
            return count == null ? 0L : count;
        } catch (ResourceAccessException e) {
            throw new ConnectException(ErrorCode.TRANSIENT, "pending count unreachable", e);
        } catch (RestClientResponseException e) {
            if (e.getStatusCode().is5xxServerError()) {
                throw new ConnectException(ErrorCode.TRANSIENT, "pending count failed: " + e.getStatusCode(), e);
            }
            throw e;
        }
    }
}

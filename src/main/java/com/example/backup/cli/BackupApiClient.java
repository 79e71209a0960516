package com.example.backup.cli;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpMethod;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.web.client.ResponseErrorHandler;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 실행 중인 서비스의 REST API 클라이언트
 * 오류 응답도 본문(status=failed)을 그대로 돌려준다.
 */
@Slf4j
public class BackupApiClient {

    private final RestTemplate restTemplate;
    private final String endpoint;

    public BackupApiClient(RestTemplate restTemplate, String endpoint) {
        this.restTemplate = restTemplate;
        this.endpoint = endpoint.endsWith("/") ? endpoint.substring(0, endpoint.length() - 1) : endpoint;
        this.restTemplate.setErrorHandler(new ResponseErrorHandler() {
            @Override
            public boolean hasError(ClientHttpResponse response) {
                return false;
            }

            @Override
            public void handleError(ClientHttpResponse response) {
                // 상태 코드와 무관하게 본문을 호출자에게 전달
            }
        });
    }

    public JsonNode createBackup(String store, String type) {
        String uri = UriComponentsBuilder.fromHttpUrl(endpoint + "/api/backups")
                .queryParam("store", store)
                .queryParam("type", type)
                .toUriString();
        return post(uri, null);
    }

    public JsonNode validateBackup(String artifactId, int level) {
        String uri = UriComponentsBuilder.fromHttpUrl(endpoint + "/api/backups/{id}/validate")
                .queryParam("level", level)
                .buildAndExpand(artifactId)
                .toUriString();
        return post(uri, null);
    }

    public JsonNode runRestore(String store, String target, String scope, boolean force) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("store", store);
        body.put("target", target);
        body.put("scope", scope);
        body.put("force", force);
        return post(endpoint + "/api/restores", body);
    }

    public JsonNode confirmRestore(String runId) {
        String uri = UriComponentsBuilder.fromHttpUrl(endpoint + "/api/restores/{runId}/confirm")
                .buildAndExpand(runId)
                .toUriString();
        return post(uri, null);
    }

    public JsonNode complianceReport(String tier) {
        UriComponentsBuilder uri = UriComponentsBuilder.fromHttpUrl(endpoint + "/api/compliance");
        if (tier != null) {
            uri.queryParam("tier", tier);
        }
        return restTemplate.getForObject(uri.toUriString(), JsonNode.class);
    }

    public JsonNode scanWal(String store) {
        String uri = UriComponentsBuilder.fromHttpUrl(endpoint + "/api/wal/{store}/continuity")
                .buildAndExpand(store)
                .toUriString();
        return restTemplate.getForObject(uri, JsonNode.class);
    }

    private JsonNode post(String uri, Object body) {
        log.debug("{} {}", HttpMethod.POST, uri);
        return restTemplate.postForObject(uri, body, JsonNode.class);
    }
}

package com.example.backup.scenario;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.test.annotation.DirtiesContext;
import org.springframework.test.context.ActiveProfiles;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * REST API E2E 테스트
 * 커밋 -> 백업 -> 검증 -> 복구 -> 연속성/컴플라이언스 조회까지 HTTP 로 수행
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@ActiveProfiles("test")
@DirtiesContext(classMode = DirtiesContext.ClassMode.AFTER_EACH_TEST_METHOD)
class BackupApiScenarioTest {

    private static final ParameterizedTypeReference<Map<String, Object>> JSON =
            new ParameterizedTypeReference<Map<String, Object>>() {
            };

    @Autowired
    private TestRestTemplate restTemplate;

    @Test
    @DisplayName("HTTP 로 백업, 검증, 시퀀스 복구까지 수행")
    void backupValidateRestoreOverHttp() {
        for (int i = 1; i <= 10; i++) {
            ResponseEntity<Map<String, Object>> committed = post("/api/stores/primary/commit", commitBody("acc-" + i, i));
            assertEquals(HttpStatus.OK, committed.getStatusCode());
        }

        ResponseEntity<Map<String, Object>> created = post("/api/backups?store=primary&type=full", null);
        assertEquals(HttpStatus.OK, created.getStatusCode());
        assertEquals("ok", created.getBody().get("status"));
        Map<String, Object> artifact = data(created);
        String artifactId = (String) artifact.get("artifactId");
        assertEquals(10, ((Number) artifact.get("consistencyMarker")).intValue());
        assertEquals("UNTESTED", artifact.get("trustState"));

        ResponseEntity<Map<String, Object>> partial = post("/api/backups/" + artifactId + "/validate?level=3", null);
        assertEquals("degraded", partial.getBody().get("status"));

        ResponseEntity<Map<String, Object>> validated = post("/api/backups/" + artifactId + "/validate?level=5", null);
        assertEquals("ok", validated.getBody().get("status"));
        assertEquals("PASSED", data(validated).get("verdict"));

        for (int i = 11; i <= 15; i++) {
            post("/api/stores/primary/commit", commitBody("acc-" + i, i));
        }

        ResponseEntity<Map<String, Object>> restored = post("/api/restores",
                Map.of("store", "primary", "target", "12", "scope", "full", "force", false));
        assertEquals(HttpStatus.OK, restored.getStatusCode());
        assertEquals("ok", restored.getBody().get("status"), String.valueOf(restored.getBody().get("summary")));
        assertEquals("PROMOTED", data(restored).get("state"));
        assertEquals(12, ((Number) data(restored).get("targetSequence")).intValue());

        ResponseEntity<Map<String, Object>> status = get("/api/stores/primary");
        assertEquals(12, ((Number) data(status).get("appliedSequence")).intValue());

        String runId = (String) data(restored).get("runId");
        ResponseEntity<Map<String, Object>> run = get("/api/restores/" + runId);
        assertEquals("PROMOTED", data(run).get("state"));
    }

    @Test
    @DisplayName("실패한 복구는 200 이지만 status=failed 와 오류 종류를 담는다")
    void failedRestoreCarriesErrorKind() {
        post("/api/stores/primary/commit", commitBody("acc-1", 1));

        ResponseEntity<Map<String, Object>> restored = post("/api/restores", Map.of("store", "primary"));

        assertEquals(HttpStatus.OK, restored.getStatusCode());
        assertEquals("failed", restored.getBody().get("status"));
        assertEquals("POLICY_VIOLATION", restored.getBody().get("errorKind"));
        assertEquals("NO_SUITABLE_BACKUP", restored.getBody().get("errorCode"));
        assertEquals("ABORTED", data(restored).get("state"));
    }

    @Test
    @DisplayName("증분 백업을 FULL 없이 요청하면 422, 없는 아티팩트는 404")
    void errorStatusMapping() {
        post("/api/stores/primary/commit", commitBody("acc-1", 1));

        ResponseEntity<Map<String, Object>> incremental = post("/api/backups?store=primary&type=incremental", null);
        assertEquals(HttpStatus.UNPROCESSABLE_ENTITY, incremental.getStatusCode());
        assertEquals("MISSING_FULL_BASE", incremental.getBody().get("errorCode"));

        ResponseEntity<Map<String, Object>> missing = get("/api/backups/primary_full_missing");
        assertEquals(HttpStatus.NOT_FOUND, missing.getStatusCode());
        assertEquals("failed", missing.getBody().get("status"));
    }

    @Test
    @DisplayName("필수 필드가 없는 요청은 400")
    void invalidRequestIsBadRequest() {
        ResponseEntity<Map<String, Object>> restore = post("/api/restores", Map.of("target", "latest"));
        assertEquals(HttpStatus.BAD_REQUEST, restore.getStatusCode());

        ResponseEntity<Map<String, Object>> commit = post("/api/stores/primary/commit", Map.of("mutations", List.of()));
        assertEquals(HttpStatus.BAD_REQUEST, commit.getStatusCode());
    }

    @Test
    @DisplayName("연속성 조회와 컴플라이언스 보고")
    void continuityAndCompliance() {
        for (int i = 1; i <= 5; i++) {
            post("/api/stores/primary/commit", commitBody("acc-" + i, i));
        }

        ResponseEntity<Map<String, Object>> continuity = get("/api/wal/primary/continuity");
        assertEquals("ok", continuity.getBody().get("status"));
        assertEquals(Boolean.TRUE, data(continuity).get("continuous"));
        assertEquals(5, ((Number) data(continuity).get("archivedCount")).intValue());

        ResponseEntity<Map<String, Object>> compliance = get("/api/compliance?tier=important");
        assertEquals(HttpStatus.OK, compliance.getStatusCode());
        List<?> stores = (List<?>) data(compliance).get("stores");
        assertEquals(1, stores.size());
        // 검증된 백업이 없으므로 RTO 측정 불가
        assertEquals("failed", compliance.getBody().get("status"));

        ResponseEntity<Map<String, Object>> critical = get("/api/compliance?tier=critical");
        assertTrue(((List<?>) data(critical).get("stores")).isEmpty());
    }

    @Test
    @DisplayName("소비자 연결 상태는 복구 force 판단에 반영된다")
    void consumerRegistration() {
        ResponseEntity<Map<String, Object>> connected = post("/api/stores/primary/consumers/etl-1", null);
        assertEquals(1, ((Number) data(connected).get("activeConsumers")).intValue());

        ResponseEntity<Map<String, Object>> disconnected = restTemplate.exchange(
                "/api/stores/primary/consumers/etl-1", HttpMethod.DELETE, null, JSON);
        assertEquals(0, ((Number) data(disconnected).get("activeConsumers")).intValue());
    }

    private ResponseEntity<Map<String, Object>> post(String url, Object body) {
        return restTemplate.exchange(url, HttpMethod.POST, new HttpEntity<>(body), JSON);
    }

    private ResponseEntity<Map<String, Object>> get(String url) {
        return restTemplate.exchange(url, HttpMethod.GET, null, JSON);
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> data(ResponseEntity<Map<String, Object>> response) {
        return (Map<String, Object>) response.getBody().get("data");
    }

    private static Map<String, Object> commitBody(String key, int balance) {
        return Map.of("mutations", List.of(Map.of(
                "collection", "accounts",
                "key", key,
                "op", "PUT",
                "value", Map.of("balance", balance))));
    }
}

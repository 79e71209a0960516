package com.example.backup.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

/**
 * CLI 출력 형식과 종료 코드 검증 (서비스는 MockRestServiceServer 로 대체)
 */
class BackupCliTest {

    private static final String ENDPOINT = "http://backup.test";

    private MockRestServiceServer server;
    private ByteArrayOutputStream buffer;
    private BackupCli cli;

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplate();
        BackupApiClient client = new BackupApiClient(restTemplate, ENDPOINT + "/");
        server = MockRestServiceServer.bindTo(restTemplate).build();
        buffer = new ByteArrayOutputStream();
        cli = new BackupCli(client, new ObjectMapper(), "primary",
                new PrintStream(buffer, true, StandardCharsets.UTF_8));
    }

    @Test
    @DisplayName("backup create: 첫 줄 status, 둘째 줄 요약, 종료 코드 0")
    void createBackupPrintsStatusAndSummary() {
        server.expect(requestTo(ENDPOINT + "/api/backups?store=primary&type=full"))
                .andExpect(method(HttpMethod.POST))
                .andRespond(withSuccess("{\"status\":\"ok\",\"summary\":\"full backup primary_full_x created\","
                        + "\"data\":{\"artifactId\":\"primary_full_x\"}}", MediaType.APPLICATION_JSON));

        int exit = run("backup", "create", "--type", "full");

        assertEquals(BackupCli.EXIT_OK, exit);
        String[] lines = lines();
        assertEquals("status=ok", lines[0]);
        assertEquals("full backup primary_full_x created", lines[1]);
        server.verify();
    }

    @Test
    @DisplayName("INCOMPLETE 검증은 degraded 이지만 종료 코드는 0")
    void degradedIsNotFailure() {
        server.expect(requestTo(ENDPOINT + "/api/backups/primary_full_x/validate?level=3"))
                .andExpect(method(HttpMethod.POST))
                .andRespond(withSuccess("{\"status\":\"degraded\",\"summary\":\"stages above 3 not run\"}",
                        MediaType.APPLICATION_JSON));

        int exit = run("backup", "validate", "--artifact", "primary_full_x", "--level=3");

        assertEquals(BackupCli.EXIT_OK, exit);
        assertEquals("status=degraded", lines()[0]);
    }

    @Test
    @DisplayName("오류 응답은 status=failed 와 error=종류/코드를 출력하고 종료 코드 1")
    void failedResponsePrintsErrorLine() {
        server.expect(requestTo(ENDPOINT + "/api/restores"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(jsonPath("$.store").value("orders-db"))
                .andExpect(jsonPath("$.target").value("2024-03-05T07:00:00Z"))
                .andExpect(jsonPath("$.scope").value("table:accounts"))
                .andExpect(jsonPath("$.force").value(true))
                .andRespond(withStatus(HttpStatus.CONFLICT)
                        .contentType(MediaType.APPLICATION_JSON)
                        .body("{\"status\":\"failed\",\"summary\":\"store busy\","
                                + "\"errorKind\":\"BUSY\",\"errorCode\":\"STORE_LOCKED\"}"));

        int exit = run("restore", "run", "--store", "orders-db", "--target", "2024-03-05T07:00:00Z",
                "--scope", "table:accounts", "--force");

        assertEquals(BackupCli.EXIT_FAILED, exit);
        String[] lines = lines();
        assertEquals("status=failed", lines[0]);
        assertEquals("store busy", lines[1]);
        assertEquals("error=BUSY/STORE_LOCKED", lines[2]);
    }

    @Test
    @DisplayName("--json 이면 응답 전체를 이어서 출력")
    void jsonFlagPrintsBody() {
        server.expect(requestTo(ENDPOINT + "/api/compliance?tier=critical"))
                .andExpect(method(HttpMethod.GET))
                .andRespond(withSuccess("{\"status\":\"ok\",\"summary\":\"0 stores\",\"data\":{\"stores\":[]}}",
                        MediaType.APPLICATION_JSON));

        int exit = run("compliance", "report", "--tier", "critical", "--json");

        assertEquals(BackupCli.EXIT_OK, exit);
        assertTrue(output().contains("\"stores\""));
    }

    @Test
    @DisplayName("wal scan 과 restore confirm 경로")
    void walScanAndConfirm() {
        server.expect(requestTo(ENDPOINT + "/api/wal/primary/continuity"))
                .andRespond(withSuccess("{\"status\":\"degraded\",\"summary\":\"2 gaps\"}", MediaType.APPLICATION_JSON));
        server.expect(requestTo(ENDPOINT + "/api/restores/RST-1/confirm"))
                .andExpect(method(HttpMethod.POST))
                .andRespond(withSuccess("{\"status\":\"ok\",\"summary\":\"confirmed\"}", MediaType.APPLICATION_JSON));

        assertEquals(BackupCli.EXIT_OK, run("wal", "scan"));
        assertEquals(BackupCli.EXIT_OK, run("restore", "confirm", "--run", "RST-1"));
        server.verify();
    }

    @Test
    @DisplayName("필수 옵션 누락과 알 수 없는 명령은 사용법 출력 후 종료 코드 2")
    void usageErrors() {
        assertEquals(BackupCli.EXIT_USAGE, run("backup", "create"));
        assertTrue(output().contains("Missing required option --type"));

        assertEquals(BackupCli.EXIT_USAGE, run("backup", "destroy"));
        assertEquals(BackupCli.EXIT_USAGE, run("backup", "validate", "--artifact", "x", "--level", "9"));
        assertTrue(output().contains("usage:"));
    }

    @Test
    @DisplayName("서비스에 접속할 수 없으면 status=failed, 종료 코드 1")
    void unreachableService() {
        server.expect(requestTo(ENDPOINT + "/api/wal/primary/continuity"))
                .andRespond(request -> {
                    throw new IOException("Connection refused");
                });

        int exit = run("wal", "scan", "--store", "primary");

        assertEquals(BackupCli.EXIT_FAILED, exit);
        assertEquals("status=failed", lines()[0]);
        assertTrue(lines()[1].startsWith("Backup service is unreachable"));
    }

    @Test
    @DisplayName("명령 그룹으로 시작할 때만 CLI 로 실행")
    void cliInvocationDetection() {
        assertTrue(BackupCli.isCliInvocation("backup", "create"));
        assertTrue(BackupCli.isCliInvocation("wal", "scan"));
        assertFalse(BackupCli.isCliInvocation());
        assertFalse(BackupCli.isCliInvocation("--server.port=9090"));
    }

    private int run(String... args) {
        return cli.execute(CliArguments.parse(args));
    }

    private String output() {
        return buffer.toString(StandardCharsets.UTF_8);
    }

    private String[] lines() {
        return output().split("\\R");
    }
}

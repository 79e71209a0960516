package com.example.backup.cli;

import com.example.backup.domain.model.CommandStatus;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.web.client.RestClientException;

import java.io.PrintStream;
import java.util.Set;

/**
 * 명령행 인터페이스
 *
 *   backup create --type full|incremental [--store name]
 *   backup validate --artifact id [--level 1..5]
 *   restore run --target latest|timestamp|sequence [--scope full|table:name] [--force] [--store name]
 *   restore confirm --run id
 *   compliance report [--tier name]
 *   wal scan [--store name]
 *
 * 출력 첫 줄은 "status=ok|degraded|failed", 둘째 줄은 요약. --json 이면 응답 전체를 출력.
 * 종료 코드: failed/서비스 접속 불가 1, 잘못된 사용법 2
 */
@Slf4j
public class BackupCli implements CommandLineRunner, ExitCodeGenerator {

    public static final int EXIT_OK = 0;
    public static final int EXIT_FAILED = 1;
    public static final int EXIT_USAGE = 2;

    private static final Set<String> COMMAND_GROUPS = Set.of("backup", "restore", "compliance", "wal");

    private static final String USAGE = String.join(System.lineSeparator(),
            "usage:",
            "  backup create --type full|incremental [--store <name>]",
            "  backup validate --artifact <id> [--level 1..5]",
            "  restore run --target latest|<timestamp>|<sequence-id> [--scope full|table:<name>] [--force] [--store <name>]",
            "  restore confirm --run <id>",
            "  compliance report [--tier critical|important|standard|low]",
            "  wal scan [--store <name>]");

    private final BackupApiClient client;
    private final ObjectMapper objectMapper;
    private final String defaultStore;
    private final PrintStream out;

    private int exitCode = EXIT_OK;

    public BackupCli(BackupApiClient client, ObjectMapper objectMapper, String defaultStore, PrintStream out) {
        this.client = client;
        this.objectMapper = objectMapper;
        this.defaultStore = defaultStore;
        this.out = out;
    }

    public static boolean isCliInvocation(String... args) {
        return args.length > 0 && COMMAND_GROUPS.contains(args[0]);
    }

    @Override
    public void run(String... args) {
        exitCode = execute(CliArguments.parse(args));
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    int execute(CliArguments arguments) {
        JsonNode response;
        try {
            response = dispatch(arguments);
        } catch (IllegalArgumentException e) {
            out.println("status=" + CommandStatus.FAILED.getValue());
            out.println(e.getMessage());
            out.println(USAGE);
            return EXIT_USAGE;
        } catch (RestClientException e) {
            log.debug("Service call failed", e);
            out.println("status=" + CommandStatus.FAILED.getValue());
            out.println("Backup service is unreachable: " + e.getMessage());
            return EXIT_FAILED;
        }
        return print(response, arguments.flag("json"));
    }

    private JsonNode dispatch(CliArguments arguments) {
        String store = arguments.option("store", defaultStore);
        switch (arguments.command()) {
            case "backup create":
                return client.createBackup(store, arguments.require("type"));
            case "backup validate":
                return client.validateBackup(arguments.require("artifact"), parseLevel(arguments.option("level", "5")));
            case "restore run":
                return client.runRestore(store, arguments.require("target"),
                        arguments.option("scope", "full"), arguments.flag("force"));
            case "restore confirm":
                return client.confirmRestore(arguments.require("run"));
            case "compliance report":
                return client.complianceReport(arguments.option("tier"));
            case "wal scan":
                return client.scanWal(store);
            default:
                throw new IllegalArgumentException("Unknown command: " + String.join(" ", arguments.getPositionals()));
        }
    }

    private int parseLevel(String raw) {
        try {
            int level = Integer.parseInt(raw);
            if (level < 1 || level > 5) {
                throw new IllegalArgumentException("--level must be between 1 and 5: " + raw);
            }
            return level;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("--level must be a number: " + raw, e);
        }
    }

    private int print(JsonNode response, boolean json) {
        if (response == null || !response.hasNonNull("status")) {
            out.println("status=" + CommandStatus.FAILED.getValue());
            out.println("Service returned no command status");
            return EXIT_FAILED;
        }
        CommandStatus status = CommandStatus.fromValue(response.get("status").asText());
        out.println("status=" + status.getValue());
        out.println(response.path("summary").asText(""));
        if (response.hasNonNull("errorKind")) {
            out.println("error=" + response.get("errorKind").asText() + "/" + response.path("errorCode").asText(""));
        }
        if (json) {
            try {
                out.println(objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(response));
            } catch (JsonProcessingException e) {
                log.warn("Could not render response: {}", e.getMessage());
            }
        }
        return status == CommandStatus.FAILED ? EXIT_FAILED : EXIT_OK;
    }
}

package com.example.backup;

import com.example.backup.cli.BackupCli;
import com.example.backup.cli.CliConfiguration;
import org.springframework.boot.Banner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.context.ConfigurableApplicationContext;

/**
 * 백업/아카이브/PITR 엔진
 *
 * 인자 없이 실행하면 서비스(REST API + 주기 작업), 명령어와 함께 실행하면 CLI 클라이언트로 동작한다.
 *   java -jar backup-recovery.jar backup create --type full
 */
@SpringBootApplication
public class BackupRecoveryApplication {

    public static void main(String[] args) {
        if (BackupCli.isCliInvocation(args)) {
            ConfigurableApplicationContext context = new SpringApplicationBuilder(CliConfiguration.class)
                    .web(WebApplicationType.NONE)
                    .profiles("cli")
                    .bannerMode(Banner.Mode.OFF)
                    .logStartupInfo(false)
                    .run(args);
            System.exit(SpringApplication.exit(context));
        }
        SpringApplication.run(BackupRecoveryApplication.class, args);
    }
}

package com.example.backup.cli;

import com.example.backup.config.BackupProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;
import org.springframework.web.client.RestTemplate;

/**
 * CLI 전용 컨텍스트 (웹 서버, 카탈로그, 스토어 없이 API 클라이언트만 구성)
 */
@Configuration
@Profile("cli")
@EnableConfigurationProperties(BackupProperties.class)
public class CliConfiguration {

    @Bean
    public BackupApiClient backupApiClient(BackupProperties properties) {
        return new BackupApiClient(new RestTemplate(), properties.getCli().getEndpoint());
    }

    @Bean
    public BackupCli backupCli(BackupApiClient backupApiClient, BackupProperties properties) {
        return new BackupCli(backupApiClient, new ObjectMapper(), properties.getDefaultStore(), System.out);
    }
}

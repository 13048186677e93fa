package com.example.ficregistry.config;

import com.example.ficregistry.access.AuditSink;
import com.example.ficregistry.access.CsvPersonTableAccess;
import com.example.ficregistry.access.FileAuditSink;
import com.example.ficregistry.access.PersonTableAccess;
import com.example.ficregistry.crypto.CredentialCipher;
import java.nio.file.Path;
import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.retry.backoff.Sleeper;
import org.springframework.retry.backoff.ThreadWaitSleeper;

@Configuration
public class RegistryConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public Sleeper sleeper() {
        return new ThreadWaitSleeper();
    }

    @Bean
    public CredentialCipher credentialCipher(CipherProperties properties) {
        return new CredentialCipher(Path.of(properties.getKeyPath()));
    }

    @Bean
    public AuditSink auditSink(AuditProperties properties) {
        return new FileAuditSink(Path.of(properties.getPath()));
    }

    @Bean
    public PersonTableAccess personTableAccess(StoreProperties properties) {
        return new CsvPersonTableAccess(Path.of(properties.getPath()));
    }
}

package com.example.ficregistry.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "registry.audit")
@Data
public class AuditProperties {

    private String path = "logs/audit.log";
}

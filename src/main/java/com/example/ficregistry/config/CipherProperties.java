package com.example.ficregistry.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Field encryption settings (registry.cipher.*). The key file is created with owner-only
 * permissions on first use when it does not exist.
 */
@Component
@ConfigurationProperties(prefix = "registry.cipher")
@Data
public class CipherProperties {

    private String keyPath = "data/.field.key";
}

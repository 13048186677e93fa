package com.example.ficregistry.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Location of the local person table, bound from application.yml (registry.store.*).
 */
@Component
@ConfigurationProperties(prefix = "registry.store")
@Data
public class StoreProperties {

    private String path = "data/efetivo.csv";
    private int suggestionLimit = 20;
}

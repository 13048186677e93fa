package com.example.ficregistry.config;

import com.example.ficregistry.access.AwsSecretsManagerSecretStore;
import com.example.ficregistry.access.DirectoryGatewayFactory;
import com.example.ficregistry.access.DynamoDirectoryGatewayFactory;
import com.example.ficregistry.access.SecretStore;
import java.net.URI;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.secretsmanager.SecretsManagerClient;

@Configuration
@ConditionalOnProperty(prefix = "registry.directory", name = "enabled", havingValue = "true")
public class AwsConfig {

    @Bean(destroyMethod = "close")
    public SecretsManagerClient secretsManager(
            @Value("${registry.aws.region}") String region,
            @Value("${registry.aws.endpoint}") String endpoint,
            @Value("${registry.aws.use-localstack:true}") boolean useLocalstack) {
        var builder = SecretsManagerClient.builder().region(Region.of(region));
        if (useLocalstack) {
            builder.endpointOverride(URI.create(endpoint))
                    .credentialsProvider(StaticCredentialsProvider.create(
                            AwsBasicCredentials.create("test", "test")));
        }
        return builder.build();
    }

    @Bean
    public SecretStore secretStore(SecretsManagerClient secretsManager) {
        return new AwsSecretsManagerSecretStore(secretsManager);
    }

    @Bean
    public DirectoryGatewayFactory directoryGatewayFactory(DirectoryProperties properties) {
        return new DynamoDirectoryGatewayFactory(properties);
    }
}

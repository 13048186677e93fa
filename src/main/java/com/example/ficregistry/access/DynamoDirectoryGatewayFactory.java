package com.example.ficregistry.access;

import com.example.ficregistry.config.DirectoryProperties;
import com.example.ficregistry.models.ServiceAccountCredentials;
import java.net.URI;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.core.client.config.ClientOverrideConfiguration;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.retry.RetryPolicy;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.DynamoDbClientBuilder;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;
import software.amazon.awssdk.services.dynamodb.model.ScanRequest;

/**
 * Directory backed by a DynamoDB table whose items carry the same attribute names as the
 * registration spreadsheet. Only {@code DescribeTable} and {@code Scan} are issued. SDK
 * retries are disabled because the client owns the retry policy.
 */
public class DynamoDirectoryGatewayFactory implements DirectoryGatewayFactory {

    private final DirectoryProperties properties;

    public DynamoDirectoryGatewayFactory(DirectoryProperties properties) {
        this.properties = properties;
    }

    @Override
    public DirectoryGateway open(ServiceAccountCredentials credentials, String target) {
        DynamoDbClientBuilder builder = DynamoDbClient.builder()
                .region(Region.of(properties.getRegion()))
                .credentialsProvider(StaticCredentialsProvider.create(
                        AwsBasicCredentials.create(credentials.clientId(), credentials.privateKey())))
                .overrideConfiguration(ClientOverrideConfiguration.builder()
                        .apiCallAttemptTimeout(properties.getCallTimeout())
                        .apiCallTimeout(properties.getCallTimeout())
                        .retryPolicy(RetryPolicy.none())
                        .build());
        if (properties.getEndpoint() != null && !properties.getEndpoint().isBlank()) {
            builder.endpointOverride(URI.create(properties.getEndpoint()));
        }
        return new DynamoDirectoryGateway(builder.build(), target, properties.getIdentifierAttribute());
    }

    static final class DynamoDirectoryGateway implements DirectoryGateway {

        private final DynamoDbClient client;
        private final String table;
        private final String identifierAttribute;

        DynamoDirectoryGateway(DynamoDbClient client, String table, String identifierAttribute) {
            this.client = client;
            this.table = table;
            this.identifierAttribute = identifierAttribute;
        }

        @Override
        public void verify() {
            try {
                client.describeTable(r -> r.tableName(table));
            } catch (SdkException ex) {
                throw new DirectoryUnavailableException(
                        "Directory target could not be verified: " + ex.getClass().getSimpleName(), ex);
            }
        }

        @Override
        public List<Map<String, String>> findByIdentifier(String identifier) {
            Map<String, AttributeValue> values = new HashMap<>();
            values.put(":s", AttributeValue.fromS(identifier));
            String filter = "#id = :s";
            if (identifier.chars().allMatch(Character::isDigit)) {
                values.put(":n", AttributeValue.fromN(identifier));
                filter = "#id = :s OR #id = :n";
            }
            ScanRequest request = ScanRequest.builder()
                    .tableName(table)
                    .filterExpression(filter)
                    .expressionAttributeNames(Map.of("#id", identifierAttribute))
                    .expressionAttributeValues(values)
                    .consistentRead(true)
                    .build();
            try {
                return client.scanPaginator(request)
                        .items()
                        .stream()
                        .map(DynamoDirectoryGateway::toRow)
                        .collect(Collectors.toList());
            } catch (SdkException ex) {
                throw new DirectoryUnavailableException(
                        "Directory scan failed: " + ex.getClass().getSimpleName(), ex);
            }
        }

        @Override
        public void close() {
            client.close();
        }

        private static Map<String, String> toRow(Map<String, AttributeValue> item) {
            Map<String, String> row = new LinkedHashMap<>();
            item.forEach((name, value) -> row.put(name, asText(value)));
            return row;
        }

        private static String asText(AttributeValue value) {
            if (value.s() != null) {
                return value.s();
            }
            if (value.n() != null) {
                return value.n();
            }
            if (value.bool() != null) {
                return value.bool().toString();
            }
            return "";
        }
    }
}

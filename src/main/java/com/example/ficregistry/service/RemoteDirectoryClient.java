package com.example.ficregistry.service;

import com.example.ficregistry.access.DirectoryGateway;
import com.example.ficregistry.access.DirectoryGatewayFactory;
import com.example.ficregistry.access.DirectoryUnavailableException;
import com.example.ficregistry.access.SecretStore;
import com.example.ficregistry.config.DirectoryProperties;
import com.example.ficregistry.crypto.Fingerprints;
import com.example.ficregistry.crypto.Masking;
import com.example.ficregistry.models.LookupAuditEntry.Operation;
import com.example.ficregistry.models.PersonColumn;
import com.example.ficregistry.models.PersonRecord;
import com.example.ficregistry.models.SecurityStatus;
import com.example.ficregistry.models.ServiceAccountCredentials;
import com.example.ficregistry.validation.FieldValidator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.retry.backoff.BackOffInterruptedException;
import org.springframework.retry.backoff.ExponentialBackOffPolicy;
import org.springframework.retry.backoff.Sleeper;
import org.springframework.retry.policy.SimpleRetryPolicy;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Service;

/**
 * Read-only client for the remote person directory.
 *
 * <p>The target and the credential bundle come from the managed {@link SecretStore} only.
 * Every remote attempt goes through a minimum-interval throttle, transient failures are
 * retried with exponential backoff, and lookups are audited by fingerprint.
 */
@Slf4j
@Service
@ConditionalOnProperty(prefix = "registry.directory", name = "enabled", havingValue = "true")
public class RemoteDirectoryClient implements AutoCloseable {

    private static final Pattern IDENTIFIER = Pattern.compile("^[A-Za-z0-9_-]{1,20}$");
    static final String UNKNOWN_NAME = "NAO INFORMADO";

    private final DirectoryProperties properties;
    private final SecretStore secretStore;
    private final DirectoryGatewayFactory gatewayFactory;
    private final AuditLogService auditLogService;
    private final ObjectMapper objectMapper;
    private final MinimumIntervalThrottle throttle;
    private final RetryTemplate retryTemplate;
    private final String target;

    private DirectoryGateway gateway;

    public RemoteDirectoryClient(DirectoryProperties properties,
                                 SecretStore secretStore,
                                 DirectoryGatewayFactory gatewayFactory,
                                 AuditLogService auditLogService,
                                 Clock clock,
                                 Sleeper sleeper,
                                 ObjectMapper objectMapper) {
        if (properties.getCredentialsFile() != null && !properties.getCredentialsFile().isBlank()) {
            throw PersonRegistryException.securityViolation(
                    "Directory credentials must come from the managed secret store",
                    "registry.directory.credentials-file is set; remove it and store the bundle under "
                            + properties.getCredentialsSecretId());
        }
        this.properties = properties;
        this.secretStore = secretStore;
        this.gatewayFactory = gatewayFactory;
        this.auditLogService = auditLogService;
        this.objectMapper = objectMapper;
        this.target = secretStore.getSecret(properties.getTargetSecretId())
                .filter(value -> !value.isBlank())
                .map(String::trim)
                .orElseThrow(() -> PersonRegistryException.securityViolation(
                        "Directory target is not configured",
                        "secret " + properties.getTargetSecretId() + " is missing in " + secretStore.describe()));
        this.throttle = new MinimumIntervalThrottle(clock, sleeper, properties.getMinDelay());
        this.retryTemplate = buildRetryTemplate(properties, sleeper);
    }

    private static RetryTemplate buildRetryTemplate(DirectoryProperties properties, Sleeper sleeper) {
        SimpleRetryPolicy retryPolicy = new SimpleRetryPolicy(properties.getMaxAttempts(),
                Map.<Class<? extends Throwable>, Boolean>of(DirectoryUnavailableException.class, true), true);

        ExponentialBackOffPolicy backOff = new ExponentialBackOffPolicy();
        backOff.setInitialInterval(properties.getInitialBackoff().toMillis());
        backOff.setMultiplier(properties.getBackoffMultiplier());
        backOff.setMaxInterval(properties.getMaxBackoff().toMillis());
        backOff.setSleeper(sleeper);

        RetryTemplate template = new RetryTemplate();
        template.setRetryPolicy(retryPolicy);
        template.setBackOffPolicy(backOff);
        return template;
    }

    /**
     * Opens and verifies a read-only session.
     *
     * @return false when the directory cannot be reached
     * @throws PersonRegistryException {@code SECURITY_VIOLATION} when the credential bundle
     *         is missing or malformed
     */
    public synchronized boolean connect() {
        ServiceAccountCredentials credentials = loadCredentials();
        DirectoryGateway opened = null;
        try {
            opened = gatewayFactory.open(credentials, target);
            throttle.acquire();
            opened.verify();
        } catch (DirectoryUnavailableException | BackOffInterruptedException ex) {
            log.warn("Directory connection failed: {}", ex.getMessage());
            if (opened != null) {
                opened.close();
            }
            auditLogService.record(Operation.CONNECT, "target=" + Fingerprints.of(target) + " connected=false");
            return false;
        }
        closeGateway();
        gateway = opened;
        log.info("Connected to remote directory (target {})", Fingerprints.of(target));
        auditLogService.record(Operation.CONNECT, "target=" + Fingerprints.of(target) + " connected=true");
        return true;
    }

    public Optional<PersonRecord> fetchByIdentifier(String rawIdentifier) {
        return fetchByIdentifier(rawIdentifier, AuditLogService.DEFAULT_ACTOR);
    }

    /**
     * Fetches the person registered under {@code rawIdentifier}.
     *
     * @throws PersonRegistryException {@code SECURITY_VIOLATION} for a malformed identifier
     *         or an unusable session, {@code FETCH_FAILED} once retries are exhausted
     */
    public synchronized Optional<PersonRecord> fetchByIdentifier(String rawIdentifier, String actor) {
        String identifier = FieldValidator.sanitize(rawIdentifier);
        if (!IDENTIFIER.matcher(identifier).matches()) {
            throw PersonRegistryException.securityViolation("Identifier has an invalid format");
        }
        String idHash = Fingerprints.of(identifier);

        if (gateway == null && !connect()) {
            throw PersonRegistryException.securityViolation(
                    "Remote directory session could not be established",
                    "connect() failed for target " + Fingerprints.of(target));
        }

        AtomicInteger attempts = new AtomicInteger();
        List<Map<String, String>> rows;
        try {
            rows = retryTemplate.execute(context -> {
                throttle.acquire();
                attempts.incrementAndGet();
                return gateway.findByIdentifier(identifier);
            });
        } catch (DirectoryUnavailableException | BackOffInterruptedException ex) {
            log.warn("Remote fetch for id {} failed after {} attempt(s): {}",
                    idHash, attempts.get(), ex.getMessage());
            auditLogService.record(Operation.FETCH_ERROR,
                    "id=" + idHash + " attempts=" + attempts.get(), actor);
            throw PersonRegistryException.fetchFailed(attempts.get(), ex);
        }

        if (rows.isEmpty()) {
            auditLogService.record(Operation.FETCH_MISS, "id=" + idHash, actor);
            return Optional.empty();
        }
        if (rows.size() > 1) {
            log.info("Identifier {} matched {} directory rows, using the lowest sequence", idHash, rows.size());
        }

        PersonRecord person = toRecord(firstInSourceOrder(rows));
        auditLogService.record(Operation.REMOTE_FETCH,
                "name=" + Fingerprints.of(person.getFullName()), actor);
        return Optional.of(person);
    }

    /**
     * Display form of a record: identity fields unchanged, sensitive fields reduced to
     * their first and last two characters.
     */
    public static Map<String, String> toMaskedView(PersonRecord person) {
        return Masking.maskedView(person);
    }

    public synchronized SecurityStatus securityStatus() {
        boolean credentials = secretStore.getSecret(properties.getCredentialsSecretId())
                .filter(value -> !value.isBlank())
                .isPresent();
        return new SecurityStatus(
                credentials,
                !target.isEmpty(),
                true,
                true,
                PersonColumn.sensitiveColumns().size(),
                gateway != null,
                credentials ? SecurityStatus.Level.HIGH : SecurityStatus.Level.MEDIUM);
    }

    public synchronized boolean isConnected() {
        return gateway != null;
    }

    @Override
    public synchronized void close() {
        closeGateway();
    }

    private void closeGateway() {
        if (gateway != null) {
            gateway.close();
            gateway = null;
        }
    }

    private ServiceAccountCredentials loadCredentials() {
        String secretId = properties.getCredentialsSecretId();
        String json = secretStore.getSecret(secretId)
                .filter(value -> !value.isBlank())
                .orElseThrow(() -> PersonRegistryException.securityViolation(
                        "Directory credentials are not configured",
                        "secret " + secretId + " is missing in " + secretStore.describe()));

        ServiceAccountCredentials credentials;
        try {
            credentials = objectMapper.readValue(json, ServiceAccountCredentials.class);
        } catch (JsonProcessingException ex) {
            // the parser message may quote the key
            throw PersonRegistryException.securityViolation("Directory credentials are malformed",
                    "secret " + secretId + " is not a JSON credential bundle");
        }
        if (credentials == null) {
            throw PersonRegistryException.securityViolation("Directory credentials are malformed",
                    "secret " + secretId + " holds a JSON null");
        }

        List<String> problems = new ArrayList<>();
        if (!credentials.isServiceAccount()) {
            problems.add("type");
        }
        if (isBlank(credentials.projectId())) {
            problems.add("project_id");
        }
        if (isBlank(credentials.privateKey())) {
            problems.add("private_key");
        }
        if (isBlank(credentials.clientId())) {
            problems.add("client_id");
        }
        if (!problems.isEmpty()) {
            throw PersonRegistryException.securityViolation("Directory credentials are incomplete",
                    "secret " + secretId + " has missing or invalid fields " + problems);
        }
        return credentials;
    }

    private static Map<String, String> firstInSourceOrder(List<Map<String, String>> rows) {
        return rows.stream()
                .min(Comparator.comparing(RemoteDirectoryClient::sequenceOf,
                        Comparator.nullsLast(Comparator.naturalOrder())))
                .orElseThrow();
    }

    private static Integer sequenceOf(Map<String, String> row) {
        for (Map.Entry<String, String> entry : row.entrySet()) {
            if (PersonColumn.forHeader(entry.getKey()).filter(PersonColumn.SEQUENCE::equals).isPresent()) {
                return PersonRecord.parseSequence(entry.getValue());
            }
        }
        return null;
    }

    private static PersonRecord toRecord(Map<String, String> row) {
        Map<PersonColumn, String> values = new EnumMap<>(PersonColumn.class);
        row.forEach((attribute, value) -> PersonColumn.forHeader(attribute)
                .ifPresent(column -> values.putIfAbsent(column, FieldValidator.sanitize(value))));
        if (values.getOrDefault(PersonColumn.FULL_NAME, "").length() < 2) {
            values.put(PersonColumn.FULL_NAME, UNKNOWN_NAME);
        }

        Map<PersonColumn, String> hashes = new EnumMap<>(PersonColumn.class);
        for (PersonColumn column : PersonColumn.sensitiveColumns()) {
            String value = values.get(column);
            if (value != null && !value.isEmpty()) {
                hashes.put(column, Fingerprints.of(value));
            }
        }
        return PersonRecord.fromColumns(values).toBuilder()
                .sensitiveHashes(hashes)
                .build();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}

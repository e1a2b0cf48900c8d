package com.launchpad.core.health;

import com.launchpad.core.persistence.InMemoryLaunchRepository;
import com.launchpad.core.persistence.LaunchRepository;
import com.launchpad.core.registry.HandlerRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import javax.sql.DataSource;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Service
public class HealthCheckService {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckService.class);

    /** Placeholder application.yml uses when no key is provided. */
    static final String UNSET_API_KEY = "not-set";

    private final HandlerRegistry registry;
    private final LaunchRepository repository;
    private final DataSource dataSource;
    private final String llmBaseUrl;
    private final String llmApiKey;
    private final String llmModel;

    public HealthCheckService(
            HandlerRegistry registry,
            LaunchRepository repository,
            @Autowired(required = false) DataSource dataSource,
            @Value("${spring.ai.openai.base-url:}") String llmBaseUrl,
            @Value("${spring.ai.openai.api-key:}") String llmApiKey,
            @Value("${spring.ai.openai.chat.options.model:}") String llmModel) {
        this.registry = registry;
        this.repository = repository;
        this.dataSource = dataSource;
        this.llmBaseUrl = llmBaseUrl;
        this.llmApiKey = llmApiKey;
        this.llmModel = llmModel;
    }

    public List<HealthStatus> checkAll() {
        var results = new ArrayList<HealthStatus>();
        results.add(checkRegistry());
        results.add(checkDatabase());
        results.add(checkLlm());
        return results;
    }

    private HealthStatus checkRegistry() {
        return new HealthStatus("registry", HealthStatus.Status.UP,
                registry.size() + " handlers registered",
                Map.of("first", registry.handlerAt(0).name(),
                        "last", registry.handlerAt(registry.size() - 1).name()));
    }

    private HealthStatus checkDatabase() {
        if (repository instanceof InMemoryLaunchRepository) {
            return new HealthStatus("database", HealthStatus.Status.DEGRADED,
                    "In-memory store; launches do not survive a restart", Map.of("store", "memory"));
        }
        if (dataSource == null) {
            return new HealthStatus("database", HealthStatus.Status.DOWN,
                    "No DataSource configured", Map.of("store", "jdbc"));
        }
        try (var conn = dataSource.getConnection()) {
            if (conn.isValid(5)) {
                return new HealthStatus("database", HealthStatus.Status.UP,
                        "Database connection valid", Map.of("store", "jdbc"));
            }
            return new HealthStatus("database", HealthStatus.Status.DOWN,
                    "Database connection invalid", Map.of("store", "jdbc"));
        } catch (Exception e) {
            log.warn("Database health check failed: {}", e.getMessage());
            return new HealthStatus("database", HealthStatus.Status.DOWN,
                    "Database error: " + e.getMessage(), Map.of("store", "jdbc"));
        }
    }

    private HealthStatus checkLlm() {
        var metadata = Map.of(
                "baseUrl", llmBaseUrl.isBlank() ? "default" : llmBaseUrl,
                "model", llmModel.isBlank() ? "default" : llmModel);
        if (llmApiKey.isBlank() || UNSET_API_KEY.equals(llmApiKey)) {
            return new HealthStatus("llm", HealthStatus.Status.DOWN,
                    "No API key configured (spring.ai.openai.api-key)", metadata);
        }
        return new HealthStatus("llm", HealthStatus.Status.UP, "LLM endpoint configured", metadata);
    }
}

/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.healthbridge.integration.railway;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import villagecompute.healthbridge.exceptions.ConfigSyncException;

/**
 * HTTP client for the Railway GraphQL API.
 *
 * <p>
 * Used to mirror the live token pair into the service's Railway environment variables so that a redeploy starts
 * with current credentials. Two mutations are used:
 * <ul>
 * <li>{@code variableCollectionUpsert} - writes all variables in one call with {@code skipDeploys: true}</li>
 * <li>{@code serviceInstanceRedeploy} - optional explicit redeploy</li>
 * </ul>
 *
 * <p>
 * Railway reports GraphQL failures with HTTP 200 and an {@code errors} array; both transport and GraphQL errors raise
 * {@link ConfigSyncException}.
 */
@ApplicationScoped
public class RailwayClient {

    private static final Logger LOG = Logger.getLogger(RailwayClient.class);

    static final String UPSERT_MUTATION = "mutation VariablesUpsert($input: VariableCollectionUpsertInput!) "
            + "{ variableCollectionUpsert(input: $input) }";

    static final String REDEPLOY_MUTATION = "mutation Redeploy($environmentId: String!, $serviceId: String!) "
            + "{ serviceInstanceRedeploy(environmentId: $environmentId, serviceId: $serviceId) }";

    @ConfigProperty(
            name = "healthbridge.railway.api-url",
            defaultValue = "https://backboard.railway.app/graphql/v2")
    String apiUrl;

    @ConfigProperty(
            name = "healthbridge.railway.api-token")
    Optional<String> apiToken;

    @ConfigProperty(
            name = "healthbridge.railway.project-id")
    Optional<String> projectId;

    @ConfigProperty(
            name = "healthbridge.railway.environment-id")
    Optional<String> environmentId;

    @ConfigProperty(
            name = "healthbridge.railway.service-id")
    Optional<String> serviceId;

    @ConfigProperty(
            name = "healthbridge.railway.timeout",
            defaultValue = "30s")
    Duration timeout;

    @Inject
    ObjectMapper objectMapper;

    private HttpClient httpClient;

    @PostConstruct
    void init() {
        this.httpClient = HttpClient.newBuilder().connectTimeout(timeout).build();
    }

    /**
     * @return true if token, project, environment and service ids are all present
     */
    public boolean isConfigured() {
        return getMissingConfig().isEmpty();
    }

    /**
     * @return names of the environment variables that still need to be set
     */
    public List<String> getMissingConfig() {
        List<String> missing = new ArrayList<>();
        if (blank(apiToken)) {
            missing.add("RAILWAY_API_TOKEN");
        }
        if (blank(projectId)) {
            missing.add("RAILWAY_PROJECT_ID");
        }
        if (blank(environmentId)) {
            missing.add("RAILWAY_ENVIRONMENT_ID");
        }
        if (blank(serviceId)) {
            missing.add("RAILWAY_SERVICE_ID");
        }
        return missing;
    }

    /**
     * Upserts service variables without triggering a deploy.
     *
     * @param variables
     *            variable names and values
     * @throws ConfigSyncException
     *             if Railway is unreachable or rejects the mutation
     */
    public void upsertVariables(Map<String, String> variables) {
        requireConfigured();
        ObjectNode input = objectMapper.createObjectNode();
        input.put("projectId", projectId.orElseThrow());
        input.put("environmentId", environmentId.orElseThrow());
        input.put("serviceId", serviceId.orElseThrow());
        input.put("skipDeploys", true);
        ObjectNode vars = input.putObject("variables");
        variables.forEach(vars::put);

        ObjectNode graphqlVariables = objectMapper.createObjectNode();
        graphqlVariables.set("input", input);

        execute(UPSERT_MUTATION, graphqlVariables);
        LOG.infof("Updated %d Railway variables", variables.size());
    }

    /**
     * Redeploys the configured service instance so it picks up the latest variables.
     *
     * @throws ConfigSyncException
     *             if Railway is unreachable or rejects the mutation
     */
    public void redeploy() {
        requireConfigured();
        ObjectNode graphqlVariables = objectMapper.createObjectNode();
        graphqlVariables.put("environmentId", environmentId.orElseThrow());
        graphqlVariables.put("serviceId", serviceId.orElseThrow());

        execute(REDEPLOY_MUTATION, graphqlVariables);
        LOG.info("Triggered Railway service redeploy");
    }

    private void requireConfigured() {
        if (!isConfigured()) {
            throw new ConfigSyncException("Railway client not configured. Missing: " + getMissingConfig());
        }
    }

    private JsonNode execute(String query, ObjectNode variables) {
        try {
            ObjectNode payload = objectMapper.createObjectNode();
            payload.put("query", query);
            payload.set("variables", variables);

            HttpRequest request = HttpRequest.newBuilder().uri(URI.create(apiUrl)).timeout(timeout)
                    .header("Authorization", "Bearer " + apiToken.get())
                    .header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(objectMapper.writeValueAsString(payload))).build();

            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());

            JsonNode root = response.body() == null || response.body().isBlank() ? objectMapper.createObjectNode()
                    : objectMapper.readTree(response.body());

            if (response.statusCode() != 200) {
                throw new ConfigSyncException("Railway API returned HTTP " + response.statusCode());
            }

            JsonNode errors = root.get("errors");
            if (errors != null && errors.isArray() && !errors.isEmpty()) {
                String message = errors.get(0).path("message").asText("Unknown error");
                throw new ConfigSyncException("Railway API error: " + message);
            }

            return root;

        } catch (ConfigSyncException e) {
            throw e;
        } catch (IOException e) {
            throw new ConfigSyncException("Railway API request failed: " + e.getMessage(), e);
        } catch (IllegalArgumentException e) {
            throw new ConfigSyncException("Invalid Railway API URL " + apiUrl + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ConfigSyncException("Interrupted while calling Railway API", e);
        }
    }

    private static boolean blank(Optional<String> value) {
        return value == null || value.isEmpty() || value.get().isBlank();
    }
}

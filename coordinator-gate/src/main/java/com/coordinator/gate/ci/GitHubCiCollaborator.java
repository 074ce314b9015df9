package com.coordinator.gate.ci;

import com.coordinator.core.ci.CiCollaborator;
import com.coordinator.core.model.CiReport;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;

/**
 * CI collaborator backed by the GitHub REST API.
 *
 * Uses three endpoints per inspection:
 * <ul>
 *   <li>{@code GET /repos/{repo}/commits/{sha}/check-runs} for check conclusions</li>
 *   <li>{@code GET /repos/{repo}/commits/{sha}} for the committer date</li>
 *   <li>{@code GET /repos/{repo}/compare/{branch}...{sha}} for mainline reachability</li>
 * </ul>
 * Missing credentials, network errors and unexpected responses all yield an unverifiable report.
 */
public class GitHubCiCollaborator implements CiCollaborator {

    private static final Logger log = LoggerFactory.getLogger(GitHubCiCollaborator.class);

    static final String PENDING = "pending";

    private final String apiUrl;
    private final String repository;
    private final String token;
    private final Duration requestTimeout;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    public GitHubCiCollaborator(String apiUrl, String repository, String token,
                                Duration requestTimeout, ObjectMapper objectMapper) {
        this(apiUrl, repository, token, requestTimeout, objectMapper,
            HttpClient.newBuilder().connectTimeout(requestTimeout).build());
    }

    GitHubCiCollaborator(String apiUrl, String repository, String token,
                         Duration requestTimeout, ObjectMapper objectMapper, HttpClient httpClient) {
        this.apiUrl = apiUrl.endsWith("/") ? apiUrl.substring(0, apiUrl.length() - 1) : apiUrl;
        this.repository = repository;
        this.token = token;
        this.requestTimeout = requestTimeout;
        this.objectMapper = objectMapper;
        this.httpClient = httpClient;
    }

    @Override
    public CiReport inspect(String commitHash, Set<String> requiredChecks, String mainlineBranch) {
        if (isBlank(token) || isBlank(repository)) {
            return CiReport.unverifiable("GitHub repository or token not configured");
        }
        if (isBlank(commitHash)) {
            return CiReport.unverifiable("no commit hash");
        }
        try {
            Map<String, String> conclusions = checkConclusions(commitHash, requiredChecks);
            Instant committedAt = commitTimestamp(commitHash);
            boolean onMainline = reachableFrom(mainlineBranch, commitHash);
            log.debug("Commit {}: checks={}, committed={}, mainline={}", commitHash, conclusions, committedAt, onMainline);
            return CiReport.verified(conclusions, committedAt, onMainline);
        } catch (GitHubResponseException e) {
            log.warn("Cannot verify commit {}: {}", commitHash, e.getMessage());
            return CiReport.unverifiable(e.getMessage());
        } catch (IOException e) {
            log.warn("Cannot reach GitHub to verify commit {}: {}", commitHash, e.getMessage());
            return CiReport.unverifiable("GitHub unreachable: " + e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return CiReport.unverifiable("interrupted");
        }
    }

    private Map<String, String> checkConclusions(String sha, Set<String> requiredChecks)
            throws IOException, InterruptedException {
        JsonNode body = get("/repos/" + repository + "/commits/" + encode(sha) + "/check-runs?per_page=100");
        Map<String, String> conclusions = new HashMap<>();
        for (JsonNode run : body.path("check_runs")) {
            String name = run.path("name").asText();
            if (!requiredChecks.contains(name) || conclusions.containsKey(name)) {
                // Newest run of each check comes first
                continue;
            }
            JsonNode conclusion = run.get("conclusion");
            conclusions.put(name, conclusion == null || conclusion.isNull() ? PENDING : conclusion.asText());
        }
        return conclusions;
    }

    private Instant commitTimestamp(String sha) throws IOException, InterruptedException {
        JsonNode body = get("/repos/" + repository + "/commits/" + encode(sha));
        String date = body.path("commit").path("committer").path("date").asText(null);
        if (date == null) {
            return null;
        }
        try {
            return Instant.parse(date);
        } catch (DateTimeParseException e) {
            log.warn("Unreadable commit date for {}: {}", sha, date);
            return null;
        }
    }

    private boolean reachableFrom(String branch, String sha) throws IOException, InterruptedException {
        JsonNode body = get("/repos/" + repository + "/compare/" + encode(branch) + "..." + encode(sha));
        String status = body.path("status").asText();
        // Base...head is "behind" or "identical" when the head is already in the base branch
        return "behind".equals(status) || "identical".equals(status);
    }

    private JsonNode get(String path) throws IOException, InterruptedException {
        HttpRequest request = HttpRequest.newBuilder()
            .uri(URI.create(apiUrl + path))
            .timeout(requestTimeout)
            .header("Accept", "application/vnd.github+json")
            .header("Authorization", "Bearer " + token)
            .header("X-GitHub-Api-Version", "2022-11-28")
            .GET()
            .build();

        HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        if (response.statusCode() != 200) {
            throw new GitHubResponseException(path, response.statusCode());
        }
        return objectMapper.readTree(response.body());
    }

    private static String encode(String segment) {
        return URLEncoder.encode(segment, StandardCharsets.UTF_8);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static class GitHubResponseException extends IOException {
        GitHubResponseException(String path, int status) {
            super("GitHub returned " + status + " for " + path);
        }
    }
}

package com.teamflow.core.sync;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.teamflow.core.config.TeamflowProperties;
import com.teamflow.core.error.ExternalSyncFailureException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * {@link IssueTrackerClient} for the GitHub REST API v3 issue endpoints.
 * <p>
 * Authenticates with a bearer token when {@code teamflow.sync.token} is set.
 * Pull requests returned by the issues listing are skipped.
 */
@Component
public class GitHubIssueTrackerClient implements IssueTrackerClient {

    private static final Logger log = LoggerFactory.getLogger(GitHubIssueTrackerClient.class);

    private static final int PAGE_SIZE = 100;

    private final TeamflowProperties.Sync config;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper = new ObjectMapper();

    @Autowired
    public GitHubIssueTrackerClient(TeamflowProperties properties) {
        this(properties, HttpClient.newBuilder()
                .connectTimeout(properties.getSync().getRequestTimeout())
                .build());
    }

    GitHubIssueTrackerClient(TeamflowProperties properties, HttpClient httpClient) {
        this.config = properties.getSync();
        this.httpClient = httpClient;
    }

    @Override
    public boolean isConfigured() {
        return config.isConfigured();
    }

    @Override
    public List<TrackerIssue> listIssues(Instant since) {
        List<TrackerIssue> issues = new ArrayList<>();
        int page = 1;
        while (true) {
            String query = "?state=all&per_page=" + PAGE_SIZE + "&page=" + page
                    + (since != null ? "&since=" + encode(since.toString()) : "");
            var response = send("GET", "/issues" + query, null, null);
            JsonNode array = readTree(response.body());
            for (JsonNode node : array) {
                if (!node.has("pull_request")) {
                    issues.add(toIssue(node));
                }
            }
            if (array.size() < PAGE_SIZE) {
                break;
            }
            page++;
        }
        log.debug("Listed {} tracker issues since {}", issues.size(), since);
        return issues;
    }

    @Override
    public FetchResult<TrackerIssue> getIssue(int number, String etag) {
        var response = send("GET", "/issues/" + number, null, etag);
        String newEtag = response.headers().firstValue("ETag").orElse(etag);
        if (response.statusCode() == 304) {
            return FetchResult.unchanged(newEtag);
        }
        return FetchResult.fresh(toIssue(readTree(response.body())), newEtag);
    }

    @Override
    public void setAssignees(int number, List<String> assignees) {
        ObjectNode body = objectMapper.createObjectNode();
        body.putArray("assignees").addAll(assignees.stream().map(objectMapper.getNodeFactory()::textNode).toList());
        send("PATCH", "/issues/" + number, body.toString(), null);
    }

    @Override
    public void addLabels(int number, List<String> labels) {
        ObjectNode body = objectMapper.createObjectNode();
        body.putArray("labels").addAll(labels.stream().map(objectMapper.getNodeFactory()::textNode).toList());
        send("POST", "/issues/" + number + "/labels", body.toString(), null);
    }

    @Override
    public void removeLabel(int number, String label) {
        try {
            send("DELETE", "/issues/" + number + "/labels/" + encode(label), null, null);
        } catch (ExternalSyncFailureException e) {
            if (!e.getMessage().contains("HTTP 404")) {
                throw e;
            }
            log.debug("Label '{}' was not present on #{}", label, number);
        }
    }

    @Override
    public void comment(int number, String body) {
        ObjectNode json = objectMapper.createObjectNode();
        json.put("body", body);
        send("POST", "/issues/" + number + "/comments", json.toString(), null);
    }

    HttpResponse<String> send(String method, String path, String body, String etag) {
        if (!isConfigured()) {
            throw new ExternalSyncFailureException("Issue tracker not configured (teamflow.sync.owner / repo)");
        }
        String url = config.getBaseUrl() + "/repos/" + config.getOwner() + "/" + config.getRepo() + path;
        try {
            var builder = HttpRequest.newBuilder()
                    .uri(URI.create(url))
                    .timeout(config.getRequestTimeout())
                    .header("Accept", "application/vnd.github+json")
                    .header("X-GitHub-Api-Version", "2022-11-28")
                    .method(method, body == null
                            ? HttpRequest.BodyPublishers.noBody()
                            : HttpRequest.BodyPublishers.ofString(body));
            if (body != null) {
                builder.header("Content-Type", "application/json");
            }
            if (config.getToken() != null && !config.getToken().isBlank()) {
                builder.header("Authorization", "Bearer " + config.getToken());
            }
            if (etag != null) {
                builder.header("If-None-Match", etag);
            }

            var response = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() >= 400) {
                throw new ExternalSyncFailureException("Tracker %s %s failed (HTTP %d): %s"
                        .formatted(method, path, response.statusCode(), response.body()));
            }
            return response;
        } catch (IOException e) {
            throw new ExternalSyncFailureException("Tracker request failed: " + method + " " + path, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ExternalSyncFailureException("Interrupted during tracker request: " + method + " " + path, e);
        }
    }

    private JsonNode readTree(String body) {
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new ExternalSyncFailureException("Malformed tracker response", e);
        }
    }

    static TrackerIssue toIssue(JsonNode node) {
        List<String> labels = new ArrayList<>();
        for (JsonNode label : node.path("labels")) {
            labels.add(label.isTextual() ? label.asText() : label.path("name").asText());
        }
        List<String> assignees = new ArrayList<>();
        for (JsonNode assignee : node.path("assignees")) {
            assignees.add(assignee.path("login").asText());
        }
        String updated = node.path("updated_at").asText(null);
        return new TrackerIssue(
                node.path("number").asInt(),
                node.path("title").asText(""),
                node.path("body").isNull() ? "" : node.path("body").asText(""),
                node.path("state").asText("open"),
                labels,
                assignees,
                updated == null ? null : Instant.parse(updated));
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}

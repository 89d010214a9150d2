package ai.imagegraph.executor.service;

import ai.imagegraph.executor.config.BackendClientProperties;
import ai.imagegraph.executor.config.OutputProperties;
import ai.imagegraph.executor.exception.BackendNetworkException;
import ai.imagegraph.executor.exception.ImageStorageException;
import ai.imagegraph.executor.model.ImageReference;
import ai.imagegraph.executor.model.JobOutcome;
import ai.imagegraph.executor.model.JobStatus;
import ai.imagegraph.executor.model.OutputMode;
import ai.imagegraph.executor.model.SavedImage;
import ai.imagegraph.executor.model.Sleeper;
import ai.imagegraph.executor.model.SubmissionHandle;
import ai.imagegraph.workflow.model.ResolvedJob;
import ai.imagegraph.workflow.parser.ExecutionGraphWriter;
import ai.imagegraph.workflow.service.PathTokens;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.util.UriComponentsBuilder;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Drives one job on the image generation backend: submit the graph, poll its history and
 * retrieve the output image.
 * <p>
 * Only polling tolerates errors. Submission is never retried because a repeated POST can
 * create a duplicate job, and fetch failures end the call.
 */
@Service
public class ExecutionClient {

    private static final Logger logger = LoggerFactory.getLogger(ExecutionClient.class);

    private final RestClient restClient;
    private final ExecutionGraphWriter graphWriter;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final Sleeper sleeper;
    private final String externalUrl;
    private final String filenamePattern;
    private final String clientId = UUID.randomUUID().toString();

    public ExecutionClient(
            BackendClientProperties backendProperties,
            OutputProperties outputProperties,
            RestClient.Builder restClientBuilder,
            ExecutionGraphWriter graphWriter,
            ObjectMapper objectMapper,
            Clock clock,
            Sleeper sleeper) {
        this.restClient = restClientBuilder.baseUrl(normalizeBaseUrl(backendProperties.getBaseUrl())).build();
        this.graphWriter = graphWriter;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.sleeper = sleeper;
        this.externalUrl = normalizeBaseUrl(backendProperties.getEffectiveExternalUrl());
        this.filenamePattern = outputProperties.getFilenamePattern();
    }

    public SubmissionHandle submit(ResolvedJob job) {
        ObjectNode body = objectMapper.createObjectNode();
        body.set("prompt", graphWriter.write(job.graph()));
        body.put("client_id", clientId);

        JsonNode response;
        try {
            response = restClient.post()
                    .uri("/prompt")
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(body)
                    .retrieve()
                    .body(JsonNode.class);
        } catch (RestClientResponseException ex) {
            throw new BackendNetworkException(
                    BackendNetworkException.Reason.SUBMIT_FAILED,
                    "Backend rejected workflow submission with HTTP " + ex.getStatusCode().value()
                            + ": " + compactBody(ex.getResponseBodyAsString()),
                    ex);
        } catch (RestClientException ex) {
            throw new BackendNetworkException(
                    BackendNetworkException.Reason.SUBMIT_FAILED,
                    "Workflow submission failed: " + ex.getMessage(),
                    ex);
        }

        JsonNode promptId = response == null ? null : response.get("prompt_id");
        if (promptId == null || promptId.isNull() || promptId.asText().isBlank()) {
            throw new BackendNetworkException(
                    BackendNetworkException.Reason.SUBMIT_FAILED,
                    "Backend accepted workflow submission but returned no prompt_id");
        }

        SubmissionHandle handle = new SubmissionHandle(promptId.asText());
        logger.info(
                "Submitted workflow prompt={} nodes={} output={} client={}",
                handle.promptId(),
                job.graph().nodeCount(),
                job.outputNodeId(),
                clientId);
        return handle;
    }

    /**
     * Polls the job history until a terminal status is observed or {@code maxWait} has elapsed.
     * Transport and parse errors are counted and the loop continues.
     */
    public JobOutcome pollForCompletion(SubmissionHandle handle, Duration pollInterval, Duration maxWait) {
        Instant started = clock.instant();
        JobStatus status = JobStatus.QUEUED;
        int polls = 0;
        int transientErrors = 0;

        while (true) {
            polls++;
            try {
                JsonNode history = restClient.get()
                        .uri("/history/{promptId}", handle.promptId())
                        .retrieve()
                        .body(JsonNode.class);
                HistoryClassifier.Classification classification =
                        HistoryClassifier.classify(history, handle.promptId());
                if (!status.canTransitionTo(classification.status())) {
                    throw new IllegalStateException(
                            "Invalid status transition " + status + " -> " + classification.status());
                }
                status = classification.status();
                logger.debug("Polled prompt={} poll={} status={}", handle.promptId(), polls, status);

                if (status == JobStatus.COMPLETED) {
                    logger.info(
                            "Workflow completed prompt={} polls={} transientErrors={} elapsed={}",
                            handle.promptId(),
                            polls,
                            transientErrors,
                            Duration.between(started, clock.instant()));
                    return JobOutcome.completed(classification.images(), polls, transientErrors);
                }
                if (status == JobStatus.FAILED) {
                    logger.info(
                            "Workflow failed prompt={} polls={} reason={}",
                            handle.promptId(),
                            polls,
                            classification.failureReason());
                    return JobOutcome.failed(classification.failureReason(), polls, transientErrors);
                }
            } catch (RestClientException | IllegalStateException ex) {
                transientErrors++;
                logger.warn(
                        "History poll failed prompt={} poll={} transientErrors={}: {}",
                        handle.promptId(),
                        polls,
                        transientErrors,
                        ex.getMessage());
            }

            Duration elapsed = Duration.between(started, clock.instant());
            if (elapsed.compareTo(maxWait) >= 0) {
                logger.warn(
                        "Workflow timed out prompt={} lastStatus={} polls={} transientErrors={} maxWait={}",
                        handle.promptId(),
                        status,
                        polls,
                        transientErrors,
                        maxWait);
                return JobOutcome.timedOut(
                        "No result after " + maxWait + " (last status " + status + ")", polls, transientErrors);
            }

            Duration remaining = maxWait.minus(elapsed);
            waitBeforeNextPoll(handle, remaining.compareTo(pollInterval) < 0 ? remaining : pollInterval);
        }
    }

    /**
     * Hands back the output image: a backend locator in url mode, a file below {@code saveDir} in file mode.
     */
    public SavedImage fetchAndSave(ImageReference outputRef, OutputMode outputMode, Path saveDir) {
        if (outputMode == OutputMode.URL) {
            String url = UriComponentsBuilder.fromHttpUrl(externalUrl)
                    .path("/view")
                    .queryParam("filename", outputRef.filename())
                    .queryParam("subfolder", outputRef.subfolder())
                    .queryParam("type", outputRef.type())
                    .encode()
                    .build()
                    .toUriString();
            logger.info("Resolved image url={} filename={}", url, outputRef.filename());
            return SavedImage.ofUrl(url);
        }

        byte[] bytes;
        try {
            bytes = restClient.get()
                    .uri(uriBuilder -> uriBuilder
                            .path("/view")
                            .queryParam("filename", outputRef.filename())
                            .queryParam("subfolder", outputRef.subfolder())
                            .queryParam("type", outputRef.type())
                            .build())
                    .retrieve()
                    .body(byte[].class);
        } catch (RestClientException ex) {
            throw new BackendNetworkException(
                    BackendNetworkException.Reason.FETCH_FAILED,
                    "Could not fetch image " + outputRef.filename() + ": " + ex.getMessage(),
                    ex);
        }
        if (bytes == null || bytes.length == 0) {
            throw new BackendNetworkException(
                    BackendNetworkException.Reason.FETCH_FAILED,
                    "Backend returned an empty body for image " + outputRef.filename());
        }

        String fileName = sanitizeFileName(PathTokens.substituteTokens(filenamePattern, LocalDateTime.now(clock)))
                + outputRef.extension();
        Path target = resolveSafePath(saveDir, fileName);
        try {
            Files.createDirectories(saveDir);
            Files.write(target, bytes);
        } catch (IOException e) {
            throw new ImageStorageException(
                    ImageStorageException.Reason.WRITE_FAILED,
                    "Could not write image to " + target + ": " + e.getMessage(),
                    e);
        }

        logger.info("Saved image path={} bytes={} source={}", target, bytes.length, outputRef.filename());
        return SavedImage.ofFile(target, bytes.length);
    }

    private void waitBeforeNextPoll(SubmissionHandle handle, Duration duration) {
        try {
            sleeper.sleep(duration);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for prompt " + handle.promptId(), e);
        }
    }

    private static Path resolveSafePath(Path baseDirectory, String fileName) {
        Path base = baseDirectory.normalize();
        Path resolved = base.resolve(fileName).normalize();
        if (!resolved.startsWith(base) || resolved.equals(base)) {
            throw new ImageStorageException(
                    ImageStorageException.Reason.WRITE_FAILED,
                    "Illegal image file name outside save directory: " + fileName);
        }
        return resolved;
    }

    private static String sanitizeFileName(String value) {
        return value.replaceAll("[^a-zA-Z0-9._-]", "_");
    }

    private static String compactBody(String body) {
        if (body == null || body.isBlank()) {
            return "<empty body>";
        }
        return body.length() > 500 ? body.substring(0, 500) : body;
    }

    private static String normalizeBaseUrl(String baseUrl) {
        if (baseUrl == null || baseUrl.isBlank()) {
            throw new IllegalArgumentException("Backend base URL must be configured");
        }
        String trimmed = baseUrl.trim();
        return trimmed.endsWith("/") ? trimmed.substring(0, trimmed.length() - 1) : trimmed;
    }
}

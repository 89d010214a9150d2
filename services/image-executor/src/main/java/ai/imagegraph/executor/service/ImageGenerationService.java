package ai.imagegraph.executor.service;

import ai.imagegraph.executor.config.BackendClientProperties;
import ai.imagegraph.executor.config.OutputProperties;
import ai.imagegraph.executor.config.WorkflowProperties;
import ai.imagegraph.executor.exception.BackendNetworkException;
import ai.imagegraph.executor.exception.JobExecutionException;
import ai.imagegraph.executor.model.GenerationRequest;
import ai.imagegraph.executor.model.ImageReference;
import ai.imagegraph.executor.model.JobOutcome;
import ai.imagegraph.executor.model.SavedImage;
import ai.imagegraph.executor.model.SubmissionHandle;
import ai.imagegraph.workflow.exception.TemplateException;
import ai.imagegraph.workflow.model.GraphTemplate;
import ai.imagegraph.workflow.model.NodeRole;
import ai.imagegraph.workflow.model.NodeSummary;
import ai.imagegraph.workflow.model.ResolvedJob;
import ai.imagegraph.workflow.service.PathTokens;
import ai.imagegraph.workflow.service.TemplateResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Generates one image per call: load the template, bind and fill its roles, then run it on the backend.
 */
@Service
public class ImageGenerationService {

    private static final Logger logger = LoggerFactory.getLogger(ImageGenerationService.class);

    private static final String DEFAULT_IMAGE_DIR = "img";

    private final TemplateResolver templateResolver;
    private final ExecutionClient executionClient;
    private final WorkflowProperties workflowProperties;
    private final BackendClientProperties backendProperties;
    private final OutputProperties outputProperties;
    private final Clock clock;

    public ImageGenerationService(
            TemplateResolver templateResolver,
            ExecutionClient executionClient,
            WorkflowProperties workflowProperties,
            BackendClientProperties backendProperties,
            OutputProperties outputProperties,
            Clock clock) {
        this.templateResolver = templateResolver;
        this.executionClient = executionClient;
        this.workflowProperties = workflowProperties;
        this.backendProperties = backendProperties;
        this.outputProperties = outputProperties;
        this.clock = clock;
    }

    public SavedImage generateImage(GenerationRequest request) {
        Path saveDir = resolveSaveDirectory(request.savePath());
        logger.info(
                "Generating image template={} mode={} saveDir={} negative={}",
                workflowProperties.getTemplatePath(),
                outputProperties.getMode(),
                saveDir,
                request.hasNegativePrompt());
        try {
            GraphTemplate template = loadTemplate();
            ResolvedJob job = resolveJob(template, request, saveDir);

            SubmissionHandle handle = executionClient.submit(job);
            JobOutcome outcome = executionClient.pollForCompletion(
                    handle, backendProperties.getPollInterval(), backendProperties.getMaxWait());
            if (!outcome.isCompleted()) {
                throw JobExecutionException.fromStatus(
                        outcome.status(),
                        handle.promptId(),
                        "Prompt " + handle.promptId() + " ended " + outcome.status() + ": " + outcome.failureReason());
            }

            ImageReference image = outcome.firstImage(job.outputNodeId())
                    .orElseThrow(() -> new BackendNetworkException(
                            BackendNetworkException.Reason.FETCH_FAILED,
                            "Prompt " + handle.promptId() + " completed without an image from output node "
                                    + job.outputNodeId()));
            return executionClient.fetchAndSave(image, outputProperties.getMode(), saveDir);
        } catch (RuntimeException e) {
            logger.error("Image generation failed template={}: {}", workflowProperties.getTemplatePath(), e.getMessage(), e);
            throw e;
        }
    }

    public List<NodeSummary> listWorkflowNodes() {
        return templateResolver.describeNodes(loadTemplate());
    }

    Path resolveSaveDirectory(String override) {
        String directory;
        if (hasText(override)) {
            directory = override.trim();
        } else if (hasText(outputProperties.getWorkingDir())) {
            directory = Path.of(outputProperties.getWorkingDir().trim(), DEFAULT_IMAGE_DIR).toString();
        } else {
            directory = DEFAULT_IMAGE_DIR;
        }
        return Path.of(PathTokens.substituteTokens(directory, LocalDateTime.now(clock)));
    }

    private GraphTemplate loadTemplate() {
        String templatePath = workflowProperties.getTemplatePath();
        return templateResolver.load(hasText(templatePath) ? Path.of(templatePath.trim()) : null);
    }

    private ResolvedJob resolveJob(GraphTemplate template, GenerationRequest request, Path saveDir) {
        Map<NodeRole, String> bindings = new EnumMap<>(NodeRole.class);
        String positiveNodeId = resolveRequired(template, NodeRole.POSITIVE_TEXT);
        bindings.put(NodeRole.POSITIVE_TEXT, positiveNodeId);
        bindings.put(NodeRole.OUTPUT, resolveRequired(template, NodeRole.OUTPUT));

        if (request.hasNegativePrompt()) {
            resolveOptional(template, NodeRole.NEGATIVE_TEXT)
                    .filter(nodeId -> {
                        if (nodeId.equals(positiveNodeId)) {
                            logger.warn(
                                    "Skipping role={}: resolved to positive prompt node={}",
                                    NodeRole.NEGATIVE_TEXT, nodeId);
                            return false;
                        }
                        return true;
                    })
                    .ifPresent(nodeId -> bindings.put(NodeRole.NEGATIVE_TEXT, nodeId));
        }
        resolveOptional(template, NodeRole.FILE_PATH)
                .ifPresent(nodeId -> bindings.put(NodeRole.FILE_PATH, nodeId));
        if (request.width() != null || request.height() != null) {
            resolveOptional(template, NodeRole.LATENT_IMAGE)
                    .ifPresent(nodeId -> bindings.put(NodeRole.LATENT_IMAGE, nodeId));
        }

        ResolvedJob job = new ResolvedJob(template, bindings);
        job = templateResolver.injectPrompt(job, NodeRole.POSITIVE_TEXT, request.positivePrompt());
        if (bindings.containsKey(NodeRole.NEGATIVE_TEXT)) {
            job = templateResolver.injectPrompt(job, NodeRole.NEGATIVE_TEXT, request.negativePrompt());
        } else if (request.hasNegativePrompt()) {
            logger.warn("Negative prompt supplied but the workflow has no usable negative prompt node; ignoring it");
        }
        if (bindings.containsKey(NodeRole.FILE_PATH)) {
            job = templateResolver.injectPrompt(job, NodeRole.FILE_PATH, saveDir.toString());
        }
        if (bindings.containsKey(NodeRole.LATENT_IMAGE)) {
            if (request.width() != null) {
                job = templateResolver.injectInput(job, NodeRole.LATENT_IMAGE, "width", request.width());
            }
            if (request.height() != null) {
                job = templateResolver.injectInput(job, NodeRole.LATENT_IMAGE, "height", request.height());
            }
        } else if (request.width() != null || request.height() != null) {
            logger.warn("Image size supplied but the workflow has no latent image node; keeping template size");
        }
        return job;
    }

    private String resolveRequired(GraphTemplate template, NodeRole role) {
        String nodeId = templateResolver.resolveRole(template, role, workflowProperties.nodeIdFor(role));
        logger.debug("Bound role={} node={}", role, nodeId);
        return nodeId;
    }

    private Optional<String> resolveOptional(GraphTemplate template, NodeRole role) {
        try {
            return Optional.of(resolveRequired(template, role));
        } catch (TemplateException e) {
            if (e.getReason() != TemplateException.Reason.NODE_NOT_FOUND) {
                throw e;
            }
            if (role == NodeRole.FILE_PATH && workflowProperties.nodeIdFor(role) == null) {
                // Path nodes are uncommon; only a configured id is expected to resolve.
                logger.debug("No node for optional role={}", role);
            } else {
                logger.warn("Skipping optional role={}: {}", role, e.getMessage());
            }
            return Optional.empty();
        }
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}

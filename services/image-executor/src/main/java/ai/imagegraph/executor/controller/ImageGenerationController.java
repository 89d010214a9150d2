package ai.imagegraph.executor.controller;

import ai.imagegraph.executor.dto.GenerateImageRequest;
import ai.imagegraph.executor.dto.GenerateImageResponse;
import ai.imagegraph.executor.model.GenerationRequest;
import ai.imagegraph.executor.model.SavedImage;
import ai.imagegraph.executor.service.ImageGenerationService;
import ai.imagegraph.workflow.model.NodeSummary;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Image generation API and workflow node listing.
 */
@RestController
@RequestMapping("/api/v1")
public class ImageGenerationController {

    private final ImageGenerationService imageGenerationService;

    public ImageGenerationController(ImageGenerationService imageGenerationService) {
        this.imageGenerationService = imageGenerationService;
    }

    @PostMapping("/images")
    public ResponseEntity<GenerateImageResponse> generateImage(@Valid @RequestBody GenerateImageRequest request) {
        SavedImage image = imageGenerationService.generateImage(new GenerationRequest(
                request.getPositivePrompt(),
                request.getNegativePrompt(),
                request.getSavePath(),
                request.getWidth(),
                request.getHeight()));
        return ResponseEntity.ok(GenerateImageResponse.from(image));
    }

    @GetMapping("/workflow/nodes")
    public ResponseEntity<List<NodeSummary>> listWorkflowNodes() {
        return ResponseEntity.ok(imageGenerationService.listWorkflowNodes());
    }
}

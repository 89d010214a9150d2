package ai.imagegraph.executor.controller;

import ai.imagegraph.executor.exception.BackendNetworkException;
import ai.imagegraph.executor.exception.ImageStorageException;
import ai.imagegraph.executor.exception.JobExecutionException;
import ai.imagegraph.executor.model.GenerationRequest;
import ai.imagegraph.executor.model.SavedImage;
import ai.imagegraph.executor.service.ImageGenerationService;
import ai.imagegraph.workflow.exception.TemplateException;
import ai.imagegraph.workflow.model.NodeSummary;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.http.converter.json.MappingJackson2HttpMessageConverter;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class ImageGenerationControllerTest {

    private MockMvc mockMvc;

    @Mock
    private ImageGenerationService imageGenerationService;

    @BeforeEach
    void setup() {
        ObjectMapper objectMapper = new ObjectMapper();
        mockMvc = MockMvcBuilders
                .standaloneSetup(new ImageGenerationController(imageGenerationService))
                .setControllerAdvice(new ApiExceptionHandler())
                .setMessageConverters(new MappingJackson2HttpMessageConverter(objectMapper))
                .build();
    }

    @Test
    void generateImage_ShouldReturnSavedFile() throws Exception {
        when(imageGenerationService.generateImage(any()))
                .thenReturn(SavedImage.ofFile(Path.of("/data/img/2024-03-07_140509.png"), 2048));

        mockMvc.perform(post("/api/v1/images")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"positivePrompt\": \"a fox\", \"negativePrompt\": \"blurry\", \"width\": 768}"))
                .andExpect(status().isOk())
                .andExpect(content().contentType(MediaType.APPLICATION_JSON))
                .andExpect(jsonPath("$.mode").value("file"))
                .andExpect(jsonPath("$.path").value("/data/img/2024-03-07_140509.png"))
                .andExpect(jsonPath("$.sizeBytes").value(2048))
                .andExpect(jsonPath("$.url").doesNotExist());

        ArgumentCaptor<GenerationRequest> captor = ArgumentCaptor.forClass(GenerationRequest.class);
        verify(imageGenerationService).generateImage(captor.capture());
        assertThat(captor.getValue()).isEqualTo(new GenerationRequest("a fox", "blurry", null, 768, null));
    }

    @Test
    void generateImage_ShouldReturnUrl_InUrlMode() throws Exception {
        when(imageGenerationService.generateImage(any()))
                .thenReturn(SavedImage.ofUrl("https://images.example.com/view?filename=a.png&subfolder=&type=output"));

        mockMvc.perform(post("/api/v1/images")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"positivePrompt\": \"a fox\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.mode").value("url"))
                .andExpect(jsonPath("$.url").value("https://images.example.com/view?filename=a.png&subfolder=&type=output"))
                .andExpect(jsonPath("$.path").doesNotExist());
    }

    @Test
    void generateImage_ShouldReturnBadRequest_WhenPromptBlank() throws Exception {
        mockMvc.perform(post("/api/v1/images")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"positivePrompt\": \"  \"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("BAD_REQUEST"))
                .andExpect(jsonPath("$.message").value(containsString("positivePrompt")));

        verifyNoInteractions(imageGenerationService);
    }

    @Test
    void generateImage_ShouldReturnBadRequest_WhenBodyUnreadable() throws Exception {
        mockMvc.perform(post("/api/v1/images")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{not json"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void generateImage_ShouldReturnUnprocessable_WhenTemplateInvalid() throws Exception {
        when(imageGenerationService.generateImage(any()))
                .thenThrow(new TemplateException(TemplateException.Reason.NODE_NOT_FOUND, "Node '42' was not found"));

        mockMvc.perform(post("/api/v1/images")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"positivePrompt\": \"a fox\"}"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.error").value("UNPROCESSABLE_ENTITY"))
                .andExpect(jsonPath("$.reason").value("NODE_NOT_FOUND"))
                .andExpect(jsonPath("$.message").value("Node '42' was not found"));
    }

    @Test
    void generateImage_ShouldReturnBadGateway_WhenSubmitFails() throws Exception {
        when(imageGenerationService.generateImage(any()))
                .thenThrow(new BackendNetworkException(BackendNetworkException.Reason.SUBMIT_FAILED, "HTTP 500"));

        mockMvc.perform(post("/api/v1/images")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"positivePrompt\": \"a fox\"}"))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.reason").value("SUBMIT_FAILED"));
    }

    @Test
    void generateImage_ShouldReturnGatewayTimeout_WhenJobTimesOut() throws Exception {
        when(imageGenerationService.generateImage(any()))
                .thenThrow(new JobExecutionException(JobExecutionException.Reason.TIMED_OUT, "p-1", "No result"));

        mockMvc.perform(post("/api/v1/images")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"positivePrompt\": \"a fox\"}"))
                .andExpect(status().isGatewayTimeout())
                .andExpect(jsonPath("$.reason").value("TIMED_OUT"));
    }

    @Test
    void generateImage_ShouldReturnBadGateway_WhenJobFails() throws Exception {
        when(imageGenerationService.generateImage(any()))
                .thenThrow(new JobExecutionException(JobExecutionException.Reason.FAILED, "p-1", "Node 3 failed"));

        mockMvc.perform(post("/api/v1/images")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"positivePrompt\": \"a fox\"}"))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.reason").value("FAILED"));
    }

    @Test
    void generateImage_ShouldReturnServerError_WhenWriteFails() throws Exception {
        when(imageGenerationService.generateImage(any()))
                .thenThrow(new ImageStorageException(
                        ImageStorageException.Reason.WRITE_FAILED, "disk full", new IOException("disk full")));

        mockMvc.perform(post("/api/v1/images")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"positivePrompt\": \"a fox\"}"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.reason").value("WRITE_FAILED"));
    }

    @Test
    void generateImage_ShouldReturnServerError_WhenServiceRejectsInternalArgument() throws Exception {
        when(imageGenerationService.generateImage(any()))
                .thenThrow(new IllegalArgumentException("timeout value is negative"));

        mockMvc.perform(post("/api/v1/images")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"positivePrompt\": \"a fox\"}"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.error").value("INTERNAL_SERVER_ERROR"))
                .andExpect(jsonPath("$.reason").value("INTERNAL_ERROR"))
                .andExpect(jsonPath("$.message").value("timeout value is negative"));
    }

    @Test
    void listWorkflowNodes_ShouldReturnNodeSummaries() throws Exception {
        when(imageGenerationService.listWorkflowNodes()).thenReturn(List.of(
                new NodeSummary("6", "CLIPTextEncode", "Positive Prompt"),
                new NodeSummary("9", "SaveImage", null)));

        mockMvc.perform(get("/api/v1/workflow/nodes"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(2))
                .andExpect(jsonPath("$[0].id").value("6"))
                .andExpect(jsonPath("$[0].title").value("Positive Prompt"))
                .andExpect(jsonPath("$[1].type").value("SaveImage"));
    }
}

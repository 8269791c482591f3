package app.slidecraft.pipeline.controller;

import app.slidecraft.pipeline.controller.dto.ArtifactLinkResponse;
import app.slidecraft.pipeline.controller.dto.CreatePresentationRequest;
import app.slidecraft.pipeline.controller.dto.PresentationTaskResponse;
import app.slidecraft.pipeline.domain.type.TaskStatus;
import app.slidecraft.pipeline.error.ValidationException;
import app.slidecraft.pipeline.service.PresentationTaskService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.web.server.ResponseStatusException;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(PresentationController.class)
@ActiveProfiles("test")
class PresentationControllerWebMvcTest {

    @Autowired
    MockMvc mockMvc;

    @MockitoBean
    PresentationTaskService taskService;

    @Test
    void submit_returnsAcceptedWithPendingTask() throws Exception {
        UUID taskId = UUID.randomUUID();
        when(taskService.submit(any())).thenReturn(pending(taskId));

        mockMvc.perform(post("/presentations")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"topic\":\"Intro to Automation\",\"page_count\":5,\"style\":\"professional\"}"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.taskId").value(taskId.toString()))
                .andExpect(jsonPath("$.status").value("PENDING"))
                .andExpect(jsonPath("$.progress").value(0));

        verify(taskService).submit(new CreatePresentationRequest("Intro to Automation", 5, "professional"));
    }

    @Test
    void submit_mapsValidationErrorToBadRequest() throws Exception {
        when(taskService.submit(any())).thenThrow(new ValidationException("page_count", "page_count must be between 3 and 20"));

        mockMvc.perform(post("/presentations")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"topic\":\"Intro\",\"pageCount\":21}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.kind").value("ValidationError"))
                .andExpect(jsonPath("$.field").value("page_count"));
    }

    @Test
    void submit_rejectsMalformedJson() throws Exception {
        mockMvc.perform(post("/presentations")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"topic\":"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.field").value("body"));
    }

    @Test
    void download_returnsPresignedLink() throws Exception {
        UUID taskId = UUID.randomUUID();
        when(taskService.getArtifact(taskId)).thenReturn(new ArtifactLinkResponse(
                taskId, "https://bucket.s3.amazonaws.com/presentations/x.pptx?sig=1",
                Instant.parse("2026-03-01T11:00:00Z"), 4096L, 5));

        mockMvc.perform(get("/presentations/{taskId}/download", taskId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.url").value("https://bucket.s3.amazonaws.com/presentations/x.pptx?sig=1"))
                .andExpect(jsonPath("$.slideCount").value(5));
    }

    @Test
    void download_returnsConflictWhileRunning() throws Exception {
        UUID taskId = UUID.randomUUID();
        when(taskService.getArtifact(taskId))
                .thenThrow(new ResponseStatusException(HttpStatus.CONFLICT, "Presentation is not ready, status IMAGES"));

        mockMvc.perform(get("/presentations/{taskId}/download", taskId))
                .andExpect(status().isConflict());
    }

    @Test
    void getStatus_returnsNotFoundForUnknownTask() throws Exception {
        UUID taskId = UUID.randomUUID();
        when(taskService.getStatus(taskId))
                .thenThrow(new ResponseStatusException(HttpStatus.NOT_FOUND, "Presentation task not found"));

        mockMvc.perform(get("/presentations/{taskId}", taskId))
                .andExpect(status().isNotFound());
    }

    private PresentationTaskResponse pending(UUID taskId) {
        Instant now = Instant.parse("2026-03-01T10:00:00Z");
        return new PresentationTaskResponse(
                taskId, TaskStatus.PENDING, 0, "Intro to Automation", 5, "professional",
                null, null, null, null,
                Map.of(TaskStatus.OUTLINE, 0), now, now);
    }
}

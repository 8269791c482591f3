package app.slidecraft.pipeline.controller;

import app.slidecraft.pipeline.controller.dto.ArtifactLinkResponse;
import app.slidecraft.pipeline.controller.dto.CreatePresentationRequest;
import app.slidecraft.pipeline.controller.dto.PresentationTaskResponse;
import app.slidecraft.pipeline.service.PresentationTaskService;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

@RestController
@RequestMapping("/presentations")
public class PresentationController {

    private final PresentationTaskService taskService;

    public PresentationController(PresentationTaskService taskService) {
        this.taskService = taskService;
    }

    @PostMapping
    @ResponseStatus(HttpStatus.ACCEPTED)
    public PresentationTaskResponse submit(@RequestBody CreatePresentationRequest request) {
        return taskService.submit(request);
    }

    @GetMapping("/{taskId}")
    public PresentationTaskResponse getStatus(@PathVariable UUID taskId) {
        return taskService.getStatus(taskId);
    }

    @GetMapping("/{taskId}/download")
    public ArtifactLinkResponse download(@PathVariable UUID taskId) {
        return taskService.getArtifact(taskId);
    }
}

package com.resumetailor.interfaces.api.resume;

import com.resumetailor.application.resume.DownloadFormat;
import com.resumetailor.application.resume.OptimizationOutcome;
import com.resumetailor.application.resume.ResumeAppService;
import com.resumetailor.domain.resume.model.Resume;
import com.resumetailor.interfaces.api.dto.OptimizeRequest;
import com.resumetailor.interfaces.api.dto.OptimizeResponse;
import com.resumetailor.interfaces.api.dto.ResumeStatusResponse;
import com.resumetailor.interfaces.api.dto.UploadResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.nio.file.Path;
import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/v1/resumes")
@RequiredArgsConstructor
public class ResumeController {

    private final ResumeAppService resumeAppService;

    @PostMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<UploadResponse> upload(@RequestPart("file") MultipartFile file,
                                                 @RequestParam("userId") String userId) {
        if (userId.isBlank()) {
            throw new IllegalArgumentException("User id is required");
        }
        Resume resume = resumeAppService.upload(userId, file);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(new UploadResponse(resume.getId(), resume.getOriginalFilename(),
                        resume.getOptimizationStatus().name()));
    }

    @PostMapping("/{id}/optimize")
    public ResponseEntity<OptimizeResponse> optimize(@PathVariable UUID id,
                                                     @Valid @RequestBody OptimizeRequest request) {
        OptimizationOutcome outcome = resumeAppService.optimize(id, request.userId(), request.jobDescription());
        Resume resume = outcome.resume();
        return ResponseEntity.ok(new OptimizeResponse(
                resume.getId(),
                resume.getOptimizationStatus().name(),
                outcome.keywordsAdded(),
                outcome.changes(),
                resume.getRenderedPath() != null));
    }

    @GetMapping("/{id}")
    public ResponseEntity<ResumeStatusResponse> status(@PathVariable UUID id,
                                                       @RequestParam("userId") String userId) {
        return ResponseEntity.ok(ResumeStatusResponse.from(resumeAppService.getResume(id, userId)));
    }

    @GetMapping
    public ResponseEntity<List<ResumeStatusResponse>> list(@RequestParam("userId") String userId) {
        return ResponseEntity.ok(resumeAppService.listResumes(userId).stream()
                .map(ResumeStatusResponse::from)
                .toList());
    }

    @GetMapping("/{id}/download")
    public ResponseEntity<Resource> download(@PathVariable UUID id,
                                             @RequestParam("userId") String userId,
                                             @RequestParam(value = "format", defaultValue = "pdf") String format) {
        DownloadFormat downloadFormat = DownloadFormat.from(format);
        Path file = resumeAppService.resolveDownload(id, userId, downloadFormat);

        String filename = "optimized_resume_" + id + "." + downloadFormat.getExtension();
        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION,
                        ContentDisposition.attachment().filename(filename).build().toString())
                .contentType(MediaType.parseMediaType(downloadFormat.getContentType()))
                .body(new FileSystemResource(file));
    }
}

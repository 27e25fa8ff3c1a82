package com.scholary.vocal.coach.api;

import com.scholary.vocal.coach.service.CoachingService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API for attempt analysis.
 *
 * <p>Analysis is synchronous and stateless. Validation failures are mapped to 400 by {@link
 * ApiExceptionHandler}.
 */
@RestController
@Tag(name = "Coaching", description = "Word alignment, feedback and performance scoring")
public class CoachingController {

  private static final Logger LOGGER = LoggerFactory.getLogger(CoachingController.class);

  private final CoachingService coachingService;

  public CoachingController(CoachingService coachingService) {
    this.coachingService = coachingService;
  }

  @PostMapping("/api/attempts/analyze")
  @Operation(
      summary = "Analyze attempt",
      description =
          "Align the user's words against the reference, build segment feedback and score the"
              + " performance")
  public ResponseEntity<CoachingReport> analyze(
      @Valid @RequestBody AttemptAnalysisRequest request) {
    LOGGER.info(
        "Analysis request: attemptId={}, referenceWords={}, userWords={}, mode={}",
        request.attemptId(),
        request.referenceWords().size(),
        request.userWords().size(),
        request.practiceMode().wireName());
    return ResponseEntity.ok(coachingService.analyze(request));
  }
}

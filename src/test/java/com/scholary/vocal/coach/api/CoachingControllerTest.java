package com.scholary.vocal.coach.api;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.scholary.vocal.coach.offset.OffsetEstimate;
import com.scholary.vocal.coach.service.CoachingService;
import com.scholary.vocal.coach.service.InvalidAttemptException;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.request.MockHttpServletRequestBuilder;

@WebMvcTest(CoachingController.class)
class CoachingControllerTest {

  private static final String VALID_BODY =
      "{"
          + "\"attemptId\": \"a-1\","
          + "\"referenceWords\": [{\"word\": \"hello\", \"start\": 0.0, \"end\": 0.5}],"
          + "\"userWords\": [{\"word\": \"hello\", \"start\": 0.1, \"end\": 0.6}],"
          + "\"verseStartSec\": 0.0,"
          + "\"verseEndSec\": 1.0,"
          + "\"practiceMode\": \"words\""
          + "}";

  @Autowired private MockMvc mockMvc;

  @MockBean private CoachingService coachingService;

  @Test
  void analyze_returnsReport() throws Exception {
    when(coachingService.analyze(any()))
        .thenReturn(new CoachingReport("a-1", null, null, OffsetEstimate.provided(120.0)));

    mockMvc
        .perform(analyzeRequest(VALID_BODY))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.attemptId").value("a-1"))
        .andExpect(jsonPath("$.offset.method").value("provided"))
        .andExpect(jsonPath("$.offset.offsetMs").value(120.0));
  }

  @Test
  void analyze_invalidAttemptIsBadRequest() throws Exception {
    when(coachingService.analyze(any()))
        .thenThrow(new InvalidAttemptException("userWords[0].end must not be before start"));

    mockMvc
        .perform(analyzeRequest(VALID_BODY))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.errorCode").value("InvalidAttemptException"))
        .andExpect(jsonPath("$.details").value("userWords[0].end must not be before start"))
        .andExpect(jsonPath("$.timestamp").exists());
  }

  @Test
  void analyze_missingVerseBoundsIsBadRequest() throws Exception {
    mockMvc
        .perform(analyzeRequest("{\"verseStartSec\": 0.0}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.errorCode").value("ValidationFailed"));

    verify(coachingService, never()).analyze(any());
  }

  @Test
  void analyze_unknownPracticeModeIsBadRequest() throws Exception {
    mockMvc
        .perform(analyzeRequest(VALID_BODY.replace("\"words\"", "\"karaoke\"")))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.errorCode").value("MalformedRequest"));
  }

  @Test
  void analyze_unexpectedFailureIsServerError() throws Exception {
    when(coachingService.analyze(any())).thenThrow(new IllegalStateException("boom"));

    mockMvc
        .perform(analyzeRequest(VALID_BODY))
        .andExpect(status().isInternalServerError())
        .andExpect(jsonPath("$.errorCode").value("InternalServerError"))
        .andExpect(jsonPath("$.message").value("An unexpected error occurred"));
  }

  private static MockHttpServletRequestBuilder analyzeRequest(String body) {
    return post("/api/attempts/analyze").contentType(MediaType.APPLICATION_JSON).content(body);
  }
}

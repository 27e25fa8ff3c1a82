package com.scholary.vocal.coach.transcript;

import com.scholary.vocal.coach.transcript.TranscriptSegment.WordTiming;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Flattens transcript segments into an ordered word timeline.
 *
 * <p>When the transcription engine reports per-word timings we use them directly. Otherwise the
 * segment's span is divided evenly across its whitespace-separated words, which is coarse but keeps
 * every word inside the segment that produced it.
 */
@Component
public class WordTimeline {

  private static final Logger LOGGER = LoggerFactory.getLogger(WordTimeline.class);

  private static final double MIN_SEGMENT_DURATION = 0.01;

  /**
   * Flatten segments into word tokens.
   *
   * <p>Each token's {@code lineIndex} is the position of the segment it came from and {@code
   * index} runs across the whole timeline.
   *
   * @param segments transcript segments in order
   * @return word tokens in order
   */
  public List<WordToken> flatten(List<TranscriptSegment> segments) {
    List<WordToken> tokens = new ArrayList<>();
    int estimatedSegments = 0;

    for (int segmentIndex = 0; segmentIndex < segments.size(); segmentIndex++) {
      TranscriptSegment segment = segments.get(segmentIndex);

      if (!segment.words().isEmpty()) {
        for (WordTiming timing : segment.words()) {
          if (timing.word() == null || timing.word().isBlank()) {
            continue;
          }
          tokens.add(
              new WordToken(
                  timing.word(), timing.start(), timing.end(), tokens.size(), segmentIndex));
        }
        continue;
      }

      List<String> words = extractWords(segment.text());
      if (words.isEmpty()) {
        continue;
      }
      estimatedSegments++;
      double duration = Math.max(MIN_SEGMENT_DURATION, segment.end() - segment.start());
      for (int i = 0; i < words.size(); i++) {
        double start = segment.start() + duration * i / words.size();
        double end = segment.start() + duration * (i + 1) / words.size();
        tokens.add(new WordToken(words.get(i), start, end, tokens.size(), segmentIndex));
      }
    }

    LOGGER.debug(
        "Flattened {} segments into {} words ({} segments with estimated word timing)",
        segments.size(),
        tokens.size(),
        estimatedSegments);
    return tokens;
  }

  /**
   * Split text on whitespace, dropping empty pieces.
   *
   * @param text the text to split (may be null)
   * @return words in order
   */
  public static List<String> extractWords(String text) {
    List<String> words = new ArrayList<>();
    if (text == null) {
      return words;
    }
    for (String word : text.trim().split("\\s+")) {
      if (!word.isEmpty()) {
        words.add(word);
      }
    }
    return words;
  }
}

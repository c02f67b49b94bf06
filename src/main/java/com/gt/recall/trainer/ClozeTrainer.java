package com.gt.recall.trainer;

import com.gt.recall.exception.SentenceGenerationException;
import com.gt.recall.generation.SentenceGenerator;
import com.gt.recall.model.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public class ClozeTrainer implements Trainer {

    private static final Logger log = LoggerFactory.getLogger(ClozeTrainer.class);

    public static final String BLANK_MARKER = "____________";
    static final String PROMPT = "Fill in the blank with the missing word:";

    private final SentenceGenerator sentenceGenerator;

    private Item item;
    private String expectedTerm;

    public ClozeTrainer(SentenceGenerator sentenceGenerator) {
        this.sentenceGenerator = sentenceGenerator;
    }

    @Override
    public TrainerMode mode() {
        return TrainerMode.Cloze;
    }

    @Override
    public CompletableFuture<PresentationPayload> render(Item item) {
        this.item = item;
        this.expectedTerm = null;

        String term = item.front().strip();

        return sentenceGenerator.generateSentence(term, item.back())
                .thenApply(sentence -> buildPayload(item, term, sentence));
    }

    private PresentationPayload buildPayload(Item item, String term, String sentence) {
        Matcher matcher = Pattern.compile(Pattern.quote(term), Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE).matcher(sentence);

        if (term.isEmpty() || !matcher.find()) {
            throw new SentenceGenerationException("Generated sentence does not contain the term '" + term + "'");
        }

        String blankedSentence = sentence.substring(0, matcher.start()) + BLANK_MARKER + sentence.substring(matcher.end());
        expectedTerm = matcher.group();

        log.debug("Built cloze sentence for item {}: {}", item.id(), blankedSentence);

        return new PresentationPayload(TrainerMode.Cloze, item.id(), item.front(), PROMPT, blankedSentence, List.of(), null);
    }

    @Override
    public GradeResult grade(String answer) {
        if (item == null || expectedTerm == null) {
            throw new IllegalStateException("No cloze sentence has been rendered for grading");
        }

        String normalizedAnswer = answer == null ? "" : answer.strip().toLowerCase(Locale.ROOT);
        double similarity = characterSimilarity(normalizedAnswer, expectedTerm.toLowerCase(Locale.ROOT));
        RecallRating rating = ratingForSimilarity(similarity);

        return new GradeResult(rating, rating.isSuccessful(), expectedTerm, answer, similarity, null);
    }

    // Jaccard similarity of the two strings' character sets
    static double characterSimilarity(String left, String right) {
        if (left.isEmpty() || right.isEmpty()) {
            return 0.0;
        }

        Set<Integer> leftChars = toCharSet(left);
        Set<Integer> rightChars = toCharSet(right);

        Set<Integer> union = new HashSet<>(leftChars);
        union.addAll(rightChars);

        Set<Integer> intersection = new HashSet<>(leftChars);
        intersection.retainAll(rightChars);

        return (double) intersection.size() / union.size();
    }

    static RecallRating ratingForSimilarity(double similarity) {
        if (similarity > 0.8) {
            return RecallRating.PerfectRecall;
        } else if (similarity > 0.6) {
            return RecallRating.CorrectHesitation;
        } else if (similarity > 0.4) {
            return RecallRating.CorrectDifficult;
        } else if (similarity > 0.2) {
            return RecallRating.IncorrectFamiliar;
        }

        return RecallRating.IncorrectRecognized;
    }

    private static Set<Integer> toCharSet(String s) {
        Set<Integer> chars = new HashSet<>();
        s.codePoints().forEach(chars::add);
        return chars;
    }
}

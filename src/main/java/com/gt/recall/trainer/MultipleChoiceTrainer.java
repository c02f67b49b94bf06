package com.gt.recall.trainer;

import com.gt.recall.model.*;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.concurrent.CompletableFuture;

public class MultipleChoiceTrainer implements Trainer {

    static final String PROMPT = "Choose the correct answer:";

    private final int distractorCount;
    private final Random random;

    private Item item;
    private int correctIndex = -1;

    public MultipleChoiceTrainer(int distractorCount, Random random) {
        this.distractorCount = distractorCount;
        this.random = random;
    }

    @Override
    public TrainerMode mode() {
        return TrainerMode.MultipleChoice;
    }

    @Override
    public CompletableFuture<PresentationPayload> render(Item item) {
        this.item = item;

        String correctAnswer = item.back();
        List<String> options = new ArrayList<>();
        options.add(correctAnswer);
        options.addAll(buildDistractors(item));

        // shuffle indexes so the correct option's final position is known
        List<Integer> order = new ArrayList<>();
        for (int index = 0; index < options.size(); index++) {
            order.add(index);
        }
        Collections.shuffle(order, random);

        List<String> shuffledOptions = new ArrayList<>();
        for (int position = 0; position < order.size(); position++) {
            int optionIndex = order.get(position);
            shuffledOptions.add(options.get(optionIndex));
            if (optionIndex == 0) {
                correctIndex = position;
            }
        }

        return CompletableFuture.completedFuture(
                new PresentationPayload(TrainerMode.MultipleChoice, item.id(), item.front(), PROMPT, null, shuffledOptions, null));
    }

    @Override
    public GradeResult grade(String answer) {
        if (item == null) {
            throw new IllegalStateException("No options have been rendered for grading");
        }

        RecallRating rating;
        boolean isCorrect;
        try {
            int selectedIndex = Integer.parseInt(answer == null ? "" : answer.strip());
            isCorrect = selectedIndex == correctIndex;
            rating = isCorrect ? RecallRating.PerfectRecall : RecallRating.IncorrectRecognized;
        } catch (NumberFormatException ex) {
            isCorrect = false;
            rating = RecallRating.CompleteBlackout;
        }

        return new GradeResult(rating, isCorrect, item.back(), answer, null, correctIndex);
    }

    int correctIndex() {
        return correctIndex;
    }

    List<String> buildDistractors(Item item) {
        List<String> distractors = new ArrayList<>();
        String correctAnswer = item.back().strip();

        for (String part : item.back().split("\n")) {
            String candidate = part.strip();
            if (distractors.size() < distractorCount
                    && !candidate.isEmpty()
                    && !candidate.equals(correctAnswer)
                    && !distractors.contains(candidate)) {
                distractors.add(candidate);
            }
        }

        List<String> genericDistractors = new ArrayList<>(List.of(
                "None of the above",
                "Not specified on the card",
                "The opposite of " + item.front(),
                "A different form of " + item.front()));
        Collections.shuffle(genericDistractors, random);

        for (String generic : genericDistractors) {
            if (distractors.size() >= distractorCount) {
                break;
            }
            if (!generic.equals(correctAnswer) && !distractors.contains(generic)) {
                distractors.add(generic);
            }
        }

        return distractors;
    }
}

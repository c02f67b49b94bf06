package com.gt.recall.trainer;

import com.gt.recall.generation.SentenceGenerator;
import com.gt.recall.model.TrainerMode;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Random;

@Component
public class TrainerFactory {

    private static final int DEFAULT_DISTRACTOR_COUNT = 3;

    private final SentenceGenerator sentenceGenerator;
    private final int distractorCount;
    private final Random random;

    @Autowired
    public TrainerFactory(SentenceGenerator sentenceGenerator,
                          @Value("${recall.review.distractorCount:" + DEFAULT_DISTRACTOR_COUNT + "}") int distractorCount) {
        this(sentenceGenerator, distractorCount, new Random());
    }

    public TrainerFactory(SentenceGenerator sentenceGenerator, int distractorCount, Random random) {
        this.sentenceGenerator = sentenceGenerator;
        this.distractorCount = distractorCount;
        this.random = random;
    }

    // Cloze needs a working sentence generator; the other modes are always available
    public boolean isAvailable(TrainerMode mode) {
        return mode != TrainerMode.Cloze || sentenceGenerator.isAvailable();
    }

    public Trainer createTrainer(TrainerMode mode) {
        switch (mode) {
            case DirectRecall:
                return new DirectRecallTrainer();
            case Cloze:
                return new ClozeTrainer(sentenceGenerator);
            case MultipleChoice:
                return new MultipleChoiceTrainer(distractorCount, random);
            default:
                throw new IllegalArgumentException("Unsupported trainer mode " + mode);
        }
    }
}

package com.gt.recall.model;

import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.gt.recall.serialization.TrainerModeSerializer;

@JsonSerialize(using = TrainerModeSerializer.class, as = Integer.class)
public enum TrainerMode {
    DirectRecall(0),
    Cloze(1),
    MultipleChoice(2);

    private final int trainerModeId;

    TrainerMode(int trainerModeId) {
        this.trainerModeId = trainerModeId;
    }

    public int getTrainerModeId() {
        return trainerModeId;
    }
}

package com.gt.recall.model;

import java.util.Collections;
import java.util.List;

// blankedSentence is only set for Cloze, options only for MultipleChoice
public record PresentationPayload(TrainerMode mode,
                                  String itemId,
                                  String front,
                                  String prompt,
                                  String blankedSentence,
                                  List<String> options,
                                  SessionProgress progress) {

    public PresentationPayload {
        options = Collections.unmodifiableList(options);
    }

    public static PresentationPayload withProgress(PresentationPayload payload, SessionProgress progress) {
        return new PresentationPayload(payload.mode, payload.itemId, payload.front, payload.prompt,
                payload.blankedSentence, payload.options, progress);
    }
}

package com.gt.recall.model;

public record AdvanceResult(AdvanceStatus status,
                            PresentationPayload payload,
                            TrainerMode mode,
                            String itemId,
                            String errorMessage) {

    public static AdvanceResult presenting(PresentationPayload payload) {
        return new AdvanceResult(AdvanceStatus.Presenting, payload, payload.mode(), payload.itemId(), null);
    }

    public static AdvanceResult failed(TrainerMode mode, String itemId, String errorMessage) {
        return new AdvanceResult(AdvanceStatus.Failed, null, mode, itemId, errorMessage);
    }

    public static AdvanceResult exhausted(TrainerMode mode) {
        return new AdvanceResult(AdvanceStatus.Exhausted, null, mode, null, null);
    }
}

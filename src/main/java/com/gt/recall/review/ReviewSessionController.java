package com.gt.recall.review;

import com.gt.recall.model.*;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/rest/review")
public class ReviewSessionController {

    private final ReviewSessionService reviewSessionService;

    public ReviewSessionController(ReviewSessionService reviewSessionService) {
        this.reviewSessionService = reviewSessionService;
    }

    @PostMapping(value = "/session/{userId}", consumes = "application/json", produces = "application/json")
    public BeginResult beginSession(@PathVariable("userId") String userId,
                                    @RequestBody BeginSessionRequest request) {
        return reviewSessionService.beginSession(userId, request.collectionId(),
                request.items() != null ? request.items() : List.of(),
                request.mode() != null ? request.mode() : TrainerMode.DirectRecall);
    }

    @PostMapping(value = "/session/{userId}/next", produces = "application/json")
    public AdvanceResult nextItem(@PathVariable("userId") String userId) {
        return reviewSessionService.nextItem(userId);
    }

    @PostMapping(value = "/session/{userId}/answer", consumes = "application/json", produces = "application/json")
    public ReviewResult submitAnswer(@PathVariable("userId") String userId,
                                     @RequestBody AnswerRequest request) {
        return reviewSessionService.submitAnswer(userId, request.answer());
    }

    @PostMapping(value = "/session/{userId}/mode", consumes = "application/json")
    public void changeMode(@PathVariable("userId") String userId,
                           @RequestBody ChangeModeRequest request) {
        reviewSessionService.changeMode(userId, request.mode());
    }

    @GetMapping(value = "/session/{userId}", produces = "application/json")
    public SessionProgress getProgress(@PathVariable("userId") String userId) {
        return reviewSessionService.getProgress(userId);
    }

    @PostMapping(value = "/session/{userId}/end", produces = "application/json")
    public SessionSummary endSession(@PathVariable("userId") String userId) {
        return reviewSessionService.endSession(userId);
    }

    @PostMapping(value = "/schedule/preview", consumes = "application/json", produces = "application/json")
    public List<RatingDueTime> previewDueTimes(@RequestBody Item item) {
        return reviewSessionService.previewDueTimes(item);
    }

    private record BeginSessionRequest(String collectionId, TrainerMode mode, List<Item> items) { }
    private record AnswerRequest(String answer) { }
    private record ChangeModeRequest(TrainerMode mode) { }
}

package com.restaurantbi.insightflow.adapter.web;

import com.restaurantbi.insightflow.app.service.FeedbackAppService;
import com.restaurantbi.insightflow.client.dto.SingleResponse;
import com.restaurantbi.insightflow.client.dto.SubmitFeedbackCmd;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

/**
 * 用户反馈入口
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class FeedbackController {

    private final FeedbackAppService feedbackAppService;

    @PostMapping("/feedback")
    @ResponseStatus(HttpStatus.ACCEPTED)
    public SingleResponse<String> submit(@Valid @RequestBody SubmitFeedbackCmd cmd) {
        return SingleResponse.of(feedbackAppService.submitFeedback(cmd));
    }
}

package com.engagesphere.booster.infrastructure.web;

import com.engagesphere.booster.application.chat.AnswerChatQuery;
import com.engagesphere.booster.infrastructure.web.dto.ChatRequest;
import com.engagesphere.booster.infrastructure.web.dto.ChatResponse;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/chat")
public class ChatController {

    private static final Logger logger = LoggerFactory.getLogger(ChatController.class);

    private final AnswerChatQuery answerChatQuery;
    private final CallerResolver callerResolver;

    public ChatController(AnswerChatQuery answerChatQuery, CallerResolver callerResolver) {
        this.answerChatQuery = answerChatQuery;
        this.callerResolver = callerResolver;
    }

    @PostMapping
    public ResponseEntity<ChatResponse> chat(
            @RequestHeader(value = CallerResolver.USER_ID_HEADER, required = false) Long callerId,
            @Valid @RequestBody ChatRequest request
    ) {
        var caller = callerResolver.resolve(callerId);
        logger.debug("Chat query from {}", caller.map(user -> "user " + user.id()).orElse("anonymous caller"));

        String reply = answerChatQuery.answer(request.query(), request.context(), caller);
        return ResponseEntity.ok(new ChatResponse(reply));
    }
}

package com.programmersdiary.chatscheduler.web;

import com.programmersdiary.chatscheduler.chat.Conversation;
import com.programmersdiary.chatscheduler.chat.ConversationService;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/conversations")
public class ConversationController {

    private final ConversationService conversationService;

    public ConversationController(ConversationService conversationService) {
        this.conversationService = conversationService;
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public Conversation create(@RequestBody Map<String, String> request) {
        return conversationService.create(request.get("name"));
    }

    @GetMapping
    public List<Conversation> list() {
        return conversationService.listAll();
    }

    @GetMapping("/{id}")
    public Conversation get(@PathVariable String id) {
        try {
            return conversationService.get(id);
        } catch (IllegalArgumentException e) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, e.getMessage());
        }
    }
}

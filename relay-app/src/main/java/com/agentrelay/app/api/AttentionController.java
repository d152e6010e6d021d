package com.agentrelay.app.api;

import com.agentrelay.gateway.attention.AttentionTracker;
import com.agentrelay.gateway.attention.DirectedMessage;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * Computes the "needs attention" badge set for a message history.
 */
@RestController
@RequestMapping("/api")
public class AttentionController {

    private final AttentionTracker attentionTracker;

    public AttentionController(AttentionTracker attentionTracker) {
        this.attentionTracker = attentionTracker;
    }

    @PostMapping("/attention")
    public Map<String, Object> needsAttention(@RequestBody List<DirectedMessage> messages) {
        return Map.of("needsAttention", List.copyOf(attentionTracker.computeNeedsAttention(messages)));
    }
}

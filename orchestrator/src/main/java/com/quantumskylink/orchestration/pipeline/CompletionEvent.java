package com.quantumskylink.orchestration.pipeline;

import java.util.Map;

/** Domain-specific event published after a pipeline finishes successfully. */
public record CompletionEvent(String eventType, Map<String, Object> data) {}

package com.concierge.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing concierge-specific MDC keys for structured logging.
 */
public final class MdcContext {

    public static final String CONVERSATION_ID = "conversationId";
    public static final String TASK_ID = "taskId";
    public static final String AGENT_NAME = "agentName";

    private MdcContext() {}

    public static void setConversation(String conversationId) {
        MDC.put(CONVERSATION_ID, conversationId);
    }

    public static void setAgent(String conversationId, String agentName) {
        MDC.put(CONVERSATION_ID, conversationId);
        MDC.put(AGENT_NAME, agentName);
    }

    public static void setTask(String conversationId, int taskId, String agentName) {
        MDC.put(CONVERSATION_ID, conversationId);
        MDC.put(TASK_ID, String.valueOf(taskId));
        MDC.put(AGENT_NAME, agentName);
    }

    /** Drops the task and agent keys but keeps the conversation. */
    public static void clearTask() {
        MDC.remove(TASK_ID);
        MDC.remove(AGENT_NAME);
    }

    public static void clear() {
        MDC.remove(CONVERSATION_ID);
        MDC.remove(TASK_ID);
        MDC.remove(AGENT_NAME);
    }
}

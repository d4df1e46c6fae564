package com.relay.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Chat message model.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Message {

    public static final String ROLE_SYSTEM = "system";
    public static final String ROLE_USER = "user";
    public static final String ROLE_ASSISTANT = "assistant";

    @JsonProperty("role")
    private String role; // system, user, assistant, tool

    @JsonProperty("content")
    private String content;

    @JsonProperty("name")
    private String name;

    @JsonProperty("tool_calls")
    private Object toolCalls;

    @JsonProperty("tool_call_id")
    private String toolCallId;

    public static Message of(String role, String content) {
        return Message.builder().role(role).content(content).build();
    }

    public boolean isSystem() {
        return ROLE_SYSTEM.equals(role);
    }
}

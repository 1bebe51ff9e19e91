package com.purchasingpower.emsflow.workflow.state;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.fasterxml.jackson.datatype.jsr310.deser.LocalDateTimeDeserializer;
import com.fasterxml.jackson.datatype.jsr310.ser.LocalDateTimeSerializer;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.time.LocalDateTime;

/**
 * Single turn record in a workflow's message history.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ChatMessage implements Serializable {

    /**
     * Values: "user", "assistant", "system", "tool"
     */
    private String role;

    private String content;

    @JsonSerialize(using = LocalDateTimeSerializer.class)
    @JsonDeserialize(using = LocalDateTimeDeserializer.class)
    @JsonFormat(pattern = "yyyy-MM-dd'T'HH:mm:ss.SSSSSSS")
    private LocalDateTime timestamp;

    public static ChatMessage user(String content) {
        return new ChatMessage("user", content, LocalDateTime.now());
    }

    public static ChatMessage assistant(String content) {
        return new ChatMessage("assistant", content, LocalDateTime.now());
    }

    public static ChatMessage system(String content) {
        return new ChatMessage("system", content, LocalDateTime.now());
    }

    public static ChatMessage tool(String content) {
        return new ChatMessage("tool", content, LocalDateTime.now());
    }
}

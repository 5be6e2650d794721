package com.queryinsight.ask.dto.stream;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * 스트리밍 응답 이벤트 DTO.
 * SSE data 프레임 하나에 JSON으로 직렬화됩니다.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class StreamEvent {

    private StreamEventType type;

    private Map<String, Object> data;

    @JsonProperty("content_block")
    private ContentBlock contentBlock;

    private Delta delta;

    private long timestamp;

    public record ContentBlock(String type, String name) {
        public static ContentBlock text(String name) {
            return new ContentBlock("text", name);
        }
    }

    public record Delta(String type, String text) {
        public static Delta text(String text) {
            return new Delta("text_delta", text);
        }
    }
}

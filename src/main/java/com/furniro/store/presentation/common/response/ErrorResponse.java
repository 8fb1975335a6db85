package com.furniro.store.presentation.common.response;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.furniro.store.common.exception.ErrorCode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * 통일된 에러 응답 DTO
 *
 * status: 4XX는 "fail", 5XX는 "error"
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ErrorResponse {
    @JsonProperty("status")
    private String status;

    @JsonProperty("error_code")
    private String errorCode;

    @JsonProperty("error_message")
    private String errorMessage;

    @JsonProperty("timestamp")
    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd'T'HH:mm:ss.SSS'Z'", timezone = "UTC")
    private Instant timestamp;

    @JsonProperty("request_id")
    private String requestId;

    /**
     * 에러 응답 생성 헬퍼 메서드
     */
    public static ErrorResponse of(int httpStatus, String errorCode, String errorMessage) {
        return ErrorResponse.builder()
                .status(httpStatus >= 500 ? "error" : "fail")
                .errorCode(errorCode)
                .errorMessage(errorMessage)
                .timestamp(Instant.now())
                .requestId("req-" + UUID.randomUUID().toString().substring(0, 12))
                .build();
    }

    public static ErrorResponse of(ErrorCode errorCode, String errorMessage) {
        return of(errorCode.getStatusCode(), errorCode.getCode(), errorMessage);
    }
}

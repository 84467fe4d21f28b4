package com.arkive.models.dto.response;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ResponseTemplate<T> {

    public static final String SUCCESS_CODE = "OK";

    private T data;
    private String message;
    private String code;

    public static <T> ResponseTemplate<T> success(T data, String message) {
        return new ResponseTemplate<>(data, message, SUCCESS_CODE);
    }

    public static <T> ResponseTemplate<T> success(String message) {
        return new ResponseTemplate<>(null, message, SUCCESS_CODE);
    }

    public static <T> ResponseTemplate<T> error(String message, String code) {
        return new ResponseTemplate<>(null, message, code);
    }

    public static <T> ResponseTemplate<T> error(T data, String message, String code) {
        return new ResponseTemplate<>(data, message, code);
    }
}

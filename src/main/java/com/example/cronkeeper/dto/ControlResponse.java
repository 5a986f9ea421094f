package com.example.cronkeeper.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Control-plane response envelope. {@code code} 200 is success; any other code
 * carries an error description in {@code data}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ControlResponse<T> {

    public static final int OK = 200;

    private int code;

    private T data;

    public static <T> ControlResponse<T> success(T data) {
        return new ControlResponse<>(OK, data);
    }

    public static ControlResponse<String> error(int code, String message) {
        return new ControlResponse<>(code, message);
    }

    @JsonIgnore
    public boolean isSuccess() {
        return code == OK;
    }
}

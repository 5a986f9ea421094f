package com.example.cronkeeper.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Control-plane request envelope
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ControlRequest<T> {

    @NotBlank(message = "Token is required")
    private String token;

    private T data;
}

/**
 * EvaluateRequest.java
 *
 * 表达式求值的请求体。
 */
package club.ppmc.dbgp.model.debug;

import jakarta.validation.constraints.NotBlank;

public record EvaluateRequest(@NotBlank String expression) {}

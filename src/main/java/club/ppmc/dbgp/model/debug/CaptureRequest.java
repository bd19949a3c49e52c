/**
 * CaptureRequest.java
 *
 * 显式捕获当前状态的请求体：调用方已知错误位置时，手动生成一个 ErrorEvent。
 */
package club.ppmc.dbgp.model.debug;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;

public record CaptureRequest(
        @NotBlank String file, @Min(1) int line, String errorType, String message) {}

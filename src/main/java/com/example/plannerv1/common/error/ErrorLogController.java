package com.example.plannerv1.common.error;

import com.example.plannerv1.common.ApiResponse;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/errors")
public class ErrorLogController {

    private final ErrorLogBuffer errorLogBuffer;

    public ErrorLogController(ErrorLogBuffer errorLogBuffer) {
        this.errorLogBuffer = errorLogBuffer;
    }

    @GetMapping("/recent")
    public ResponseEntity<ApiResponse<List<ErrorLogBuffer.Entry>>> recent() {
        List<ErrorLogBuffer.Entry> entries = errorLogBuffer.recent();
        return ResponseEntity.ok(ApiResponse.success("直近のエラーを取得しました", entries,
                Map.of("count", entries.size())));
    }

    @DeleteMapping("/recent")
    public ResponseEntity<ApiResponse<Void>> clear() {
        errorLogBuffer.clear();
        return ResponseEntity.ok(ApiResponse.success("エラー履歴をクリアしました", null));
    }
}

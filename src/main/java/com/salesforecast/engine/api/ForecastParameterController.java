package com.salesforecast.engine.api;

import com.salesforecast.engine.domain.model.ForecastParameterRecord;
import com.salesforecast.engine.domain.repository.ForecastParameterRepository;
import com.salesforecast.engine.domain.service.history.TransactionHistorySource;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api/forecast")
@RequiredArgsConstructor
@CrossOrigin(origins = "*")
public class ForecastParameterController {

    private final ForecastParameterRepository parameterRepository;
    private final TransactionHistorySource historySource;

    @GetMapping("/categories")
    public ResponseEntity<Map<String, Object>> categories() {
        List<String> categories = historySource.categories();
        return ResponseEntity.ok(Map.of(
                "success", true,
                "data", categories,
                "message", "Categories retrieved successfully"));
    }

    @GetMapping("/parameters")
    public ResponseEntity<Map<String, Object>> parameters() {
        List<ForecastParameterRecord> params = parameterRepository.findAllByOrderByCategoryAsc();
        return ResponseEntity.ok(Map.of(
                "success", true,
                "data", params,
                "message", "Parameters retrieved successfully"));
    }

    @DeleteMapping("/parameters/{id}")
    public ResponseEntity<Map<String, Object>> deleteParameter(@PathVariable long id) {
        if (!parameterRepository.existsById(id)) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of(
                    "success", false,
                    "message", "Parameter not found"));
        }
        parameterRepository.deleteById(id);
        log.info("[Params API] deleted parameter set id={}", id);
        return ResponseEntity.ok(Map.of(
                "success", true,
                "message", "Parameter deleted successfully"));
    }
}

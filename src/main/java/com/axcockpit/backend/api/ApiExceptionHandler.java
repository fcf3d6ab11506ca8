package com.axcockpit.backend.api;

import com.axcockpit.backend.error.CockpitException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;

@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(CockpitException.class)
    public ResponseEntity<Map<String, Object>> handle(CockpitException e) {
        HttpStatus status = switch (e.getKind()) {
            case UNKNOWN_ENTITY -> HttpStatus.NOT_FOUND;
            case DUPLICATE_SNAPSHOT, CONSTRAINT_VIOLATION -> HttpStatus.CONFLICT;
            default -> HttpStatus.BAD_REQUEST;
        };
        log.warn("[api] {} -> {}", e.toString(), status.value());

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("ok", false);
        body.put("kind", e.getKind());
        body.put("detail", e.getDetail());
        if (e.getSheet() != null) body.put("sheet", e.getSheet());
        if (e.getRow() != null) body.put("row", e.getRow());
        return ResponseEntity.status(status).body(body);
    }
}

package com.example.linkaudit;

import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Controller;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseBody;

import java.util.LinkedHashMap;
import java.util.Map;

/** JSON body for everything that escapes a route. */
@Slf4j
@Controller
public class ApiErrorController implements org.springframework.boot.web.servlet.error.ErrorController {

    @RequestMapping("/error")
    @ResponseBody
    public ResponseEntity<Map<String, Object>> handleError(HttpServletRequest request) {
        Map<String, Object> errorDetails = new LinkedHashMap<>();

        Integer statusCode = (Integer) request.getAttribute("jakarta.servlet.error.status_code");
        String errorMessage = (String) request.getAttribute("jakarta.servlet.error.message");
        Throwable exception = (Throwable) request.getAttribute("jakarta.servlet.error.exception");
        int status = statusCode != null ? statusCode : 500;

        errorDetails.put("status", status);
        errorDetails.put("error", status >= 500 ? "Internal Server Error" : "Request Error");
        errorDetails.put("message", errorMessage != null && !errorMessage.isEmpty()
                ? errorMessage : "An unexpected error occurred");

        if (exception != null) {
            errorDetails.put("exception", exception.getClass().getSimpleName());
            errorDetails.put("details", exception.getMessage());
            log.error("request failed: {}", errorDetails, exception);
        } else {
            log.warn("request failed: {}", errorDetails);
        }

        return ResponseEntity.status(status).body(errorDetails);
    }
}

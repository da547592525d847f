package com.slb.stake_backend.common.api;

import com.slb.stake_backend.common.exception.StakeErrorCode;
import com.slb.stake_backend.common.exception.StakeException;
import com.slb.stake_backend.common.trace.TraceIdHolder;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MissingServletRequestParameterException;

import static org.junit.jupiter.api.Assertions.*;

class GlobalExceptionHandlerTest {

    private final GlobalExceptionHandler handler = new GlobalExceptionHandler();

    @BeforeEach
    void setup() {
        TraceIdHolder.set("t-1");
    }

    @AfterEach
    void cleanup() {
        TraceIdHolder.clear();
    }

    @Test
    void stakeException_shouldMapKindToStatusAndMachineCode() {
        ResponseEntity<ApiResponse<Void>> response = handler.biz(new StakeException(StakeErrorCode.PAUSED, "claim is paused"));

        assertEquals(423, response.getStatusCode().value());
        ApiResponse<Void> body = response.getBody();
        assertNotNull(body);
        assertEquals(423, body.getCode());
        assertEquals("claim is paused", body.getMessage());
        assertEquals("STAKE_PAUSED", body.getError().getCode());
        assertEquals("t-1", body.getTraceId());
    }

    @Test
    void invalidPoolId_shouldBeNotFound() {
        ResponseEntity<ApiResponse<Void>> response = handler.biz(StakeException.invalidPoolId(3));

        assertEquals(404, response.getStatusCode().value());
        assertEquals("invalid pid: 3", response.getBody().getMessage());
    }

    @Test
    void missingParameter_shouldBeInvalidParameter() {
        ResponseEntity<ApiResponse<Void>> response =
                handler.malformed(new MissingServletRequestParameterException("from", "long"));

        assertEquals(400, response.getStatusCode().value());
        assertEquals("STAKE_INVALID_PARAMETER", response.getBody().getError().getCode());
    }
}

package com.opspos.unit.controller;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.opspos.api.controller.CheckLockController;
import com.opspos.config.ApiResponseAdvice;
import com.opspos.config.TerminalConfig;
import com.opspos.domain.enums.LockIndicator;
import com.opspos.domain.enums.LockOutcome;
import com.opspos.domain.enums.LockType;
import com.opspos.domain.enums.OverrideOutcome;
import com.opspos.domain.model.LockAcquireResult;
import com.opspos.domain.model.LockStatusView;
import com.opspos.domain.model.OverrideResult;
import com.opspos.exception.BusinessException;
import com.opspos.exception.ErrorCode;
import com.opspos.exception.GlobalExceptionHandler;
import com.opspos.lock.CheckLockManager;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@ExtendWith(MockitoExtension.class)
class CheckLockControllerTest {

    private static final String OVERRIDE_BODY = """
            {
              "requestingTerminalId": "T2",
              "requestingEmployeeId": "E2",
              "managerEmployeeId": "M1",
              "managerPin": "4321",
              "riskAcknowledged": %s
            }
            """;

    private MockMvc mockMvc;

    @Mock
    private CheckLockManager checkLockManager;

    private static TerminalConfig terminalConfig() {
        TerminalConfig terminalConfig = new TerminalConfig();
        terminalConfig.setTerminalId("T-BAR");
        return terminalConfig;
    }

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new CheckLockController(checkLockManager))
                .setControllerAdvice(new ApiResponseAdvice(terminalConfig()), new GlobalExceptionHandler())
                .build();
    }

    @Test
    @DisplayName("POST /api/checks/{id}/lock returns the acquisition outcome")
    void acquireReturnsOutcome() throws Exception {
        when(checkLockManager.acquire("C1", "T2", "E2", LockType.ACTIVE)).thenReturn(LockAcquireResult.builder()
                .checkId("C1")
                .outcome(LockOutcome.HOLDER_OFFLINE)
                .holderTerminalId("T1")
                .holderReachable(false)
                .indicator(LockIndicator.RED)
                .build());

        mockMvc.perform(post("/api/checks/C1/lock")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"terminalId\":\"T2\",\"employeeId\":\"E2\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.terminalId").value("T-BAR"))
                .andExpect(jsonPath("$.data.outcome").value("HOLDER_OFFLINE"))
                .andExpect(jsonPath("$.data.holderTerminalId").value("T1"))
                .andExpect(jsonPath("$.data.indicator").value("RED"));
    }

    @Test
    @DisplayName("POST /api/checks/{id}/lock without a terminal id is a validation error")
    void acquireValidatesBody() throws Exception {
        mockMvc.perform(post("/api/checks/C1/lock")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"employeeId\":\"E2\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.code").value("VALIDATION_ERROR"));

        verify(checkLockManager, never()).acquire(any(), any(), any(), any());
    }

    @Test
    @DisplayName("GET /api/checks/{id}/lock returns the indicator for the requesting terminal")
    void lockStatus() throws Exception {
        when(checkLockManager.getLockStatus("C1", "T1")).thenReturn(LockStatusView.builder()
                .checkId("C1")
                .holderTerminalId("T1")
                .lockType(LockType.ACTIVE)
                .holderReachable(true)
                .indicator(LockIndicator.GREEN)
                .build());

        mockMvc.perform(get("/api/checks/C1/lock").param("terminalId", "T1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.indicator").value("GREEN"));
    }

    @Test
    @DisplayName("override against an offline holder without acknowledgment answers 428")
    void overrideRequiresAcknowledgment() throws Exception {
        when(checkLockManager.override(any()))
                .thenThrow(new BusinessException(
                        ErrorCode.RISK_ACKNOWLEDGMENT_REQUIRED, "Holder T1 is offline; acknowledge the conflict risk"));

        mockMvc.perform(post("/api/checks/C1/lock/override")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(OVERRIDE_BODY.formatted("false")))
                .andExpect(status().is(428))
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.error.code").value("RISK_ACKNOWLEDGMENT_REQUIRED"))
                .andExpect(jsonPath("$.error.retryable").value(false));
    }

    @Test
    @DisplayName("acknowledged override returns the clone id")
    void acknowledgedOverrideCreatesClone() throws Exception {
        when(checkLockManager.override(any())).thenReturn(OverrideResult.builder()
                .outcome(OverrideOutcome.CONFLICT_CLONE_CREATED)
                .originalCheckId("C1")
                .checkId("C1-clone")
                .previousHolderTerminalId("T1")
                .conflictId(9L)
                .build());

        mockMvc.perform(post("/api/checks/C1/lock/override")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(OVERRIDE_BODY.formatted("true")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.outcome").value("CONFLICT_CLONE_CREATED"))
                .andExpect(jsonPath("$.data.checkId").value("C1-clone"))
                .andExpect(jsonPath("$.data.conflictId").value(9));

        verify(checkLockManager)
                .override(argThat(command -> command.getCheckId().equals("C1")
                        && command.isRiskAcknowledged()
                        && command.getManagerPin().equals("4321")));
    }
}

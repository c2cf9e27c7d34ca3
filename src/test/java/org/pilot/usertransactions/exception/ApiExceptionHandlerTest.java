package org.pilot.usertransactions.exception;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.pilot.usertransactions.controller.TransactionController;
import org.pilot.usertransactions.entity.TransactionStatus;
import org.pilot.usertransactions.service.TransactionService;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

class ApiExceptionHandlerTest {

    TransactionService transactionService;
    MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        transactionService = mock(TransactionService.class);
        mockMvc = MockMvcBuilders.standaloneSetup(new TransactionController(transactionService))
                .setControllerAdvice(new ApiExceptionHandler())
                .build();
    }

    @Test
    void storageFailure_returnsGeneric500_withoutCause() throws Exception {
        when(transactionService.get(5L)).thenThrow(new DataAccessResourceFailureException("connection to db-host:5432 refused"));

        MvcResult result = mockMvc.perform(get("/api/transactions/5"))
                .andExpect(status().isInternalServerError())
                .andExpect(content().json("{\"error\":\"Internal server error\"}", true))
                .andReturn();

        String body = result.getResponse().getContentAsString();
        assertThat(body).doesNotContain("db-host").doesNotContain("refused");
    }

    @Test
    void notFoundExceptions_mapTo404Messages() throws Exception {
        when(transactionService.updateStatus(9L, TransactionStatus.FAILED)).thenThrow(new TransactionNotFoundException(9L));
        mockMvc.perform(put("/api/transactions/9").contentType(MediaType.APPLICATION_JSON).content("{\"status\":\"FAILED\"}"))
                .andExpect(status().isNotFound())
                .andExpect(content().json("{\"error\":\"Transaction not found\"}", true));

        when(transactionService.listForUser(4L)).thenThrow(new UserNotFoundException(4L));
        mockMvc.perform(get("/api/transactions").param("user_id", "4"))
                .andExpect(status().isNotFound())
                .andExpect(content().json("{\"error\":\"User not found\"}", true));
    }
}

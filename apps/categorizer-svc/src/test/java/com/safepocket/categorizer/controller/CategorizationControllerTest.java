package com.safepocket.categorizer.controller;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
class CategorizationControllerTest {

    @Autowired
    MockMvc mockMvc;

    @Test
    void manualRuleMatch() throws Exception {
        mockMvc.perform(post("/categorizations")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"description":"ALBERT SUPERMARKET","amount":-249.90,"account":"123456789/0800"}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.tier1").value("Living Expenses"))
                .andExpect(jsonPath("$.tier2").value("Groceries"))
                .andExpect(jsonPath("$.tier3").value("Supermarket"))
                .andExpect(jsonPath("$.owner").value("Primary"))
                .andExpect(jsonPath("$.source").value("manual_rule"))
                .andExpect(jsonPath("$.internalTransfer").value(false))
                .andExpect(jsonPath("$.confidence").doesNotExist());
    }

    @Test
    void ownAccountTransfer() throws Exception {
        mockMvc.perform(post("/categorizations")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"description":"Savings","counterpartyAccount":"999/0100","date":"2024-06-01"}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.source").value("internal_transfer"))
                .andExpect(jsonPath("$.internalTransfer").value(true))
                .andExpect(jsonPath("$.tier1").value("Transfers"))
                .andExpect(jsonPath("$.owner").value("Unknown"));
    }

    @Test
    void unmatchedIsUncategorized() throws Exception {
        mockMvc.perform(post("/categorizations")
                        .param("disableAi", "true")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"description":"MYSTERY SHOP","owner":"Imported"}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.tier1").value("Uncategorized"))
                .andExpect(jsonPath("$.tier2").value("Needs Review"))
                .andExpect(jsonPath("$.tier3").value("Unknown Transaction"))
                .andExpect(jsonPath("$.owner").value("Imported"))
                .andExpect(jsonPath("$.source").value("uncategorized"));
    }

    @Test
    void batchKeepsOrder() throws Exception {
        mockMvc.perform(post("/categorizations/batch")
                        .header("X-Request-Trace", "batch-1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"transactions":[
                                  {"description":"LIDL PRAHA"},
                                  {"counterpartyName":"Employer a.s.","account":"555666777/2010"},
                                  {"description":"COFFEE CORNER","amount":-85}
                                ]}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.traceId").value("batch-1"))
                .andExpect(jsonPath("$.results.length()").value(3))
                .andExpect(jsonPath("$.results[0].tier3").value("Supermarket"))
                .andExpect(jsonPath("$.results[1].tier3").value("Monthly Salary"))
                .andExpect(jsonPath("$.results[1].owner").value("Payroll"))
                .andExpect(jsonPath("$.results[2].tier3").value("Cafe"));
    }

    @Test
    void malformedBodyIsBadRequest() throws Exception {
        mockMvc.perform(post("/categorizations")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"amount\":\"not-a-number\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("MALFORMED_REQUEST"));
    }

    @Test
    void batchWithoutTransactionsFailsValidation() throws Exception {
        mockMvc.perform(post("/categorizations/batch")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"))
                .andExpect(jsonPath("$.details.transactions").exists())
                .andExpect(jsonPath("$.path").value("/categorizations/batch"));
    }

    @Test
    void malformedTraceHeaderIsReplacedOnTheErrorResponse() throws Exception {
        mockMvc.perform(post("/categorizations")
                        .header("X-Request-Trace", "bad trace\nid")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"amount\":\"x\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.traceId").value(org.hamcrest.Matchers.matchesPattern("[0-9a-f-]{36}")))
                .andExpect(jsonPath("$.path").value("/categorizations"));
    }
}

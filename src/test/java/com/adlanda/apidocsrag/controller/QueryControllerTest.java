package com.adlanda.apidocsrag.controller;

import com.adlanda.apidocsrag.model.QueryResponse;
import com.adlanda.apidocsrag.model.QueryResult;
import com.adlanda.apidocsrag.model.RetrieveResponse;
import com.adlanda.apidocsrag.service.RetrievalService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(QueryController.class)
class QueryControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private RetrievalService retrievalService;

    @Test
    void query_validRequest_returnsAnswer() throws Exception {
        QueryResponse response = new QueryResponse(
                "Send a POST request to /api/v2/tickets.",
                List.of(new QueryResult("POST", "/api/v2/tickets", "Create Ticket", "Create a new ticket",
                        7.25, List.of("create", "ticket"))),
                List.of("Freshservice API Documentation"),
                0.82,
                "Found 1 relevant endpoints. Best match: 'POST /api/v2/tickets' with score 7.25. Overall confidence: 0.82",
                true,
                7,
                1,
                50
        );
        when(retrievalService.query(anyString(), anyInt(), anyBoolean())).thenReturn(response);

        mockMvc.perform(post("/api/v1/query")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                            {"question": "How do I create a ticket?"}
                            """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.answer").value("Send a POST request to /api/v2/tickets."))
                .andExpect(jsonPath("$.results[0].method").value("POST"))
                .andExpect(jsonPath("$.results[0].path").value("/api/v2/tickets"))
                .andExpect(jsonPath("$.results[0].score").value(7.25))
                .andExpect(jsonPath("$.results[0].matchedTerms[1]").value("ticket"))
                .andExpect(jsonPath("$.sources[0]").value("Freshservice API Documentation"))
                .andExpect(jsonPath("$.confidence").value(0.82))
                .andExpect(jsonPath("$.answerGenerated").value(true))
                .andExpect(jsonPath("$.totalEndpoints").value(7))
                .andExpect(jsonPath("$.queryTimeMs").value(50));

        verify(retrievalService).query("How do I create a ticket?", 0, true);
    }

    @Test
    void query_withOptions_passesToService() throws Exception {
        QueryResponse response = new QueryResponse("fallback", List.of(), List.of(), 0.1, "Found 0 relevant endpoints. Overall confidence: 0.10",
                false, 0, 0, 10);
        when(retrievalService.query("list tickets", 3, false)).thenReturn(response);

        mockMvc.perform(post("/api/v1/query")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                            {"question": "list tickets", "maxResults": 3, "generateAnswer": false}
                            """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.answerGenerated").value(false));
    }

    @Test
    void query_emptyQuestion_returnsBadRequest() throws Exception {
        mockMvc.perform(post("/api/v1/query")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                            {"question": ""}
                            """))
                .andExpect(status().isBadRequest());

        verify(retrievalService, never()).query(anyString(), anyInt(), anyBoolean());
    }

    @Test
    void query_missingQuestion_returnsBadRequest() throws Exception {
        mockMvc.perform(post("/api/v1/query")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void query_maxResultsOutOfRange_returnsBadRequest() throws Exception {
        mockMvc.perform(post("/api/v1/query")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                            {"question": "list tickets", "maxResults": 0}
                            """))
                .andExpect(status().isBadRequest());
    }

    @Test
    void retrieve_returnsContextWithoutAnswer() throws Exception {
        RetrieveResponse response = new RetrieveResponse(
                List.of(new QueryResult("GET", "/api/v2/tickets", "List All Tickets", "List all tickets",
                        4.1, List.of("list", "ticket"))),
                "Endpoint: GET /api/v2/tickets\n",
                7,
                1,
                12
        );
        when(retrievalService.retrieveContext("list tickets", 0)).thenReturn(response);

        mockMvc.perform(post("/api/v1/retrieve")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                            {"question": "list tickets"}
                            """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.results[0].path").value("/api/v2/tickets"))
                .andExpect(jsonPath("$.context").value("Endpoint: GET /api/v2/tickets\n"))
                .andExpect(jsonPath("$.contextEndpoints").value(1))
                .andExpect(jsonPath("$.answer").doesNotExist());
    }
}
